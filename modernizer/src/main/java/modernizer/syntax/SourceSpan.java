package modernizer.syntax;

/**
 * Source span for diagnostics and text edits.
 *
 * <p>Lines are 1-based, columns are 0-based character offsets within the
 * physical line. The end position is exclusive.
 */
public record SourceSpan(int line, int column, int endLine, int endColumn) {
    public static final SourceSpan NONE = new SourceSpan(-1, -1, -1, -1);

    /** Returns a span covering both {@code start} and {@code end}. */
    public static SourceSpan between(SourceSpan start, SourceSpan end) {
        return new SourceSpan(start.line, start.column, end.endLine, end.endColumn);
    }

    public boolean isSingleLine() {
        return line == endLine;
    }

    public boolean contains(int otherLine) {
        return otherLine >= line && otherLine <= endLine;
    }
}
