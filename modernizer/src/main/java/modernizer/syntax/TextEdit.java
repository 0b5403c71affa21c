package modernizer.syntax;

import java.util.List;

/**
 * One textual edit on a single physical line.
 *
 * <p>Replaces columns {@code [startColumn, endColumn)} of {@code line} with
 * {@code replacement}; an insertion has {@code startColumn == endColumn}. A
 * replacement may contain newlines, which turns one line into several once the
 * batch is rendered. {@link #deleteLine} removes the whole line.
 *
 * @param line        1-based line number
 * @param startColumn 0-based start column, or -1 for a line deletion
 * @param endColumn   0-based exclusive end column
 * @param replacement replacement text
 * @param ruleId      identifier of the rule that produced the edit
 */
public record TextEdit(int line, int startColumn, int endColumn, String replacement, String ruleId) {

    public static TextEdit insert(int line, int column, String text, String ruleId) {
        return new TextEdit(line, column, column, text, ruleId);
    }

    public static TextEdit replace(int line, int start, int end, String text, String ruleId) {
        return new TextEdit(line, start, end, text, ruleId);
    }

    public static TextEdit deleteLine(int line, String ruleId) {
        return new TextEdit(line, -1, -1, "", ruleId);
    }

    /** Wraps a single- or multi-line span: {@code prefix} before it and {@code suffix} after it. */
    public static List<TextEdit> wrap(SourceSpan span, String prefix, String suffix, String ruleId) {
        return List.of(
                insert(span.line(), span.column(), prefix, ruleId),
                insert(span.endLine(), span.endColumn(), suffix, ruleId));
    }

    public boolean isLineDeletion() {
        return startColumn < 0;
    }
}
