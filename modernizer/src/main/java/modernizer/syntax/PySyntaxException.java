package modernizer.syntax;

/**
 * Thrown when source text cannot be tokenized or parsed.
 *
 * <p>Carries the 1-based line and 0-based column of the offending token so that
 * recovery code can locate the line to fix or stub.
 */
public class PySyntaxException extends Exception {

    private final int line;
    private final int column;
    private final String reason;

    public PySyntaxException(String reason, int line, int column) {
        super(reason + " (line " + line + ", column " + column + ")");
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** Returns the message without position information. */
    public String getReason() {
        return reason;
    }
}
