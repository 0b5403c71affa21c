package modernizer.syntax;

public record PyToken(PyTokenType type, String text, SourceSpan span) {

    public boolean isOp(String op) {
        return type == PyTokenType.OP && text.equals(op);
    }

    public boolean isName(String name) {
        return type == PyTokenType.NAME && text.equals(name);
    }
}
