package modernizer.syntax;

public enum PyTokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    ENDMARKER
}
