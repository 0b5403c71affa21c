package modernizer.preprocess;

/**
 * Rules applied while making legacy input parseable.
 */
public enum PreprocessRule {
    /** {@code unicode}, {@code basestring} to {@code str}; {@code long} to {@code int}. */
    TYPE_ALIAS("type_alias"),
    /** {@code <>} to {@code !=}. */
    NOT_EQUAL("not_equal_operator"),
    /** {@code 10L} to {@code 10}. */
    LONG_LITERAL("long_literal"),
    /** {@code 0777} to {@code 0o777}. */
    OCTAL_LITERAL("octal_literal"),
    /** {@code ur'..'} to {@code r'..'}. */
    RAW_UNICODE_PREFIX("raw_unicode_prefix"),
    /** {@code print a, b} to {@code print(a, b)}. */
    PRINT_STATEMENT("print_statement"),
    /** {@code exec code in ns} to {@code exec(code, ns)}. */
    EXEC_STATEMENT("exec_statement"),
    /** {@code `x`} to {@code repr(x)}. */
    BACKTICK_REPR("backtick_repr"),
    /** A print statement after {@code :} or {@code ;}. */
    INLINE_PRINT("inline_print"),
    /** Line commented out because no fix applied. */
    STUB("stub_line");

    private final String id;

    PreprocessRule(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
