package modernizer.verify;

/**
 * Result of comparing the legacy and modern output of one unit.
 *
 * @param match whether the outputs are equivalent
 * @param details {@code All outputs match}, or a description of the difference
 */
public record Comparison(boolean match, String details) {

    public static final String ALL_MATCH = "All outputs match";
    public static final String EMPTY_OUTPUT = "Empty or invalid output";
    public static final String TEXTUAL = "Non-JSON textual comparison";
}
