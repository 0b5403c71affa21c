package modernizer.syntax;

import java.util.Optional;

/**
 * Convenience entry points over {@link PyParser}.
 */
public final class PySyntax {

    private PySyntax() {}

    /** Returns true if {@code source} parses under {@code grammar}. */
    public static boolean isParseable(String source, PyGrammar grammar) {
        return check(source, grammar).isEmpty();
    }

    /**
     * Parses {@code source} and returns the first error, if any.
     *
     * @return the syntax error, or empty if the source parses
     */
    public static Optional<PySyntaxException> check(String source, PyGrammar grammar) {
        try {
            PyParser.parse(source, grammar);
            return Optional.empty();
        } catch (PySyntaxException e) {
            return Optional.of(e);
        }
    }

    /** Parses {@code source}, returning empty when it does not parse. */
    public static Optional<PyModule> tryParse(String source, PyGrammar grammar) {
        try {
            return Optional.of(PyParser.parse(source, grammar));
        } catch (PySyntaxException e) {
            return Optional.empty();
        }
    }
}
