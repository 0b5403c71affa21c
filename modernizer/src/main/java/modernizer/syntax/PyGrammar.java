package modernizer.syntax;

/**
 * Grammar accepted by {@link PyParser}.
 *
 * <p>{@link #TRANSITIONAL} is the modern grammar plus the two legacy clause forms
 * that the structural stage rewrites: the comma exception capture
 * ({@code except E, e:}) and the comma raise ({@code raise E, v[, tb]}).
 * Everything else that only the legacy dialect accepts is rejected by both grammars.
 */
public enum PyGrammar {
    MODERN,
    TRANSITIONAL
}
