package modernizer.config;

/**
 * Alert level for pipeline event logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link modernizer.alert.PipelineAlertLogger}. Configured via the
 * {@code modernizer.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - all events: session and stage transitions, repair attempts, warnings, errors</li>
 *   <li>{@link #WARNING} - sandbox fallback, execution timeouts, exhausted repairs and errors</li>
 *   <li>{@link #ERROR} - stage and session failures only</li>
 * </ul>
 */
public enum AlertLevel {
    DEBUG,

    /** Default level, suitable for unattended runs. */
    WARNING,

    ERROR
}
