package modernizer.exceptions;

/**
 * Exception thrown when a modernization step fails.
 *
 * <p>Carries optional diagnostic context:
 * <ul>
 *   <li>the pipeline stage in which the failure occurred</li>
 *   <li>the unit (relative source path) being processed</li>
 * </ul>
 *
 * <p>Context is appended to {@link #getMessage()} so log lines stay self-describing.
 *
 * @see modernizer.engine.SessionOrchestrator
 */
public class ModernizeException extends Exception {

    private final String stage;
    private final String unit;

    public ModernizeException(String message) {
        this(message, null, null, null);
    }

    public ModernizeException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    /**
     * Creates a new exception with stage and unit context.
     *
     * @param message the error message
     * @param stage the stage name, may be null
     * @param unit the relative path of the unit, may be null
     * @param cause the underlying cause, may be null
     */
    public ModernizeException(String message, String stage, String unit, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.unit = unit;
    }

    /**
     * Returns the stage where the failure occurred.
     *
     * @return the stage name, or null if not set
     */
    public String getStage() {
        return stage;
    }

    /**
     * Returns the unit being processed when the failure occurred.
     *
     * @return the relative unit path, or null if not set
     */
    public String getUnit() {
        return unit;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(super.getMessage()));
        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (unit != null) sb.append(" [unit=").append(unit).append("]");
        return sb.toString();
    }
}
