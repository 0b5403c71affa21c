package modernizer.exceptions;

/**
 * An exception escaped a stage's contract. Fatal to the session: the
 * orchestrator records it and schedules no further stages.
 */
public class StageFailureException extends ModernizeException {

    public StageFailureException(String stage, Throwable cause) {
        super(describe(cause), stage, null, cause);
    }

    public StageFailureException(String message, String stage) {
        super(message, stage, null, null);
    }

    /** Message of {@code cause}, or its type when it has none. */
    public static String describe(Throwable cause) {
        if (cause == null) {
            return "Stage failed";
        }
        String msg = cause.getMessage();
        return msg != null ? msg : cause.getClass().getSimpleName();
    }
}
