package modernizer.exceptions;

import java.time.Duration;

/**
 * Thrown when a bounded operation exceeds its configured timeout.
 *
 * <p>Unchecked so that timeout protection can wrap existing calls without
 * changing their signatures. Harness executions never surface this: an
 * execution timeout is reported as a mismatch instead.
 *
 * @see modernizer.engine.TimeoutExecutor
 */
public class ExecutionTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    public ExecutionTimeoutException(String operation, Duration timeout) {
        super(formatMessage(operation, timeout));
        this.operation = operation;
        this.timeout = timeout;
    }

    public ExecutionTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(formatMessage(operation, timeout), cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    /**
     * Returns the name of the operation that timed out.
     *
     * @return the operation name (e.g., "stage0_preprocess")
     */
    public String getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }

    private static String formatMessage(String operation, Duration timeout) {
        return String.format("Operation '%s' timed out after %d ms", operation, timeout.toMillis());
    }
}
