package modernizer.sandbox;

import java.io.IOException;

/**
 * Runs a script in one environment and captures its output.
 *
 * <p>Two fixed variants exist: {@link SandboxedExecutor} and {@link LocalExecutor}.
 * The variant is chosen once per session by {@link ExecutorSelector} and
 * recorded in session metadata, so reports stay attributable.
 */
public interface Executor {

    /** {@code sandboxed} or {@code local}. */
    String name();

    /**
     * Runs the request. Timeouts are reported in the result, not thrown.
     *
     * @throws IOException if the process cannot be started
     */
    ExecutionResult execute(ExecutionRequest request) throws IOException;
}
