package modernizer.sandbox;

import modernizer.alert.PipelineAlertLogger;
import modernizer.config.ModernizerConfig;
import modernizer.config.SandboxMode;
import modernizer.exceptions.SandboxUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Chooses the executor variant once per session.
 *
 * <ul>
 *   <li>{@code LOCAL}: never checks the runtime</li>
 *   <li>{@code SANDBOXED}: checks the runtime and fails if the runtime is unavailable</li>
 *   <li>{@code AUTO}: checks the runtime and falls back to local execution with a warning</li>
 * </ul>
 */
public final class ExecutorSelector {

    private static final Logger log = LoggerFactory.getLogger(ExecutorSelector.class);
    private static final Duration CHECK_TIMEOUT = Duration.ofSeconds(10);

    /**
     * The chosen executor.
     *
     * @param executor the executor to use for the whole session
     * @param fallbackReason why sandboxing was not used in AUTO mode, or null
     */
    public record Selection(Executor executor, String fallbackReason) {
        public boolean fellBack() {
            return fallbackReason != null;
        }
    }

    private ExecutorSelector() {}

    public static Selection select(ModernizerConfig config) throws SandboxUnavailableException {
        SandboxMode mode = config.sandboxMode();
        String runtime = config.containerRuntime();
        if (mode == SandboxMode.LOCAL) {
            log.info("Sandbox mode LOCAL, using local executor");
            return new Selection(new LocalExecutor(), null);
        }
        try {
            checkRuntime(runtime);
            log.info("Container runtime '{}' available, using sandboxed executor", runtime);
            return new Selection(new SandboxedExecutor(runtime), null);
        } catch (SandboxUnavailableException e) {
            if (mode == SandboxMode.SANDBOXED) {
                throw e;
            }
            log.warn("{}; falling back to local execution", e.getMessage());
            PipelineAlertLogger.sandboxFallback(runtime, e.getMessage());
            return new Selection(new LocalExecutor(), e.getMessage());
        }
    }

    /**
     * Checks that {@code <runtime> info} exits successfully.
     *
     * @throws SandboxUnavailableException if it cannot be run, fails or hangs
     */
    public static void checkRuntime(String runtime) throws SandboxUnavailableException {
        ExecutionResult result;
        try {
            result = ProcessRunner.run(List.of(runtime, "info"), null, CHECK_TIMEOUT, "runtime-check");
        } catch (IOException e) {
            throw new SandboxUnavailableException(runtime, e);
        }
        if (result.timedOut()) {
            throw new SandboxUnavailableException(runtime, "runtime check timed out");
        }
        if (result.exitCode() != 0) {
            throw new SandboxUnavailableException(runtime, "runtime check exited with " + result.exitCode());
        }
    }
}
