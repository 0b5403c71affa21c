package modernizer.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs the interpreter inside a throwaway container with networking disabled.
 * The mount root is exposed read-only at {@code /workspace}.
 *
 * <p>Every run gets its own container name. Killing the runtime client on a
 * timeout does not stop the container, so a timed-out run is followed by
 * {@code <runtime> kill <name>}.
 */
public final class SandboxedExecutor implements Executor {

    private static final Logger log = LoggerFactory.getLogger(SandboxedExecutor.class);

    public static final String NAME = "sandboxed";
    static final String CONTAINER_ROOT = "/workspace";
    static final String CONTAINER_PREFIX = "modernizer-";
    private static final Duration KILL_TIMEOUT = Duration.ofSeconds(10);

    /** Starts a command and waits for it; {@link ProcessRunner#run} outside of tests. */
    @FunctionalInterface
    interface CommandRunner {
        ExecutionResult run(List<String> command, Path workDir, Duration timeout, String executorName)
                throws IOException;
    }

    private final String runtime;
    private final CommandRunner runner;

    public SandboxedExecutor(String runtime) {
        this(runtime, ProcessRunner::run);
    }

    SandboxedExecutor(String runtime, CommandRunner runner) {
        this.runtime = runtime;
        this.runner = runner;
    }

    public String runtime() {
        return runtime;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request) throws IOException {
        String container = CONTAINER_PREFIX + UUID.randomUUID();
        ExecutionResult result = runner.run(command(request, container), request.mountRoot(), request.timeout(), NAME);
        if (result.timedOut()) {
            kill(container);
        }
        return result;
    }

    private void kill(String container) {
        try {
            ExecutionResult killed = runner.run(List.of(runtime, "kill", container), null, KILL_TIMEOUT, NAME);
            if (killed.exitCode() != 0) {
                log.warn("Could not kill container {}: {}", container, killed.stderr().strip());
            }
        } catch (IOException e) {
            log.warn("Could not kill container {}", container, e);
        }
    }

    List<String> command(ExecutionRequest request, String container) {
        List<String> cmd = new ArrayList<>();
        cmd.add(runtime);
        cmd.add("run");
        cmd.add("--rm");
        cmd.add("--name");
        cmd.add(container);
        cmd.add("--network");
        cmd.add("none");
        cmd.add("-v");
        cmd.add(request.mountRoot().toAbsolutePath() + ":" + CONTAINER_ROOT + ":ro");
        cmd.add("-w");
        cmd.add(CONTAINER_ROOT);
        cmd.add(request.environment().image());
        cmd.add(request.environment().interpreter());
        cmd.add("-B");
        cmd.add(request.script());
        cmd.addAll(request.args());
        return cmd;
    }
}
