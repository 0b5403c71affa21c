package modernizer.sandbox;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * A script run inside one environment.
 *
 * @param environment where to run
 * @param mountRoot host directory exposed to the run; also its working directory
 * @param script script path relative to {@code mountRoot}
 * @param args script arguments; paths among them are relative to {@code mountRoot}
 * @param timeout upper bound on the run
 */
public record ExecutionRequest(
        RuntimeEnvironment environment,
        Path mountRoot,
        String script,
        List<String> args,
        Duration timeout
) {
    public ExecutionRequest {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(mountRoot, "mountRoot");
        Objects.requireNonNull(script, "script");
        Objects.requireNonNull(timeout, "timeout");
        args = List.copyOf(args);
    }
}
