package modernizer.sandbox;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the interpreter directly on the host, with the mount root as working directory.
 * Used when no container runtime is available, or when configured explicitly.
 */
public final class LocalExecutor implements Executor {

    public static final String NAME = "local";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request) throws IOException {
        return ProcessRunner.run(command(request), request.mountRoot(), request.timeout(), NAME);
    }

    static List<String> command(ExecutionRequest request) {
        List<String> cmd = new ArrayList<>();
        cmd.add(request.environment().interpreter());
        cmd.add("-B");
        cmd.add(request.script());
        cmd.addAll(request.args());
        return cmd;
    }
}
