package modernizer.sandbox;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Test executor that never launches a process. The stdout of each run is
 * computed from the environment id and the unit's source in the mounted
 * workspace.
 */
public final class FakeExecutor implements Executor {

    @FunctionalInterface
    public interface Behavior {
        ExecutionResult run(String environment, String unit, String source) throws IOException;
    }

    @FunctionalInterface
    public interface Output {
        String stdout(String environment, String unit, String source);
    }

    private final Behavior behavior;
    private final List<ExecutionRequest> requests = Collections.synchronizedList(new ArrayList<>());

    public FakeExecutor(Behavior behavior) {
        this.behavior = behavior;
    }

    /** Executor whose runs all exit 0 with the given stdout. */
    public static FakeExecutor printing(Output output) {
        return new FakeExecutor((env, unit, source) ->
                new ExecutionResult(output.stdout(env, unit, source) + "\n", "", 0, false, 1, "fake"));
    }

    @Override
    public String name() {
        return "fake";
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request) throws IOException {
        requests.add(request);
        String unit = request.args().get(0);
        String source = Files.readString(request.mountRoot().resolve(unit), StandardCharsets.UTF_8);
        return behavior.run(request.environment().id(), unit, source);
    }

    public List<ExecutionRequest> requests() {
        return List.copyOf(requests);
    }
}
