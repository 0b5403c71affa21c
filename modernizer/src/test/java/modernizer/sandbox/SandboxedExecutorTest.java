package modernizer.sandbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SandboxedExecutor")
class SandboxedExecutorTest {

    private final List<List<String>> commands = new ArrayList<>();

    private final ExecutionRequest request = new ExecutionRequest(
            new RuntimeEnvironment(RuntimeEnvironment.LEGACY, "python:2.7-slim", "python2"),
            Path.of("work"), "_modernizer_harness.py", List.of("mod.py"), Duration.ofSeconds(1));

    private SandboxedExecutor executor(boolean runTimesOut) {
        return new SandboxedExecutor("docker", (command, workDir, timeout, executorName) -> {
            commands.add(command);
            if (command.get(1).equals("run") && runTimesOut) {
                return ExecutionResult.timeout("", timeout.toMillis(), executorName);
            }
            return new ExecutionResult("{}\n", "", 0, false, 5, executorName);
        });
    }

    @Test
    @DisplayName("should kill the named container when a run times out")
    void shouldKillContainerOnTimeout() throws Exception {
        ExecutionResult result = executor(true).execute(request);

        assertThat(result.timedOut()).isTrue();
        assertThat(commands).hasSize(2);
        String container = commands.get(0).get(commands.get(0).indexOf("--name") + 1);
        assertThat(container).startsWith(SandboxedExecutor.CONTAINER_PREFIX);
        assertThat(commands.get(1)).containsExactly("docker", "kill", container);
    }

    @Test
    @DisplayName("should not kill anything after a run that finished")
    void shouldNotKillFinishedRun() throws Exception {
        ExecutionResult result = executor(false).execute(request);

        assertThat(result.succeeded()).isTrue();
        assertThat(commands).hasSize(1);
    }

    @Test
    @DisplayName("should give every run its own container")
    void shouldNameEveryRunDistinctly() throws Exception {
        SandboxedExecutor executor = executor(false);

        executor.execute(request);
        executor.execute(request);

        assertThat(commands.get(0).get(4)).isNotEqualTo(commands.get(1).get(4));
    }
}
