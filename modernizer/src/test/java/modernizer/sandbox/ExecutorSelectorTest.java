package modernizer.sandbox;

import modernizer.config.ModernizerConfig;
import modernizer.config.SandboxMode;
import modernizer.exceptions.SandboxUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Executor selection")
class ExecutorSelectorTest {

    private static final String MISSING_RUNTIME = "modernizer-no-such-runtime";

    private static ModernizerConfig config(SandboxMode mode) {
        return ModernizerConfig.builder().sandboxMode(mode).containerRuntime(MISSING_RUNTIME).build();
    }

    @Nested
    @DisplayName("select")
    class Select {

        @Test
        @DisplayName("should use the local executor without probing in LOCAL mode")
        void shouldUseLocalInLocalMode() throws Exception {
            ExecutorSelector.Selection selection = ExecutorSelector.select(config(SandboxMode.LOCAL));

            assertThat(selection.executor()).isInstanceOf(LocalExecutor.class);
            assertThat(selection.fellBack()).isFalse();
        }

        @Test
        @DisplayName("should fall back to local execution in AUTO mode")
        void shouldFallBackInAutoMode() throws Exception {
            ExecutorSelector.Selection selection = ExecutorSelector.select(config(SandboxMode.AUTO));

            assertThat(selection.executor().name()).isEqualTo(LocalExecutor.NAME);
            assertThat(selection.fellBack()).isTrue();
            assertThat(selection.fallbackReason()).contains(MISSING_RUNTIME);
        }

        @Test
        @DisplayName("should fail in SANDBOXED mode when no runtime is available")
        void shouldFailInSandboxedMode() {
            assertThatThrownBy(() -> ExecutorSelector.select(config(SandboxMode.SANDBOXED)))
                    .isInstanceOf(SandboxUnavailableException.class)
                    .satisfies(e -> assertThat(((SandboxUnavailableException) e).getRuntime()).isEqualTo(MISSING_RUNTIME));
        }
    }

    @Nested
    @DisplayName("commands")
    class Commands {

        private final ExecutionRequest request = new ExecutionRequest(
                new RuntimeEnvironment(RuntimeEnvironment.MODERN, "python:3.11-slim", "python3"),
                Path.of("work"), "_modernizer_harness.py", List.of("pkg/mod.py"), Duration.ofSeconds(5));

        @Test
        @DisplayName("should run the interpreter directly for local execution")
        void shouldBuildLocalCommand() {
            assertThat(LocalExecutor.command(request))
                    .containsExactly("python3", "-B", "_modernizer_harness.py", "pkg/mod.py");
        }

        @Test
        @DisplayName("should run an offline read-only container for sandboxed execution")
        void shouldBuildSandboxedCommand() {
            List<String> cmd = new SandboxedExecutor("podman").command(request, "modernizer-1");

            assertThat(cmd).startsWith("podman", "run", "--rm", "--name", "modernizer-1", "--network", "none", "-v");
            assertThat(cmd.get(8)).endsWith(":/workspace:ro");
            assertThat(cmd).endsWith("python:3.11-slim", "python3", "-B", "_modernizer_harness.py", "pkg/mod.py");
        }
    }
}
