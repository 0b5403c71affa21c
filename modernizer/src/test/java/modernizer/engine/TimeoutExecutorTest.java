package modernizer.engine;

import modernizer.exceptions.ExecutionTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeoutExecutor")
class TimeoutExecutorTest {

    @Test
    @DisplayName("should return the result of a stage that finishes in time")
    void shouldReturnResultWithinTimeout() throws Exception {
        String result = TimeoutExecutor.executeWithTimeoutChecked("stage0_preprocess", Duration.ofSeconds(5),
                () -> "done");

        assertThat(result).isEqualTo("done");
    }

    @Test
    @DisplayName("should run on the calling thread when the timeout is disabled")
    void shouldRunInlineWhenDisabled() throws Exception {
        Thread caller = Thread.currentThread();

        Thread ran = TimeoutExecutor.executeWithTimeoutChecked("stage1_structural", Duration.ZERO,
                Thread::currentThread);

        assertThat(ran).isSameAs(caller);
        assertThat(TimeoutExecutor.isEnabled(null)).isFalse();
        assertThat(TimeoutExecutor.isEnabled(Duration.ofSeconds(-1))).isFalse();
    }

    @Test
    @DisplayName("should throw ExecutionTimeoutException when a stage overruns")
    void shouldThrowWhenStageOverruns() {
        assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeoutChecked("stage3_verification",
                Duration.ofMillis(50), () -> {
                    Thread.sleep(5000);
                    return "never";
                }))
                .isInstanceOf(ExecutionTimeoutException.class)
                .hasMessageContaining("stage3_verification")
                .hasMessageContaining("50 ms")
                .satisfies(e -> assertThat(((ExecutionTimeoutException) e).getTimeout())
                        .isEqualTo(Duration.ofMillis(50)));
    }

    @Test
    @DisplayName("should rethrow the stage's own checked exception unwrapped")
    void shouldRethrowCheckedException() {
        IOException expected = new IOException("disk full");

        assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeoutChecked("stage4_repair",
                Duration.ofSeconds(5), () -> {
                    throw expected;
                }))
                .isSameAs(expected);
    }

    @Test
    @DisplayName("should rethrow errors unwrapped")
    void shouldRethrowErrors() {
        assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeoutChecked("stage5_review",
                Duration.ofSeconds(5), () -> {
                    throw new OutOfMemoryError("test OOM");
                }))
                .isInstanceOf(OutOfMemoryError.class)
                .hasMessage("test OOM");
    }
}
