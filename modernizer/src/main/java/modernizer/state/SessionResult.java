package modernizer.state;

import modernizer.metrics.SessionMetrics;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@code SessionOrchestrator.run}.
 *
 * @param sessionId the session id
 * @param status terminal status
 * @param sessionDir the session directory
 * @param stages stage records in execution order
 * @param metrics session metrics, partial when the session failed
 * @param error error message when failed, null otherwise
 */
public record SessionResult(
        String sessionId,
        SessionStatus status,
        Path sessionDir,
        List<StageRecord> stages,
        SessionMetrics metrics,
        String error
) {
    public SessionResult {
        stages = List.copyOf(stages);
    }

    public boolean isCompleted() {
        return status == SessionStatus.COMPLETED;
    }
}
