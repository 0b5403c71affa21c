package modernizer.phase;

import modernizer.exceptions.ModernizeException;
import modernizer.state.StageRecord;

/**
 * Receives signals about stage boundaries, e.g. to drive a progress display
 * or to publish intermediate artifacts.
 *
 * <h2>Usage:</h2>
 * <pre>
 * public class ProgressListener implements StageListener {
 *     public void onStageStarted(StageContext ctx) {
 *         progress.show(ctx.stage().dirName());
 *     }
 *     public void onStageCompleted(StageContext ctx, StageRecord record) {
 *         progress.done(record.stage(), record.durationMs());
 *     }
 *     public void onStageFailed(StageContext ctx, Throwable error) {
 *         progress.fail(ctx.stage().dirName(), error.getMessage());
 *     }
 * }
 * </pre>
 */
public interface StageListener {

    /**
     * Called before a stage runs. Throwing fails the stage and the session.
     *
     * @throws ModernizeException to refuse the stage
     */
    void onStageStarted(StageContext ctx) throws ModernizeException;

    /**
     * Called after the stage's record and metadata are written.
     *
     * @throws ModernizeException to fail the session before the next stage
     */
    void onStageCompleted(StageContext ctx, StageRecord record) throws ModernizeException;

    /**
     * Called once when a stage fails. Exceptions thrown here are logged and ignored.
     */
    void onStageFailed(StageContext ctx, Throwable error);
}
