package modernizer.phase;

import modernizer.state.StageRecord;

/**
 * Default listener used when the caller does not supply one.
 */
public enum NoopStageListener implements StageListener {
    INSTANCE;

    @Override
    public void onStageStarted(StageContext ctx) { /* no-op */ }

    @Override
    public void onStageCompleted(StageContext ctx, StageRecord record) { /* no-op */ }

    @Override
    public void onStageFailed(StageContext ctx, Throwable error) { /* no-op */ }
}
