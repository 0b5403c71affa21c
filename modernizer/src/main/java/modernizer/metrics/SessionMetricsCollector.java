package modernizer.metrics;

import modernizer.plan.PipelineStage;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Collects per-stage timing and unit counts during a session.
 *
 * <h2>Usage:</h2>
 * <pre>
 * SessionMetricsCollector collector = new SessionMetricsCollector().start(sessionId);
 * StageOutcome outcome = collector.timed(PipelineStage.PREPROCESS, () -&gt; stage.process(ctx));
 * collector.totalUnits(units.size());
 * SessionMetrics metrics = collector.finish();
 * </pre>
 *
 * <p>Not thread-safe: the orchestrator drives stages sequentially.
 */
public final class SessionMetricsCollector {

    private final Map<PipelineStage, Long> stageDurations = new EnumMap<>(PipelineStage.class);
    private SessionMetrics.Builder builder = SessionMetrics.builder();
    private Instant startTime;

    public SessionMetricsCollector start(String sessionId) {
        this.startTime = Instant.now();
        this.stageDurations.clear();
        this.builder = SessionMetrics.builder().sessionId(sessionId).startTime(startTime);
        return this;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * Time a stage and return the result (can throw checked exceptions).
     */
    public <T, E extends Exception> T timed(PipelineStage stage, ThrowingSupplier<T, E> action) throws E {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            stageDurations.put(stage, Duration.ofNanos(System.nanoTime() - start).toMillis());
        }
    }

    /** Duration of a stage timed so far, or 0. */
    public long durationOf(PipelineStage stage) {
        return stageDurations.getOrDefault(stage, 0L);
    }

    public SessionMetricsCollector totalUnits(int count) {
        builder.totalUnits(count);
        return this;
    }

    public SessionMetricsCollector parseableUnits(int count) {
        builder.parseableUnits(count);
        return this;
    }

    public SessionMetricsCollector matchedUnits(int count) {
        builder.matchedUnits(count);
        return this;
    }

    public SessionMetricsCollector repairedUnits(int count) {
        builder.repairedUnits(count);
        return this;
    }

    public SessionMetricsCollector manualUnits(int count) {
        builder.manualUnits(count);
        return this;
    }

    public SessionMetrics finish() {
        Instant endTime = Instant.now();
        return builder
                .endTime(endTime)
                .stageDurations(stageDurations)
                .totalDurationMs(Duration.between(startTime, endTime).toMillis())
                .build();
    }
}
