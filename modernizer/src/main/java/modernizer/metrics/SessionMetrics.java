package modernizer.metrics;

import modernizer.plan.PipelineStage;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable metrics collected during one session.
 *
 * <p>Use {@link #summary()} for a log line, or {@link #toMap()} for JSON.
 *
 * @see SessionMetricsCollector
 */
public record SessionMetrics(
        String sessionId,
        Instant startTime,
        Instant endTime,
        Map<PipelineStage, Long> stageDurations,
        long totalDurationMs,
        int totalUnits,
        int parseableUnits,
        int matchedUnits,
        int repairedUnits,
        int manualUnits
) {

    /**
     * Returns the duration of one stage.
     *
     * @return duration in milliseconds, or 0 if the stage did not run
     */
    public long stageDuration(PipelineStage stage) {
        return stageDurations.getOrDefault(stage, 0L);
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "Session %s in %dms | Units: %d (%d parseable) | Verified: %d matched, %d repaired, %d manual",
                sessionId, totalDurationMs, totalUnits, parseableUnits, matchedUnits, repairedUnits, manualUnits);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("session_id", sessionId);
        map.put("start_time", startTime.toString());
        map.put("end_time", endTime.toString());
        map.put("total_duration_ms", totalDurationMs);
        map.put("total_units", totalUnits);
        map.put("parseable_units", parseableUnits);
        map.put("matched_units", matchedUnits);
        map.put("repaired_units", repairedUnits);
        map.put("manual_units", manualUnits);
        stageDurations.forEach((stage, duration) -> map.put(stage.dirName() + "_duration_ms", duration));
        return map;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sessionId;
        private Instant startTime;
        private Instant endTime;
        private final Map<PipelineStage, Long> stageDurations = new EnumMap<>(PipelineStage.class);
        private long totalDurationMs;
        private int totalUnits, parseableUnits, matchedUnits, repairedUnits, manualUnits;

        public Builder sessionId(String id) { this.sessionId = id; return this; }
        public Builder startTime(Instant t) { this.startTime = t; return this; }
        public Builder endTime(Instant t) { this.endTime = t; return this; }

        public Builder stageDurations(Map<PipelineStage, Long> durations) {
            this.stageDurations.putAll(durations);
            return this;
        }

        public Builder totalDurationMs(long v) { this.totalDurationMs = v; return this; }
        public Builder totalUnits(int v) { this.totalUnits = v; return this; }
        public Builder parseableUnits(int v) { this.parseableUnits = v; return this; }
        public Builder matchedUnits(int v) { this.matchedUnits = v; return this; }
        public Builder repairedUnits(int v) { this.repairedUnits = v; return this; }
        public Builder manualUnits(int v) { this.manualUnits = v; return this; }

        public SessionMetrics build() {
            return new SessionMetrics(sessionId, startTime, endTime, new EnumMap<>(stageDurations),
                    totalDurationMs, totalUnits, parseableUnits, matchedUnits, repairedUnits, manualUnits);
        }
    }
}
