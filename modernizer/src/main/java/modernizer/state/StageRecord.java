package modernizer.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable record of one executed stage.
 *
 * <p>Use {@link #ok} and {@link #error} to create records.
 *
 * @param stage stage name (its directory name)
 * @param status OK or ERROR
 * @param metrics headline numbers of the stage
 * @param outputDir stage output directory, relative to the session root
 * @param durationMs wall-clock duration
 * @param error error message for failed stages, null otherwise
 */
public record StageRecord(
        String stage,
        Status status,
        Map<String, Object> metrics,
        String outputDir,
        long durationMs,
        String error
) {

    public enum Status {
        OK,
        ERROR
    }

    public StageRecord {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static StageRecord ok(String stage, Map<String, Object> metrics, String outputDir, long durationMs) {
        return new StageRecord(stage, Status.OK, metrics, outputDir, durationMs, null);
    }

    public static StageRecord error(String stage, String outputDir, long durationMs, String error) {
        return new StageRecord(stage, Status.ERROR, Map.of(), outputDir, durationMs, error);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("stage", stage);
        map.put("status", status.name().toLowerCase());
        map.put("output_dir", outputDir);
        map.put("duration_ms", durationMs);
        map.put("metrics", metrics);
        if (error != null) {
            map.put("error", error);
        }
        return map;
    }
}
