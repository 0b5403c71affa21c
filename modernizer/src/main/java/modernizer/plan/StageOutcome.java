package modernizer.plan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a stage hands back to the orchestrator.
 *
 * @param metrics headline numbers recorded on the stage record
 * @param metadata full stage metadata, written as {@code <stage>_metadata.json}
 * @param warnings degraded-path notes copied into the stage log
 */
public record StageOutcome(Map<String, Object> metrics, Map<String, Object> metadata, List<String> warnings) {

    public StageOutcome {
        metrics = new LinkedHashMap<>(metrics);
        metadata = new LinkedHashMap<>(metadata);
        warnings = List.copyOf(warnings);
    }

    public static StageOutcome of(Map<String, Object> metrics, Map<String, Object> metadata) {
        return new StageOutcome(metrics, metadata, List.of());
    }
}
