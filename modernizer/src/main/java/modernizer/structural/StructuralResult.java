package modernizer.structural;

import modernizer.unit.FindingLog;
import modernizer.unit.SourceUnit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of the structural rules on one unit.
 *
 * @param unit the rewritten unit, or the input when skipped
 * @param findings everything the rules reported, rolled back rules as MANUAL
 * @param rollbacks one entry per line and rule whose edits were discarded
 * @param skipped true when the unit was not parseable and was copied unchanged
 * @param modernParseable whether the result parses under the modern grammar
 */
public record StructuralResult(SourceUnit unit,
                               FindingLog findings,
                               List<Rollback> rollbacks,
                               boolean skipped,
                               boolean modernParseable) {

    /**
     * Edits of one rule on one line that were discarded because they broke parsing.
     */
    public record Rollback(int line, String ruleId) {
        public Map<String, Object> toMap() {
            return Map.of("line", line, "rule", ruleId);
        }
    }

    public StructuralResult {
        rollbacks = List.copyOf(rollbacks);
    }

    static StructuralResult skipped(SourceUnit unit) {
        return new StructuralResult(unit, FindingLog.empty(), List.of(), true, false);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", unit.path());
        map.put("skipped", skipped);
        map.put("modern_parseable", modernParseable);
        map.put("summary", findings.summary());
        map.put("findings", findings.toMaps());
        map.put("rollbacks", rollbacks.stream().map(Rollback::toMap).toList());
        return map;
    }
}
