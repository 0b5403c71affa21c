package modernizer.unit;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A recorded, non-fatal observation made by a transformation stage.
 *
 * @param unit relative path of the unit
 * @param line 1-based line the finding refers to
 * @param ruleId rule that produced it
 * @param severity fixed, flagged or manual
 * @param before line text before the rule ran
 * @param after line text after the rule ran, equal to {@code before} when nothing changed
 * @param message optional advice, may be null
 */
public record TransformationFinding(
        String unit,
        int line,
        String ruleId,
        Severity severity,
        String before,
        String after,
        String message
) {
    public static TransformationFinding fixed(String unit, int line, String ruleId, String before, String after) {
        return new TransformationFinding(unit, line, ruleId, Severity.FIXED, before, after, null);
    }

    public static TransformationFinding flagged(String unit, int line, String ruleId, String snippet, String message) {
        return new TransformationFinding(unit, line, ruleId, Severity.FLAGGED, snippet, snippet, message);
    }

    public static TransformationFinding manual(String unit, int line, String ruleId, String snippet, String message) {
        return new TransformationFinding(unit, line, ruleId, Severity.MANUAL, snippet, snippet, message);
    }

    public TransformationFinding downgrade(String reason) {
        return new TransformationFinding(unit, line, ruleId, Severity.MANUAL, before, before, reason);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("unit", unit);
        map.put("line", line);
        map.put("rule", ruleId);
        map.put("severity", severity.label());
        map.put("before", before);
        map.put("after", after);
        if (message != null) {
            map.put("message", message);
        }
        return map;
    }
}
