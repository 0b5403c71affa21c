package modernizer.semantic;

import modernizer.unit.SourceUnit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of the semantic detectors on one unit.
 *
 * @param unit the rewritten unit, or the input when skipped or reverted
 * @param counters per-detector counters, e.g. {@code division_fixes}
 * @param warnings constructs noticed but not rewritten
 * @param divisionLines lines of the output holding a rewritten division
 * @param skipped true when the unit was not parseable
 * @param reverted true when the combined edits broke parsing and were discarded
 */
public record SemanticResult(SourceUnit unit,
                             Map<String, Integer> counters,
                             List<String> warnings,
                             Set<Integer> divisionLines,
                             boolean skipped,
                             boolean reverted) {

    public SemanticResult {
        counters = new LinkedHashMap<>(counters);
        warnings = List.copyOf(warnings);
        divisionLines = Set.copyOf(divisionLines);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", unit.path());
        map.put("skipped", skipped);
        map.put("reverted", reverted);
        map.putAll(counters);
        map.put("warnings", warnings);
        return map;
    }
}
