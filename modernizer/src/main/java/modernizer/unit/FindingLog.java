package modernizer.unit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable, append-only list of findings threaded through a stage.
 *
 * <p>Rules never mutate a log in place; {@link #with} and {@link #plus}
 * return a new log. This keeps per-unit processing a pure fold and lets
 * units be processed independently.
 */
public final class FindingLog {

    private static final FindingLog EMPTY = new FindingLog(List.of());

    private final List<TransformationFinding> findings;

    private FindingLog(List<TransformationFinding> findings) {
        this.findings = findings;
    }

    public static FindingLog empty() {
        return EMPTY;
    }

    public FindingLog with(TransformationFinding finding) {
        List<TransformationFinding> next = new ArrayList<>(findings.size() + 1);
        next.addAll(findings);
        next.add(finding);
        return new FindingLog(Collections.unmodifiableList(next));
    }

    public FindingLog plus(FindingLog other) {
        if (other.findings.isEmpty()) return this;
        if (findings.isEmpty()) return other;
        List<TransformationFinding> next = new ArrayList<>(findings);
        next.addAll(other.findings);
        return new FindingLog(Collections.unmodifiableList(next));
    }

    public List<TransformationFinding> findings() {
        return findings;
    }

    public int size() {
        return findings.size();
    }

    public boolean isEmpty() {
        return findings.isEmpty();
    }

    public long count(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).count();
    }

    /** Number of findings per rule id, sorted by rule id. */
    public Map<String, Integer> countsByRule() {
        Map<String, Integer> counts = new TreeMap<>();
        for (TransformationFinding f : findings) {
            counts.merge(f.ruleId(), 1, Integer::sum);
        }
        return counts;
    }

    public Map<String, Object> summary() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("fixed", count(Severity.FIXED));
        map.put("flagged", count(Severity.FLAGGED));
        map.put("manual", count(Severity.MANUAL));
        map.put("by_rule", countsByRule());
        return map;
    }

    public List<Map<String, Object>> toMaps() {
        List<Map<String, Object>> out = new ArrayList<>(findings.size());
        for (TransformationFinding f : findings) {
            out.add(f.toMap());
        }
        return out;
    }
}
