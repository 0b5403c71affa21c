package modernizer.preprocess;

import modernizer.unit.SourceUnit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of preprocessing one unit.
 *
 * @param unit the resulting unit; the original content when it stayed unparseable
 * @param status {@code modified}, {@code unchanged}, {@code skipped_empty} or {@code unparseable}
 * @param rulesApplied distinct rule ids, sorted
 * @param linesChanged number of lines whose text changed
 * @param stubbedLines lines replaced by a stub comment
 * @param markedLines lines calling legacy builtins, left unchanged
 * @param errors parse errors left after recovery
 */
public record PreprocessResult(SourceUnit unit,
                               String status,
                               List<String> rulesApplied,
                               int linesChanged,
                               List<Integer> stubbedLines,
                               List<Integer> markedLines,
                               List<String> errors) {

    public static final String MODIFIED = "modified";
    public static final String UNCHANGED = "unchanged";
    public static final String SKIPPED_EMPTY = "skipped_empty";
    public static final String UNPARSEABLE = "unparseable";

    public PreprocessResult {
        rulesApplied = List.copyOf(rulesApplied);
        stubbedLines = List.copyOf(stubbedLines);
        markedLines = List.copyOf(markedLines);
        errors = List.copyOf(errors);
    }

    static PreprocessResult skippedEmpty(SourceUnit unit) {
        return new PreprocessResult(unit.withParseable(true), SKIPPED_EMPTY, List.of(), 0, List.of(), List.of(),
                List.of());
    }

    public boolean parseable() {
        return unit.parseable();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", unit.path());
        map.put("status", status);
        map.put("parseable", parseable());
        map.put("rules_applied", rulesApplied);
        map.put("lines_changed", linesChanged);
        map.put("stubbed_lines", stubbedLines);
        map.put("marked_lines", markedLines);
        map.put("errors", errors);
        return map;
    }
}
