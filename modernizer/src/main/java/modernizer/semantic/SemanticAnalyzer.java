package modernizer.semantic;

import modernizer.syntax.ParsedSource;
import modernizer.syntax.PyGrammar;
import modernizer.syntax.PySyntax;
import modernizer.syntax.PySyntaxException;
import modernizer.syntax.SourceText;
import modernizer.syntax.TextEdit;
import modernizer.unit.AppliedRule;
import modernizer.unit.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Runs every detector against the same parsed unit and applies all proposed
 * edits as one batch.
 *
 * <p>If the batch leaves the unit unparseable the unit is returned unchanged,
 * so a parseable input always yields a parseable output.
 */
public final class SemanticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final List<SemanticDetector> detectors;

    public SemanticAnalyzer(List<SemanticDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public static List<SemanticDetector> standardDetectors() {
        return List.of(
                new IntDivisionDetector(),
                new IteratorWrapDetector(),
                new OpenEncodingDetector(),
                new CompatImportDetector(),
                new FutureCleanupDetector());
    }

    public SemanticResult analyze(SourceUnit unit) {
        Map<String, Integer> zero = zeroCounters();
        if (!unit.parseable()) {
            return new SemanticResult(unit, zero, List.of(), Set.of(), true, false);
        }
        SourceText text = SourceText.of(unit.content());
        ParsedSource parsed;
        try {
            parsed = ParsedSource.parse(text, PyGrammar.TRANSITIONAL);
        } catch (PySyntaxException e) {
            log.warn("Skipping {}: {}", unit.path(), e.getMessage());
            return new SemanticResult(unit.withParseable(false), zero, List.of(e.getMessage()), Set.of(), true, false);
        }
        SemanticContext ctx = new SemanticContext(unit.path(), parsed);

        List<TextEdit> edits = new ArrayList<>();
        Map<String, Integer> counters = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        for (SemanticDetector detector : detectors) {
            Detection d = detector.detect(ctx);
            edits.addAll(d.edits());
            counters.put(detector.counter(), d.count());
            warnings.addAll(d.warnings());
        }
        if (edits.isEmpty()) {
            return new SemanticResult(unit, counters, warnings, Set.of(), false, false);
        }

        String content = text.apply(edits).render();
        if (!PySyntax.isParseable(content, PyGrammar.TRANSITIONAL)) {
            log.warn("Reverting semantic rewrites of {}: result did not parse", unit.path());
            warnings.add("Semantic rewrites reverted: the result did not parse");
            return new SemanticResult(unit, zero, warnings, Set.of(), false, true);
        }
        return new SemanticResult(unit.withContent(content, history(edits)), counters, warnings,
                divisionLines(edits), false, false);
    }

    private Map<String, Integer> zeroCounters() {
        Map<String, Integer> counters = new LinkedHashMap<>();
        for (SemanticDetector d : detectors) {
            counters.put(d.counter(), 0);
        }
        return counters;
    }

    /**
     * Lines of the rewritten text that hold a division fix. Lines deleted by
     * the same batch shift everything below them up.
     */
    static Set<Integer> divisionLines(List<TextEdit> edits) {
        SortedSet<Integer> deleted = new TreeSet<>();
        for (TextEdit e : edits) {
            if (e.isLineDeletion()) {
                deleted.add(e.line());
            }
        }
        Set<Integer> lines = new TreeSet<>();
        for (TextEdit e : edits) {
            if (e.ruleId().equals(IntDivisionDetector.ID) && !deleted.contains(e.line())) {
                lines.add(e.line() - deleted.headSet(e.line()).size());
            }
        }
        return lines;
    }

    private static List<AppliedRule> history(List<TextEdit> edits) {
        Map<String, SortedSet<Integer>> lines = new LinkedHashMap<>();
        for (TextEdit e : edits) {
            lines.computeIfAbsent(e.ruleId(), k -> new TreeSet<>()).add(e.line());
        }
        List<AppliedRule> out = new ArrayList<>();
        lines.forEach((rule, l) -> out.add(new AppliedRule(rule, new ArrayList<>(l))));
        return out;
    }
}
