package modernizer.structural;

import modernizer.alert.PipelineAlertLogger;
import modernizer.syntax.ParsedSource;
import modernizer.syntax.PyGrammar;
import modernizer.syntax.PyModule;
import modernizer.syntax.PySyntax;
import modernizer.syntax.SourceText;
import modernizer.syntax.TextEdit;
import modernizer.unit.AppliedRule;
import modernizer.unit.FindingLog;
import modernizer.unit.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Applies the structural rule catalog to one unit.
 *
 * <p>All rules see the same input text. Their changes are accepted line by
 * line, in line order: a line's edits are kept only if the unit still parses
 * with them and every previously accepted edit. When a line breaks parsing,
 * each rule is dropped in turn to find the culprit; if no single rule is to
 * blame, all edits on the line are dropped. Dropped changes become MANUAL
 * findings.
 */
public final class StructuralTransformer {

    private static final Logger log = LoggerFactory.getLogger(StructuralTransformer.class);

    static final String ROLLBACK_REASON = "Rewrite rolled back: the result did not parse";

    private final List<StructuralRule> rules;

    public StructuralTransformer(List<StructuralRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /** Catalog in application order. */
    public static List<StructuralRule> standardRules() {
        return List.of(
                new ExceptAsRule(),
                new RaiseCallRule(),
                new ImportRenameRule(),
                new BuiltinRenameRule(),
                new NewStyleClassRule(),
                new MetaclassFlagRule(),
                new NonzeroBoolRule(),
                new UnicodePrefixRule(),
                new DeprecatedBuiltinRule());
    }

    public List<StructuralRule> rules() {
        return rules;
    }

    public StructuralResult transform(SourceUnit unit) {
        if (!unit.parseable()) {
            return StructuralResult.skipped(unit);
        }
        Optional<PyModule> tree = PySyntax.tryParse(unit.content(), PyGrammar.TRANSITIONAL);
        if (tree.isEmpty()) {
            log.warn("Skipping {}: not parseable", unit.path());
            return StructuralResult.skipped(unit.withParseable(false));
        }
        SourceText text = SourceText.of(unit.content());
        StructuralContext ctx = new StructuralContext(unit.path(), new ParsedSource(text, tree.get()));

        Map<Integer, List<LineChange>> byLine = new TreeMap<>();
        for (StructuralRule rule : rules) {
            for (LineChange change : rule.apply(ctx)) {
                byLine.computeIfAbsent(change.line(), k -> new ArrayList<>()).add(change);
            }
        }

        List<TextEdit> accepted = new ArrayList<>();
        List<LineChange> kept = new ArrayList<>();
        List<StructuralResult.Rollback> rollbacks = new ArrayList<>();
        for (Map.Entry<Integer, List<LineChange>> entry : byLine.entrySet()) {
            int line = entry.getKey();
            List<LineChange> changes = entry.getValue();
            List<TextEdit> lineEdits = editsOf(changes, null);
            if (lineEdits.isEmpty() || parses(text, accepted, lineEdits)) {
                accepted.addAll(lineEdits);
                kept.addAll(changes);
                continue;
            }
            String culprit = null;
            for (String ruleId : editingRules(changes)) {
                List<TextEdit> without = editsOf(changes, ruleId);
                if (parses(text, accepted, without)) {
                    culprit = ruleId;
                    accepted.addAll(without);
                    break;
                }
            }
            for (LineChange change : changes) {
                boolean dropped = culprit == null ? !change.edits().isEmpty() : change.ruleId().equals(culprit);
                if (dropped) {
                    kept.add(change.rolledBack(ROLLBACK_REASON));
                    rollbacks.add(new StructuralResult.Rollback(line, change.ruleId()));
                    PipelineAlertLogger.ruleRolledBack(unit.path(), line, change.ruleId());
                } else {
                    kept.add(change);
                }
            }
        }

        FindingLog findings = FindingLog.empty();
        for (LineChange change : kept) {
            for (var f : change.findings()) {
                findings = findings.with(f);
            }
        }
        String content = text.apply(accepted).render();
        boolean modern = PySyntax.isParseable(content, PyGrammar.MODERN);
        SourceUnit result = accepted.isEmpty() ? unit : unit.withContent(content, history(accepted));
        return new StructuralResult(result, findings, rollbacks, false, modern);
    }

    private static boolean parses(SourceText text, List<TextEdit> accepted, List<TextEdit> candidate) {
        List<TextEdit> all = new ArrayList<>(accepted);
        all.addAll(candidate);
        return PySyntax.isParseable(text.apply(all).render(), PyGrammar.TRANSITIONAL);
    }

    /** Edits of all changes, leaving out those of {@code excludedRule} when non-null. */
    private static List<TextEdit> editsOf(List<LineChange> changes, String excludedRule) {
        List<TextEdit> edits = new ArrayList<>();
        for (LineChange c : changes) {
            if (!c.ruleId().equals(excludedRule)) {
                edits.addAll(c.edits());
            }
        }
        return edits;
    }

    private static Set<String> editingRules(List<LineChange> changes) {
        Set<String> ids = new LinkedHashSet<>();
        for (LineChange c : changes) {
            if (!c.edits().isEmpty()) {
                ids.add(c.ruleId());
            }
        }
        return ids;
    }

    private static List<AppliedRule> history(List<TextEdit> accepted) {
        Map<String, SortedSet<Integer>> lines = new LinkedHashMap<>();
        for (TextEdit e : accepted) {
            lines.computeIfAbsent(e.ruleId(), k -> new TreeSet<>()).add(e.line());
        }
        List<AppliedRule> out = new ArrayList<>();
        lines.forEach((rule, l) -> out.add(new AppliedRule(rule, new ArrayList<>(l))));
        return out;
    }
}
