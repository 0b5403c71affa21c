package modernizer.preprocess;

import modernizer.syntax.CodeMask;
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
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Makes a legacy unit parseable under the transitional grammar.
 *
 * <p>Phases run in order, each as one batch of edits against the text left by
 * the previous one:
 * <ol>
 *   <li>token substitutions (type aliases, {@code <>}, numeric literals, {@code ur} prefixes)</li>
 *   <li>print statements, unless the unit imports {@code print_function}</li>
 *   <li>marking of legacy builtins</li>
 *   <li>a bounded recovery loop: parse, fix or stub the error line, repeat</li>
 * </ol>
 *
 * <p>No phase adds or removes lines. A unit that still fails to parse after
 * recovery is returned with its original content and marked unparseable.
 * Processing is pure and idempotent.
 */
public final class Preprocessor {

    private static final Logger log = LoggerFactory.getLogger(Preprocessor.class);

    static final String STUB_PREFIX = "# STUBBED: ";

    private final int maxFixIterations;

    public Preprocessor(int maxFixIterations) {
        if (maxFixIterations <= 0) {
            throw new IllegalArgumentException("maxFixIterations must be positive");
        }
        this.maxFixIterations = maxFixIterations;
    }

    public PreprocessResult process(SourceUnit unit) {
        if (unit.isBlank()) {
            return PreprocessResult.skippedEmpty(unit);
        }
        SourceText original = SourceText.of(unit.content());
        Map<String, SortedSet<Integer>> applied = new LinkedHashMap<>();

        SourceText text = apply(original, LegacyTokenRewriter.substitutions(original, CodeMask.of(original)), applied);
        CodeMask mask = CodeMask.of(text);
        boolean printFunction = LegacyTokenRewriter.importsPrintFunction(mask);
        if (!printFunction) {
            text = apply(text, PrintStatementRewriter.statements(text, mask, PreprocessRule.PRINT_STATEMENT.id()),
                    applied);
            mask = CodeMask.of(text);
        }
        SortedSet<Integer> marked = LegacyTokenRewriter.legacyBuiltinLines(text, mask);

        List<Integer> stubbed = new ArrayList<>();
        String error = null;
        int bound = Math.min(maxFixIterations, Math.max(1, text.lineCount()));
        for (int attempt = 0; ; attempt++) {
            Optional<PySyntaxException> failure = PySyntax.check(text.render(), PyGrammar.TRANSITIONAL);
            if (failure.isEmpty()) {
                error = null;
                break;
            }
            PySyntaxException e = failure.get();
            error = e.getMessage();
            int line = Math.max(1, Math.min(e.getLine(), text.lineCount()));
            if (attempt >= bound || stubbed.contains(line)) {
                break;
            }
            Optional<RecoveryFixer.Fix> fix = RecoveryFixer.fix(text, mask, line, printFunction);
            SourceText fixed = fix.map(f -> f.edits()).map(text::apply).orElse(null);
            if (fixed != null && !fixed.render().equals(text.render())) {
                track(fix.get().edits(), applied);
                text = fixed;
            } else {
                log.debug("Stubbing line {} of {}: {}", line, unit.path(), e.getReason());
                text = stub(text, line);
                applied.computeIfAbsent(PreprocessRule.STUB.id(), k -> new TreeSet<>()).add(line);
                stubbed.add(line);
            }
            mask = CodeMask.of(text);
        }

        if (error != null) {
            log.warn("Unit {} is not parseable after recovery: {}", unit.path(), error);
            return new PreprocessResult(unit.withParseable(false), PreprocessResult.UNPARSEABLE, List.of(), 0,
                    List.of(), List.copyOf(marked), List.of(error));
        }

        int changed = changedLines(original, text);
        if (changed == 0) {
            return new PreprocessResult(unit.withParseable(true), PreprocessResult.UNCHANGED, List.of(), 0,
                    List.of(), List.copyOf(marked), List.of());
        }
        List<AppliedRule> history = new ArrayList<>();
        applied.forEach((rule, lines) -> history.add(new AppliedRule(rule, new ArrayList<>(lines))));
        SourceUnit result = unit.withContent(text.render(), history).withParseable(true);
        return new PreprocessResult(result, PreprocessResult.MODIFIED, new TreeSet<>(applied.keySet()).stream().toList(),
                changed, stubbed.stream().sorted().toList(), List.copyOf(marked), List.of());
    }

    private static SourceText apply(SourceText text, List<TextEdit> edits, Map<String, SortedSet<Integer>> applied) {
        SourceText result = text.apply(edits);
        track(edits, applied);
        return result;
    }

    private static void track(Collection<TextEdit> edits, Map<String, SortedSet<Integer>> applied) {
        for (TextEdit e : edits) {
            applied.computeIfAbsent(e.ruleId(), k -> new TreeSet<>()).add(e.line());
        }
    }

    /** Comments out a line, keeping its indentation. */
    static SourceText stub(SourceText text, int line) {
        return text.withLine(line, text.indentation(line) + STUB_PREFIX + text.line(line).strip());
    }

    private static int changedLines(SourceText before, SourceText after) {
        int common = Math.min(before.lineCount(), after.lineCount());
        int changed = Math.abs(before.lineCount() - after.lineCount());
        for (int n = 1; n <= common; n++) {
            if (!before.line(n).equals(after.line(n))) {
                changed++;
            }
        }
        return changed;
    }
}
