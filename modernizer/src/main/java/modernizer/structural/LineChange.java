package modernizer.structural;

import modernizer.syntax.SourceText;
import modernizer.syntax.TextEdit;
import modernizer.unit.TransformationFinding;

import java.util.List;

/**
 * The edits and findings one rule produces for one line.
 *
 * @param line 1-based line in the unit text
 * @param ruleId the producing rule
 * @param edits edits anchored on {@code line}; empty for flag-only changes
 * @param findings what the rule reports for the line
 */
public record LineChange(int line, String ruleId, List<TextEdit> edits, List<TransformationFinding> findings) {

    public LineChange {
        edits = List.copyOf(edits);
        findings = List.copyOf(findings);
    }

    /** A rewrite recorded as a FIXED finding with the line text before and after. */
    public static LineChange fixed(StructuralContext ctx, int line, String ruleId, List<TextEdit> edits) {
        String before = ctx.text().line(line);
        String after = applyToLine(before, edits);
        return new LineChange(line, ruleId, edits,
                List.of(TransformationFinding.fixed(ctx.unit(), line, ruleId, before, after)));
    }

    public static LineChange flagged(StructuralContext ctx, int line, String ruleId, String message) {
        return new LineChange(line, ruleId, List.of(),
                List.of(TransformationFinding.flagged(ctx.unit(), line, ruleId, ctx.text().line(line).strip(), message)));
    }

    public static LineChange manual(StructuralContext ctx, int line, String ruleId, String message) {
        return new LineChange(line, ruleId, List.of(),
                List.of(TransformationFinding.manual(ctx.unit(), line, ruleId, ctx.text().line(line).strip(), message)));
    }

    /** Drops the edits and turns every finding into a MANUAL one. */
    public LineChange rolledBack(String reason) {
        return new LineChange(line, ruleId, List.of(),
                findings.stream().map(f -> f.downgrade(reason)).toList());
    }

    private static String applyToLine(String text, List<TextEdit> edits) {
        List<TextEdit> local = edits.stream()
                .map(e -> e.isLineDeletion()
                        ? TextEdit.deleteLine(1, e.ruleId())
                        : TextEdit.replace(1, e.startColumn(), e.endColumn(), e.replacement(), e.ruleId()))
                .toList();
        return SourceText.of(text).apply(local).render();
    }
}
