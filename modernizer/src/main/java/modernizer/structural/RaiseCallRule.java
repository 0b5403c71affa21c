package modernizer.structural;

import modernizer.syntax.PyExpr;
import modernizer.syntax.PyStmt;
import modernizer.syntax.PyTreeWalker;
import modernizer.syntax.SourceSpan;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code raise E, v} becomes {@code raise E(v)} and {@code raise E, v, tb}
 * becomes {@code raise E(v).with_traceback(tb)}.
 *
 * <p>A tuple value is unpacked into the constructor arguments and {@code None}
 * gives an argument-less call, matching how the legacy runtime instantiated
 * the exception.
 */
public final class RaiseCallRule implements StructuralRule {

    public static final String ID = "raise_call";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<LineChange> apply(StructuralContext ctx) {
        List<LineChange> changes = new ArrayList<>();
        for (PyStmt s : PyTreeWalker.statements(ctx.tree())) {
            if (!(s instanceof PyStmt.Raise r) || r.legacyArguments().isEmpty()) {
                continue;
            }
            List<PyExpr> legacy = r.legacyArguments();
            PyExpr last = legacy.get(legacy.size() - 1);
            SourceSpan covered = SourceSpan.between(r.exception().span(), last.span());
            int line = covered.line();
            if (!covered.isSingleLine()) {
                changes.add(LineChange.manual(ctx, line, ID, "Multi-line raise statement; rewrite by hand"));
                continue;
            }
            String call = ctx.source(r.exception().span()) + arguments(ctx, legacy.get(0));
            if (legacy.size() > 1) {
                call += ".with_traceback(" + ctx.source(legacy.get(1).span()) + ")";
            }
            changes.add(LineChange.fixed(ctx, line, ID,
                    List.of(TextEdit.replace(line, covered.column(), covered.endColumn(), call, ID))));
        }
        return changes;
    }

    private static String arguments(StructuralContext ctx, PyExpr value) {
        if (value instanceof PyExpr.Constant c && c.kind() == PyExpr.Constant.Kind.NONE) {
            return "()";
        }
        String text = ctx.source(value.span());
        if (value instanceof PyExpr.Composite c && c.kind().equals("tuple") && text.startsWith("(")) {
            return text;
        }
        return "(" + text + ")";
    }
}
