package modernizer.structural;

import modernizer.syntax.PyExpr;
import modernizer.syntax.PyStmt;
import modernizer.syntax.PyTreeWalker;
import modernizer.syntax.TextEdit;
import modernizer.unit.TransformationFinding;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags {@code __metaclass__ = M} inside a class body.
 *
 * <p>The assignment is left alone because the keyword form changes class
 * creation order; a marker comment is inserted above it instead, once.
 */
public final class MetaclassFlagRule implements StructuralRule {

    public static final String ID = "metaclass_flag";

    static String marker(String className) {
        return "# TODO: convert metaclass syntax for " + className;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<LineChange> apply(StructuralContext ctx) {
        List<LineChange> changes = new ArrayList<>();
        for (PyStmt.ClassDef c : PyTreeWalker.classes(ctx.tree())) {
            for (PyStmt s : c.body()) {
                if (s instanceof PyStmt.Assign a && assignsMetaclass(a)) {
                    changes.add(flag(ctx, c, a.span().line()));
                }
            }
        }
        return changes;
    }

    private static LineChange flag(StructuralContext ctx, PyStmt.ClassDef c, int line) {
        String marker = marker(c.name());
        String message = "Rewrite as class " + c.name() + "(metaclass=...)";
        TransformationFinding finding = TransformationFinding.flagged(ctx.unit(), line, ID,
                ctx.text().line(line).strip(), message);
        boolean present = line > 1 && ctx.text().line(line - 1).strip().equals(marker);
        List<TextEdit> edits = present
                ? List.of()
                : List.of(TextEdit.insert(line, 0, ctx.text().indentation(line) + marker + "\n", ID));
        return new LineChange(line, ID, edits, List.of(finding));
    }

    private static boolean assignsMetaclass(PyStmt.Assign a) {
        return a.targets().stream().anyMatch(t -> t instanceof PyExpr.Name n && n.id().equals("__metaclass__"));
    }
}
