package modernizer.semantic;

import modernizer.syntax.PyExpr;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rewrites {@code a / b} to {@code a // b} when both operands look like
 * integers, preserving the legacy truncating division.
 *
 * <p>The integer test is a name and shape heuristic, not type inference. The
 * detector is off for units that import {@code division} from {@code __future__}.
 */
public final class IntDivisionDetector implements SemanticDetector {

    public static final String ID = "int_division";

    private static final Set<String> INT_NAMES = Set.of(
            "i", "j", "k", "n", "m", "count", "idx", "index", "num", "size", "len", "length", "total");
    private static final Set<String> INT_FUNCTIONS = Set.of("len", "int", "range", "ord");
    private static final Set<String> INT_OPERATORS = Set.of("+", "-", "*", "//", "%");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String counter() {
        return "division_fixes";
    }

    @Override
    public Detection detect(SemanticContext ctx) {
        if (ctx.importsFuture("division")) {
            return Detection.none();
        }
        List<TextEdit> edits = new ArrayList<>();
        for (PyExpr e : ctx.parsed().expressions()) {
            if (e instanceof PyExpr.BinOp b && b.op().equals("/") && likelyInt(b.left()) && likelyInt(b.right())) {
                edits.add(TextEdit.replace(b.opSpan().line(), b.opSpan().column(), b.opSpan().endColumn(), "//", ID));
            }
        }
        return new Detection(edits, edits.size(), List.of());
    }

    static boolean likelyInt(PyExpr e) {
        if (e instanceof PyExpr.Constant c) {
            return c.isIntegerLiteral();
        }
        if (e instanceof PyExpr.Name n) {
            String id = n.id();
            return INT_NAMES.contains(id) || id.endsWith("_count") || id.startsWith("num_") || id.startsWith("n_");
        }
        if (e instanceof PyExpr.Call c) {
            return c.funcName() != null && INT_FUNCTIONS.contains(c.funcName());
        }
        if (e instanceof PyExpr.BinOp b) {
            return INT_OPERATORS.contains(b.op()) && likelyInt(b.left()) && likelyInt(b.right());
        }
        if (e instanceof PyExpr.Composite c && c.kind().equals("unary-")) {
            return likelyInt(c.elements().get(0));
        }
        return false;
    }
}
