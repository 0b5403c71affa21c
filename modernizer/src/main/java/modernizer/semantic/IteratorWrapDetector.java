package modernizer.semantic;

import modernizer.syntax.ParsedSource;
import modernizer.syntax.PyExpr;
import modernizer.syntax.PyTreeWalker.Role;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Wraps lazy results in {@code list(...)} where the code needs a real list.
 *
 * <p>Contexts that need a list:
 * <ul>
 *   <li>indexing: {@code map(f, xs)[0]}, {@code d.keys()[0]}</li>
 *   <li>{@code len()} of a {@code map}, {@code filter} or {@code zip}</li>
 *   <li>concatenation with a list literal: {@code range(3) + [9]}</li>
 * </ul>
 */
public final class IteratorWrapDetector implements SemanticDetector {

    public static final String ID = "iterator_wrap";

    private static final Set<String> LAZY_BUILTINS = Set.of("map", "filter", "zip");
    private static final Set<String> DICT_VIEWS = Set.of("keys", "values", "items");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String counter() {
        return "iterator_wraps";
    }

    @Override
    public Detection detect(SemanticContext ctx) {
        ParsedSource parsed = ctx.parsed();
        List<TextEdit> edits = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (PyExpr e : parsed.expressions()) {
            if (!(e instanceof PyExpr.Call call)) {
                continue;
            }
            boolean lazy = call.funcName() != null && LAZY_BUILTINS.contains(call.funcName());
            boolean range = "range".equals(call.funcName());
            boolean view = call.args().isEmpty() && call.methodName() != null && DICT_VIEWS.contains(call.methodName());
            if (!lazy && !range && !view) {
                continue;
            }
            ParsedSource.Parent parent = parsed.parentOf(call);
            if (needsList(parent, call, lazy, view)) {
                edits.addAll(TextEdit.wrap(call.span(), "list(", ")", ID));
            } else if (view && parent.role() == Role.ASSIGNED_VALUE) {
                warnings.add("line " + call.span().line() + ": ." + call.methodName()
                        + "() now returns a view; wrap in list() if the result is indexed or mutated");
            }
        }
        return new Detection(edits, edits.size() / 2, warnings);
    }

    private static boolean needsList(ParsedSource.Parent parent, PyExpr.Call call, boolean lazy, boolean view) {
        if (parent == null) {
            return false;
        }
        if (parent.role() == Role.SUBSCRIPT_BASE) {
            return lazy || view;
        }
        if (parent.role() == Role.CALL_ARGUMENT && parent.node() instanceof PyExpr.Call outer) {
            return lazy && "len".equals(outer.funcName());
        }
        if (parent.role() == Role.OPERAND && parent.node() instanceof PyExpr.BinOp b && b.op().equals("+")) {
            PyExpr other = b.left() == call ? b.right() : b.left();
            return other instanceof PyExpr.Composite c && (c.kind().equals("list") || c.kind().equals("listcomp"));
        }
        return false;
    }
}
