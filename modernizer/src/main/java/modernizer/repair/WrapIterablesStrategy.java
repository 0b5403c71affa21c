package modernizer.repair;

import modernizer.syntax.ParsedSource;
import modernizer.syntax.PyExpr;
import modernizer.syntax.PyTreeWalker.Role;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Wraps lazy {@code map}, {@code filter}, {@code zip}, {@code range} and
 * dictionary view results in {@code list(...)} wherever they escape into a
 * value: assigned, returned, printed, stored in a container.
 *
 * <p>Results that are only iterated, compared or passed to a function that
 * consumes an iterable are left alone.
 */
public final class WrapIterablesStrategy implements RepairStrategy {

    public static final String ID = "wrap_iterables";

    private static final Set<String> LAZY = Set.of("map", "filter", "zip", "range");
    private static final Set<String> VIEWS = Set.of("keys", "values", "items");
    private static final Set<String> CONSUMING_FUNCTIONS = Set.of(
            "list", "tuple", "set", "frozenset", "sorted", "sum", "any", "all", "min", "max",
            "dict", "enumerate", "iter", "next", "reversed");
    private static final Set<String> CONSUMING_METHODS = Set.of("join", "extend", "update");
    private static final Set<Role> ITERATED = Set.of(Role.ITERABLE, Role.COMPARED, Role.STATEMENT);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Optional<String> apply(RepairTarget target) {
        Optional<ParsedSource> parsed = target.parse();
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        ParsedSource source = parsed.get();
        List<TextEdit> edits = new ArrayList<>();
        for (PyExpr e : source.expressions()) {
            if (e instanceof PyExpr.Call call && isLazy(call) && escapes(source, call)) {
                edits.addAll(TextEdit.wrap(call.span(), "list(", ")", ID));
            }
        }
        return target.rewrite(source, edits);
    }

    private static boolean isLazy(PyExpr.Call call) {
        if (call.funcName() != null) {
            return LAZY.contains(call.funcName());
        }
        return call.args().isEmpty() && call.methodName() != null && VIEWS.contains(call.methodName());
    }

    private static boolean escapes(ParsedSource source, PyExpr.Call call) {
        ParsedSource.Parent parent = source.parentOf(call);
        if (parent == null || ITERATED.contains(parent.role())) {
            return false;
        }
        if (parent.role() == Role.CALL_ARGUMENT && parent.node() instanceof PyExpr.Call outer) {
            if (outer.funcName() != null && CONSUMING_FUNCTIONS.contains(outer.funcName())) {
                return false;
            }
            if (outer.methodName() != null && CONSUMING_METHODS.contains(outer.methodName())) {
                return false;
            }
            boolean sized = "range".equals(call.funcName()) || call.funcName() == null;
            return !("len".equals(outer.funcName()) && sized);
        }
        return true;
    }
}
