package modernizer.repair;

import modernizer.syntax.ParsedSource;
import modernizer.syntax.PyExpr;
import modernizer.syntax.PyStmt;
import modernizer.syntax.PyTreeWalker;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Makes printed values explicit strings: {@code print(x)} becomes
 * {@code print(str(x))}. String literals and values already passed through
 * {@code str()} are left alone.
 */
public final class StrCoercionStrategy implements RepairStrategy {

    public static final String ID = "str_coercion";

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
        List<TextEdit> edits = new ArrayList<>();
        for (PyStmt s : PyTreeWalker.statements(parsed.get().tree())) {
            if (!(s instanceof PyStmt.ExprStmt stmt) || !(stmt.value() instanceof PyExpr.Call call)
                    || !"print".equals(call.funcName())) {
                continue;
            }
            for (PyExpr arg : call.positional()) {
                if (!isString(arg)) {
                    edits.addAll(TextEdit.wrap(arg.span(), "str(", ")", ID));
                }
            }
        }
        return target.rewrite(parsed.get(), edits);
    }

    private static boolean isString(PyExpr e) {
        if (e instanceof PyExpr.Constant c) {
            return c.kind() == PyExpr.Constant.Kind.STRING;
        }
        return e instanceof PyExpr.Call c && "str".equals(c.funcName());
    }
}
