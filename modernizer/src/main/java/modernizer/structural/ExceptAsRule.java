package modernizer.structural;

import modernizer.syntax.CodeScan;
import modernizer.syntax.PyStmt;
import modernizer.syntax.PyTreeWalker;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code except E, e:} becomes {@code except E as e:}, tuple types included.
 */
public final class ExceptAsRule implements StructuralRule {

    public static final String ID = "except_as";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<LineChange> apply(StructuralContext ctx) {
        List<LineChange> changes = new ArrayList<>();
        for (PyStmt s : PyTreeWalker.statements(ctx.tree())) {
            if (!(s instanceof PyStmt.Try t)) {
                continue;
            }
            for (PyStmt.Handler h : t.handlers()) {
                if (!h.legacyComma()) {
                    continue;
                }
                int line = h.span().line();
                if (!h.name().matches("[A-Za-z_]\\w*")) {
                    changes.add(LineChange.manual(ctx, line, ID,
                            "Unpack the exception inside the handler body; a tuple target has no 'as' form"));
                    continue;
                }
                String code = ctx.mask().code(line);
                int keyword = code.indexOf("except");
                int limit = ctx.mask().commentStart(line) >= 0 ? ctx.mask().commentStart(line) : code.length();
                List<Integer> commas = keyword < 0 ? List.of() : CodeScan.topLevelCommas(code, keyword, limit);
                if (commas.isEmpty()) {
                    changes.add(LineChange.manual(ctx, line, ID, "Handler clause spans several lines"));
                    continue;
                }
                int comma = commas.get(0);
                int target = CodeScan.skipSpaces(code, comma + 1, limit);
                int typeEnd = CodeScan.trimBack(code, keyword, comma);
                changes.add(LineChange.fixed(ctx, line, ID,
                        List.of(TextEdit.replace(line, typeEnd, target, " as ", ID))));
            }
        }
        return changes;
    }
}
