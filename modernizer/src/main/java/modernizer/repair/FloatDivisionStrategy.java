package modernizer.repair;

import modernizer.syntax.ParsedSource;
import modernizer.syntax.PyExpr;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Undoes a floor-division rewrite that changed results: {@code a // b} on a
 * line the semantic stage touched becomes {@code float(a) / b}.
 */
public final class FloatDivisionStrategy implements RepairStrategy {

    public static final String ID = "float_division";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Optional<String> apply(RepairTarget target) {
        if (target.divisionLines().isEmpty()) {
            return Optional.empty();
        }
        Optional<ParsedSource> parsed = target.parse();
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        List<TextEdit> edits = new ArrayList<>();
        for (PyExpr e : parsed.get().expressions()) {
            if (e instanceof PyExpr.BinOp b && b.op().equals("//")
                    && target.divisionLines().contains(b.opSpan().line())) {
                edits.add(TextEdit.replace(b.opSpan().line(), b.opSpan().column(), b.opSpan().endColumn(), "/", ID));
                edits.addAll(TextEdit.wrap(b.left().span(), "float(", ")", ID));
            }
        }
        return target.rewrite(parsed.get(), edits);
    }
}
