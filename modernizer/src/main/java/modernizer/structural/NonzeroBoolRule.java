package modernizer.structural;

import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code __nonzero__} becomes {@code __bool__}, in definitions and references.
 */
public final class NonzeroBoolRule implements StructuralRule {

    public static final String ID = "nonzero_bool";

    private static final Pattern NONZERO = Pattern.compile("(?:\\bdef\\s+|\\.\\s*|^\\s*)(__nonzero__)\\b");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<LineChange> apply(StructuralContext ctx) {
        List<LineChange> changes = new ArrayList<>();
        for (int n = 1; n <= ctx.text().lineCount(); n++) {
            Matcher m = NONZERO.matcher(ctx.mask().code(n));
            List<TextEdit> edits = new ArrayList<>();
            while (m.find()) {
                edits.add(TextEdit.replace(n, m.start(1), m.end(1), "__bool__", ID));
            }
            if (!edits.isEmpty()) {
                changes.add(LineChange.fixed(ctx, n, ID, edits));
            }
        }
        return changes;
    }
}
