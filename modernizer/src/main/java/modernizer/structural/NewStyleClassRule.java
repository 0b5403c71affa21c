package modernizer.structural;

import modernizer.syntax.PyStmt;
import modernizer.syntax.PyTreeWalker;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code class C:} and {@code class C():} become {@code class C(object):}.
 */
public final class NewStyleClassRule implements StructuralRule {

    public static final String ID = "new_style_class";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<LineChange> apply(StructuralContext ctx) {
        List<LineChange> changes = new ArrayList<>();
        for (PyStmt.ClassDef c : PyTreeWalker.classes(ctx.tree())) {
            if (!c.bases().isEmpty()) {
                continue;
            }
            int line = headerLine(ctx, c);
            if (line < 0) {
                continue;
            }
            Matcher m = header(c.name()).matcher(ctx.mask().code(line));
            if (!m.find()) {
                continue;
            }
            int from = m.end(1);
            int to = m.group(2) != null ? m.end(2) : from;
            changes.add(LineChange.fixed(ctx, line, ID, List.of(TextEdit.replace(line, from, to, "(object)", ID))));
        }
        return changes;
    }

    /** Line holding {@code class <name>}, skipping decorator lines. */
    static int headerLine(StructuralContext ctx, PyStmt.ClassDef c) {
        Pattern p = Pattern.compile("^\\s*class\\s+" + Pattern.quote(c.name()) + "\\b");
        for (int n = c.span().line(); n <= Math.min(c.span().endLine(), ctx.text().lineCount()); n++) {
            if (p.matcher(ctx.mask().code(n)).find()) {
                return n;
            }
        }
        return -1;
    }

    private static Pattern header(String name) {
        return Pattern.compile("^(\\s*class\\s+" + Pattern.quote(name) + ")(\\s*\\(\\s*\\))?\\s*:");
    }
}
