package modernizer.structural;

import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Drops the {@code u}/{@code U} prefix of string literals.
 */
public final class UnicodePrefixRule implements StructuralRule {

    public static final String ID = "unicode_prefix";

    private static final Pattern PREFIX = Pattern.compile("(?<![\\w])[uU](?=['\"])");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<LineChange> apply(StructuralContext ctx) {
        List<LineChange> changes = new ArrayList<>();
        for (int n = 1; n <= ctx.text().lineCount(); n++) {
            Matcher m = PREFIX.matcher(ctx.mask().code(n));
            List<TextEdit> edits = new ArrayList<>();
            while (m.find()) {
                edits.add(TextEdit.replace(n, m.start(), m.start() + 1, "", ID));
            }
            if (!edits.isEmpty()) {
                changes.add(LineChange.fixed(ctx, n, ID, edits));
            }
        }
        return changes;
    }
}
