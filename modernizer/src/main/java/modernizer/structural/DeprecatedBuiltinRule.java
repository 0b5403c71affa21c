package modernizer.structural;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Flags calls to builtins that no longer exist. Nothing is rewritten: each
 * replacement needs a decision about semantics.
 */
public final class DeprecatedBuiltinRule implements StructuralRule {

    public static final String ID = "deprecated_builtin";

    static final Map<String, String> ADVICE = Map.ofEntries(
            entry("apply", "Call the function directly: f(*args, **kwargs)"),
            entry("buffer", "Use memoryview"),
            entry("cmp", "Use (a > b) - (a < b), or functools.cmp_to_key for sort functions"),
            entry("execfile", "Use exec(open(path).read())"),
            entry("file", "Use open()"),
            entry("reload", "Use importlib.reload"),
            entry("reduce", "Import reduce from functools"),
            entry("intern", "Use sys.intern"),
            entry("coerce", "Remove; numeric operands are coerced implicitly"));

    private static final Pattern CALL = Pattern.compile(
            "(?<![\\w.])(apply|buffer|cmp|execfile|file|reload|reduce|intern|coerce)\\s*\\(");
    private static final Pattern DEFINITION = Pattern.compile("\\b(def|class)\\s+$");
    private static final Pattern REDUCE_IMPORT = Pattern.compile("^\\s*from\\s+functools\\s+import\\b.*\\breduce\\b");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<LineChange> apply(StructuralContext ctx) {
        boolean reduceImported = false;
        for (int n = 1; n <= ctx.text().lineCount(); n++) {
            if (REDUCE_IMPORT.matcher(ctx.mask().code(n)).find()) {
                reduceImported = true;
            }
        }
        List<LineChange> changes = new ArrayList<>();
        for (int n = 1; n <= ctx.text().lineCount(); n++) {
            String code = ctx.mask().code(n);
            Matcher m = CALL.matcher(code);
            while (m.find()) {
                String name = m.group(1);
                if (DEFINITION.matcher(code.substring(0, m.start())).find()
                        || reduceImported && name.equals("reduce")) {
                    continue;
                }
                changes.add(LineChange.flagged(ctx, n, ID, name + "(): " + ADVICE.get(name)));
            }
        }
        return changes;
    }
}
