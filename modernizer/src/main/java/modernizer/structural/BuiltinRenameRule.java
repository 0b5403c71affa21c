package modernizer.structural;

import modernizer.syntax.ParsedSource;
import modernizer.syntax.PyExpr;
import modernizer.syntax.PyTreeWalker;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renames builtins and dictionary methods that were removed or renamed.
 *
 * <ul>
 *   <li>{@code xrange}, {@code raw_input}, {@code unichr} to {@code range}, {@code input}, {@code chr}</li>
 *   <li>{@code .iteritems()}, {@code .iterkeys()}, {@code .itervalues()} to the view methods</li>
 *   <li>{@code d.has_key(k)} to {@code k in d}</li>
 * </ul>
 */
public final class BuiltinRenameRule implements StructuralRule {

    public static final String ID = "builtin_rename";

    private static final Map<String, String> BUILTINS = Map.of(
            "xrange", "range",
            "raw_input", "input",
            "unichr", "chr");
    private static final Map<String, String> METHODS = Map.of(
            "iteritems", "items",
            "iterkeys", "keys",
            "itervalues", "values");

    private static final Pattern BUILTIN = Pattern.compile("(?<![\\w.])(xrange|raw_input|unichr)\\b");
    private static final Pattern METHOD = Pattern.compile("\\.\\s*(iteritems|iterkeys|itervalues)\\b");
    private static final Pattern DEFINITION = Pattern.compile("\\b(def|class)\\s+$");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<LineChange> apply(StructuralContext ctx) {
        List<LineChange> changes = new ArrayList<>();
        for (int n = 1; n <= ctx.text().lineCount(); n++) {
            List<TextEdit> edits = new ArrayList<>();
            String code = ctx.mask().code(n);
            Matcher b = BUILTIN.matcher(code);
            while (b.find()) {
                if (!DEFINITION.matcher(code.substring(0, b.start())).find()) {
                    edits.add(TextEdit.replace(n, b.start(1), b.end(1), BUILTINS.get(b.group(1)), ID));
                }
            }
            Matcher m = METHOD.matcher(code);
            while (m.find()) {
                edits.add(TextEdit.replace(n, m.start(1), m.end(1), METHODS.get(m.group(1)), ID));
            }
            if (!edits.isEmpty()) {
                changes.add(LineChange.fixed(ctx, n, ID, edits));
            }
        }
        for (PyExpr e : ctx.expressions()) {
            if (e instanceof PyExpr.Call call && "has_key".equals(call.methodName())) {
                changes.add(hasKey(ctx, call));
            }
        }
        return changes;
    }

    private static LineChange hasKey(StructuralContext ctx, PyExpr.Call call) {
        int line = call.span().line();
        List<PyExpr> positional = call.positional();
        if (!call.span().isSingleLine() || positional.size() != 1 || call.args().size() != 1) {
            return LineChange.manual(ctx, line, ID, "Replace has_key() with the 'in' operator");
        }
        PyExpr receiver = ((PyExpr.Attribute) call.func()).value();
        String key = operand(ctx, positional.get(0));
        String container = operand(ctx, receiver);
        String membership = key + " in " + container;
        ParsedSource.Parent parent = ctx.parentOf(call);
        if (parent != null && parent.node() != null) {
            membership = "(" + membership + ")";
        }
        return LineChange.fixed(ctx, line, ID, List.of(TextEdit.replace(line,
                call.span().column(), call.span().endColumn(), membership, ID)));
    }

    /** Text of an operand, parenthesized unless it binds tighter than {@code in}. */
    private static String operand(StructuralContext ctx, PyExpr e) {
        String text = ctx.source(e.span());
        boolean atomic = e instanceof PyExpr.Name || e instanceof PyExpr.Constant || e instanceof PyExpr.Call
                || e instanceof PyExpr.Attribute || e instanceof PyExpr.Subscript
                || e instanceof PyExpr.Composite c && (c.kind().equals("list") || c.kind().equals("dict")
                || c.kind().equals("set") || c.kind().equals("tuple") && text.startsWith("("));
        return atomic ? text : "(" + text + ")";
    }
}
