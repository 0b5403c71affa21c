package modernizer.semantic;

import modernizer.syntax.PyExpr;
import modernizer.syntax.SourceSpan;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;

/**
 * Adds {@code encoding='utf-8'} to text-mode {@code open()} calls, which
 * otherwise decode with the platform default.
 */
public final class OpenEncodingDetector implements SemanticDetector {

    public static final String ID = "open_encoding";

    static final String ENCODING_ARGUMENT = ", encoding='utf-8'";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String counter() {
        return "encoding_fixes";
    }

    @Override
    public Detection detect(SemanticContext ctx) {
        List<TextEdit> edits = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (PyExpr e : ctx.parsed().expressions()) {
            if (!(e instanceof PyExpr.Call call) || !"open".equals(call.funcName())) {
                continue;
            }
            if (call.args().isEmpty() || call.keyword("encoding") != null || call.hasStarArgs()
                    || call.positional().size() >= 4) {
                continue;
            }
            PyExpr mode = mode(call);
            if (mode != null && !(mode instanceof PyExpr.Constant c && c.kind() == PyExpr.Constant.Kind.STRING)) {
                warnings.add("line " + call.span().line() + ": open() with a computed mode left without encoding");
                continue;
            }
            if (mode != null && isBinary((PyExpr.Constant) mode)) {
                continue;
            }
            SourceSpan last = call.args().get(call.args().size() - 1).span();
            edits.add(TextEdit.insert(last.endLine(), last.endColumn(), ENCODING_ARGUMENT, ID));
        }
        return new Detection(edits, edits.size(), warnings);
    }

    private static PyExpr mode(PyExpr.Call call) {
        PyExpr.Argument keyword = call.keyword("mode");
        if (keyword != null) {
            return keyword.value();
        }
        List<PyExpr> positional = call.positional();
        return positional.size() > 1 ? positional.get(1) : null;
    }

    /** Mode literal such as {@code 'rb'}; the prefix and quotes are skipped. */
    public static boolean isBinary(PyExpr.Constant mode) {
        String literal = mode.text().replaceFirst("^[A-Za-z]*", "");
        return literal.indexOf('b') >= 0;
    }
}
