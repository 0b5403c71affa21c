package modernizer.repair;

import modernizer.semantic.OpenEncodingDetector;
import modernizer.syntax.ParsedSource;
import modernizer.syntax.PyExpr;
import modernizer.syntax.SourceSpan;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Adds {@code encoding='utf-8'} to text-mode {@code open()}, {@code io.open()}
 * and {@code codecs.open()} calls that still lack one.
 */
public final class TextEncodingStrategy implements RepairStrategy {

    public static final String ID = "text_encoding";

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
        for (PyExpr e : parsed.get().expressions()) {
            if (!(e instanceof PyExpr.Call call) || call.args().isEmpty()) {
                continue;
            }
            int encodingPosition = encodingPosition(call);
            if (encodingPosition < 0 || call.keyword("encoding") != null || call.hasStarArgs()
                    || call.positional().size() > encodingPosition) {
                continue;
            }
            PyExpr mode = call.keyword("mode") != null ? call.keyword("mode").value()
                    : call.positional().size() > 1 ? call.positional().get(1) : null;
            if (mode != null && (!(mode instanceof PyExpr.Constant c) || c.kind() != PyExpr.Constant.Kind.STRING
                    || OpenEncodingDetector.isBinary(c))) {
                continue;
            }
            SourceSpan last = call.args().get(call.args().size() - 1).span();
            edits.add(TextEdit.insert(last.endLine(), last.endColumn(), ", encoding='utf-8'", ID));
        }
        return target.rewrite(parsed.get(), edits);
    }

    /** Positional index of the encoding parameter, or -1 for calls that are not file opens. */
    private static int encodingPosition(PyExpr.Call call) {
        if ("open".equals(call.funcName())) {
            return 3;
        }
        if ("open".equals(call.methodName()) && ((PyExpr.Attribute) call.func()).value() instanceof PyExpr.Name n) {
            if (n.id().equals("io")) {
                return 3;
            }
            if (n.id().equals("codecs")) {
                return 2;
            }
        }
        return -1;
    }
}
