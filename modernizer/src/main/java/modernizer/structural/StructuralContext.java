package modernizer.structural;

import modernizer.syntax.CodeMask;
import modernizer.syntax.ParsedSource;
import modernizer.syntax.PyExpr;
import modernizer.syntax.PyModule;
import modernizer.syntax.SourceSpan;
import modernizer.syntax.SourceText;

import java.util.List;

/**
 * Read-only view of one parsed unit shared by all structural rules.
 */
public final class StructuralContext {

    private final String unit;
    private final ParsedSource parsed;

    public StructuralContext(String unit, ParsedSource parsed) {
        this.unit = unit;
        this.parsed = parsed;
    }

    public String unit() {
        return unit;
    }

    public SourceText text() {
        return parsed.text();
    }

    public CodeMask mask() {
        return parsed.mask();
    }

    public PyModule tree() {
        return parsed.tree();
    }

    public List<PyExpr> expressions() {
        return parsed.expressions();
    }

    public ParsedSource.Parent parentOf(PyExpr node) {
        return parsed.parentOf(node);
    }

    public String source(SourceSpan span) {
        return parsed.source(span);
    }
}
