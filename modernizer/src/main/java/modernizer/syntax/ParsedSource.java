package modernizer.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed unit together with its text, masked code and expression parent links.
 */
public final class ParsedSource {

    private final SourceText text;
    private final CodeMask mask;
    private final PyModule tree;
    private final Map<PyExpr, Parent> parents = new IdentityHashMap<>();
    private final List<PyExpr> expressions = new ArrayList<>();

    /**
     * Parent link of an expression.
     *
     * @param node the parent expression, null at statement level
     * @param role the role the child plays in it
     */
    public record Parent(PyExpr node, PyTreeWalker.Role role) {
    }

    public ParsedSource(SourceText text, PyModule tree) {
        this.text = text;
        this.mask = CodeMask.of(text);
        this.tree = tree;
        PyTreeWalker.walk(tree, (node, parent, role) -> {
            expressions.add(node);
            parents.put(node, new Parent(parent, role));
        });
    }

    /** Parses {@code text} under {@code grammar}. */
    public static ParsedSource parse(SourceText text, PyGrammar grammar) throws PySyntaxException {
        return new ParsedSource(text, PyParser.parse(text.render(), grammar));
    }

    public SourceText text() {
        return text;
    }

    public CodeMask mask() {
        return mask;
    }

    public PyModule tree() {
        return tree;
    }

    /** Every expression in document order. */
    public List<PyExpr> expressions() {
        return Collections.unmodifiableList(expressions);
    }

    public Parent parentOf(PyExpr node) {
        return parents.get(node);
    }

    /** Source text covered by a span, lines joined with {@code \n}. */
    public String source(SourceSpan span) {
        if (span.isSingleLine()) {
            return text.line(span.line()).substring(span.column(), span.endColumn());
        }
        StringBuilder sb = new StringBuilder(text.line(span.line()).substring(span.column()));
        for (int n = span.line() + 1; n < span.endLine(); n++) {
            sb.append('\n').append(text.line(n));
        }
        sb.append('\n').append(text.line(span.endLine()), 0, span.endColumn());
        return sb.toString();
    }
}
