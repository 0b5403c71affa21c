package modernizer.syntax;

import java.util.List;

/**
 * Statement nodes of the syntax tree.
 */
public interface PyStmt extends PyNode {

    record Alias(String name, String asName, SourceSpan span) {
    }

    record Import(List<Alias> names, SourceSpan span) implements PyStmt {
    }

    record ImportFrom(String module, int level, List<Alias> names, SourceSpan span) implements PyStmt {
    }

    record Assign(List<PyExpr> targets, PyExpr value, SourceSpan span) implements PyStmt {
    }

    record ExprStmt(PyExpr value, SourceSpan span) implements PyStmt {
    }

    /**
     * {@code legacyArguments} holds the value and traceback of a comma raise
     * ({@code raise E, v, tb}); it is empty for the modern form.
     */
    record Raise(PyExpr exception, PyExpr cause, List<PyExpr> legacyArguments, SourceSpan span) implements PyStmt {
    }

    record Handler(PyExpr type, String name, boolean legacyComma, List<PyStmt> body, SourceSpan span) {
    }

    record Try(List<PyStmt> body, List<Handler> handlers, List<PyStmt> orElse, List<PyStmt> finalBody,
               SourceSpan span) implements PyStmt {
    }

    record ClassDef(String name, List<PyExpr.Argument> bases, List<PyExpr> decorators, List<PyStmt> body,
                    SourceSpan span) implements PyStmt {
    }

    record FunctionDef(String name, List<PyExpr> parameterDefaults, List<PyExpr> decorators, List<PyStmt> body,
                       SourceSpan span) implements PyStmt {
    }

    /** pass, break, continue, return, del, assert, global, nonlocal, augmented and annotated assignment. */
    record Simple(String kind, List<PyExpr> expressions, SourceSpan span) implements PyStmt {
    }

    /**
     * if, while, for and with. For {@code for} the header is [target, iterable];
     * for {@code if} it holds one condition per if/elif branch.
     */
    record Compound(String kind, List<PyExpr> header, List<List<PyStmt>> blocks, SourceSpan span) implements PyStmt {
    }
}
