package modernizer.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the modern dialect.
 *
 * <p>Builds a {@link PyModule} whose nodes carry {@link SourceSpan}s precise
 * enough to anchor text edits. The parser validates structure only; it does not
 * resolve names or check assignment targets.
 *
 * <p>Under {@link PyGrammar#TRANSITIONAL} the comma forms of exception capture
 * and raise are accepted as well and flagged on the resulting nodes.
 */
public final class PyParser {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private static final Set<String> AUGMENTED = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "@=", "&=", "|=", "^=", ">>=", "<<=", "**=");

    private static final Set<String> COMPARISON = Set.of("<", ">", "==", ">=", "<=", "!=");

    private final List<PyToken> toks;
    private final PyGrammar grammar;
    private int p;
    private PyToken last;

    private PyParser(List<PyToken> toks, PyGrammar grammar) {
        this.toks = toks;
        this.grammar = grammar;
    }

    /**
     * Parses source text.
     *
     * @param source  the source text
     * @param grammar the grammar to accept
     * @return the syntax tree
     * @throws PySyntaxException on the first tokenization or parse error
     */
    public static PyModule parse(String source, PyGrammar grammar) throws PySyntaxException {
        PyParser parser = new PyParser(PyLexer.tokenize(source), grammar);
        return new PyModule(parser.file(), grammar);
    }

    // ===== statements =====

    private List<PyStmt> file() throws PySyntaxException {
        List<PyStmt> body = new ArrayList<>();
        while (peek().type() != PyTokenType.ENDMARKER) {
            if (peek().type() == PyTokenType.NEWLINE) {
                next();
                continue;
            }
            if (peek().type() == PyTokenType.INDENT) {
                throw error(peek(), "unexpected indent");
            }
            body.addAll(statement());
        }
        return body;
    }

    private List<PyStmt> statement() throws PySyntaxException {
        PyToken t = peek();
        if (t.type() == PyTokenType.NAME) {
            switch (t.text()) {
                case "if":
                    return List.of(ifStmt());
                case "while":
                    return List.of(whileStmt());
                case "for":
                    return List.of(forStmt(t));
                case "try":
                    return List.of(tryStmt());
                case "with":
                    return List.of(withStmt(t));
                case "def":
                    return List.of(funcDef(t, List.of()));
                case "class":
                    return List.of(classDef(t, List.of()));
                case "async":
                    return List.of(asyncStmt(List.of()));
                default:
                    break;
            }
        }
        if (t.isOp("@")) {
            return List.of(decorated());
        }
        return simpleStatements();
    }

    private List<PyStmt> simpleStatements() throws PySyntaxException {
        List<PyStmt> out = new ArrayList<>();
        while (true) {
            out.add(smallStatement());
            if (!peek().isOp(";")) {
                break;
            }
            next();
            if (peek().type() == PyTokenType.NEWLINE || peek().type() == PyTokenType.ENDMARKER) {
                break;
            }
        }
        expectNewline();
        return out;
    }

    private PyStmt smallStatement() throws PySyntaxException {
        PyToken t = peek();
        if (t.type() == PyTokenType.NAME) {
            switch (t.text()) {
                case "pass":
                case "break":
                case "continue":
                    next();
                    return new PyStmt.Simple(t.text(), List.of(), t.span());
                case "return": {
                    next();
                    List<PyExpr> value = atSimpleEnd() ? List.of() : List.of(testListStarExpr());
                    return new PyStmt.Simple("return", value, spanFrom(t));
                }
                case "raise":
                    return raiseStmt(t);
                case "global":
                case "nonlocal": {
                    next();
                    List<PyExpr> names = new ArrayList<>();
                    do {
                        if (!names.isEmpty()) {
                            next();
                        }
                        PyToken n = expectIdentifier();
                        names.add(new PyExpr.Name(n.text(), n.span()));
                    } while (peek().isOp(","));
                    return new PyStmt.Simple(t.text(), names, spanFrom(t));
                }
                case "del": {
                    next();
                    return new PyStmt.Simple("del", List.of(exprList()), spanFrom(t));
                }
                case "assert": {
                    next();
                    List<PyExpr> parts = new ArrayList<>();
                    parts.add(test());
                    if (peek().isOp(",")) {
                        next();
                        parts.add(test());
                    }
                    return new PyStmt.Simple("assert", parts, spanFrom(t));
                }
                case "import":
                    return importName(t);
                case "from":
                    return importFrom(t);
                default:
                    break;
            }
        }
        return expressionStatement(t);
    }

    private PyStmt expressionStatement(PyToken start) throws PySyntaxException {
        PyExpr first = peek().isName("yield") ? yieldExpr() : testListStarExpr();

        if (peek().isOp(":")) {
            next();
            List<PyExpr> parts = new ArrayList<>(List.of(first, test()));
            if (peek().isOp("=")) {
                next();
                parts.add(peek().isName("yield") ? yieldExpr() : testListStarExpr());
            }
            return new PyStmt.Simple("annassign", parts, spanFrom(start));
        }

        if (peek().type() == PyTokenType.OP && AUGMENTED.contains(peek().text())) {
            String op = next().text();
            PyExpr value = peek().isName("yield") ? yieldExpr() : testList();
            return new PyStmt.Simple("augassign" + op, List.of(first, value), spanFrom(start));
        }

        if (peek().isOp("=")) {
            List<PyExpr> targets = new ArrayList<>();
            PyExpr value = first;
            while (peek().isOp("=")) {
                next();
                targets.add(value);
                value = peek().isName("yield") ? yieldExpr() : testListStarExpr();
            }
            return new PyStmt.Assign(targets, value, spanFrom(start));
        }

        return new PyStmt.ExprStmt(first, spanFrom(start));
    }

    private PyStmt raiseStmt(PyToken start) throws PySyntaxException {
        next();
        if (atSimpleEnd()) {
            return new PyStmt.Raise(null, null, List.of(), start.span());
        }
        PyExpr exc = test();
        PyExpr cause = null;
        List<PyExpr> legacy = new ArrayList<>();
        if (peek().isName("from")) {
            next();
            cause = test();
        } else if (peek().isOp(",")) {
            if (grammar != PyGrammar.TRANSITIONAL) {
                throw error(peek(), "invalid syntax");
            }
            next();
            legacy.add(test());
            if (peek().isOp(",")) {
                next();
                legacy.add(test());
            }
        }
        return new PyStmt.Raise(exc, cause, legacy, spanFrom(start));
    }

    private PyStmt importName(PyToken start) throws PySyntaxException {
        next();
        List<PyStmt.Alias> names = new ArrayList<>();
        do {
            if (!names.isEmpty()) {
                next();
            }
            PyToken first = peek();
            String dotted = dottedName();
            String as = null;
            if (peek().isName("as")) {
                next();
                as = expectIdentifier().text();
            }
            names.add(new PyStmt.Alias(dotted, as, spanFrom(first)));
        } while (peek().isOp(","));
        return new PyStmt.Import(names, spanFrom(start));
    }

    private PyStmt importFrom(PyToken start) throws PySyntaxException {
        next();
        int level = 0;
        while (peek().isOp(".") || peek().isOp("...")) {
            level += next().text().length();
        }
        String module = null;
        if (!peek().isName("import")) {
            module = dottedName();
        } else if (level == 0) {
            throw error(peek(), "invalid syntax");
        }
        expectKeyword("import");

        List<PyStmt.Alias> names = new ArrayList<>();
        if (peek().isOp("*")) {
            PyToken star = next();
            names.add(new PyStmt.Alias("*", null, star.span()));
            return new PyStmt.ImportFrom(module, level, names, spanFrom(start));
        }
        boolean parens = peek().isOp("(");
        if (parens) {
            next();
        }
        while (true) {
            PyToken n = expectIdentifier();
            String as = null;
            if (peek().isName("as")) {
                next();
                as = expectIdentifier().text();
            }
            names.add(new PyStmt.Alias(n.text(), as, spanFrom(n)));
            if (!peek().isOp(",")) {
                break;
            }
            next();
            if (parens && peek().isOp(")")) {
                break;
            }
            if (!parens && atSimpleEnd()) {
                throw error(peek(), "trailing comma not allowed without surrounding parentheses");
            }
        }
        if (parens) {
            expectOp(")");
        }
        return new PyStmt.ImportFrom(module, level, names, spanFrom(start));
    }

    private String dottedName() throws PySyntaxException {
        StringBuilder sb = new StringBuilder(expectIdentifier().text());
        while (peek().isOp(".")) {
            next();
            sb.append('.').append(expectIdentifier().text());
        }
        return sb.toString();
    }

    private PyStmt ifStmt() throws PySyntaxException {
        PyToken start = next();
        List<PyExpr> header = new ArrayList<>();
        List<List<PyStmt>> blocks = new ArrayList<>();
        header.add(namedExprTest());
        expectOp(":");
        blocks.add(block());
        while (peek().isName("elif")) {
            next();
            header.add(namedExprTest());
            expectOp(":");
            blocks.add(block());
        }
        if (peek().isName("else")) {
            next();
            expectOp(":");
            blocks.add(block());
        }
        return new PyStmt.Compound("if", header, blocks, spanFrom(start));
    }

    private PyStmt whileStmt() throws PySyntaxException {
        PyToken start = next();
        PyExpr cond = namedExprTest();
        expectOp(":");
        List<List<PyStmt>> blocks = new ArrayList<>();
        blocks.add(block());
        if (peek().isName("else")) {
            next();
            expectOp(":");
            blocks.add(block());
        }
        return new PyStmt.Compound("while", List.of(cond), blocks, spanFrom(start));
    }

    private PyStmt forStmt(PyToken start) throws PySyntaxException {
        expectKeyword("for");
        PyExpr target = exprList();
        expectKeyword("in");
        PyExpr iter = testListStarExpr();
        expectOp(":");
        List<List<PyStmt>> blocks = new ArrayList<>();
        blocks.add(block());
        if (peek().isName("else")) {
            next();
            expectOp(":");
            blocks.add(block());
        }
        return new PyStmt.Compound("for", List.of(target, iter), blocks, spanFrom(start));
    }

    private PyStmt tryStmt() throws PySyntaxException {
        PyToken start = next();
        expectOp(":");
        List<PyStmt> body = block();
        List<PyStmt.Handler> handlers = new ArrayList<>();
        while (peek().isName("except")) {
            PyToken h = next();
            PyExpr type = null;
            String name = null;
            boolean legacy = false;
            if (!peek().isOp(":")) {
                type = test();
                if (peek().isName("as")) {
                    next();
                    name = expectIdentifier().text();
                } else if (peek().isOp(",")) {
                    if (grammar != PyGrammar.TRANSITIONAL) {
                        throw error(peek(), "multiple exception types must be parenthesized");
                    }
                    next();
                    PyToken targetStart = peek();
                    expr();
                    name = sourceOf(targetStart);
                    legacy = true;
                }
            }
            expectOp(":");
            List<PyStmt> hbody = block();
            handlers.add(new PyStmt.Handler(type, name, legacy, hbody, spanFrom(h)));
        }
        List<PyStmt> orElse = List.of();
        List<PyStmt> finalBody = List.of();
        if (!handlers.isEmpty() && peek().isName("else")) {
            next();
            expectOp(":");
            orElse = block();
        }
        if (peek().isName("finally")) {
            next();
            expectOp(":");
            finalBody = block();
        }
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw error(peek(), "expected 'except' or 'finally' block");
        }
        return new PyStmt.Try(body, handlers, orElse, finalBody, spanFrom(start));
    }

    private PyStmt withStmt(PyToken start) throws PySyntaxException {
        expectKeyword("with");
        List<PyExpr> items = new ArrayList<>();
        do {
            if (!items.isEmpty()) {
                next();
            }
            items.add(test());
            if (peek().isName("as")) {
                next();
                items.add(expr());
            }
        } while (peek().isOp(","));
        expectOp(":");
        return new PyStmt.Compound("with", items, List.of(block()), spanFrom(start));
    }

    private PyStmt asyncStmt(List<PyExpr> decorators) throws PySyntaxException {
        PyToken start = next();
        PyToken t = peek();
        if (t.isName("def")) {
            return funcDef(start, decorators);
        }
        if (!decorators.isEmpty()) {
            throw error(t, "invalid syntax");
        }
        if (t.isName("for")) {
            return forStmt(start);
        }
        if (t.isName("with")) {
            return withStmt(start);
        }
        throw error(t, "invalid syntax");
    }

    private PyStmt decorated() throws PySyntaxException {
        PyToken start = peek();
        List<PyExpr> decorators = new ArrayList<>();
        while (peek().isOp("@")) {
            next();
            decorators.add(namedExprTest());
            if (peek().type() != PyTokenType.NEWLINE) {
                throw error(peek(), "invalid syntax");
            }
            next();
        }
        PyToken t = peek();
        if (t.isName("def")) {
            return funcDef(start, decorators);
        }
        if (t.isName("class")) {
            return classDef(start, decorators);
        }
        if (t.isName("async")) {
            return asyncStmt(decorators);
        }
        throw error(t, "invalid syntax");
    }

    private PyStmt funcDef(PyToken start, List<PyExpr> decorators) throws PySyntaxException {
        expectKeyword("def");
        String name = expectIdentifier().text();
        expectOp("(");
        List<PyExpr> defaults = parameters(")", true);
        expectOp(")");
        if (peek().isOp("->")) {
            next();
            defaults.add(test());
        }
        expectOp(":");
        List<PyStmt> body = block();
        return new PyStmt.FunctionDef(name, defaults, decorators, body, spanFrom(start));
    }

    /**
     * Parses a parameter list up to (not including) {@code closing}. Returns the
     * default and annotation expressions, which are the only expression children
     * a parameter list has.
     */
    private List<PyExpr> parameters(String closing, boolean annotations) throws PySyntaxException {
        List<PyExpr> exprs = new ArrayList<>();
        while (!peek().isOp(closing)) {
            if (peek().isOp("*") || peek().isOp("**")) {
                next();
                if (peek().type() == PyTokenType.NAME) {
                    expectIdentifier();
                    if (annotations && peek().isOp(":")) {
                        next();
                        exprs.add(test());
                    }
                }
            } else if (peek().isOp("/")) {
                next();
            } else {
                expectIdentifier();
                if (annotations && peek().isOp(":")) {
                    next();
                    exprs.add(test());
                }
                if (peek().isOp("=")) {
                    next();
                    exprs.add(test());
                }
            }
            if (!peek().isOp(",")) {
                break;
            }
            next();
        }
        return exprs;
    }

    private PyStmt classDef(PyToken start, List<PyExpr> decorators) throws PySyntaxException {
        expectKeyword("class");
        String name = expectIdentifier().text();
        List<PyExpr.Argument> bases = List.of();
        if (peek().isOp("(")) {
            next();
            bases = arguments();
            expectOp(")");
        }
        expectOp(":");
        List<PyStmt> body = block();
        return new PyStmt.ClassDef(name, bases, decorators, body, spanFrom(start));
    }

    private List<PyStmt> block() throws PySyntaxException {
        if (peek().type() != PyTokenType.NEWLINE) {
            return simpleStatements();
        }
        next();
        if (peek().type() != PyTokenType.INDENT) {
            throw error(peek(), "expected an indented block");
        }
        next();
        List<PyStmt> body = new ArrayList<>();
        while (peek().type() != PyTokenType.DEDENT && peek().type() != PyTokenType.ENDMARKER) {
            if (peek().type() == PyTokenType.NEWLINE) {
                next();
                continue;
            }
            if (peek().type() == PyTokenType.INDENT) {
                throw error(peek(), "unexpected indent");
            }
            body.addAll(statement());
        }
        if (peek().type() == PyTokenType.DEDENT) {
            next();
        }
        return body;
    }

    // ===== expressions =====

    private PyExpr testListStarExpr() throws PySyntaxException {
        return sequence(true, false);
    }

    private PyExpr testList() throws PySyntaxException {
        return sequence(false, false);
    }

    private PyExpr exprList() throws PySyntaxException {
        return sequence(true, true);
    }

    private PyExpr sequence(boolean allowStar, boolean exprLevel) throws PySyntaxException {
        PyToken start = peek();
        List<PyExpr> items = new ArrayList<>();
        items.add(sequenceItem(allowStar, exprLevel));
        boolean trailingComma = false;
        while (peek().isOp(",")) {
            next();
            trailingComma = true;
            if (atSequenceEnd()) {
                break;
            }
            trailingComma = false;
            items.add(sequenceItem(allowStar, exprLevel));
        }
        if (items.size() == 1 && !trailingComma) {
            return items.get(0);
        }
        return new PyExpr.Composite("tuple", items, spanFrom(start));
    }

    private PyExpr sequenceItem(boolean allowStar, boolean exprLevel) throws PySyntaxException {
        if (allowStar && peek().isOp("*")) {
            return starExpr();
        }
        return exprLevel ? expr() : test();
    }

    private boolean atSequenceEnd() {
        PyToken t = peek();
        if (t.type() == PyTokenType.NEWLINE || t.type() == PyTokenType.ENDMARKER) {
            return true;
        }
        if (t.type() == PyTokenType.OP) {
            return Set.of("=", ")", "]", "}", ":", ";").contains(t.text()) || AUGMENTED.contains(t.text());
        }
        return t.isName("in");
    }

    private PyExpr starExpr() throws PySyntaxException {
        PyToken start = next();
        PyExpr value = expr();
        return new PyExpr.Composite("starred", List.of(value), spanFrom(start));
    }

    private PyExpr namedExprTest() throws PySyntaxException {
        if (peek().type() == PyTokenType.NAME && peek(1).isOp(":=")) {
            PyToken name = expectIdentifier();
            next();
            PyExpr value = test();
            return new PyExpr.Composite("named",
                    List.of(new PyExpr.Name(name.text(), name.span()), value), spanFrom(name));
        }
        return test();
    }

    private PyExpr test() throws PySyntaxException {
        if (peek().isName("lambda")) {
            return lambda(true);
        }
        PyToken start = peek();
        PyExpr body = orTest();
        if (peek().isName("if")) {
            next();
            PyExpr cond = orTest();
            expectKeyword("else");
            PyExpr other = test();
            return new PyExpr.Composite("ifexp", List.of(body, cond, other), spanFrom(start));
        }
        return body;
    }

    private PyExpr testNoCond() throws PySyntaxException {
        if (peek().isName("lambda")) {
            return lambda(false);
        }
        return orTest();
    }

    private PyExpr lambda(boolean allowConditional) throws PySyntaxException {
        PyToken start = next();
        List<PyExpr> parts = parameters(":", false);
        expectOp(":");
        parts.add(allowConditional ? test() : testNoCond());
        return new PyExpr.Composite("lambda", parts, spanFrom(start));
    }

    private PyExpr orTest() throws PySyntaxException {
        return boolChain("or");
    }

    private PyExpr andTest() throws PySyntaxException {
        return boolChain("and");
    }

    private PyExpr boolChain(String op) throws PySyntaxException {
        PyToken start = peek();
        PyExpr first = op.equals("or") ? andTest() : notTest();
        if (!peek().isName(op)) {
            return first;
        }
        List<PyExpr> values = new ArrayList<>(List.of(first));
        while (peek().isName(op)) {
            next();
            values.add(op.equals("or") ? andTest() : notTest());
        }
        return new PyExpr.Composite(op, values, spanFrom(start));
    }

    private PyExpr notTest() throws PySyntaxException {
        if (peek().isName("not")) {
            PyToken start = next();
            PyExpr operand = notTest();
            return new PyExpr.Composite("not", List.of(operand), spanFrom(start));
        }
        return comparison();
    }

    private PyExpr comparison() throws PySyntaxException {
        PyToken start = peek();
        PyExpr first = expr();
        List<PyExpr> operands = null;
        while (true) {
            PyToken t = peek();
            boolean isCmp = (t.type() == PyTokenType.OP && COMPARISON.contains(t.text()))
                    || t.isName("in") || t.isName("is")
                    || (t.isName("not") && peek(1).isName("in"));
            if (!isCmp) {
                break;
            }
            next();
            if (t.isName("not") || (t.isName("is") && peek().isName("not"))) {
                next();
            }
            if (operands == null) {
                operands = new ArrayList<>(List.of(first));
            }
            operands.add(expr());
        }
        if (operands == null) {
            return first;
        }
        return new PyExpr.Composite("compare", operands, spanFrom(start));
    }

    private PyExpr expr() throws PySyntaxException {
        return binary(0);
    }

    private static final List<Set<String>> BINARY_LEVELS = List.of(
            Set.of("|"),
            Set.of("^"),
            Set.of("&"),
            Set.of("<<", ">>"),
            Set.of("+", "-"),
            Set.of("*", "/", "%", "//", "@"));

    private PyExpr binary(int level) throws PySyntaxException {
        if (level == BINARY_LEVELS.size()) {
            return factor();
        }
        PyExpr left = binary(level + 1);
        while (peek().type() == PyTokenType.OP && BINARY_LEVELS.get(level).contains(peek().text())) {
            PyToken op = next();
            PyExpr right = binary(level + 1);
            left = new PyExpr.BinOp(left, op.text(), op.span(), right, SourceSpan.between(left.span(), right.span()));
        }
        return left;
    }

    private PyExpr factor() throws PySyntaxException {
        PyToken t = peek();
        if (t.isOp("+") || t.isOp("-") || t.isOp("~")) {
            next();
            PyExpr operand = factor();
            return new PyExpr.Composite("unary" + t.text(), List.of(operand), spanFrom(t));
        }
        return power();
    }

    private PyExpr power() throws PySyntaxException {
        PyToken start = peek();
        PyExpr base;
        if (peek().isName("await")) {
            next();
            PyExpr operand = primary();
            base = new PyExpr.Composite("await", List.of(operand), spanFrom(start));
        } else {
            base = primary();
        }
        if (peek().isOp("**")) {
            PyToken op = next();
            PyExpr exponent = factor();
            return new PyExpr.BinOp(base, "**", op.span(), exponent, SourceSpan.between(base.span(), exponent.span()));
        }
        return base;
    }

    private PyExpr primary() throws PySyntaxException {
        PyExpr e = atom();
        while (true) {
            PyToken t = peek();
            if (t.isOp("(")) {
                next();
                List<PyExpr.Argument> args = arguments();
                PyToken close = expectOp(")");
                e = new PyExpr.Call(e, args, close.span(), SourceSpan.between(e.span(), close.span()));
            } else if (t.isOp("[")) {
                next();
                List<PyExpr> slices = subscripts();
                PyToken close = expectOp("]");
                e = new PyExpr.Subscript(e, slices, SourceSpan.between(e.span(), close.span()));
            } else if (t.isOp(".")) {
                next();
                PyToken name = expectIdentifier();
                e = new PyExpr.Attribute(e, name.text(), SourceSpan.between(e.span(), name.span()));
            } else {
                return e;
            }
        }
    }

    private List<PyExpr.Argument> arguments() throws PySyntaxException {
        List<PyExpr.Argument> args = new ArrayList<>();
        while (!peek().isOp(")")) {
            PyToken start = peek();
            if (start.isOp("*") || start.isOp("**")) {
                next();
                PyExpr value = test();
                args.add(new PyExpr.Argument(null, start.text(), value, spanFrom(start)));
            } else if (start.type() == PyTokenType.NAME && peek(1).isOp("=")) {
                PyToken kw = expectIdentifier();
                next();
                PyExpr value = test();
                args.add(new PyExpr.Argument(kw.text(), "", value, spanFrom(start)));
            } else {
                PyExpr value = namedExprTest();
                if (atCompFor()) {
                    value = comprehension("genexp", List.of(value), start);
                }
                args.add(new PyExpr.Argument(null, "", value, spanFrom(start)));
            }
            if (!peek().isOp(",")) {
                break;
            }
            next();
        }
        return args;
    }

    private List<PyExpr> subscripts() throws PySyntaxException {
        List<PyExpr> items = new ArrayList<>();
        while (!peek().isOp("]")) {
            items.add(subscript());
            if (!peek().isOp(",")) {
                break;
            }
            next();
        }
        if (items.isEmpty()) {
            throw error(peek(), "invalid syntax");
        }
        return items;
    }

    private PyExpr subscript() throws PySyntaxException {
        PyToken start = peek();
        if (start.isOp("*")) {
            return starExpr();
        }
        List<PyExpr> parts = new ArrayList<>();
        if (!start.isOp(":")) {
            PyExpr lower = namedExprTest();
            if (!peek().isOp(":")) {
                return lower;
            }
            parts.add(lower);
        }
        next();
        if (!peek().isOp(":") && !peek().isOp("]") && !peek().isOp(",")) {
            parts.add(test());
        }
        if (peek().isOp(":")) {
            next();
            if (!peek().isOp("]") && !peek().isOp(",")) {
                parts.add(test());
            }
        }
        return new PyExpr.Composite("slice", parts, spanFrom(start));
    }

    private PyExpr atom() throws PySyntaxException {
        PyToken t = peek();
        switch (t.type()) {
            case NUMBER:
                next();
                return new PyExpr.Constant(PyExpr.Constant.Kind.NUMBER, t.text(), t.span());
            case STRING: {
                next();
                StringBuilder text = new StringBuilder(t.text());
                while (peek().type() == PyTokenType.STRING) {
                    text.append(' ').append(next().text());
                }
                return new PyExpr.Constant(PyExpr.Constant.Kind.STRING, text.toString(), spanFrom(t));
            }
            case NAME:
                return nameAtom(t);
            case OP:
                if (t.isOp("(")) {
                    return parenAtom(t);
                }
                if (t.isOp("[")) {
                    return listAtom(t);
                }
                if (t.isOp("{")) {
                    return braceAtom(t);
                }
                if (t.isOp("...")) {
                    next();
                    return new PyExpr.Constant(PyExpr.Constant.Kind.ELLIPSIS, "...", t.span());
                }
                throw error(t, "invalid syntax");
            default:
                throw error(t, t.type() == PyTokenType.INDENT ? "unexpected indent" : "invalid syntax");
        }
    }

    private PyExpr nameAtom(PyToken t) throws PySyntaxException {
        switch (t.text()) {
            case "None":
                next();
                return new PyExpr.Constant(PyExpr.Constant.Kind.NONE, t.text(), t.span());
            case "True":
                next();
                return new PyExpr.Constant(PyExpr.Constant.Kind.TRUE, t.text(), t.span());
            case "False":
                next();
                return new PyExpr.Constant(PyExpr.Constant.Kind.FALSE, t.text(), t.span());
            default:
                if (KEYWORDS.contains(t.text())) {
                    throw error(t, "invalid syntax");
                }
                next();
                return new PyExpr.Name(t.text(), t.span());
        }
    }

    private PyExpr parenAtom(PyToken open) throws PySyntaxException {
        next();
        if (peek().isOp(")")) {
            next();
            return new PyExpr.Composite("tuple", List.of(), spanFrom(open));
        }
        if (peek().isName("yield")) {
            PyExpr y = yieldExpr();
            expectOp(")");
            return y;
        }
        PyExpr first = peek().isOp("*") ? starExpr() : namedExprTest();
        if (atCompFor()) {
            PyExpr gen = comprehension("genexp", List.of(first), open);
            expectOp(")");
            return gen;
        }
        if (!peek().isOp(",")) {
            expectOp(")");
            return first;
        }
        List<PyExpr> items = new ArrayList<>(List.of(first));
        while (peek().isOp(",")) {
            next();
            if (peek().isOp(")")) {
                break;
            }
            items.add(peek().isOp("*") ? starExpr() : namedExprTest());
        }
        expectOp(")");
        return new PyExpr.Composite("tuple", items, spanFrom(open));
    }

    private PyExpr listAtom(PyToken open) throws PySyntaxException {
        next();
        List<PyExpr> items = new ArrayList<>();
        if (!peek().isOp("]")) {
            PyExpr first = peek().isOp("*") ? starExpr() : namedExprTest();
            if (atCompFor()) {
                PyExpr comp = comprehension("listcomp", List.of(first), open);
                expectOp("]");
                return comp;
            }
            items.add(first);
            while (peek().isOp(",")) {
                next();
                if (peek().isOp("]")) {
                    break;
                }
                items.add(peek().isOp("*") ? starExpr() : namedExprTest());
            }
        }
        expectOp("]");
        return new PyExpr.Composite("list", items, spanFrom(open));
    }

    private PyExpr braceAtom(PyToken open) throws PySyntaxException {
        next();
        if (peek().isOp("}")) {
            next();
            return new PyExpr.Composite("dict", List.of(), spanFrom(open));
        }
        List<PyExpr> items = new ArrayList<>();
        boolean dict;
        if (peek().isOp("**")) {
            PyToken s = next();
            items.add(new PyExpr.Composite("double_starred", List.of(expr()), spanFrom(s)));
            dict = true;
        } else {
            PyExpr first = peek().isOp("*") ? starExpr() : test();
            if (peek().isOp(":")) {
                next();
                PyExpr value = test();
                if (atCompFor()) {
                    PyExpr comp = comprehension("dictcomp", List.of(first, value), open);
                    expectOp("}");
                    return comp;
                }
                items.add(first);
                items.add(value);
                dict = true;
            } else {
                if (atCompFor()) {
                    PyExpr comp = comprehension("setcomp", List.of(first), open);
                    expectOp("}");
                    return comp;
                }
                items.add(first);
                dict = false;
            }
        }
        while (peek().isOp(",")) {
            next();
            if (peek().isOp("}")) {
                break;
            }
            if (dict) {
                if (peek().isOp("**")) {
                    PyToken s = next();
                    items.add(new PyExpr.Composite("double_starred", List.of(expr()), spanFrom(s)));
                } else {
                    items.add(test());
                    expectOp(":");
                    items.add(test());
                }
            } else {
                items.add(peek().isOp("*") ? starExpr() : test());
            }
        }
        expectOp("}");
        return new PyExpr.Composite(dict ? "dict" : "set", items, spanFrom(open));
    }

    private boolean atCompFor() {
        return peek().isName("for") || (peek().isName("async") && peek(1).isName("for"));
    }

    /**
     * Parses one or more {@code for ... in ... [if ...]} clauses. Each clause
     * becomes a {@code comp_for} composite of [target, iterable, conditions...].
     */
    private PyExpr comprehension(String kind, List<PyExpr> head, PyToken start) throws PySyntaxException {
        List<PyExpr> parts = new ArrayList<>(head);
        while (atCompFor()) {
            PyToken forTok = next();
            if (forTok.isName("async")) {
                next();
            }
            List<PyExpr> clause = new ArrayList<>();
            clause.add(exprList());
            expectKeyword("in");
            clause.add(orTest());
            while (peek().isName("if")) {
                next();
                clause.add(testNoCond());
            }
            parts.add(new PyExpr.Composite("comp_for", clause, spanFrom(forTok)));
        }
        return new PyExpr.Composite(kind, parts, spanFrom(start));
    }

    private PyExpr yieldExpr() throws PySyntaxException {
        PyToken start = next();
        if (peek().isName("from")) {
            next();
            PyExpr value = test();
            return new PyExpr.Composite("yield_from", List.of(value), spanFrom(start));
        }
        if (atSimpleEnd() || peek().isOp(")") || peek().isOp("=")) {
            return new PyExpr.Composite("yield", List.of(), start.span());
        }
        PyExpr value = testListStarExpr();
        return new PyExpr.Composite("yield", List.of(value), spanFrom(start));
    }

    // ===== token helpers =====

    private PyToken peek() {
        return toks.get(p);
    }

    private PyToken peek(int ahead) {
        int i = Math.min(p + ahead, toks.size() - 1);
        return toks.get(i);
    }

    private PyToken next() {
        PyToken t = toks.get(p);
        if (p < toks.size() - 1) {
            p++;
        }
        switch (t.type()) {
            case NAME:
            case NUMBER:
            case STRING:
            case OP:
                last = t;
                break;
            default:
                break;
        }
        return t;
    }

    private boolean atSimpleEnd() {
        PyToken t = peek();
        return t.type() == PyTokenType.NEWLINE || t.type() == PyTokenType.ENDMARKER || t.isOp(";");
    }

    private void expectNewline() throws PySyntaxException {
        PyToken t = peek();
        if (t.type() == PyTokenType.NEWLINE) {
            next();
            return;
        }
        if (t.type() == PyTokenType.ENDMARKER) {
            return;
        }
        throw error(t, "invalid syntax");
    }

    private PyToken expectOp(String op) throws PySyntaxException {
        if (!peek().isOp(op)) {
            throw error(peek(), "expected '" + op + "'");
        }
        return next();
    }

    private void expectKeyword(String kw) throws PySyntaxException {
        if (!peek().isName(kw)) {
            throw error(peek(), "expected '" + kw + "'");
        }
        next();
    }

    private PyToken expectIdentifier() throws PySyntaxException {
        PyToken t = peek();
        if (t.type() != PyTokenType.NAME || KEYWORDS.contains(t.text())) {
            throw error(t, "invalid syntax");
        }
        return next();
    }

    private SourceSpan spanFrom(PyToken start) {
        if (last == null) {
            return start.span();
        }
        return SourceSpan.between(start.span(), last.span());
    }

    /** Re-joins the significant tokens consumed since {@code start}. */
    private String sourceOf(PyToken start) {
        StringBuilder sb = new StringBuilder();
        int i = toks.indexOf(start);
        for (; i < p; i++) {
            PyToken t = toks.get(i);
            if (t.type() == PyTokenType.NEWLINE || t.type() == PyTokenType.INDENT || t.type() == PyTokenType.DEDENT) {
                continue;
            }
            sb.append(t.text());
        }
        return sb.toString();
    }

    private PySyntaxException error(PyToken t, String message) {
        return new PySyntaxException(message, t.span().line(), t.span().column());
    }
}
