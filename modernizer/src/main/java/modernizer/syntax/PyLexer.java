package modernizer.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for the modern dialect.
 *
 * <p>Produces logical-line tokens with explicit NEWLINE, INDENT and DEDENT markers.
 * Newlines inside brackets and after an explicit backslash continuation are
 * joined. Comments and blank lines produce no tokens.
 *
 * <p>Lexemes that only the legacy dialect accepts are rejected with a
 * {@link PySyntaxException}: backtick repr, the {@code <>} operator, the long
 * suffix ({@code 10L}), zero-prefixed octal literals ({@code 0777}) and the
 * {@code ur} string prefix.
 */
public final class PyLexer {

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private static final List<String> THREE_CHAR_OPS = List.of(
            "**=", "//=", ">>=", "<<=", "...");

    private static final List<String> TWO_CHAR_OPS = List.of(
            "**", "//", "<<", ">>", "<=", ">=", "==", "!=", "->",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=", ":=");

    private static final String ONE_CHAR_OPS = "+-*/%@&|^~<>()[]{},:.;=";

    private final String src;
    private final List<PyToken> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<PyToken> brackets = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;

    private PyLexer(String source) {
        this.src = source.replace("\r\n", "\n").replace('\r', '\n');
    }

    public static List<PyToken> tokenize(String source) throws PySyntaxException {
        PyLexer lexer = new PyLexer(source);
        lexer.run();
        return lexer.tokens;
    }

    private void run() throws PySyntaxException {
        indents.push(0);
        boolean atLineStart = true;

        while (pos < src.length()) {
            if (atLineStart && brackets.isEmpty()) {
                if (!readIndentation()) {
                    continue;
                }
                atLineStart = false;
            }

            char c = src.charAt(pos);

            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
                continue;
            }

            if (c == '#') {
                while (pos < src.length() && src.charAt(pos) != '\n') {
                    pos++;
                }
                continue;
            }

            if (c == '\\') {
                if (pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
                    pos += 2;
                    newLine();
                    continue;
                }
                if (pos + 1 >= src.length()) {
                    throw error("unexpected EOF after line continuation character", pos);
                }
                throw error("unexpected character after line continuation character", pos);
            }

            if (c == '\n') {
                if (brackets.isEmpty()) {
                    addLogicalNewline(pos);
                    atLineStart = true;
                }
                pos++;
                newLine();
                continue;
            }

            if (Character.isLetter(c) || c == '_') {
                readNameOrString();
                continue;
            }

            if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1)))) {
                readNumber();
                continue;
            }

            if (c == '"' || c == '\'') {
                readString(pos);
                continue;
            }

            if (c == '`') {
                throw error("backtick repr is not supported, use repr()", pos);
            }

            readOperator();
        }

        if (!brackets.isEmpty()) {
            PyToken open = brackets.peek();
            throw new PySyntaxException("'" + open.text() + "' was never closed",
                    open.span().line(), open.span().column());
        }
        addLogicalNewline(pos);
        SourceSpan end = new SourceSpan(line, column(pos), line, column(pos));
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(new PyToken(PyTokenType.DEDENT, "", end));
        }
        tokens.add(new PyToken(PyTokenType.ENDMARKER, "", end));
    }

    /**
     * Measures the indentation of the current physical line and emits INDENT or
     * DEDENT tokens. Returns false when the line is blank or a comment, in which
     * case the whole line has been consumed.
     */
    private boolean readIndentation() throws PySyntaxException {
        int width = 0;
        int i = pos;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            i++;
        }

        if (i >= src.length() || src.charAt(i) == '\n' || src.charAt(i) == '#') {
            while (i < src.length() && src.charAt(i) != '\n') {
                i++;
            }
            if (i < src.length()) {
                i++;
                pos = i;
                newLine();
            } else {
                pos = i;
            }
            return false;
        }

        SourceSpan span = new SourceSpan(line, 0, line, column(i));
        if (width > indents.peek()) {
            indents.push(width);
            tokens.add(new PyToken(PyTokenType.INDENT, "", span));
        } else {
            while (width < indents.peek()) {
                indents.pop();
                tokens.add(new PyToken(PyTokenType.DEDENT, "", span));
            }
            if (width != indents.peek()) {
                throw new PySyntaxException("unindent does not match any outer indentation level", line, column(i));
            }
        }
        pos = i;
        return true;
    }

    private void addLogicalNewline(int at) {
        if (tokens.isEmpty()) {
            return;
        }
        PyTokenType last = tokens.get(tokens.size() - 1).type();
        if (last == PyTokenType.NEWLINE || last == PyTokenType.DEDENT || last == PyTokenType.INDENT) {
            return;
        }
        tokens.add(new PyToken(PyTokenType.NEWLINE, "", new SourceSpan(line, column(at), line, column(at) + 1)));
    }

    private void readNameOrString() throws PySyntaxException {
        int start = pos;
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        String word = src.substring(start, pos);
        boolean quoteFollows = pos < src.length() && (src.charAt(pos) == '"' || src.charAt(pos) == '\'');
        if (quoteFollows) {
            String prefix = word.toLowerCase();
            if (STRING_PREFIXES.contains(prefix)) {
                readString(start);
                return;
            }
            if (prefix.equals("ur")) {
                throw error("the 'ur' string prefix is not supported", start);
            }
        }
        tokens.add(token(PyTokenType.NAME, start, pos));
    }

    private void readString(int start) throws PySyntaxException {
        int startLine = line;
        char quote = src.charAt(pos);
        boolean triple = pos + 2 < src.length() && src.charAt(pos + 1) == quote && src.charAt(pos + 2) == quote;
        pos += triple ? 3 : 1;

        while (true) {
            if (pos >= src.length()) {
                throw new PySyntaxException(triple
                        ? "unterminated triple-quoted string literal"
                        : "unterminated string literal", startLine, columnOn(start, startLine));
            }
            char c = src.charAt(pos);
            if (c == '\\') {
                if (pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
                    pos += 2;
                    newLine();
                } else {
                    pos += 2;
                }
                continue;
            }
            if (c == '\n') {
                if (!triple) {
                    throw new PySyntaxException("unterminated string literal", startLine, columnOn(start, startLine));
                }
                pos++;
                newLine();
                continue;
            }
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (pos + 2 < src.length() && src.charAt(pos + 1) == quote && src.charAt(pos + 2) == quote) {
                    pos += 3;
                    break;
                }
            }
            pos++;
        }

        int startColumn = columnOn(start, startLine);
        tokens.add(new PyToken(PyTokenType.STRING, src.substring(start, pos),
                new SourceSpan(startLine, startColumn, line, column(pos))));
    }

    private void readNumber() throws PySyntaxException {
        int start = pos;
        char c = src.charAt(pos);
        if (c == '0' && pos + 1 < src.length() && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
            char base = Character.toLowerCase(src.charAt(pos + 1));
            pos += 2;
            int digitsStart = pos;
            while (pos < src.length() && isDigitOfBase(src.charAt(pos), base)) {
                pos++;
            }
            if (pos == digitsStart) {
                throw error("invalid " + (base == 'x' ? "hexadecimal" : base == 'o' ? "octal" : "binary") + " literal", start);
            }
        } else {
            boolean integer = true;
            while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                pos++;
            }
            if (pos < src.length() && src.charAt(pos) == '.') {
                integer = false;
                pos++;
                while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                    pos++;
                }
            }
            if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                    integer = false;
                    while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                        pos++;
                    }
                } else {
                    pos = mark;
                }
            }
            if (pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) {
                integer = false;
                pos++;
            }
            String text = src.substring(start, pos).replace("_", "");
            if (integer && text.length() > 1 && text.charAt(0) == '0' && !text.chars().allMatch(ch -> ch == '0')) {
                throw error("leading zeros in decimal integer literals are not permitted", start);
            }
        }

        if (pos < src.length() && (src.charAt(pos) == 'L' || src.charAt(pos) == 'l')) {
            throw error("invalid decimal literal (long suffix)", start);
        }
        if (pos < src.length() && (Character.isLetter(src.charAt(pos)) || src.charAt(pos) == '_')) {
            throw error("invalid decimal literal", start);
        }
        tokens.add(token(PyTokenType.NUMBER, start, pos));
    }

    private static boolean isDigitOfBase(char c, char base) {
        if (c == '_') {
            return true;
        }
        switch (base) {
            case 'x':
                return Character.digit(c, 16) >= 0;
            case 'o':
                return c >= '0' && c <= '7';
            default:
                return c == '0' || c == '1';
        }
    }

    private void readOperator() throws PySyntaxException {
        int start = pos;
        if (src.startsWith("<>", pos)) {
            throw error("the '<>' operator is not supported, use '!='", start);
        }
        for (String op : THREE_CHAR_OPS) {
            if (src.startsWith(op, pos)) {
                pos += 3;
                tokens.add(token(PyTokenType.OP, start, pos));
                return;
            }
        }
        for (String op : TWO_CHAR_OPS) {
            if (src.startsWith(op, pos)) {
                pos += 2;
                tokens.add(token(PyTokenType.OP, start, pos));
                return;
            }
        }
        char c = src.charAt(pos);
        if (ONE_CHAR_OPS.indexOf(c) < 0) {
            throw error("invalid character '" + c + "'", start);
        }
        pos++;
        PyToken tok = token(PyTokenType.OP, start, pos);
        if (c == '(' || c == '[' || c == '{') {
            brackets.push(tok);
        } else if (c == ')' || c == ']' || c == '}') {
            if (brackets.isEmpty()) {
                throw error("unmatched '" + c + "'", start);
            }
            char open = brackets.pop().text().charAt(0);
            if ("([{".indexOf(open) != ")]}".indexOf(c)) {
                throw error("closing parenthesis '" + c + "' does not match opening parenthesis '" + open + "'", start);
            }
        }
        tokens.add(tok);
    }

    private PyToken token(PyTokenType type, int start, int end) {
        return new PyToken(type, src.substring(start, end), new SourceSpan(line, column(start), line, column(end)));
    }

    private PySyntaxException error(String message, int at) {
        return new PySyntaxException(message, line, column(at));
    }

    private void newLine() {
        line++;
        lineStart = pos;
    }

    private int column(int offset) {
        return offset - lineStart;
    }

    private int columnOn(int offset, int onLine) {
        if (onLine == line) {
            return column(offset);
        }
        int start = src.lastIndexOf('\n', offset - 1) + 1;
        return offset - start;
    }
}
