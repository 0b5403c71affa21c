package modernizer.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-line view of source text in which string literal bodies and comments are
 * blanked out with spaces.
 *
 * <p>Every masked line has the same length as the original line, so a column
 * found by matching against {@link #code(int)} is a valid column in the real
 * text. String prefixes and quote characters are kept so that literals remain
 * visible as such. The scanner never fails: unterminated literals simply run
 * to the end of the line or file.
 */
public final class CodeMask {

    private final List<String> code;
    private final List<Integer> commentStarts;
    private final boolean[] stringOpenAtEnd;

    private CodeMask(List<String> code, List<Integer> commentStarts, boolean[] stringOpenAtEnd) {
        this.code = code;
        this.commentStarts = commentStarts;
        this.stringOpenAtEnd = stringOpenAtEnd;
    }

    public static CodeMask of(SourceText text) {
        List<String> lines = text.lines();
        List<String> code = new ArrayList<>(lines.size());
        List<Integer> comments = new ArrayList<>(lines.size());
        boolean[] open = new boolean[lines.size()];

        char quote = 0;
        boolean triple = false;

        for (int ln = 0; ln < lines.size(); ln++) {
            String line = lines.get(ln);
            StringBuilder sb = new StringBuilder(line.length());
            int comment = -1;
            int i = 0;
            while (i < line.length()) {
                char c = line.charAt(i);
                if (quote != 0) {
                    if (c == '\\') {
                        sb.append(' ');
                        if (i + 1 < line.length()) {
                            sb.append(' ');
                        }
                        i += 2;
                        continue;
                    }
                    if (c == quote) {
                        if (!triple) {
                            sb.append(c);
                            quote = 0;
                            i++;
                            continue;
                        }
                        if (line.startsWith(String.valueOf(c).repeat(3), i)) {
                            sb.append(c).append(c).append(c);
                            quote = 0;
                            i += 3;
                            continue;
                        }
                    }
                    sb.append(' ');
                    i++;
                    continue;
                }
                if (c == '#') {
                    comment = i;
                    sb.append(" ".repeat(line.length() - i));
                    break;
                }
                if (c == '"' || c == '\'') {
                    quote = c;
                    triple = line.startsWith(String.valueOf(c).repeat(3), i);
                    int n = triple ? 3 : 1;
                    sb.append(String.valueOf(c).repeat(n));
                    i += n;
                    continue;
                }
                sb.append(c);
                i++;
            }
            boolean continued = line.endsWith("\\") && quote != 0;
            if (quote != 0 && !triple && !continued) {
                quote = 0;
            }
            open[ln] = quote != 0;
            code.add(sb.toString());
            comments.add(comment);
        }
        return new CodeMask(code, comments, open);
    }

    public static CodeMask of(String source) {
        return of(SourceText.of(source));
    }

    public int lineCount() {
        return code.size();
    }

    /** Masked text of a 1-based line. */
    public String code(int line) {
        return code.get(line - 1);
    }

    /** Column where a comment starts on a 1-based line, or -1. */
    public int commentStart(int line) {
        return commentStarts.get(line - 1);
    }

    /** True if a string literal is still open at the end of a 1-based line. */
    public boolean stringOpenAtEnd(int line) {
        return stringOpenAtEnd[line - 1];
    }

    /** Returns true if the 1-based line has no code (blank or comment only). */
    public boolean isBlank(int line) {
        return code(line).isBlank() && !stringOpenAtEnd(line) && (line == 1 || !stringOpenAtEnd(line - 1));
    }

    /**
     * Groups physical lines into logical lines using bracket depth, backslash
     * continuations and open multi-line strings.
     */
    public List<LogicalLine> logicalLines() {
        List<LogicalLine> out = new ArrayList<>();
        int depth = 0;
        int start = -1;
        for (int ln = 1; ln <= code.size(); ln++) {
            String c = code(ln);
            if (start < 0) {
                if (c.isBlank() && !stringOpenAtEnd(ln)) {
                    continue;
                }
                start = ln;
            }
            for (int i = 0; i < c.length(); i++) {
                char ch = c.charAt(i);
                if (ch == '(' || ch == '[' || ch == '{') {
                    depth++;
                } else if ((ch == ')' || ch == ']' || ch == '}') && depth > 0) {
                    depth--;
                }
            }
            boolean continued = depth > 0 || stringOpenAtEnd(ln) || c.stripTrailing().endsWith("\\");
            if (!continued) {
                out.add(new LogicalLine(start, ln));
                start = -1;
            }
        }
        if (start >= 0) {
            out.add(new LogicalLine(start, code.size()));
        }
        return out;
    }

    /** A range of 1-based physical lines forming one logical line. */
    public record LogicalLine(int startLine, int endLine) {
    }
}
