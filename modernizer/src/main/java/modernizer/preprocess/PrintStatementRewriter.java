package modernizer.preprocess;

import modernizer.syntax.CodeMask;
import modernizer.syntax.SourceText;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;

import static modernizer.syntax.CodeScan.isIdentChar;
import static modernizer.syntax.CodeScan.matching;
import static modernizer.syntax.CodeScan.skipSpaces;
import static modernizer.syntax.CodeScan.statementEnd;
import static modernizer.syntax.CodeScan.topLevelCommas;
import static modernizer.syntax.CodeScan.trimBack;

/**
 * Rewrites print statements into print calls.
 *
 * <ul>
 *   <li>{@code print a, b} becomes {@code print(a, b)}</li>
 *   <li>a trailing comma becomes {@code end=' '}</li>
 *   <li>{@code print >>f, x} becomes {@code print(x, file=f)}</li>
 *   <li>a bare {@code print} becomes {@code print()}</li>
 * </ul>
 *
 * <p>Edits replace whole physical lines and never change the line count, so
 * line numbers reported by later stages still refer to the input.
 */
final class PrintStatementRewriter {

    static final String KEYWORD = "print";

    private PrintStatementRewriter() {}

    /** Edits converting every print statement that starts a logical line. */
    static List<TextEdit> statements(SourceText text, CodeMask mask, String ruleId) {
        List<TextEdit> edits = new ArrayList<>();
        for (CodeMask.LogicalLine logical : mask.logicalLines()) {
            int line = logical.startLine();
            String code = mask.code(line);
            int column = skipSpaces(code, 0, code.length());
            if (code.startsWith(KEYWORD, column)) {
                edits.addAll(rewrite(text, mask, logical, column, ruleId));
            }
        }
        return edits;
    }

    /**
     * Edits converting the print statement at {@code column} of the first line
     * of {@code logical}; empty when there is none or it cannot be rewritten
     * without moving text across lines.
     */
    static List<TextEdit> rewrite(SourceText text, CodeMask mask, CodeMask.LogicalLine logical, int column,
                                  String ruleId) {
        int first = logical.startLine();
        int last = logical.endLine();
        StringBuilder orig = new StringBuilder();
        StringBuilder masked = new StringBuilder();
        int lastLineStart = 0;
        for (int n = first; n <= last; n++) {
            if (n > first) {
                orig.append('\n');
                masked.append('\n');
            }
            lastLineStart = orig.length();
            orig.append(text.line(n));
            masked.append(mask.code(n));
        }
        String source = orig.toString();
        String code = masked.toString();
        int comment = mask.commentStart(last);
        int limit = comment >= 0 ? lastLineStart + comment : code.length();

        if (!code.startsWith(KEYWORD, column)) {
            return List.of();
        }
        int afterKeyword = column + KEYWORD.length();
        if (afterKeyword < code.length() && isIdentChar(code.charAt(afterKeyword))) {
            return List.of();
        }
        int argsEnd = trimBack(code, afterKeyword, statementEnd(code, afterKeyword, limit));
        int argsStart = skipSpaces(code, afterKeyword, argsEnd);

        if (argsStart < argsEnd) {
            char ch = code.charAt(argsStart);
            if (ch == '(' && matching(code, argsStart) == argsEnd - 1) {
                return List.of();
            }
            if (".,)]};:=\\".indexOf(ch) >= 0 && !code.startsWith("==", argsStart) || isAssignment(code, argsStart)) {
                return List.of();
            }
        }

        List<Integer> commas = topLevelCommas(code, argsStart, argsEnd);
        boolean trailing = !commas.isEmpty() && commas.get(commas.size() - 1) == argsEnd - 1;
        String file = null;
        int bodyStart = argsStart;
        if (code.startsWith(">>", argsStart)) {
            int firstComma = commas.isEmpty() ? argsEnd : commas.get(0);
            file = source.substring(argsStart + 2, firstComma).strip();
            if (file.isEmpty() || file.indexOf('\n') >= 0) {
                return List.of();
            }
            bodyStart = firstComma < argsEnd ? skipSpaces(code, firstComma + 1, argsEnd) : argsEnd;
        }
        int bodyEnd = trailing ? argsEnd - 1 : argsEnd;
        String body = bodyStart < bodyEnd ? source.substring(bodyStart, bodyEnd).stripTrailing() : "";

        List<String> keywords = new ArrayList<>();
        if (trailing) {
            keywords.add("end=' '");
        }
        if (file != null) {
            keywords.add("file=" + file);
        }
        StringBuilder call = new StringBuilder(KEYWORD).append('(').append(body);
        if (!body.isEmpty() && !keywords.isEmpty()) {
            call.append(", ");
        }
        call.append(String.join(", ", keywords)).append(')');

        String rewritten = source.substring(0, column) + call + source.substring(argsEnd);
        String[] parts = rewritten.split("\n", -1);
        if (parts.length != last - first + 1) {
            return List.of();
        }
        List<TextEdit> edits = new ArrayList<>();
        for (int i = 0; i < parts.length; i++) {
            int n = first + i;
            if (!parts[i].equals(text.line(n))) {
                edits.add(TextEdit.replace(n, 0, text.line(n).length(), parts[i], ruleId));
            }
        }
        return edits;
    }

    /** {@code print = x} or {@code print += x}: the name is being assigned, not called. */
    private static boolean isAssignment(String code, int at) {
        int i = at;
        while (i < code.length() && i - at < 2 && "+-*/%&|^@<>".indexOf(code.charAt(i)) >= 0) {
            i++;
        }
        return i < code.length() && code.charAt(i) == '='
                && (i + 1 >= code.length() || code.charAt(i + 1) != '=');
    }
}
