package modernizer.preprocess;

import modernizer.syntax.CodeMask;
import modernizer.syntax.SourceText;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static modernizer.syntax.CodeScan.statementEnd;
import static modernizer.syntax.CodeScan.topLevelKeyword;
import static modernizer.syntax.CodeScan.trimBack;

/**
 * Targeted fixes tried on the line a parse error points at, in order:
 * exec statement, backtick repr, inline print statement.
 */
final class RecoveryFixer {

    private static final Pattern EXEC = Pattern.compile("(?:^\\s*|[:;]\\s*)(exec)\\b(?!\\s*\\()");
    private static final Pattern INLINE_PRINT = Pattern.compile("[:;]\\s*(print)\\b(?!\\s*\\()");

    /**
     * A fix for one line.
     *
     * @param rule the rule that produced it
     * @param edits the edits to apply
     */
    record Fix(PreprocessRule rule, List<TextEdit> edits) {
    }

    private RecoveryFixer() {}

    static Optional<Fix> fix(SourceText text, CodeMask mask, int line, boolean printFunction) {
        Optional<Fix> fix = execStatement(text, mask, line);
        if (fix.isEmpty()) {
            fix = backticks(mask, line);
        }
        if (fix.isEmpty() && !printFunction) {
            fix = inlinePrint(text, mask, line);
        }
        return fix;
    }

    /** {@code exec code in g, l} becomes {@code exec(code, g, l)}; single physical lines only. */
    static Optional<Fix> execStatement(SourceText text, CodeMask mask, int line) {
        CodeMask.LogicalLine logical = logicalLineOf(mask, line);
        if (logical == null || logical.startLine() != logical.endLine()) {
            return Optional.empty();
        }
        String code = mask.code(line);
        String source = text.line(line);
        Matcher m = EXEC.matcher(code);
        if (!m.find()) {
            return Optional.empty();
        }
        int keyword = m.start(1);
        int afterKeyword = m.end(1);
        int limit = mask.commentStart(line) >= 0 ? mask.commentStart(line) : code.length();
        int end = trimBack(code, afterKeyword, statementEnd(code, afterKeyword, limit));
        int in = topLevelKeyword(code, "in", afterKeyword, end);

        String call;
        if (in < 0) {
            String expr = source.substring(afterKeyword, end).strip();
            if (expr.isEmpty()) {
                return Optional.empty();
            }
            call = "exec(" + expr + ")";
        } else {
            String expr = source.substring(afterKeyword, in).strip();
            String namespaces = source.substring(in + 2, end).strip();
            if (expr.isEmpty() || namespaces.isEmpty()) {
                return Optional.empty();
            }
            call = "exec(" + expr + ", " + namespaces + ")";
        }
        return Optional.of(new Fix(PreprocessRule.EXEC_STATEMENT,
                List.of(TextEdit.replace(line, keyword, end, call, PreprocessRule.EXEC_STATEMENT.id()))));
    }

    /** Pairs of backticks become {@code repr(...)}; an odd count is left alone. */
    static Optional<Fix> backticks(CodeMask mask, int line) {
        String code = mask.code(line);
        List<Integer> ticks = new ArrayList<>();
        for (int i = 0; i < code.length(); i++) {
            if (code.charAt(i) == '`') {
                ticks.add(i);
            }
        }
        if (ticks.isEmpty() || ticks.size() % 2 != 0) {
            return Optional.empty();
        }
        List<TextEdit> edits = new ArrayList<>();
        for (int i = 0; i < ticks.size(); i += 2) {
            int open = ticks.get(i);
            int close = ticks.get(i + 1);
            edits.add(TextEdit.replace(line, open, open + 1, "repr(", PreprocessRule.BACKTICK_REPR.id()));
            edits.add(TextEdit.replace(line, close, close + 1, ")", PreprocessRule.BACKTICK_REPR.id()));
        }
        return Optional.of(new Fix(PreprocessRule.BACKTICK_REPR, edits));
    }

    /** {@code if x: print y} and {@code a = 1; print a}. */
    static Optional<Fix> inlinePrint(SourceText text, CodeMask mask, int line) {
        CodeMask.LogicalLine logical = logicalLineOf(mask, line);
        if (logical == null || logical.startLine() != line) {
            return Optional.empty();
        }
        Matcher m = INLINE_PRINT.matcher(mask.code(line));
        while (m.find()) {
            int column = m.start(1);
            List<TextEdit> edits = PrintStatementRewriter.rewrite(text, mask,
                    new CodeMask.LogicalLine(line, logical.endLine()), column, PreprocessRule.INLINE_PRINT.id());
            if (!edits.isEmpty()) {
                return Optional.of(new Fix(PreprocessRule.INLINE_PRINT, edits));
            }
        }
        return Optional.empty();
    }

    private static CodeMask.LogicalLine logicalLineOf(CodeMask mask, int line) {
        for (CodeMask.LogicalLine logical : mask.logicalLines()) {
            if (logical.startLine() <= line && line <= logical.endLine()) {
                return logical;
            }
        }
        return null;
    }
}
