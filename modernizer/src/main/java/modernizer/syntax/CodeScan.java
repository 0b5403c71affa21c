package modernizer.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Scanning helpers over masked code, where string bodies and comments are
 * blanked so brackets, commas and semicolons can be counted reliably.
 */
public final class CodeScan {

    private CodeScan() {}

    public static boolean isIdentChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    public static int skipSpaces(String code, int from, int limit) {
        int i = from;
        while (i < limit && (code.charAt(i) == ' ' || code.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    /** Position after the last non-blank character in {@code [from, to)}. */
    public static int trimBack(String code, int from, int to) {
        int i = to;
        while (i > from && Character.isWhitespace(code.charAt(i - 1))) {
            i--;
        }
        return i;
    }

    /** First top-level {@code ;} in {@code [from, limit)}, or {@code limit}. */
    public static int statementEnd(String code, int from, int limit) {
        int depth = 0;
        for (int i = from; i < limit; i++) {
            char c = code.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == ';' && depth == 0) {
                return i;
            }
        }
        return limit;
    }

    /** Positions of top-level commas in {@code [from, to)}. */
    public static List<Integer> topLevelCommas(String code, int from, int to) {
        List<Integer> out = new ArrayList<>();
        int depth = 0;
        for (int i = from; i < to; i++) {
            char c = code.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                out.add(i);
            }
        }
        return out;
    }

    /** Index of the bracket closing the one at {@code open}, or -1. */
    public static int matching(String code, int open) {
        int depth = 0;
        for (int i = open; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /** First top-level occurrence of keyword {@code word} in {@code [from, to)}, or -1. */
    public static int topLevelKeyword(String code, String word, int from, int to) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            char c = code.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && code.startsWith(word, i)
                    && (i == 0 || !isIdentChar(code.charAt(i - 1)))
                    && (i + word.length() >= code.length() || !isIdentChar(code.charAt(i + word.length())))) {
                return i;
            }
        }
        return -1;
    }
}
