package modernizer.preprocess;

import modernizer.syntax.CodeMask;
import modernizer.syntax.SourceText;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token-level substitutions that the transitional grammar cannot read, plus
 * detection of legacy builtins that are only marked, never rewritten.
 *
 * <p>Matching runs on masked code, so nothing inside string literals or
 * comments is touched.
 */
final class LegacyTokenRewriter {

    private static final Pattern TYPE_ALIAS = Pattern.compile("(?<![\\w.])(unicode|basestring|long)\\b");
    private static final Map<String, String> ALIASES = Map.of(
            "unicode", "str",
            "basestring", "str",
            "long", "int");

    private static final Pattern NUMBER = Pattern.compile("(?<![\\w.])(0[xX][0-9a-fA-F]+|\\d+)([lL])?(?![\\w.])");
    private static final Pattern LEGACY_OCTAL = Pattern.compile("0[0-7]*[1-7][0-7]*");
    private static final Pattern RAW_UNICODE = Pattern.compile("(?<!\\w)[uU](?=[rR]['\"])");

    private static final Pattern LEGACY_BUILTIN = Pattern.compile(
            "(?<![\\w.])(apply|coerce|execfile|reduce|cmp|buffer|intern|reload|file)\\s*\\(");
    private static final Pattern DEFINITION_PREFIX = Pattern.compile("\\b(def|class)\\s+$");
    private static final Pattern REDUCE_IMPORT = Pattern.compile(
            "from\\s+functools\\s+import\\s+\\(?[\\w\\s,\\\\]*\\breduce\\b");
    private static final Pattern PRINT_FUNCTION_IMPORT = Pattern.compile(
            "from\\s+__future__\\s+import\\s+\\(?[\\w\\s,\\\\]*\\bprint_function\\b");

    private LegacyTokenRewriter() {}

    /** Substitution edits for every line; edits never overlap. */
    static List<TextEdit> substitutions(SourceText text, CodeMask mask) {
        List<TextEdit> edits = new ArrayList<>();
        for (int n = 1; n <= text.lineCount(); n++) {
            String code = mask.code(n);

            Matcher alias = TYPE_ALIAS.matcher(code);
            while (alias.find()) {
                String before = code.substring(0, alias.start());
                String after = code.substring(alias.end());
                if (DEFINITION_PREFIX.matcher(before).find() || isKeywordOrAssignment(after)) {
                    continue;
                }
                edits.add(TextEdit.replace(n, alias.start(), alias.end(),
                        ALIASES.get(alias.group(1)), PreprocessRule.TYPE_ALIAS.id()));
            }

            int ne = code.indexOf("<>");
            while (ne >= 0) {
                edits.add(TextEdit.replace(n, ne, ne + 2, "!=", PreprocessRule.NOT_EQUAL.id()));
                ne = code.indexOf("<>", ne + 2);
            }

            Matcher number = NUMBER.matcher(code);
            while (number.find()) {
                String digits = number.group(1);
                boolean longSuffix = number.group(2) != null;
                boolean octal = LEGACY_OCTAL.matcher(digits).matches();
                if (octal) {
                    String replacement = "0o" + digits.substring(1);
                    edits.add(TextEdit.replace(n, number.start(), number.end(), replacement,
                            PreprocessRule.OCTAL_LITERAL.id()));
                } else if (longSuffix) {
                    edits.add(TextEdit.replace(n, number.end(2) - 1, number.end(2), "",
                            PreprocessRule.LONG_LITERAL.id()));
                }
            }

            Matcher prefix = RAW_UNICODE.matcher(code);
            while (prefix.find()) {
                edits.add(TextEdit.replace(n, prefix.start(), prefix.start() + 1, "",
                        PreprocessRule.RAW_UNICODE_PREFIX.id()));
            }
        }
        return edits;
    }

    /** Lines calling builtins that no longer exist; they are reported, not changed. */
    static SortedSet<Integer> legacyBuiltinLines(SourceText text, CodeMask mask) {
        boolean reduceImported = REDUCE_IMPORT.matcher(maskedSource(mask)).find();
        SortedSet<Integer> lines = new TreeSet<>();
        for (int n = 1; n <= text.lineCount(); n++) {
            String code = mask.code(n);
            Matcher m = LEGACY_BUILTIN.matcher(code);
            while (m.find()) {
                if (DEFINITION_PREFIX.matcher(code.substring(0, m.start())).find()) {
                    continue;
                }
                if (reduceImported && m.group(1).equals("reduce")) {
                    continue;
                }
                lines.add(n);
            }
        }
        return lines;
    }

    static boolean importsPrintFunction(CodeMask mask) {
        return PRINT_FUNCTION_IMPORT.matcher(maskedSource(mask)).find();
    }

    private static String maskedSource(CodeMask mask) {
        StringBuilder sb = new StringBuilder();
        for (int n = 1; n <= mask.lineCount(); n++) {
            sb.append(mask.code(n)).append('\n');
        }
        return sb.toString();
    }

    /** {@code long=3} names a keyword argument or a variable, not the type. */
    private static boolean isKeywordOrAssignment(String after) {
        String rest = after.stripLeading();
        return rest.startsWith("=") && !rest.startsWith("==");
    }
}
