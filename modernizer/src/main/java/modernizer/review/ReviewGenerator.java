package modernizer.review;

import modernizer.verify.VerificationReport;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders reviewer-facing artifacts for one verification report.
 */
public final class ReviewGenerator {

    static final String SUGGEST_LIST = "Wrap the iterator result in list(...) so both versions see a materialized sequence.";
    static final String SUGGEST_DIVISION = "Opt into true division explicitly with 'from __future__ import division', "
            + "or use // where floor division is intended.";
    static final String SUGGEST_TIMEOUT = "Execution timed out; review the unit's running time or raise the execution timeout.";
    static final String SUGGEST_MANUAL = "Manual review required.";

    private static final Pattern ITERATOR_PHRASES = Pattern.compile("\\b(?:iterator|map|filter|zip)\\b|object at 0x");

    /** Suggested fix chosen from phrases in the mismatch detail. Matching reports need none. */
    public String suggestFix(VerificationReport report) {
        if (report.match()) {
            return "";
        }
        String text = report.details().toLowerCase(Locale.ROOT);
        if (ITERATOR_PHRASES.matcher(text).find()) {
            return SUGGEST_LIST;
        }
        if (text.contains("division")) {
            return SUGGEST_DIVISION;
        }
        if (report.timedOut() || text.contains("timed out")) {
            return SUGGEST_TIMEOUT;
        }
        return SUGGEST_MANUAL;
    }

    public ReviewStatus status(VerificationReport report) {
        return report.match() ? ReviewStatus.ACCEPTED : ReviewStatus.MANUAL;
    }

    public Map<String, Object> snapshot(VerificationReport report) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", report.unit());
        map.put("match", report.match());
        map.put("details", report.details());
        map.put("suggested_fix", suggestFix(report));
        map.put("status", status(report).label());
        return map;
    }

    /** Side-by-side HTML page of the two captured outputs. */
    public String html(VerificationReport report) {
        List<LineDiff.Row> rows = LineDiff.between(report.legacyOutput().lines().toList(),
                report.modernOutput().lines().toList());
        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\">\n")
                .append("<title>Review: ").append(escape(report.unit())).append("</title>\n")
                .append("<style>\n")
                .append("table { border-collapse: collapse; width: 100%; font-family: monospace; }\n")
                .append("td { border: 1px solid #ccc; padding: 2px 6px; white-space: pre-wrap; vertical-align: top; }\n")
                .append(".changed { background: #fff5c2; }\n")
                .append(".left_only { background: #ffd7d5; }\n")
                .append(".right_only { background: #d4f7d4; }\n")
                .append("</style>\n</head>\n<body>\n")
                .append("<h1>").append(escape(report.unit())).append("</h1>\n")
                .append("<p>Status: <b>").append(status(report).label()).append("</b></p>\n")
                .append("<p>Details: ").append(escape(report.details())).append("</p>\n");
        String fix = suggestFix(report);
        if (!fix.isEmpty()) {
            sb.append("<p>Suggested fix: ").append(escape(fix)).append("</p>\n");
        }
        sb.append("<table>\n<tr><th>Legacy output</th><th>Modern output</th></tr>\n");
        for (LineDiff.Row row : rows) {
            String css = row.kind() == LineDiff.Kind.SAME ? "" : " class=\"" + row.kind().name().toLowerCase() + "\"";
            sb.append("<tr").append(css).append("><td>").append(escape(row.left()))
                    .append("</td><td>").append(escape(row.right())).append("</td></tr>\n");
        }
        sb.append("</table>\n</body>\n</html>\n");
        return sb.toString();
    }

    static String escape(String s) {
        if (s == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append("&amp;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
