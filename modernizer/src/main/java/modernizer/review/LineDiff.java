package modernizer.review;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-level side-by-side diff based on the longest common subsequence.
 */
public final class LineDiff {

    public enum Kind { SAME, CHANGED, LEFT_ONLY, RIGHT_ONLY }

    /** One aligned row. The missing side of a one-sided row is null. */
    public record Row(Kind kind, String left, String right) {
    }

    private LineDiff() {}

    public static List<Row> between(List<String> left, List<String> right) {
        int n = left.size();
        int m = right.size();
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                lcs[i][j] = left.get(i).equals(right.get(j))
                        ? lcs[i + 1][j + 1] + 1
                        : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }

        List<Row> rows = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<String> added = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < n || j < m) {
            if (i < n && j < m && left.get(i).equals(right.get(j))) {
                flush(rows, removed, added);
                rows.add(new Row(Kind.SAME, left.get(i), right.get(j)));
                i++;
                j++;
            } else if (j < m && (i == n || lcs[i][j + 1] >= lcs[i + 1][j])) {
                added.add(right.get(j++));
            } else {
                removed.add(left.get(i++));
            }
        }
        flush(rows, removed, added);
        return rows;
    }

    /** Pairs a run of removed lines with the run of added lines that replaced it. */
    private static void flush(List<Row> rows, List<String> removed, List<String> added) {
        int paired = Math.min(removed.size(), added.size());
        for (int k = 0; k < paired; k++) {
            rows.add(new Row(Kind.CHANGED, removed.get(k), added.get(k)));
        }
        for (int k = paired; k < removed.size(); k++) {
            rows.add(new Row(Kind.LEFT_ONLY, removed.get(k), null));
        }
        for (int k = paired; k < added.size(); k++) {
            rows.add(new Row(Kind.RIGHT_ONLY, null, added.get(k)));
        }
        removed.clear();
        added.clear();
    }
}
