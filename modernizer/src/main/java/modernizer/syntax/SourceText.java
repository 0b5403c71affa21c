package modernizer.syntax;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable line-addressed source buffer.
 *
 * <p>Edits are applied as one batch: grouped per line, each line's edits run
 * in reverse column order so earlier columns stay valid while later ones are
 * rewritten. Line numbers inside a batch always refer to the text the batch
 * was computed against.
 */
public final class SourceText {

    private static final Logger log = LoggerFactory.getLogger(SourceText.class);

    private final List<String> lines;
    private final boolean trailingNewline;

    private SourceText(List<String> lines, boolean trailingNewline) {
        this.lines = List.copyOf(lines);
        this.trailingNewline = trailingNewline;
    }

    public static SourceText of(String content) {
        String normalized = content.replace("\r\n", "\n").replace('\r', '\n');
        boolean trailing = normalized.endsWith("\n");
        String body = trailing ? normalized.substring(0, normalized.length() - 1) : normalized;
        List<String> lines = body.isEmpty() && !trailing ? List.of() : List.of(body.split("\n", -1));
        return new SourceText(lines, trailing);
    }

    public List<String> lines() {
        return lines;
    }

    public int lineCount() {
        return lines.size();
    }

    /** Returns the text of a 1-based line. */
    public String line(int number) {
        return lines.get(number - 1);
    }

    /** Returns the leading whitespace of a 1-based line. */
    public String indentation(int number) {
        String l = line(number);
        int i = 0;
        while (i < l.length() && (l.charAt(i) == ' ' || l.charAt(i) == '\t')) {
            i++;
        }
        return l.substring(0, i);
    }

    /** Returns a copy with one line replaced. */
    public SourceText withLine(int number, String text) {
        List<String> copy = new ArrayList<>(lines);
        copy.set(number - 1, text);
        return rebuild(copy);
    }

    /**
     * Applies a batch of edits. Overlapping edits on one line keep the one that
     * sorts last and drop the others.
     */
    public SourceText apply(Collection<TextEdit> edits) {
        if (edits.isEmpty()) {
            return this;
        }
        Map<Integer, List<Indexed>> byLine = new TreeMap<>();
        int seq = 0;
        for (TextEdit e : edits) {
            if (e.line() < 1 || e.line() > lines.size()) {
                throw new IllegalArgumentException("Edit outside of text: line " + e.line());
            }
            byLine.computeIfAbsent(e.line(), k -> new ArrayList<>()).add(new Indexed(e, seq++));
        }

        List<String> out = new ArrayList<>(lines.size());
        for (int n = 1; n <= lines.size(); n++) {
            List<Indexed> lineEdits = byLine.get(n);
            if (lineEdits == null) {
                out.add(lines.get(n - 1));
                continue;
            }
            if (lineEdits.stream().anyMatch(i -> i.edit.isLineDeletion())) {
                continue;
            }
            lineEdits.sort(Comparator.<Indexed>comparingInt(i -> i.edit.startColumn())
                    .thenComparingInt(i -> i.edit.endColumn())
                    .thenComparingInt(i -> i.seq)
                    .reversed());
            String text = lines.get(n - 1);
            int limit = Integer.MAX_VALUE;
            for (Indexed i : lineEdits) {
                TextEdit e = i.edit;
                if (e.endColumn() > text.length() || e.startColumn() > e.endColumn()) {
                    throw new IllegalArgumentException("Edit outside of line " + n + ": " + e);
                }
                if (e.endColumn() > limit) {
                    log.debug("Dropping overlapping edit on line {}: {}", n, e);
                    continue;
                }
                text = text.substring(0, e.startColumn()) + e.replacement() + text.substring(e.endColumn());
                limit = e.startColumn();
            }
            out.addAll(List.of(text.split("\n", -1)));
        }
        return rebuild(out);
    }

    public String render() {
        if (lines.isEmpty()) {
            return trailingNewline ? "\n" : "";
        }
        String joined = String.join("\n", lines);
        return trailingNewline ? joined + "\n" : joined;
    }

    @Override
    public String toString() {
        return render();
    }

    private SourceText rebuild(List<String> newLines) {
        return new SourceText(newLines, trailingNewline);
    }

    private record Indexed(TextEdit edit, int seq) {
    }
}
