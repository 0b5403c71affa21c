package modernizer.unit;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One source file tracked through the pipeline.
 *
 * <p>Units are values: every transformation returns a new unit carrying the
 * new content and an extended history, leaving the input untouched.
 *
 * @param path path relative to the tree root, always with {@code /} separators
 * @param content current content
 * @param history ordered transformation history
 * @param parseable whether the content parses under the transitional grammar
 * @param encoding charset the file was decoded with and is written back in
 */
public record SourceUnit(String path, String content, List<AppliedRule> history, boolean parseable,
                         Charset encoding) {

    public SourceUnit {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(encoding, "encoding");
        history = List.copyOf(history);
    }

    public SourceUnit(String path, String content, List<AppliedRule> history, boolean parseable) {
        this(path, content, history, parseable, StandardCharsets.UTF_8);
    }

    public static SourceUnit of(String path, String content) {
        return of(path, content, StandardCharsets.UTF_8);
    }

    public static SourceUnit of(String path, String content, Charset encoding) {
        return new SourceUnit(path, content, List.of(), true, encoding);
    }

    /** Report key: separators replaced by {@code __}, {@code .py} suffix dropped. */
    public String key() {
        return UnitNames.reportKey(path);
    }

    /**
     * Returns a unit with new content; the applied rules are appended to the history.
     */
    public SourceUnit withContent(String newContent, Collection<AppliedRule> applied) {
        List<AppliedRule> h = new ArrayList<>(history);
        h.addAll(applied);
        return new SourceUnit(path, newContent, h, parseable, encoding);
    }

    public SourceUnit withParseable(boolean value) {
        return new SourceUnit(path, content, history, value, encoding);
    }

    public boolean isBlank() {
        return content.isBlank();
    }

    public int lineCount() {
        if (content.isEmpty()) {
            return 0;
        }
        return (int) content.lines().count();
    }
}
