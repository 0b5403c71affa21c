package modernizer.verify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import modernizer.io.JsonFiles;

import java.util.Comparator;
import java.util.Iterator;
import java.util.TreeSet;

/**
 * Compares the harness output of the two environments.
 *
 * <ul>
 *   <li>empty output on either side is a mismatch</li>
 *   <li>when both sides print JSON, values are compared structurally, with
 *       numbers compared by value ({@code 2} equals {@code 2.0})</li>
 *   <li>otherwise the whole trimmed output of both sides is compared</li>
 * </ul>
 *
 * <p>A JSON mismatch is described by the keys that differ only, as
 * {@code {"key": [legacy, modern]}} with {@code null} for a missing side.
 * The comparison is symmetric in its match outcome.
 */
public final class OutputComparator {

    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.equals(b) ? 0 : 1;
    };

    private final ObjectMapper mapper;

    public OutputComparator() {
        this(JsonFiles.mapper());
    }

    OutputComparator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Comparison compare(String legacyStdout, String modernStdout) {
        String legacy = lastLine(legacyStdout);
        String modern = lastLine(modernStdout);
        if (legacy.isEmpty() || modern.isEmpty()) {
            return new Comparison(false, Comparison.EMPTY_OUTPUT);
        }
        JsonNode a;
        JsonNode b;
        try {
            a = mapper.readTree(legacy);
            b = mapper.readTree(modern);
        } catch (JsonProcessingException e) {
            return textual(legacyStdout, modernStdout);
        }
        if (a == null || b == null || a.isMissingNode() || b.isMissingNode()) {
            return textual(legacyStdout, modernStdout);
        }
        if (a.equals(NUMERIC_AWARE, b)) {
            return new Comparison(true, Comparison.ALL_MATCH);
        }
        return new Comparison(false, describe(a, b));
    }

    private static Comparison textual(String legacyStdout, String modernStdout) {
        return new Comparison(legacyStdout.strip().equals(modernStdout.strip()), Comparison.TEXTUAL);
    }

    private String describe(JsonNode legacy, JsonNode modern) {
        ObjectNode diff = JsonNodeFactory.instance.objectNode();
        if (legacy.isObject() && modern.isObject()) {
            TreeSet<String> keys = new TreeSet<>();
            legacy.fieldNames().forEachRemaining(keys::add);
            modern.fieldNames().forEachRemaining(keys::add);
            for (String key : keys) {
                JsonNode l = legacy.get(key);
                JsonNode m = modern.get(key);
                if (l == null || m == null || !l.equals(NUMERIC_AWARE, m)) {
                    diff.set(key, pair(l, m));
                }
            }
        } else {
            diff.set("$", pair(legacy, modern));
        }
        try {
            return mapper.writeValueAsString(diff);
        } catch (JsonProcessingException e) {
            return diff.toString();
        }
    }

    private static ArrayNode pair(JsonNode legacy, JsonNode modern) {
        ArrayNode pair = JsonNodeFactory.instance.arrayNode();
        pair.add(legacy == null ? NullNode.getInstance() : legacy);
        pair.add(modern == null ? NullNode.getInstance() : modern);
        return pair;
    }

    /** The last non-blank line, trimmed; the harness prints its JSON payload last. */
    static String lastLine(String stdout) {
        if (stdout == null) {
            return "";
        }
        String trimmed = stdout.strip();
        Iterator<String> lines = trimmed.lines().iterator();
        String last = "";
        while (lines.hasNext()) {
            String line = lines.next().strip();
            if (!line.isEmpty()) {
                last = line;
            }
        }
        return last;
    }
}
