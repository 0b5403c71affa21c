package modernizer.verify;

import com.fasterxml.jackson.databind.JsonNode;
import modernizer.io.JsonFiles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OutputComparator")
class OutputComparatorTest {

    private final OutputComparator comparator = new OutputComparator();

    private static JsonNode details(Comparison c) throws Exception {
        return JsonFiles.mapper().readTree(c.details());
    }

    @Nested
    @DisplayName("JSON payloads")
    class JsonPayloads {

        @Test
        @DisplayName("should match equal objects regardless of key order")
        void shouldMatchEqualObjects() {
            Comparison c = comparator.compare("{\"a\": 1, \"b\": [1, 2]}\n", "{\"b\": [1, 2], \"a\": 1}\n");

            assertThat(c.match()).isTrue();
            assertThat(c.details()).isEqualTo(Comparison.ALL_MATCH);
        }

        @Test
        @DisplayName("should compare numbers by value")
        void shouldCompareNumbersByValue() {
            assertThat(comparator.compare("{\"half\": 2}", "{\"half\": 2.0}").match()).isTrue();
        }

        @Test
        @DisplayName("should report only the keys that differ")
        void shouldReportOnlyDifferingKeys() throws Exception {
            Comparison c = comparator.compare("{\"a\": 1, \"b\": 2}", "{\"a\": 1, \"b\": 3}");

            assertThat(c.match()).isFalse();
            JsonNode diff = details(c);
            assertThat(diff.has("a")).isFalse();
            assertThat(diff.get("b").get(0).asInt()).isEqualTo(2);
            assertThat(diff.get("b").get(1).asInt()).isEqualTo(3);
        }

        @Test
        @DisplayName("should use null for a key missing on one side")
        void shouldUseNullForMissingKey() throws Exception {
            JsonNode diff = details(comparator.compare("{\"a\": 1}", "{}"));

            assertThat(diff.get("a").get(0).asInt()).isEqualTo(1);
            assertThat(diff.get("a").get(1).isNull()).isTrue();
        }

        @Test
        @DisplayName("should report non-object payloads under the root key")
        void shouldReportRootDifference() throws Exception {
            JsonNode diff = details(comparator.compare("[1, 2]", "[2, 1]"));

            assertThat(diff.has("$")).isTrue();
        }

        @Test
        @DisplayName("should give the same verdict in both directions")
        void shouldBeSymmetric() {
            String[][] pairs = {
                    {"{\"a\": 1}", "{\"a\": 1.0}"},
                    {"{\"a\": [1]}", "{\"a\": [1, 2]}"},
                    {"plain", "plain"},
                    {"plain", "other"},
                    {"{\"a\": 1}", "a"},
            };
            for (String[] p : pairs) {
                assertThat(comparator.compare(p[0], p[1]).match())
                        .as("%s vs %s", p[0], p[1])
                        .isEqualTo(comparator.compare(p[1], p[0]).match());
            }
        }
    }

    @Nested
    @DisplayName("other payloads")
    class OtherPayloads {

        @Test
        @DisplayName("should compare non-JSON output as text")
        void shouldCompareTextually() {
            Comparison c = comparator.compare("hello world\n", "  hello world  \n");

            assertThat(c.match()).isTrue();
            assertThat(c.details()).isEqualTo(Comparison.TEXTUAL);
        }

        @Test
        @DisplayName("should read the JSON payload from the last non-blank line")
        void shouldReadPayloadFromLastLine() {
            assertThat(comparator.compare("noise 1\n{\"a\": 1}\n\n", "noise 2\n{\"a\": 1}\n").match()).isTrue();
        }

        @Test
        @DisplayName("should compare the whole text when the output is not JSON")
        void shouldCompareWholeTextWithoutJson() {
            Comparison c = comparator.compare("Traceback A\nboom\n", "Traceback B\nboom\n");

            assertThat(c.match()).isFalse();
            assertThat(c.details()).isEqualTo(Comparison.TEXTUAL);
            assertThat(comparator.compare("line 1\nline 2\n", "line 1\nline 2").match()).isTrue();
        }

        @Test
        @DisplayName("should treat empty output on either side as a mismatch")
        void shouldRejectEmptyOutput() {
            Comparison c = comparator.compare("", "{\"a\": 1}");

            assertThat(c.match()).isFalse();
            assertThat(c.details()).isEqualTo(Comparison.EMPTY_OUTPUT);
            assertThat(comparator.compare(null, null).match()).isFalse();
        }
    }
}
