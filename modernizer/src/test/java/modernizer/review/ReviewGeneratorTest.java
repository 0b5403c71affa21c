package modernizer.review;

import modernizer.verify.Comparison;
import modernizer.verify.VerificationReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReviewGenerator")
class ReviewGeneratorTest {

    private final ReviewGenerator generator = new ReviewGenerator();

    private static VerificationReport mismatch(String details) {
        return new VerificationReport("pkg/mod.py", false, details, 0, 0, false, 1, false,
                "{\"f\": [1, 2]}", "{\"f\": \"<map object at 0x>\"}", "local");
    }

    @Nested
    @DisplayName("suggested fixes")
    class SuggestedFixes {

        @Test
        @DisplayName("should suggest list() for lazy iterator output")
        void shouldSuggestList() {
            assertThat(generator.suggestFix(mismatch("{\"f\": [[1, 2], \"<map object at 0x>\"]}")))
                    .isEqualTo(ReviewGenerator.SUGGEST_LIST);
        }

        @Test
        @DisplayName("should match iterator names only as whole words")
        void shouldMatchIteratorNamesAsWords() {
            assertThat(generator.suggestFix(mismatch("{\"bitmap\": [0, 1], \"mapping\": {}, \"zipcode\": 1}")))
                    .isEqualTo(ReviewGenerator.SUGGEST_MANUAL);
            assertThat(generator.suggestFix(mismatch("{\"pairs\": \"<zip object>\"}")))
                    .isEqualTo(ReviewGenerator.SUGGEST_LIST);
            assertThat(generator.suggestFix(mismatch("map result differs")))
                    .isEqualTo(ReviewGenerator.SUGGEST_LIST);
        }

        @Test
        @DisplayName("should suggest explicit division when the detail mentions division")
        void shouldSuggestDivision() {
            assertThat(generator.suggestFix(mismatch("integer division changed the result")))
                    .isEqualTo(ReviewGenerator.SUGGEST_DIVISION);
        }

        @Test
        @DisplayName("should point at the timeout for timed out runs")
        void shouldSuggestTimeout() {
            VerificationReport timedOut = new VerificationReport("a.py", false,
                    "Execution timed out in the modern environment", 0, -1, false, 1, true, "", "", "local");

            assertThat(generator.suggestFix(timedOut)).isEqualTo(ReviewGenerator.SUGGEST_TIMEOUT);
        }

        @Test
        @DisplayName("should fall back to manual review")
        void shouldFallBackToManualReview() {
            assertThat(generator.suggestFix(mismatch("{\"f\": [1, 2]}"))).isEqualTo(ReviewGenerator.SUGGEST_MANUAL);
        }

        @Test
        @DisplayName("should not look at the captured outputs")
        void shouldIgnoreCapturedOutputs() {
            VerificationReport report = new VerificationReport("a.py", false, "{\"g\": [1, 2]}", 0, 0, false, 1,
                    false, "map", "filter", "local");

            assertThat(generator.suggestFix(report)).isEqualTo(ReviewGenerator.SUGGEST_MANUAL);
        }

        @Test
        @DisplayName("should suggest nothing for a match")
        void shouldSuggestNothingForMatch() {
            VerificationReport match = new VerificationReport("a.py", true, Comparison.ALL_MATCH, 0, 0, false, 1,
                    false, "{}", "{}", "local");

            assertThat(generator.suggestFix(match)).isEmpty();
            assertThat(generator.status(match)).isEqualTo(ReviewStatus.ACCEPTED);
        }
    }

    @Nested
    @DisplayName("artifacts")
    class Artifacts {

        @Test
        @DisplayName("should snapshot the verdict with status and suggestion")
        void shouldSnapshotVerdict() {
            Map<String, Object> snapshot = generator.snapshot(mismatch("{\"f\": \"<map object at 0x>\"}"));

            assertThat(snapshot)
                    .containsEntry("file", "pkg/mod.py")
                    .containsEntry("match", false)
                    .containsEntry("suggested_fix", ReviewGenerator.SUGGEST_LIST)
                    .containsEntry("status", "manual");
        }

        @Test
        @DisplayName("should render both outputs side by side with markup escaped")
        void shouldRenderEscapedHtml() {
            String html = generator.html(mismatch("{\"f\": \"<map object at 0x>\"}"));

            assertThat(html).startsWith("<!DOCTYPE html>");
            assertThat(html).contains("<tr class=\"changed\">");
            assertThat(html).contains("&lt;map object at 0x&gt;");
            assertThat(html).doesNotContain("<map object");
            assertThat(html).contains("Suggested fix: ");
        }

        @Test
        @DisplayName("should escape every markup character")
        void shouldEscapeMarkup() {
            assertThat(ReviewGenerator.escape("<a href=\"x\">'&'</a>"))
                    .isEqualTo("&lt;a href=&quot;x&quot;&gt;&#39;&amp;&#39;&lt;/a&gt;");
            assertThat(ReviewGenerator.escape(null)).isEmpty();
        }
    }
}
