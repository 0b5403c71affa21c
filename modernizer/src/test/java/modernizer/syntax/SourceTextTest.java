package modernizer.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SourceText")
class SourceTextTest {

    @Test
    @DisplayName("should normalize line endings and keep the trailing newline")
    void shouldNormalizeLineEndings() {
        SourceText text = SourceText.of("a = 1\r\nb = 2\r\n");

        assertThat(text.lines()).containsExactly("a = 1", "b = 2");
        assertThat(text.render()).isEqualTo("a = 1\nb = 2\n");
        assertThat(SourceText.of("x").render()).isEqualTo("x");
        assertThat(SourceText.of("").lineCount()).isZero();
    }

    @Test
    @DisplayName("should report indentation of a line")
    void shouldReportIndentation() {
        SourceText text = SourceText.of("if x:\n    \ty = 1\n");

        assertThat(text.indentation(1)).isEmpty();
        assertThat(text.indentation(2)).isEqualTo("    \t");
    }

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        @DisplayName("should apply several edits on one line against original columns")
        void shouldApplyEditsAgainstOriginalColumns() {
            SourceText text = SourceText.of("x = map(f, xs)\n");

            SourceText out = text.apply(List.of(
                    TextEdit.insert(1, 4, "list(", "wrap"),
                    TextEdit.insert(1, 14, ")", "wrap")));

            assertThat(out.render()).isEqualTo("x = list(map(f, xs))\n");
        }

        @Test
        @DisplayName("should delete lines and split multi-line replacements")
        void shouldDeleteAndSplit() {
            SourceText text = SourceText.of("a\nb\nc\n");

            SourceText out = text.apply(List.of(
                    TextEdit.deleteLine(2, "drop"),
                    TextEdit.replace(3, 0, 1, "c1\nc2", "split")));

            assertThat(out.lines()).containsExactly("a", "c1", "c2");
            assertThat(out.render()).endsWith("\n");
        }

        @Test
        @DisplayName("should keep only the last-sorting edit when edits overlap")
        void shouldDropOverlappingEdits() {
            SourceText text = SourceText.of("abcdef");

            SourceText out = text.apply(List.of(
                    TextEdit.replace(1, 0, 4, "X", "first"),
                    TextEdit.replace(1, 2, 5, "Y", "second")));

            assertThat(out.render()).isEqualTo("abYf");
        }

        @Test
        @DisplayName("should reject edits outside the text")
        void shouldRejectOutOfRangeEdits() {
            SourceText text = SourceText.of("short\n");

            assertThatThrownBy(() -> text.apply(List.of(TextEdit.insert(3, 0, "x", "r"))))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> text.apply(List.of(TextEdit.replace(1, 2, 40, "x", "r"))))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should return the same instance for an empty batch")
        void shouldReturnSameForEmptyBatch() {
            SourceText text = SourceText.of("a\n");

            assertThat(text.apply(List.of())).isSameAs(text);
        }
    }
}
