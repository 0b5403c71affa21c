package modernizer.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CodeMask")
class CodeMaskTest {

    @Test
    @DisplayName("should blank string bodies and comments but keep columns")
    void shouldBlankStringsAndComments() {
        String line = "x = 'a # b' + y  # tail";
        CodeMask mask = CodeMask.of(line + "\n");

        assertThat(mask.code(1)).hasSameSizeAs(line);
        assertThat(mask.code(1)).startsWith("x = '     ' + y");
        assertThat(mask.code(1)).doesNotContain("#", "tail");
        assertThat(mask.commentStart(1)).isEqualTo(line.indexOf("# tail"));
    }

    @Test
    @DisplayName("should handle escaped quotes")
    void shouldHandleEscapedQuotes() {
        CodeMask mask = CodeMask.of("s = 'it\\'s' + t\n");

        assertThat(mask.code(1)).endsWith("' + t");
        assertThat(mask.commentStart(1)).isEqualTo(-1);
    }

    @Test
    @DisplayName("should track triple-quoted strings across lines")
    void shouldTrackTripleQuotedStrings() {
        CodeMask mask = CodeMask.of("doc = \"\"\"first\n# not a comment\nend\"\"\"\nz = 1\n");

        assertThat(mask.stringOpenAtEnd(1)).isTrue();
        assertThat(mask.stringOpenAtEnd(2)).isTrue();
        assertThat(mask.stringOpenAtEnd(3)).isFalse();
        assertThat(mask.commentStart(2)).isEqualTo(-1);
        assertThat(mask.isBlank(2)).isFalse();
        assertThat(mask.logicalLines()).containsExactly(
                new CodeMask.LogicalLine(1, 3),
                new CodeMask.LogicalLine(4, 4));
    }

    @Test
    @DisplayName("should join bracketed and backslash-continued lines")
    void shouldJoinContinuedLines() {
        CodeMask mask = CodeMask.of("f(a,\n  b)\n\n# only a comment\nx = 1 + \\\n    2\n");

        assertThat(mask.isBlank(3)).isTrue();
        assertThat(mask.isBlank(4)).isTrue();
        assertThat(mask.logicalLines()).containsExactly(
                new CodeMask.LogicalLine(1, 2),
                new CodeMask.LogicalLine(5, 6));
    }
}
