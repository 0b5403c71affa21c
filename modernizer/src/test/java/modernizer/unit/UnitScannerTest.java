package modernizer.unit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UnitScanner")
class UnitScannerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should find source units sorted and skip tool directories")
    void shouldScanSorted() throws Exception {
        Files.createDirectories(tempDir.resolve("b/.venv"));
        Files.createDirectories(tempDir.resolve("a"));
        Files.writeString(tempDir.resolve("b/z.py"), "");
        Files.writeString(tempDir.resolve("a/y.py"), "");
        Files.writeString(tempDir.resolve("b/.venv/site.py"), "");
        Files.writeString(tempDir.resolve("a/notes.txt"), "");

        assertThat(UnitScanner.scan(tempDir)).containsExactly("a/y.py", "b/z.py");
    }

    @Test
    @DisplayName("should return nothing for a missing root")
    void shouldHandleMissingRoot() throws Exception {
        assertThat(UnitScanner.scan(tempDir.resolve("missing"))).isEmpty();
    }

    @Test
    @DisplayName("should fall back to latin-1 for legacy bytes")
    void shouldReadLegacyBytes() throws Exception {
        Path file = tempDir.resolve("legacy.py");
        Files.write(file, new byte[] {'s', ' ', '=', ' ', '\'', (byte) 0xE9, '\''});

        assertThat(UnitScanner.read(file)).isEqualTo("s = 'é'");
    }

    @Test
    @DisplayName("should write legacy units back in the charset they were read with")
    void shouldKeepLegacyCharset() throws Exception {
        byte[] original = "# -*- coding: latin-1 -*-\nname = 'café'\n".getBytes(StandardCharsets.ISO_8859_1);
        Files.write(tempDir.resolve("legacy.py"), original);

        SourceUnit unit = UnitScanner.readUnit(tempDir, "legacy.py");
        Path out = tempDir.resolve("out");
        UnitScanner.write(out, unit.withContent(unit.content().replace("name", "label"), List.of()));

        assertThat(unit.encoding()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(unit.content()).contains("café");
        assertThat(Files.readAllBytes(out.resolve("legacy.py")))
                .isEqualTo("# -*- coding: latin-1 -*-\nlabel = 'café'\n".getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    @DisplayName("should write and reload units")
    void shouldWriteAndLoad() throws Exception {
        UnitScanner.write(tempDir, SourceUnit.of("pkg/mod.py", "print('x')\n"));

        List<SourceUnit> units = UnitScanner.load(tempDir);

        assertThat(units).extracting(SourceUnit::path).containsExactly("pkg/mod.py");
        assertThat(units.get(0).content()).isEqualTo("print('x')\n");
    }

    @Test
    @DisplayName("should derive report keys from relative paths")
    void shouldDeriveReportKeys() {
        assertThat(UnitNames.reportKey("pkg/sub/mod.py")).isEqualTo("pkg__sub__mod");
        assertThat(UnitNames.reportKey("pkg\\mod.py")).isEqualTo("pkg__mod");
    }
}
