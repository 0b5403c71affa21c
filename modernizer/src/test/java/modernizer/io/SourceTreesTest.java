package modernizer.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SourceTrees")
class SourceTreesTest {

    @TempDir
    Path tempDir;

    private Path stageTree() throws Exception {
        Path stage = tempDir.resolve("stage1_structural");
        Files.createDirectories(stage.resolve("pkg/__pycache__"));
        Files.writeString(stage.resolve("pkg/mod.py"), "x = 1\n");
        Files.writeString(stage.resolve("pkg/data.csv"), "a,b\n");
        Files.writeString(stage.resolve("pkg/__pycache__/mod.pyc"), "junk");
        Files.writeString(stage.resolve("stage1_structural_metadata.json"), "{}");
        return stage;
    }

    @Test
    @DisplayName("should copy a stage tree without its metadata or cache directories")
    void shouldCopyStageTree() throws Exception {
        Path target = tempDir.resolve("out");

        int copied = SourceTrees.copyStageTree(stageTree(), target);

        assertThat(copied).isEqualTo(2);
        assertThat(Files.readString(target.resolve("pkg/mod.py"))).isEqualTo("x = 1\n");
        assertThat(target.resolve("stage1_structural_metadata.json")).doesNotExist();
        assertThat(target.resolve("pkg/__pycache__")).doesNotExist();
    }

    @Test
    @DisplayName("should copy only non-source assets")
    void shouldCopyAssets() throws Exception {
        Path target = tempDir.resolve("assets");

        SourceTrees.copyAssets(stageTree(), target);

        assertThat(target.resolve("pkg/data.csv")).exists();
        assertThat(target.resolve("pkg/mod.py")).doesNotExist();
    }

    @Test
    @DisplayName("should replace stale contents when mirroring")
    void shouldMirror() throws Exception {
        Path target = tempDir.resolve("final_output");
        Files.createDirectories(target);
        Files.writeString(target.resolve("stale.py"), "old\n");

        SourceTrees.mirror(stageTree(), target);

        assertThat(target.resolve("stale.py")).doesNotExist();
        assertThat(target.resolve("pkg/mod.py")).exists();
    }

    @Test
    @DisplayName("should write JSON atomically and read it back")
    void shouldWriteJsonAtomically() throws Exception {
        Path file = tempDir.resolve("nested/report.json");

        JsonFiles.writeAtomic(file, Map.of("status", "completed", "count", 2));

        assertThat(JsonFiles.readMap(file)).containsEntry("status", "completed").containsEntry("count", 2);
        try (var entries = Files.list(file.getParent())) {
            assertThat(entries).containsExactly(file);
        }
    }
}
