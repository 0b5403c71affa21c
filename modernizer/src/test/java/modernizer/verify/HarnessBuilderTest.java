package modernizer.verify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HarnessBuilder")
class HarnessBuilderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should copy the tree and place the harness at the workspace root")
    void shouldPrepareWorkspace() throws Exception {
        Path tree = tempDir.resolve("tree");
        Files.createDirectories(tree.resolve("pkg"));
        Files.writeString(tree.resolve("pkg/mod.py"), "x = 1\n");
        Files.writeString(tree.resolve("preprocess_metadata.json"), "[]");

        Path workspace = HarnessBuilder.prepare(tree, tempDir.resolve("ws"));

        assertThat(workspace.resolve("pkg/mod.py")).hasContent("x = 1");
        assertThat(workspace.resolve(HarnessBuilder.HARNESS_FILE)).exists();
        assertThat(workspace.resolve("preprocess_metadata.json")).doesNotExist();
    }

    @Test
    @DisplayName("should replace a stale workspace")
    void shouldReplaceStaleWorkspace() throws Exception {
        Path tree = tempDir.resolve("tree");
        Files.createDirectories(tree);
        Files.writeString(tree.resolve("a.py"), "a = 1\n");
        Path ws = tempDir.resolve("ws");
        Files.createDirectories(ws);
        Files.writeString(ws.resolve("stale.py"), "old\n");

        HarnessBuilder.prepare(tree, ws);

        assertThat(ws.resolve("stale.py")).doesNotExist();
        assertThat(ws.resolve("a.py")).exists();
    }

    @Test
    @DisplayName("should load a harness that prints a JSON line")
    void shouldLoadHarnessSource() throws Exception {
        assertThat(HarnessBuilder.harnessSource()).contains("import json").contains("sys.argv");
    }
}
