package modernizer.verify;

import modernizer.io.SourceTrees;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lays out the tree one environment executes: a copy of the unit tree with
 * the harness script at its root.
 */
public final class HarnessBuilder {

    static final String HARNESS_RESOURCE = "harness/unit_harness.py";

    /** File name of the harness inside a workspace; unlikely to clash with a unit. */
    public static final String HARNESS_FILE = "_modernizer_harness.py";

    private HarnessBuilder() {}

    /**
     * Copies {@code sourceTree} into {@code workspace} and writes the harness next to it.
     *
     * @return the workspace root
     */
    public static Path prepare(Path sourceTree, Path workspace) throws IOException {
        SourceTrees.deleteRecursively(workspace);
        Files.createDirectories(workspace);
        SourceTrees.copyStageTree(sourceTree, workspace);
        Files.writeString(workspace.resolve(HARNESS_FILE), harnessSource());
        return workspace;
    }

    static String harnessSource() throws IOException {
        try (InputStream in = HarnessBuilder.class.getClassLoader().getResourceAsStream(HARNESS_RESOURCE)) {
            if (in == null) {
                throw new IOException("Harness resource missing: " + HARNESS_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
