package modernizer.state;

import modernizer.plan.PipelineStage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Filesystem layout of one session directory.
 *
 * <pre>
 * sessions/&lt;session_id&gt;/
 *   intermediate/source/             snapshot of the input
 *   intermediate/&lt;stageN_name&gt;/      per-stage working tree
 *   logs/&lt;stage&gt;.json                per-stage diagnostic log
 *   final_output/                    mirror of the most recent source-producing stage
 *   metadata.json                    top-level run status
 *   session_metadata.json            merged per-stage summary
 *   diff_reports/&lt;unit&gt;_diff.json    latest verification report per unit
 *   repair_metadata.json             per-unit repair history
 * </pre>
 */
public record SessionLayout(Path root) {

    public Path intermediate() {
        return root.resolve("intermediate");
    }

    public Path sourceSnapshot() {
        return intermediate().resolve("source");
    }

    public Path stageDir(PipelineStage stage) {
        return intermediate().resolve(stage.dirName());
    }

    public Path stageMetadata(PipelineStage stage) {
        return stageDir(stage).resolve(stage.metadataFileName());
    }

    public Path logs() {
        return root.resolve("logs");
    }

    public Path stageLog(PipelineStage stage) {
        return logs().resolve(stage.dirName() + ".json");
    }

    public Path finalOutput() {
        return root.resolve("final_output");
    }

    public Path diffReports() {
        return root.resolve("diff_reports");
    }

    public Path metadataFile() {
        return root.resolve("metadata.json");
    }

    public Path sessionMetadataFile() {
        return root.resolve("session_metadata.json");
    }

    public Path repairMetadataFile() {
        return root.resolve("repair_metadata.json");
    }

    /** Creates the fixed directories of the layout. */
    public SessionLayout create() throws IOException {
        Files.createDirectories(intermediate());
        Files.createDirectories(logs());
        Files.createDirectories(finalOutput());
        Files.createDirectories(diffReports());
        return this;
    }
}
