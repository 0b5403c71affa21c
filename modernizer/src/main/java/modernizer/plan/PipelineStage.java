package modernizer.plan;

/**
 * The fixed stages of a modernization session, in execution order.
 */
public enum PipelineStage {
    /** Makes raw legacy input parseable. */
    PREPROCESS("stage0_preprocess", true),
    /** Rewrites legacy statement syntax. */
    STRUCTURAL("stage1_structural", true),
    /** Rewrites behavior-altering constructs. */
    SEMANTIC("stage2_semantic", true),
    /** Runs both environments and compares output. */
    VERIFICATION("stage3_verification", false),
    /** Patches verified mismatches and re-verifies. */
    REPAIR("stage4_repair", true),
    /** Renders reviewer-facing artifacts. */
    REVIEW("stage5_review", false);

    private final String dirName;
    private final boolean producesSource;

    PipelineStage(String dirName, boolean producesSource) {
        this.dirName = dirName;
        this.producesSource = producesSource;
    }

    /** Directory name under {@code intermediate/}, also the stage's name in metadata. */
    public String dirName() {
        return dirName;
    }

    /** Whether the stage writes a source tree that later stages and {@code final_output/} consume. */
    public boolean producesSource() {
        return producesSource;
    }

    public String metadataFileName() {
        return dirName + "_metadata.json";
    }
}
