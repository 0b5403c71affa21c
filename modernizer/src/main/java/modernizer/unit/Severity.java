package modernizer.unit;

/** Severity of a {@link TransformationFinding}. */
public enum Severity {
    /** The construct was rewritten automatically. */
    FIXED,
    /** The construct was left alone and annotated for a reviewer. */
    FLAGGED,
    /** An automatic rewrite was attempted and rolled back. */
    MANUAL;

    public String label() {
        return name().toLowerCase();
    }
}
