package modernizer.config;

/**
 * How the verification engine chooses its executor at session start.
 */
public enum SandboxMode {
    /** Check the container runtime; fall back to local execution if it is unavailable. */
    AUTO,
    /** Require the container runtime; the session fails if it is unavailable. */
    SANDBOXED,
    /** Always execute locally without probing. */
    LOCAL
}
