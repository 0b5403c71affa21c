package modernizer.exceptions;

/**
 * The container runtime could not be reached. Non-fatal in {@code AUTO}
 * sandbox mode, where execution falls back to the local interpreter.
 */
public class SandboxUnavailableException extends ModernizeException {

    private final String runtime;

    public SandboxUnavailableException(String runtime, String reason) {
        super("Sandbox runtime '" + runtime + "' unavailable: " + reason);
        this.runtime = runtime;
    }

    public SandboxUnavailableException(String runtime, Throwable cause) {
        super("Sandbox runtime '" + runtime + "' unavailable: " + cause.getMessage(), cause);
        this.runtime = runtime;
    }

    public String getRuntime() {
        return runtime;
    }
}
