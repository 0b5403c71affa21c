package modernizer.state;

/** Lifecycle of a session. RUNNING is the only non-terminal state. */
public enum SessionStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public String label() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
