package modernizer.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Central configuration for a modernization session.
 *
 * <p>Covers:
 * <ul>
 *   <li>where sessions are written</li>
 *   <li>the legacy and modern runtime environments and how they are executed</li>
 *   <li>execution and stage timeouts</li>
 *   <li>repair and preprocessing bounds</li>
 *   <li>alert level</li>
 * </ul>
 *
 * <p>Configuration can be loaded from {@code modernizer.properties} or
 * {@code modernizer.yml} using {@link ModernizerConfigLoader}. A snapshot of
 * the effective values is recorded in every session's {@code metadata.json}.
 *
 * @see ModernizerConfigLoader
 */
public final class ModernizerConfig {

    public static final ModernizerConfig DEFAULTS = builder().build();

    private final Path sessionsRoot;
    private final int maxRepairAttempts;
    private final String legacyImage;
    private final String legacyInterpreter;
    private final String modernImage;
    private final String modernInterpreter;
    private final Duration executionTimeout;
    private final Duration stageTimeout;
    private final SandboxMode sandboxMode;
    private final String containerRuntime;
    private final int verificationWorkers;
    private final int maxFixIterations;
    private final AlertLevel alertLevel;

    private ModernizerConfig(Builder b) {
        this.sessionsRoot = b.sessionsRoot;
        this.maxRepairAttempts = b.maxRepairAttempts;
        this.legacyImage = b.legacyImage;
        this.legacyInterpreter = b.legacyInterpreter;
        this.modernImage = b.modernImage;
        this.modernInterpreter = b.modernInterpreter;
        this.executionTimeout = b.executionTimeout;
        this.stageTimeout = b.stageTimeout;
        this.sandboxMode = b.sandboxMode;
        this.containerRuntime = b.containerRuntime;
        this.verificationWorkers = b.verificationWorkers;
        this.maxFixIterations = b.maxFixIterations;
        this.alertLevel = b.alertLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-filled with this configuration's values. */
    public Builder toBuilder() {
        return new Builder()
                .sessionsRoot(sessionsRoot)
                .maxRepairAttempts(maxRepairAttempts)
                .legacyImage(legacyImage)
                .legacyInterpreter(legacyInterpreter)
                .modernImage(modernImage)
                .modernInterpreter(modernInterpreter)
                .executionTimeout(executionTimeout)
                .stageTimeout(stageTimeout)
                .sandboxMode(sandboxMode)
                .containerRuntime(containerRuntime)
                .verificationWorkers(verificationWorkers)
                .maxFixIterations(maxFixIterations)
                .alertLevel(alertLevel);
    }

    /** Directory under which {@code <session_id>/} directories are created. */
    public Path sessionsRoot() { return sessionsRoot; }

    /** Upper bound on repair attempts. */
    public int maxRepairAttempts() { return maxRepairAttempts; }

    /** Container image of the legacy environment. */
    public String legacyImage() { return legacyImage; }

    /** Interpreter command of the legacy environment. */
    public String legacyInterpreter() { return legacyInterpreter; }

    /** Container image of the modern environment. */
    public String modernImage() { return modernImage; }

    /** Interpreter command of the modern environment. */
    public String modernInterpreter() { return modernInterpreter; }

    /** Timeout for one harness execution. */
    public Duration executionTimeout() { return executionTimeout; }

    /** Timeout for a whole stage, or {@link Duration#ZERO} when disabled. */
    public Duration stageTimeout() { return stageTimeout; }

    public SandboxMode sandboxMode() { return sandboxMode; }

    /** Container CLI used for sandboxed execution (e.g. {@code docker}). */
    public String containerRuntime() { return containerRuntime; }

    /** Size of the verification worker pool. */
    public int verificationWorkers() { return verificationWorkers; }

    /** Upper bound on parse-fix iterations per unit during preprocessing. */
    public int maxFixIterations() { return maxFixIterations; }

    public AlertLevel alertLevel() { return alertLevel; }

    /**
     * Converts the configuration to a Map for JSON serialization.
     *
     * @return the effective configuration values
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sessions_root", sessionsRoot.toString());
        map.put("max_repair_attempts", maxRepairAttempts);
        map.put("legacy_image", legacyImage);
        map.put("legacy_interpreter", legacyInterpreter);
        map.put("modern_image", modernImage);
        map.put("modern_interpreter", modernInterpreter);
        map.put("execution_timeout_sec", executionTimeout.toSeconds());
        map.put("stage_timeout_sec", stageTimeout.toSeconds());
        map.put("sandbox_mode", sandboxMode.name());
        map.put("container_runtime", containerRuntime);
        map.put("verification_workers", verificationWorkers);
        map.put("max_fix_iterations", maxFixIterations);
        map.put("alert_level", alertLevel.name());
        return map;
    }

    @Override
    public String toString() {
        return "ModernizerConfig{" +
                "sessionsRoot=" + sessionsRoot +
                ", maxRepairAttempts=" + maxRepairAttempts +
                ", legacy=" + legacyImage + "/" + legacyInterpreter +
                ", modern=" + modernImage + "/" + modernInterpreter +
                ", executionTimeout=" + executionTimeout.toSeconds() + "s" +
                ", sandboxMode=" + sandboxMode +
                ", verificationWorkers=" + verificationWorkers +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link ModernizerConfig} instances.
     */
    public static final class Builder {
        private Path sessionsRoot = Path.of("sessions");
        private int maxRepairAttempts = 3;
        private String legacyImage = "python:2.7";
        private String legacyInterpreter = "python2";
        private String modernImage = "python:3.11";
        private String modernInterpreter = "python3";
        private Duration executionTimeout = Duration.ofSeconds(15);
        private Duration stageTimeout = Duration.ZERO;
        private SandboxMode sandboxMode = SandboxMode.AUTO;
        private String containerRuntime = "docker";
        private int verificationWorkers = 4;
        private int maxFixIterations = 20;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder sessionsRoot(Path root) {
            this.sessionsRoot = root;
            return this;
        }

        public Builder maxRepairAttempts(int attempts) {
            if (attempts < 0) throw new IllegalArgumentException("maxRepairAttempts must not be negative");
            this.maxRepairAttempts = attempts;
            return this;
        }

        public Builder legacyImage(String image) {
            this.legacyImage = image;
            return this;
        }

        public Builder legacyInterpreter(String interpreter) {
            this.legacyInterpreter = interpreter;
            return this;
        }

        public Builder modernImage(String image) {
            this.modernImage = image;
            return this;
        }

        public Builder modernInterpreter(String interpreter) {
            this.modernInterpreter = interpreter;
            return this;
        }

        public Builder executionTimeout(Duration timeout) {
            this.executionTimeout = timeout;
            return this;
        }

        public Builder executionTimeoutSeconds(long seconds) {
            if (seconds <= 0) throw new IllegalArgumentException("execution timeout must be positive");
            return executionTimeout(Duration.ofSeconds(seconds));
        }

        public Builder stageTimeout(Duration timeout) {
            this.stageTimeout = timeout;
            return this;
        }

        public Builder stageTimeoutSeconds(long seconds) {
            return stageTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder sandboxMode(SandboxMode mode) {
            this.sandboxMode = mode;
            return this;
        }

        public Builder containerRuntime(String runtime) {
            this.containerRuntime = runtime;
            return this;
        }

        public Builder verificationWorkers(int workers) {
            if (workers <= 0) throw new IllegalArgumentException("verificationWorkers must be positive");
            this.verificationWorkers = workers;
            return this;
        }

        public Builder maxFixIterations(int iterations) {
            if (iterations <= 0) throw new IllegalArgumentException("maxFixIterations must be positive");
            this.maxFixIterations = iterations;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public ModernizerConfig build() {
            return new ModernizerConfig(this);
        }
    }
}
