package modernizer.alert;

import modernizer.config.AlertLevel;
import modernizer.metrics.SessionMetrics;
import modernizer.plan.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging for session events.
 *
 * <p>Entries use markers like SESSION_STARTED, STAGE_COMPLETED, SESSION_FAILED
 * followed by key=value pairs, so log aggregators can alert on them.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events</li>
 *   <li>WARNING: logs warnings and errors only</li>
 *   <li>ERROR: logs errors only</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  modernizer - SESSION_STARTED id=20240101_120000_a1b2c3 units_root=/src
 * 12:00:00.500 INFO  modernizer - STAGE_COMPLETED id=20240101_120000_a1b2c3 stage=stage0_preprocess duration_ms=480
 * 12:00:03.000 WARN  modernizer - REPAIR_EXHAUSTED id=20240101_120000_a1b2c3 attempts=3 still_failing=2
 * </pre>
 */
public final class PipelineAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("modernizer");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private PipelineAlertLogger() {}

    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void sessionStarted(String sessionId, String sourceRoot) {
        if (shouldLogInfo()) {
            log.info("SESSION_STARTED id={} units_root={}", sessionId, sourceRoot);
        }
    }

    public static void stageStarted(String sessionId, PipelineStage stage) {
        if (shouldLogInfo()) {
            log.info("STAGE_STARTED id={} stage={}", sessionId, stage.dirName());
        }
    }

    public static void stageCompleted(String sessionId, PipelineStage stage, long durationMs) {
        if (shouldLogInfo()) {
            log.info("STAGE_COMPLETED id={} stage={} duration_ms={}", sessionId, stage.dirName(), durationMs);
        }
    }

    public static void sessionCompleted(String sessionId, SessionMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("SESSION_COMPLETED id={} duration_ms={} units={} matched={} repaired={} manual={}",
                    sessionId,
                    metrics.totalDurationMs(),
                    metrics.totalUnits(),
                    metrics.matchedUnits(),
                    metrics.repairedUnits(),
                    metrics.manualUnits());
        }
    }

    /**
     * Log when a stage fails. Always logged.
     *
     * @param stage the failing stage (may be null)
     */
    public static void stageFailed(String sessionId, PipelineStage stage, Throwable error) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        String stageName = stage != null ? stage.dirName() : "UNKNOWN";
        log.error("STAGE_FAILED id={} stage={} error=\"{}\"", sessionId, stageName, errorMsg);
    }

    /**
     * Log when a session fails before its first stage. Always logged.
     */
    public static void setupFailed(String sessionId, String step, Throwable error) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        log.error("SESSION_FAILED id={} step={} error=\"{}\"", sessionId, step, errorMsg);
    }

    /**
     * Log when a session ends in the failed state. Always logged.
     */
    public static void sessionFailed(String sessionId, PipelineStage stage, SessionMetrics partialMetrics) {
        String stageName = stage != null ? stage.dirName() : "UNKNOWN";
        if (partialMetrics != null) {
            log.error("SESSION_FAILED id={} stage={} duration_ms={} units={}",
                    sessionId, stageName, partialMetrics.totalDurationMs(), partialMetrics.totalUnits());
        } else {
            log.error("SESSION_FAILED id={} stage={}", sessionId, stageName);
        }
    }

    public static void sandboxFallback(String runtime, String reason) {
        if (shouldLogWarn()) {
            log.warn("SANDBOX_FALLBACK runtime={} reason=\"{}\"", runtime, reason);
        }
    }

    public static void executionTimeout(String unit, String environment, long timeoutMs) {
        if (shouldLogWarn()) {
            log.warn("EXECUTION_TIMEOUT unit={} env={} timeout_ms={}", unit, environment, timeoutMs);
        }
    }

    public static void repairAttempt(int attempt, int failing, int mutated) {
        if (shouldLogInfo()) {
            log.info("REPAIR_ATTEMPT attempt={} failing={} mutated={}", attempt, failing, mutated);
        }
    }

    public static void repairExhausted(int attempts, int stillFailing) {
        if (shouldLogWarn()) {
            log.warn("REPAIR_EXHAUSTED attempts={} still_failing={}", attempts, stillFailing);
        }
    }

    public static void ruleRolledBack(String unit, int line, String ruleId) {
        if (shouldLogWarn()) {
            log.warn("RULE_ROLLED_BACK unit={} line={} rule={}", unit, line, ruleId);
        }
    }
}
