package modernizer.sandbox;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Captured result of one run. A run that timed out has exit code -1 and
 * {@code timedOut} set; it is never reported as a pass.
 *
 * @param stdout captured standard output
 * @param stderr captured standard error
 * @param exitCode process exit code, -1 on timeout
 * @param timedOut whether the run was killed at its timeout
 * @param elapsedMillis wall-clock duration
 * @param executor name of the executor that produced the result
 */
public record ExecutionResult(
        String stdout,
        String stderr,
        int exitCode,
        boolean timedOut,
        long elapsedMillis,
        String executor
) {
    public static ExecutionResult timeout(String stdout, long elapsedMillis, String executor) {
        return new ExecutionResult(stdout, "TimeoutExpired", -1, true, elapsedMillis, executor);
    }

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("executor", executor);
        map.put("exit_code", exitCode);
        map.put("timed_out", timedOut);
        map.put("elapsed_ms", elapsedMillis);
        map.put("stdout", stdout);
        map.put("stderr", stderr);
        return map;
    }
}
