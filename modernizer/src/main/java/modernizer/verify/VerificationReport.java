package modernizer.verify;

import modernizer.sandbox.ExecutionResult;
import modernizer.unit.UnitNames;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verdict of one differential run of one unit.
 *
 * @param unit relative path of the unit
 * @param match whether both environments produced equivalent output
 * @param details comparator description, or why the unit was not run
 * @param legacyExit exit code of the legacy run, -1 when timed out or not run
 * @param modernExit exit code of the modern run, -1 when timed out or not run
 * @param manual true when the unit needs a human: it was never executed
 * @param pass verification pass that produced the report, starting at 1
 * @param timedOut whether either side hit the execution timeout
 * @param legacyOutput captured legacy stdout
 * @param modernOutput captured modern stdout
 * @param executor executor variant that ran the unit
 */
public record VerificationReport(String unit,
                                 boolean match,
                                 String details,
                                 int legacyExit,
                                 int modernExit,
                                 boolean manual,
                                 int pass,
                                 boolean timedOut,
                                 String legacyOutput,
                                 String modernOutput,
                                 String executor) {

    static final String NOT_PARSEABLE = "Unit is not parseable; not executed";

    /** Report for a unit that preprocessing could not make parseable. */
    public static VerificationReport notExecuted(String unit, int pass, String executor) {
        return new VerificationReport(unit, false, NOT_PARSEABLE, -1, -1, true, pass, false, "", "", executor);
    }

    public static VerificationReport of(String unit, int pass, ExecutionResult legacy, ExecutionResult modern,
                                        Comparison comparison) {
        return new VerificationReport(unit, comparison.match(), comparison.details(), legacy.exitCode(),
                modern.exitCode(), false, pass, legacy.timedOut() || modern.timedOut(), legacy.stdout(),
                modern.stdout(), legacy.executor());
    }

    /** Candidate for repair: executed, but the outputs differ. */
    public boolean isFailing() {
        return !match && !manual;
    }

    public String key() {
        return UnitNames.reportKey(unit);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", unit);
        map.put("match", match);
        map.put("details", details);
        map.put("legacy_exit", legacyExit);
        map.put("modern_exit", modernExit);
        map.put("manual", manual);
        map.put("pass", pass);
        map.put("timed_out", timedOut);
        map.put("legacy_output", legacyOutput);
        map.put("modern_output", modernOutput);
        map.put("executor", executor);
        return map;
    }

    /** Reads back a report written by {@link #toMap()}. */
    public static VerificationReport fromMap(Map<String, Object> map) {
        return new VerificationReport(
                String.valueOf(map.get("file")),
                Boolean.TRUE.equals(map.get("match")),
                String.valueOf(map.getOrDefault("details", "")),
                intValue(map.get("legacy_exit")),
                intValue(map.get("modern_exit")),
                Boolean.TRUE.equals(map.get("manual")),
                intValue(map.get("pass")),
                Boolean.TRUE.equals(map.get("timed_out")),
                String.valueOf(map.getOrDefault("legacy_output", "")),
                String.valueOf(map.getOrDefault("modern_output", "")),
                String.valueOf(map.getOrDefault("executor", "")));
    }

    private static int intValue(Object o) {
        return o instanceof Number n ? n.intValue() : -1;
    }
}
