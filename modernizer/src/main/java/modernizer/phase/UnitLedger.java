package modernizer.phase;

import modernizer.verify.VerificationReport;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-session facts about units that later stages rely on.
 *
 * <ul>
 *   <li>parseability as decided by preprocessing</li>
 *   <li>lines where the semantic stage rewrote a division</li>
 *   <li>the latest verification report of each unit</li>
 * </ul>
 *
 * <p>Keys are unit paths relative to the tree root. Thread-safe, since
 * verification records reports from worker threads.
 */
public final class UnitLedger {

    private final Map<String, Boolean> parseable = new ConcurrentHashMap<>();
    private final Map<String, Set<Integer>> divisionLines = new ConcurrentHashMap<>();
    private final Map<String, VerificationReport> latestReports = new ConcurrentHashMap<>();
    private final AtomicInteger verificationPasses = new AtomicInteger();

    public void recordParseable(String unit, boolean value) {
        parseable.put(unit, value);
    }

    /** Parseability recorded by preprocessing; units never seen count as parseable. */
    public boolean isParseable(String unit) {
        return parseable.getOrDefault(unit, Boolean.TRUE);
    }

    public int unparseableCount() {
        return (int) parseable.values().stream().filter(v -> !v).count();
    }

    public void recordDivisionLines(String unit, Set<Integer> lines) {
        if (!lines.isEmpty()) {
            divisionLines.put(unit, Collections.unmodifiableSet(new TreeSet<>(lines)));
        }
    }

    public Set<Integer> divisionLines(String unit) {
        return divisionLines.getOrDefault(unit, Set.of());
    }

    public void recordReport(VerificationReport report) {
        latestReports.put(report.unit(), report);
    }

    /** Latest report per unit, sorted by unit path. */
    public Map<String, VerificationReport> latestReports() {
        return Collections.unmodifiableMap(new TreeMap<>(latestReports));
    }

    /** Reserves the number of the next verification pass, starting at 1. */
    public int nextVerificationPass() {
        return verificationPasses.incrementAndGet();
    }

    public int verificationPasses() {
        return verificationPasses.get();
    }
}
