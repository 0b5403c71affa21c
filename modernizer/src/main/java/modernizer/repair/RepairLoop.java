package modernizer.repair;

import modernizer.alert.PipelineAlertLogger;
import modernizer.phase.UnitLedger;
import modernizer.unit.SourceUnit;
import modernizer.unit.UnitScanner;
import modernizer.verify.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded repair of units whose outputs still differ after verification.
 *
 * <p>Each round takes the units failing in their latest report, applies to
 * each the first strategy that changes it, and re-verifies the whole tree.
 * Changes are never undone: a strategy that did not help stays applied and
 * the next round moves on to the next applicable strategy. The loop ends when
 * nothing fails, when no strategy changes anything, or after
 * {@code maxAttempts} rounds.
 */
public final class RepairLoop {

    private static final Logger log = LoggerFactory.getLogger(RepairLoop.class);

    /** Re-runs verification over the repaired tree. */
    @FunctionalInterface
    public interface Reverifier {
        List<VerificationReport> verify(Path tree) throws IOException;
    }

    /** Receives each unit's report after a round in which it was changed. */
    @FunctionalInterface
    public interface ReportSink {
        void accept(VerificationReport report) throws IOException;
    }

    private final List<RepairStrategy> strategies;
    private final int maxAttempts;

    public RepairLoop(List<RepairStrategy> strategies, int maxAttempts) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        this.strategies = List.copyOf(strategies);
        this.maxAttempts = maxAttempts;
    }

    /** Strategies in the order they are tried. */
    public static List<RepairStrategy> standardStrategies() {
        return List.of(
                new WrapIterablesStrategy(),
                new FloatDivisionStrategy(),
                new StrCoercionStrategy(),
                new TextEncodingStrategy());
    }

    /**
     * Repairs {@code tree} in place.
     *
     * @param tree migrated tree, modified by the loop
     * @param ledger source of the latest reports and division lines
     * @param reverifier re-runs verification; its reports must reach the ledger
     * @param sink receives the post-round report of every changed unit
     */
    public RepairSummary run(Path tree, UnitLedger ledger, Reverifier reverifier, ReportSink sink)
            throws IOException {
        Map<String, UnitRepair> history = new LinkedHashMap<>();
        for (String unit : failing(ledger)) {
            history.put(unit, new UnitRepair(unit));
        }
        if (history.isEmpty()) {
            return RepairSummary.nothingToRepair();
        }

        int attempts = 0;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            List<String> failing = failing(ledger);
            if (failing.isEmpty()) {
                break;
            }
            Map<String, VerificationReport> latest = ledger.latestReports();
            Map<String, String> changed = new LinkedHashMap<>();
            for (String unit : failing) {
                SourceUnit current = UnitScanner.readUnit(tree, unit);
                RepairTarget target = new RepairTarget(current, ledger.divisionLines(unit), latest.get(unit));
                for (RepairStrategy strategy : strategies) {
                    Optional<String> repaired = strategy.apply(target);
                    if (repaired.isPresent()) {
                        UnitScanner.write(tree, current.withContent(repaired.get(), List.of()));
                        changed.put(unit, strategy.id());
                        log.debug("Applied {} to {}", strategy.id(), unit);
                        break;
                    }
                }
            }
            PipelineAlertLogger.repairAttempt(attempt, failing.size(), changed.size());
            if (changed.isEmpty()) {
                break;
            }
            attempts = attempt;

            Map<String, VerificationReport> after = new LinkedHashMap<>();
            for (VerificationReport r : reverifier.verify(tree)) {
                after.put(r.unit(), r);
            }
            for (Map.Entry<String, String> e : changed.entrySet()) {
                VerificationReport report = after.get(e.getKey());
                if (report == null) {
                    continue;
                }
                history.computeIfAbsent(e.getKey(), UnitRepair::new)
                        .record(new UnitRepair.Applied(e.getValue(), report.match(), report.details()));
                sink.accept(report);
            }
        }

        List<String> stillFailing = failing(ledger);
        boolean exhausted = !stillFailing.isEmpty() && attempts == maxAttempts;
        if (!stillFailing.isEmpty()) {
            PipelineAlertLogger.repairExhausted(attempts, stillFailing.size());
        }
        return new RepairSummary(new ArrayList<>(history.values()), stillFailing, attempts, exhausted);
    }

    private static List<String> failing(UnitLedger ledger) {
        return ledger.latestReports().values().stream()
                .filter(VerificationReport::isFailing)
                .map(VerificationReport::unit)
                .sorted()
                .toList();
    }
}
