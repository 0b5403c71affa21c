package modernizer.repair;

import modernizer.phase.UnitLedger;
import modernizer.unit.UnitScanner;
import modernizer.verify.Comparison;
import modernizer.verify.VerificationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RepairLoop")
class RepairLoopTest {

    @TempDir
    Path tree;

    private UnitLedger ledger;
    private List<VerificationReport> sunk;
    private int verifications;

    /** Strategy driven by a content rewrite; unchanged content means not applicable. */
    private record ScriptedStrategy(String id, Function<String, String> rewrite) implements RepairStrategy {
        @Override
        public Optional<String> apply(RepairTarget target) {
            String content = target.unit().content();
            String out = rewrite.apply(content);
            return out.equals(content) ? Optional.empty() : Optional.of(out);
        }
    }

    @BeforeEach
    void setUp() {
        ledger = new UnitLedger();
        sunk = new ArrayList<>();
        verifications = 0;
    }

    private static VerificationReport report(String unit, boolean match, int pass) {
        return new VerificationReport(unit, match, match ? Comparison.ALL_MATCH : "{\"f\": [1, 2]}",
                0, 0, false, pass, false, "", "", "fake");
    }

    private void unit(String path, String content, boolean match) throws IOException {
        Files.writeString(tree.resolve(path), content);
        ledger.recordReport(report(path, match, 1));
    }

    /** Verifies by content: a unit matches when {@code matches} accepts its source. */
    private RepairLoop.Reverifier verifier(Predicate<String> matches) {
        return dir -> {
            verifications++;
            List<VerificationReport> reports = new ArrayList<>();
            for (String u : UnitScanner.scan(dir)) {
                VerificationReport r = report(u, matches.test(UnitScanner.read(dir.resolve(u))), verifications + 1);
                ledger.recordReport(r);
                reports.add(r);
            }
            return reports;
        };
    }

    private RepairSummary run(RepairLoop loop, Predicate<String> matches) throws IOException {
        return loop.run(tree, ledger, verifier(matches), sunk::add);
    }

    @Nested
    @DisplayName("outcomes")
    class Outcomes {

        @Test
        @DisplayName("should repair an escaping map in one attempt")
        void shouldRepairEscapingMap() throws Exception {
            unit("u.py", "def f():\n    return map(str, [1, 2])\n", false);
            RepairLoop loop = new RepairLoop(RepairLoop.standardStrategies(), 3);

            RepairSummary summary = run(loop, src -> src.contains("list(map("));

            assertThat(summary.attempts()).isEqualTo(1);
            assertThat(summary.stillFailing()).isEmpty();
            assertThat(summary.exhausted()).isFalse();
            assertThat(summary.repairedCount()).isEqualTo(1);
            UnitRepair repair = summary.units().get(0);
            assertThat(repair.unit()).isEqualTo("u.py");
            assertThat(repair.applied()).extracting(UnitRepair.Applied::strategy)
                    .containsExactly(WrapIterablesStrategy.ID);
            assertThat(repair.applied().get(0).success()).isTrue();
            assertThat(tree.resolve("u.py")).hasContent("def f():\n    return list(map(str, [1, 2]))");
            assertThat(sunk).extracting(VerificationReport::unit).containsExactly("u.py");
        }

        @Test
        @DisplayName("should do nothing when no unit fails")
        void shouldDoNothingWithoutFailures() throws Exception {
            unit("ok.py", "x = 1\n", true);
            ledger.recordReport(new VerificationReport("bad.py", false, "not run", -1, -1, true, 1, false,
                    "", "", "fake"));

            RepairSummary summary = run(new RepairLoop(RepairLoop.standardStrategies(), 3), src -> true);

            assertThat(summary).isEqualTo(RepairSummary.nothingToRepair());
            assertThat(verifications).isZero();
        }

        @Test
        @DisplayName("should stop without re-verifying when no strategy applies")
        void shouldStopWhenNothingApplies() throws Exception {
            unit("u.py", "def f():\n    return 1\n", false);

            RepairSummary summary = run(new RepairLoop(RepairLoop.standardStrategies(), 3), src -> false);

            assertThat(summary.attempts()).isZero();
            assertThat(summary.stillFailing()).containsExactly("u.py");
            assertThat(summary.exhausted()).isFalse();
            assertThat(summary.units().get(0).applied()).isEmpty();
            assertThat(verifications).isZero();
        }

        @Test
        @DisplayName("should reject a negative attempt bound")
        void shouldRejectNegativeBound() {
            assertThatThrownBy(() -> new RepairLoop(List.of(), -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("bounds and ordering")
    class BoundsAndOrdering {

        @Test
        @DisplayName("should never exceed the attempt bound")
        void shouldNeverExceedBound() throws Exception {
            unit("u.py", "x = 1\n", false);
            RepairStrategy endless = new ScriptedStrategy("endless", src -> src + "# again\n");

            RepairSummary summary = run(new RepairLoop(List.of(endless), 3), src -> false);

            assertThat(summary.attempts()).isEqualTo(3);
            assertThat(summary.exhausted()).isTrue();
            assertThat(summary.stillFailing()).containsExactly("u.py");
            assertThat(verifications).isEqualTo(3);
            assertThat(summary.units().get(0).applied()).hasSize(3).noneMatch(UnitRepair.Applied::success);
            assertThat(summary.units().get(0).repaired()).isFalse();
        }

        @Test
        @DisplayName("should count a zero bound with failures as exhausted")
        void shouldTreatZeroBoundAsExhausted() throws Exception {
            unit("u.py", "def f():\n    return map(str, [1])\n", false);

            RepairSummary summary = run(new RepairLoop(RepairLoop.standardStrategies(), 0), src -> true);

            assertThat(summary.attempts()).isZero();
            assertThat(summary.exhausted()).isTrue();
            assertThat(tree.resolve("u.py")).hasContent("def f():\n    return map(str, [1])");
        }

        @Test
        @DisplayName("should keep earlier changes and move on to the next strategy")
        void shouldChainStrategiesForwardOnly() throws Exception {
            unit("u.py", "x = 1\n", false);
            RepairStrategy first = new ScriptedStrategy("first", src -> src.contains("a = 1") ? src : src + "a = 1\n");
            RepairStrategy second = new ScriptedStrategy("second", src -> src.contains("b = 2") ? src : src + "b = 2\n");

            RepairSummary summary = run(new RepairLoop(List.of(first, second), 3),
                    src -> src.contains("a = 1") && src.contains("b = 2"));

            assertThat(summary.attempts()).isEqualTo(2);
            assertThat(summary.stillFailing()).isEmpty();
            UnitRepair repair = summary.units().get(0);
            assertThat(repair.applied()).extracting(UnitRepair.Applied::strategy).containsExactly("first", "second");
            assertThat(repair.applied()).extracting(UnitRepair.Applied::success).containsExactly(false, true);
            assertThat(repair.repaired()).isTrue();
            assertThat(tree.resolve("u.py")).hasContent("x = 1\na = 1\nb = 2");
        }

        @Test
        @DisplayName("should only touch units that are failing")
        void shouldOnlyTouchFailingUnits() throws Exception {
            unit("good.py", "def f():\n    return map(str, [1])\n", true);
            unit("bad.py", "def g():\n    return map(str, [2])\n", false);

            RepairSummary summary = run(new RepairLoop(RepairLoop.standardStrategies(), 3), src -> true);

            assertThat(summary.units()).extracting(UnitRepair::unit).containsExactly("bad.py");
            assertThat(tree.resolve("good.py")).hasContent("def f():\n    return map(str, [1])");
            assertThat(sunk).extracting(VerificationReport::unit).containsExactly("bad.py");
        }
    }
}
