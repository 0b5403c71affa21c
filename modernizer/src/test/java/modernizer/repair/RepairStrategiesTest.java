package modernizer.repair;

import modernizer.unit.SourceUnit;
import modernizer.verify.VerificationReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Repair strategies")
class RepairStrategiesTest {

    private static final VerificationReport MISMATCH = new VerificationReport(
            "u.py", false, "{\"f\": [[\"1\", \"2\"], \"<map object at 0x>\"]}", 0, 0, false, 1, false,
            "", "", "fake");

    private static RepairTarget target(String content, Set<Integer> divisionLines) {
        return new RepairTarget(SourceUnit.of("u.py", content), divisionLines, MISMATCH);
    }

    private static RepairTarget target(String content) {
        return target(content, Set.of());
    }

    @Nested
    @DisplayName("wrap_iterables")
    class WrapIterables {

        private final WrapIterablesStrategy strategy = new WrapIterablesStrategy();

        @Test
        @DisplayName("should wrap a returned map in list()")
        void shouldWrapReturnedMap() {
            Optional<String> out = strategy.apply(target("def f():\n    return map(str, [1, 2])\n"));

            assertThat(out).contains("def f():\n    return list(map(str, [1, 2]))\n");
        }

        @Test
        @DisplayName("should wrap a dict view stored in a variable")
        void shouldWrapStoredView() {
            assertThat(strategy.apply(target("ks = d.keys()\n"))).contains("ks = list(d.keys())\n");
        }

        @Test
        @DisplayName("should leave iterated and consumed results alone")
        void shouldLeaveConsumedResultsAlone() {
            assertThat(strategy.apply(target("for x in map(f, xs):\n    pass\n"))).isEmpty();
            assertThat(strategy.apply(target("total = sum(map(f, xs))\n"))).isEmpty();
            assertThat(strategy.apply(target("s = ', '.join(map(str, xs))\n"))).isEmpty();
            assertThat(strategy.apply(target("n = len(range(3))\n"))).isEmpty();
        }

        @Test
        @DisplayName("should wrap a map measured with len()")
        void shouldWrapMapInsideLen() {
            assertThat(strategy.apply(target("n = len(map(f, xs))\n"))).contains("n = len(list(map(f, xs)))\n");
        }

        @Test
        @DisplayName("should not wrap twice")
        void shouldNotWrapTwice() {
            assertThat(strategy.apply(target("result = list(map(f, xs))\n"))).isEmpty();
        }

        @Test
        @DisplayName("should give up on units that do not parse")
        void shouldGiveUpOnUnparseableUnits() {
            assertThat(strategy.apply(target("result = map(f,\n"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("float_division")
    class FloatDivision {

        private final FloatDivisionStrategy strategy = new FloatDivisionStrategy();

        @Test
        @DisplayName("should restore true division on a rewritten line")
        void shouldRestoreTrueDivision() {
            Optional<String> out = strategy.apply(target("def f():\n    return total // count\n", Set.of(2)));

            assertThat(out).contains("def f():\n    return float(total) / count\n");
        }

        @Test
        @DisplayName("should leave floor divisions the unit wrote itself alone")
        void shouldLeaveOriginalFloorDivisionAlone() {
            assertThat(strategy.apply(target("a = n // 2\nb = m // 2\n", Set.of(2))))
                    .contains("a = n // 2\nb = float(m) / 2\n");
            assertThat(strategy.apply(target("a = n // 2\n"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("str_coercion")
    class StrCoercion {

        private final StrCoercionStrategy strategy = new StrCoercionStrategy();

        @Test
        @DisplayName("should coerce printed values that are not strings")
        void shouldCoercePrintedValues() {
            assertThat(strategy.apply(target("print(x, 'items')\n"))).contains("print(str(x), 'items')\n");
        }

        @Test
        @DisplayName("should leave prints of strings alone")
        void shouldLeaveStringPrintsAlone() {
            assertThat(strategy.apply(target("print('a', str(b))\n"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("text_encoding")
    class TextEncoding {

        private final TextEncodingStrategy strategy = new TextEncodingStrategy();

        @Test
        @DisplayName("should add an encoding to codecs.open()")
        void shouldAddEncodingToCodecsOpen() {
            assertThat(strategy.apply(target("fh = codecs.open('f.txt', 'r')\n")))
                    .contains("fh = codecs.open('f.txt', 'r', encoding='utf-8')\n");
        }

        @Test
        @DisplayName("should add an encoding to io.open()")
        void shouldAddEncodingToIoOpen() {
            assertThat(strategy.apply(target("fh = io.open('f.txt')\n")))
                    .contains("fh = io.open('f.txt', encoding='utf-8')\n");
        }

        @Test
        @DisplayName("should leave binary, computed and explicit modes alone")
        void shouldLeaveOtherCallsAlone() {
            assertThat(strategy.apply(target("fh = io.open('f.bin', 'rb')\n"))).isEmpty();
            assertThat(strategy.apply(target("fh = open(name, mode)\n"))).isEmpty();
            assertThat(strategy.apply(target("fh = open('f', 'r', -1, 'latin-1')\n"))).isEmpty();
            assertThat(strategy.apply(target("fh = open('f', encoding='latin-1')\n"))).isEmpty();
        }
    }
}
