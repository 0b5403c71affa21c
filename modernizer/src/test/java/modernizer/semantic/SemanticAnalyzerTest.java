package modernizer.semantic;

import modernizer.syntax.TextEdit;
import modernizer.unit.AppliedRule;
import modernizer.unit.SourceUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SemanticAnalyzer")
class SemanticAnalyzerTest {

    private final SemanticAnalyzer analyzer = new SemanticAnalyzer(SemanticAnalyzer.standardDetectors());

    private SemanticResult analyze(String content) {
        return analyzer.analyze(SourceUnit.of("calc.py", content));
    }

    @Nested
    @DisplayName("integer division")
    class IntegerDivision {

        @Test
        @DisplayName("should keep truncating division between integer-looking operands")
        void shouldKeepTruncatingDivision() {
            SemanticResult result = analyze("avg = total / count\n");

            assertThat(result.unit().content()).isEqualTo("avg = total // count\n");
            assertThat(result.counters()).containsEntry("division_fixes", 1);
            assertThat(result.divisionLines()).containsExactly(1);
            assertThat(result.unit().history()).contains(new AppliedRule(IntDivisionDetector.ID, List.of(1)));
        }

        @Test
        @DisplayName("should leave float operands alone")
        void shouldLeaveFloatOperandsAlone() {
            SemanticResult result = analyze("ratio = 1.0 / 3\n");

            assertThat(result.unit().content()).isEqualTo("ratio = 1.0 / 3\n");
            assertThat(result.counters()).containsEntry("division_fixes", 0);
            assertThat(result.divisionLines()).isEmpty();
        }

        @Test
        @DisplayName("should not rewrite when true division is already imported")
        void shouldNotRewriteUnderFutureDivision() {
            SemanticResult result = analyze("from __future__ import division\navg = total / count\n");

            assertThat(result.unit().content()).isEqualTo("avg = total / count\n");
            assertThat(result.counters()).containsEntry("division_fixes", 0).containsEntry("future_cleanups", 1);
            assertThat(result.divisionLines()).isEmpty();
        }

        @Test
        @DisplayName("should report division lines of the rewritten text when lines above are deleted")
        void shouldShiftDivisionLinesAfterDeletions() {
            SemanticResult result = analyze("from __future__ import print_function\nhalf = n / 2\n");

            assertThat(result.unit().content()).isEqualTo("half = n // 2\n");
            assertThat(result.divisionLines()).containsExactly(1);
        }
    }

    @Nested
    @DisplayName("lazy results")
    class LazyResults {

        @Test
        @DisplayName("should wrap an indexed map call in list()")
        void shouldWrapIndexedMap() {
            SemanticResult result = analyze("first = map(f, xs)[0]\n");

            assertThat(result.unit().content()).isEqualTo("first = list(map(f, xs))[0]\n");
            assertThat(result.counters()).containsEntry("iterator_wraps", 1);
        }

        @Test
        @DisplayName("should wrap a filter call measured with len()")
        void shouldWrapFilterInsideLen() {
            SemanticResult result = analyze("size = len(filter(None, xs))\n");

            assertThat(result.unit().content()).isEqualTo("size = len(list(filter(None, xs)))\n");
        }

        @Test
        @DisplayName("should leave iteration over a lazy result alone")
        void shouldLeaveIterationAlone() {
            String source = "for y in map(f, xs):\n    print(y)\n";

            assertThat(analyze(source).unit().content()).isEqualTo(source);
        }

        @Test
        @DisplayName("should warn about a dict view stored in a variable")
        void shouldWarnAboutStoredView() {
            SemanticResult result = analyze("ks = d.keys()\n");

            assertThat(result.unit().content()).isEqualTo("ks = d.keys()\n");
            assertThat(result.warnings()).anyMatch(w -> w.contains(".keys()"));
        }
    }

    @Nested
    @DisplayName("file encodings")
    class FileEncodings {

        @Test
        @DisplayName("should add an explicit encoding to text-mode open()")
        void shouldAddEncoding() {
            SemanticResult result = analyze("data = open('f.txt').read()\n");

            assertThat(result.unit().content()).isEqualTo("data = open('f.txt', encoding='utf-8').read()\n");
            assertThat(result.counters()).containsEntry("encoding_fixes", 1);
        }

        @Test
        @DisplayName("should leave binary-mode open() alone")
        void shouldLeaveBinaryModeAlone() {
            String source = "blob = open('f.bin', 'rb').read()\n";

            assertThat(analyze(source).unit().content()).isEqualTo(source);
        }

        @Test
        @DisplayName("should leave open() with an explicit encoding alone")
        void shouldLeaveExplicitEncodingAlone() {
            String source = "fh = open('f.txt', encoding='latin-1')\n";

            assertThat(analyze(source).counters()).containsEntry("encoding_fixes", 0);
        }
    }

    @Nested
    @DisplayName("imports")
    class Imports {

        @Test
        @DisplayName("should collapse an ImportError fallback to the modern import")
        void shouldCollapseImportFallback() {
            SemanticResult result = analyze(
                    "try:\n    import cPickle as pickle\nexcept ImportError:\n    import pickle\nx = 1\n");

            assertThat(result.unit().content()).isEqualTo("import pickle\nx = 1\n");
            assertThat(result.counters()).containsEntry("import_cleanups", 1);
        }

        @Test
        @DisplayName("should keep the modern import when it is tried first")
        void shouldKeepModernImportTriedFirst() {
            SemanticResult result = analyze(
                    "try:\n    import json\nexcept ImportError:\n    import simplejson as json\nx = 1\n");

            assertThat(result.unit().content()).isEqualTo("import json\nx = 1\n");
            assertThat(result.counters()).containsEntry("import_cleanups", 1);
        }

        @Test
        @DisplayName("should collapse branches the structural stage already renamed")
        void shouldCollapseAlreadyRenamedBranches() {
            SemanticResult result = analyze(
                    "def load():\n    try:\n        from io import StringIO\n    except ImportError:\n"
                            + "        from io import StringIO\n    return StringIO\n");

            assertThat(result.unit().content()).isEqualTo("def load():\n    from io import StringIO\n    return StringIO\n");
        }

        @Test
        @DisplayName("should leave fallbacks between unrelated libraries alone")
        void shouldLeaveUnrelatedFallbacksAlone() {
            String source = "try:\n    from lxml import etree as ET\nexcept ImportError:\n"
                    + "    import xml.etree.ElementTree as ET\nx = 1\n";

            SemanticResult result = analyze(source);

            assertThat(result.unit().content()).isEqualTo(source);
            assertThat(result.counters()).containsEntry("import_cleanups", 0);
        }

        @Test
        @DisplayName("should leave fallbacks that bind different names alone")
        void shouldLeaveDifferentBindingsAlone() {
            String source = "try:\n    import cPickle as pickle\nexcept ImportError:\n    import pickle as pkl\n";

            assertThat(analyze(source).unit().content()).isEqualTo(source);
        }

        @Test
        @DisplayName("should keep future features that still matter")
        void shouldKeepMeaningfulFutureFeatures() {
            SemanticResult result = analyze("from __future__ import division, annotations\nx = 1\n");

            assertThat(result.unit().content()).isEqualTo("from __future__ import annotations\nx = 1\n");
            assertThat(result.counters()).containsEntry("future_cleanups", 1);
        }
    }

    @Nested
    @DisplayName("safety")
    class Safety {

        @Test
        @DisplayName("should skip units that are not parseable")
        void shouldSkipUnparseableUnits() {
            SourceUnit unit = new SourceUnit("bad.py", "x = (\n", List.of(), false);

            SemanticResult result = analyzer.analyze(unit);

            assertThat(result.skipped()).isTrue();
            assertThat(result.unit().content()).isEqualTo("x = (\n");
        }

        @Test
        @DisplayName("should revert every rewrite when the combined result does not parse")
        void shouldRevertWhenResultDoesNotParse() {
            SemanticDetector breaking = new SemanticDetector() {
                @Override
                public String id() {
                    return "breaking";
                }

                @Override
                public String counter() {
                    return "breakages";
                }

                @Override
                public Detection detect(SemanticContext ctx) {
                    return new Detection(List.of(TextEdit.insert(1, 0, "(", "breaking")), 1, List.of());
                }
            };
            SemanticAnalyzer withBreaking = new SemanticAnalyzer(List.of(new IntDivisionDetector(), breaking));

            SemanticResult result = withBreaking.analyze(SourceUnit.of("calc.py", "avg = total / count\n"));

            assertThat(result.reverted()).isTrue();
            assertThat(result.unit().content()).isEqualTo("avg = total / count\n");
            assertThat(result.counters()).containsEntry("division_fixes", 0).containsEntry("breakages", 0);
            assertThat(result.warnings()).contains("Semantic rewrites reverted: the result did not parse");
        }

        @Test
        @DisplayName("should return untouched content when nothing applies")
        void shouldReturnUntouchedContent() {
            SemanticResult result = analyze("print('hi')\n");

            assertThat(result.unit().content()).isEqualTo("print('hi')\n");
            assertThat(result.reverted()).isFalse();
            assertThat(result.skipped()).isFalse();
        }
    }
}
