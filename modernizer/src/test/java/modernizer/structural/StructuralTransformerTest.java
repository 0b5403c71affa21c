package modernizer.structural;

import modernizer.syntax.PyGrammar;
import modernizer.syntax.PySyntax;
import modernizer.syntax.TextEdit;
import modernizer.unit.Severity;
import modernizer.unit.SourceUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StructuralTransformer")
class StructuralTransformerTest {

    private final StructuralTransformer transformer = new StructuralTransformer(StructuralTransformer.standardRules());

    private StructuralResult transform(String content) {
        return transformer.transform(SourceUnit.of("app/mod.py", content));
    }

    @Nested
    @DisplayName("exception syntax")
    class ExceptionSyntax {

        @Test
        @DisplayName("should rewrite the comma form of except clauses")
        void shouldRewriteExceptComma() {
            StructuralResult result = transform("try:\n    f()\nexcept (IOError, OSError), e:\n    pass\n");

            assertThat(result.unit().content()).isEqualTo("try:\n    f()\nexcept (IOError, OSError) as e:\n    pass\n");
            assertThat(result.findings().count(Severity.FIXED)).isEqualTo(1);
            assertThat(result.modernParseable()).isTrue();
        }

        @Test
        @DisplayName("should call the exception class for legacy raise arguments")
        void shouldRewriteRaiseArguments() {
            StructuralResult result = transform("raise ValueError, 'bad value'\n");

            assertThat(result.unit().content()).isEqualTo("raise ValueError('bad value')\n");
        }

        @Test
        @DisplayName("should carry a traceback argument over to with_traceback")
        void shouldRewriteRaiseWithTraceback() {
            StructuralResult result = transform("raise KeyError, (1, 2), tb\n");

            assertThat(result.unit().content()).isEqualTo("raise KeyError(1, 2).with_traceback(tb)\n");
        }

        @Test
        @DisplayName("should instantiate without arguments for a None value")
        void shouldRewriteRaiseNone() {
            assertThat(transform("raise StopIteration, None\n").unit().content())
                    .isEqualTo("raise StopIteration()\n");
        }
    }

    @Nested
    @DisplayName("renames")
    class Renames {

        @Test
        @DisplayName("should rename moved modules and keep the bound name")
        void shouldRenameModules() {
            StructuralResult result = transform("import urllib2\nimport cPickle as pickle\nfrom StringIO import StringIO\n");

            assertThat(result.unit().content()).isEqualTo(
                    "import urllib.request as urllib2\nimport pickle\nfrom io import StringIO\n");
        }

        @Test
        @DisplayName("should rename removed builtins and iterator methods")
        void shouldRenameBuiltins() {
            StructuralResult result = transform("for i in xrange(3):\n    pass\nfor k, v in d.iteritems():\n    pass\n");

            assertThat(result.unit().content())
                    .isEqualTo("for i in range(3):\n    pass\nfor k, v in d.items():\n    pass\n");
        }

        @Test
        @DisplayName("should turn has_key into a membership test")
        void shouldRewriteHasKey() {
            assertThat(transform("found = d.has_key(k)\n").unit().content()).isEqualTo("found = k in d\n");
            assertThat(transform("if not d.has_key(k):\n    pass\n").unit().content())
                    .isEqualTo("if not (k in d):\n    pass\n");
        }

        @Test
        @DisplayName("should rename __nonzero__ and drop unicode prefixes")
        void shouldRenameNonzeroAndPrefixes() {
            StructuralResult result = transform("class A(object):\n    def __nonzero__(self):\n        return u'x'\n");

            assertThat(result.unit().content())
                    .isEqualTo("class A(object):\n    def __bool__(self):\n        return 'x'\n");
        }
    }

    @Nested
    @DisplayName("classes and advice")
    class ClassesAndAdvice {

        @Test
        @DisplayName("should make classic classes derive from object")
        void shouldAddObjectBase() {
            assertThat(transform("class A:\n    pass\nclass B():\n    pass\n").unit().content())
                    .isEqualTo("class A(object):\n    pass\nclass B(object):\n    pass\n");
        }

        @Test
        @DisplayName("should flag removed builtins without rewriting them")
        void shouldFlagRemovedBuiltins() {
            String content = "total = reduce(add, items)\n";

            StructuralResult result = transform(content);

            assertThat(result.unit().content()).isEqualTo(content);
            assertThat(result.findings().count(Severity.FLAGGED)).isEqualTo(1);
            assertThat(result.findings().findings().get(0).message()).contains("functools");
        }

        @Test
        @DisplayName("should mark a metaclass assignment once and leave it in place")
        void shouldMarkMetaclassAssignment() {
            String content = "class Plugin(object):\n    __metaclass__ = Registry\n    name = 'p'\n";
            String marked = "class Plugin(object):\n    # TODO: convert metaclass syntax for Plugin\n"
                    + "    __metaclass__ = Registry\n    name = 'p'\n";

            StructuralResult first = transform(content);
            StructuralResult second = transform(first.unit().content());

            assertThat(first.unit().content()).isEqualTo(marked);
            assertThat(first.findings().findings())
                    .filteredOn(f -> f.ruleId().equals(MetaclassFlagRule.ID))
                    .singleElement()
                    .satisfies(f -> {
                        assertThat(f.severity()).isEqualTo(Severity.FLAGGED);
                        assertThat(f.line()).isEqualTo(2);
                        assertThat(f.before()).isEqualTo("__metaclass__ = Registry");
                        assertThat(f.message()).contains("metaclass=");
                    });
            assertThat(second.unit().content()).isEqualTo(marked);
        }

        @Test
        @DisplayName("should not flag reduce when it is imported from functools")
        void shouldNotFlagImportedReduce() {
            StructuralResult result = transform("from functools import reduce\ntotal = reduce(add, items)\n");

            assertThat(result.findings().count(Severity.FLAGGED)).isZero();
        }
    }

    @Nested
    @DisplayName("rollback")
    class Rollback {

        /** Rule that leaves a dangling operator at the end of the first line. */
        private final StructuralRule breaking = new StructuralRule() {
            @Override
            public String id() {
                return "breaking";
            }

            @Override
            public List<LineChange> apply(StructuralContext ctx) {
                return List.of(LineChange.fixed(ctx, 1, id(),
                        List.of(TextEdit.insert(1, ctx.text().line(1).length(), " +", id()))));
            }
        };

        @Test
        @DisplayName("should drop the edits of a rule that breaks parsing and keep the rest")
        void shouldRollBackCulpritOnly() {
            List<StructuralRule> rules = new ArrayList<>(StructuralTransformer.standardRules());
            rules.add(breaking);
            StructuralTransformer withBreaking = new StructuralTransformer(rules);

            StructuralResult result = withBreaking.transform(SourceUnit.of("m.py", "x = xrange(3)\n"));

            assertThat(result.unit().content()).isEqualTo("x = range(3)\n");
            assertThat(result.rollbacks()).containsExactly(new StructuralResult.Rollback(1, "breaking"));
            assertThat(result.findings().count(Severity.MANUAL)).isEqualTo(1);
        }

        @Test
        @DisplayName("should skip units that are not parseable")
        void shouldSkipUnparseableUnits() {
            SourceUnit unit = SourceUnit.of("m.py", "print 'x'\n").withParseable(false);

            StructuralResult result = transformer.transform(unit);

            assertThat(result.skipped()).isTrue();
            assertThat(result.unit().content()).isEqualTo("print 'x'\n");
        }

        @Test
        @DisplayName("should keep parseable input parseable")
        void shouldPreserveParseability() {
            String content = "import Queue\nclass W:\n    def run(self):\n        try:\n            q.get()\n"
                    + "        except Queue.Empty, e:\n            raise RuntimeError, 'empty'\n";

            StructuralResult result = transform(content);

            assertThat(PySyntax.isParseable(result.unit().content(), PyGrammar.TRANSITIONAL)).isTrue();
            assertThat(result.modernParseable()).isTrue();
        }
    }
}
