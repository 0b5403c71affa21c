package modernizer.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Expression nodes of the syntax tree.
 *
 * <p>Only the shapes the transformation rules inspect get their own record.
 * Everything else (tuples, lambdas, comparisons, comprehensions, ...) is a
 * {@link Composite} tagged with its kind.
 */
public interface PyExpr extends PyNode {

    List<PyExpr> children();

    record Name(String id, SourceSpan span) implements PyExpr {
        @Override
        public List<PyExpr> children() {
            return List.of();
        }
    }

    record Constant(Kind kind, String text, SourceSpan span) implements PyExpr {
        public enum Kind { NUMBER, STRING, NONE, TRUE, FALSE, ELLIPSIS }

        @Override
        public List<PyExpr> children() {
            return List.of();
        }

        /** True for decimal, hex, octal and binary integer literals. */
        public boolean isIntegerLiteral() {
            if (kind != Kind.NUMBER) {
                return false;
            }
            String t = text.toLowerCase();
            if (t.startsWith("0x") || t.startsWith("0o") || t.startsWith("0b")) {
                return true;
            }
            return t.indexOf('.') < 0 && t.indexOf('e') < 0 && t.indexOf('j') < 0;
        }
    }

    record Attribute(PyExpr value, String attr, SourceSpan span) implements PyExpr {
        @Override
        public List<PyExpr> children() {
            return List.of(value);
        }
    }

    record Subscript(PyExpr value, List<PyExpr> slices, SourceSpan span) implements PyExpr {
        @Override
        public List<PyExpr> children() {
            List<PyExpr> out = new ArrayList<>();
            out.add(value);
            out.addAll(slices);
            return out;
        }
    }

    /**
     * A call. {@code closeParen} is the span of the closing parenthesis so that
     * arguments can be appended without re-tokenizing.
     */
    record Call(PyExpr func, List<Argument> args, SourceSpan closeParen, SourceSpan span) implements PyExpr {
        @Override
        public List<PyExpr> children() {
            List<PyExpr> out = new ArrayList<>();
            out.add(func);
            for (Argument a : args) {
                out.add(a.value());
            }
            return out;
        }

        /** Returns the simple function name, or null for attribute and computed callees. */
        public String funcName() {
            return func instanceof Name n ? n.id() : null;
        }

        /** Returns the method name for {@code obj.method(...)} calls, or null. */
        public String methodName() {
            return func instanceof Attribute a ? a.attr() : null;
        }

        public List<PyExpr> positional() {
            List<PyExpr> out = new ArrayList<>();
            for (Argument a : args) {
                if (a.keyword() == null && a.star().isEmpty()) {
                    out.add(a.value());
                }
            }
            return out;
        }

        public Argument keyword(String name) {
            for (Argument a : args) {
                if (name.equals(a.keyword())) {
                    return a;
                }
            }
            return null;
        }

        public boolean hasStarArgs() {
            return args.stream().anyMatch(a -> !a.star().isEmpty());
        }
    }

    /**
     * A call argument. {@code keyword} is null for positional arguments,
     * {@code star} is "", "*" or "**".
     */
    record Argument(String keyword, String star, PyExpr value, SourceSpan span) {
    }

    record BinOp(PyExpr left, String op, SourceSpan opSpan, PyExpr right, SourceSpan span) implements PyExpr {
        @Override
        public List<PyExpr> children() {
            return List.of(left, right);
        }
    }

    record Composite(String kind, List<PyExpr> elements, SourceSpan span) implements PyExpr {
        @Override
        public List<PyExpr> children() {
            return elements;
        }
    }
}
