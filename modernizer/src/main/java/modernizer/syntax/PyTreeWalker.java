package modernizer.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first traversal of a {@link PyModule}.
 *
 * <p>Every expression is reported together with its parent expression (null
 * at statement level) and the {@link Role} it plays there, which is what the
 * context-sensitive rewrites need to decide whether a value is materialized,
 * iterated or indexed.
 */
public final class PyTreeWalker {

    /** Position of an expression relative to its parent. */
    public enum Role {
        CALLEE,
        CALL_ARGUMENT,
        SUBSCRIPT_BASE,
        ATTRIBUTE_BASE,
        OPERAND,
        ELEMENT,
        ITERABLE,
        COMPARED,
        ASSIGNED_VALUE,
        TARGET,
        RETURNED,
        STATEMENT,
        OTHER
    }

    @FunctionalInterface
    public interface Visitor {
        void visit(PyExpr node, PyExpr parent, Role role);
    }

    private PyTreeWalker() {}

    public static void walk(PyModule module, Visitor visitor) {
        walkStatements(module.body(), visitor);
    }

    /** Collects every statement, nested ones included, in document order. */
    public static List<PyStmt> statements(PyModule module) {
        List<PyStmt> out = new ArrayList<>();
        collect(module.body(), out);
        return out;
    }

    /** Collects every class definition, nested ones included. */
    public static List<PyStmt.ClassDef> classes(PyModule module) {
        List<PyStmt.ClassDef> out = new ArrayList<>();
        for (PyStmt s : statements(module)) {
            if (s instanceof PyStmt.ClassDef c) {
                out.add(c);
            }
        }
        return out;
    }

    /** Collects every expression node, nested ones included, in document order. */
    public static List<PyExpr> expressions(PyModule module) {
        List<PyExpr> out = new ArrayList<>();
        walk(module, (node, parent, role) -> out.add(node));
        return out;
    }

    private static void collect(List<PyStmt> body, List<PyStmt> out) {
        for (PyStmt s : body) {
            out.add(s);
            for (List<PyStmt> child : blocksOf(s)) {
                collect(child, out);
            }
        }
    }

    /** Returns the nested statement blocks of a statement. */
    public static List<List<PyStmt>> blocksOf(PyStmt s) {
        if (s instanceof PyStmt.Compound c) {
            return c.blocks();
        }
        if (s instanceof PyStmt.ClassDef c) {
            return List.of(c.body());
        }
        if (s instanceof PyStmt.FunctionDef f) {
            return List.of(f.body());
        }
        if (s instanceof PyStmt.Try t) {
            List<List<PyStmt>> blocks = new ArrayList<>();
            blocks.add(t.body());
            for (PyStmt.Handler h : t.handlers()) {
                blocks.add(h.body());
            }
            blocks.add(t.orElse());
            blocks.add(t.finalBody());
            return blocks;
        }
        return List.of();
    }

    private static void walkStatements(List<PyStmt> body, Visitor v) {
        for (PyStmt s : body) {
            walkStatement(s, v);
        }
    }

    private static void walkStatement(PyStmt s, Visitor v) {
        if (s instanceof PyStmt.Assign a) {
            for (PyExpr t : a.targets()) {
                walkExpr(t, null, Role.TARGET, v);
            }
            walkExpr(a.value(), null, Role.ASSIGNED_VALUE, v);
        } else if (s instanceof PyStmt.ExprStmt e) {
            walkExpr(e.value(), null, Role.STATEMENT, v);
        } else if (s instanceof PyStmt.Raise r) {
            walkNullable(r.exception(), v);
            walkNullable(r.cause(), v);
            for (PyExpr x : r.legacyArguments()) {
                walkExpr(x, null, Role.OTHER, v);
            }
        } else if (s instanceof PyStmt.Simple simple) {
            Role role = simple.kind().equals("return") ? Role.RETURNED : Role.OTHER;
            for (PyExpr x : simple.expressions()) {
                walkExpr(x, null, role, v);
            }
        } else if (s instanceof PyStmt.Compound c) {
            for (int i = 0; i < c.header().size(); i++) {
                Role role = Role.OTHER;
                if (c.kind().equals("for")) {
                    role = i == 0 ? Role.TARGET : Role.ITERABLE;
                }
                walkExpr(c.header().get(i), null, role, v);
            }
        } else if (s instanceof PyStmt.ClassDef c) {
            for (PyExpr d : c.decorators()) {
                walkExpr(d, null, Role.OTHER, v);
            }
            for (PyExpr.Argument a : c.bases()) {
                walkExpr(a.value(), null, Role.OTHER, v);
            }
        } else if (s instanceof PyStmt.FunctionDef f) {
            for (PyExpr d : f.decorators()) {
                walkExpr(d, null, Role.OTHER, v);
            }
            for (PyExpr d : f.parameterDefaults()) {
                walkExpr(d, null, Role.OTHER, v);
            }
        } else if (s instanceof PyStmt.Try t) {
            for (PyStmt.Handler h : t.handlers()) {
                walkNullable(h.type(), v);
            }
        }
        for (List<PyStmt> block : blocksOf(s)) {
            walkStatements(block, v);
        }
    }

    private static void walkNullable(PyExpr e, Visitor v) {
        if (e != null) {
            walkExpr(e, null, Role.OTHER, v);
        }
    }

    private static void walkExpr(PyExpr e, PyExpr parent, Role role, Visitor v) {
        v.visit(e, parent, role);
        if (e instanceof PyExpr.Call c) {
            walkExpr(c.func(), c, Role.CALLEE, v);
            for (PyExpr.Argument a : c.args()) {
                walkExpr(a.value(), c, Role.CALL_ARGUMENT, v);
            }
        } else if (e instanceof PyExpr.Subscript s) {
            walkExpr(s.value(), s, Role.SUBSCRIPT_BASE, v);
            for (PyExpr x : s.slices()) {
                walkExpr(x, s, Role.OTHER, v);
            }
        } else if (e instanceof PyExpr.Attribute a) {
            walkExpr(a.value(), a, Role.ATTRIBUTE_BASE, v);
        } else if (e instanceof PyExpr.BinOp b) {
            walkExpr(b.left(), b, Role.OPERAND, v);
            walkExpr(b.right(), b, Role.OPERAND, v);
        } else if (e instanceof PyExpr.Composite c) {
            List<PyExpr> elements = c.elements();
            for (int i = 0; i < elements.size(); i++) {
                walkExpr(elements.get(i), c, compositeRole(c.kind(), i), v);
            }
        }
    }

    private static Role compositeRole(String kind, int index) {
        switch (kind) {
            case "comp_for":
                return index == 0 ? Role.TARGET : index == 1 ? Role.ITERABLE : Role.OTHER;
            case "list":
            case "tuple":
            case "set":
            case "dict":
                return Role.ELEMENT;
            case "compare":
                return Role.COMPARED;
            case "yield":
                return Role.RETURNED;
            case "yield_from":
                return Role.ITERABLE;
            default:
                return Role.OTHER;
        }
    }
}
