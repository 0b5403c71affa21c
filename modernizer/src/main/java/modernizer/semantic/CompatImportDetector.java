package modernizer.semantic;

import modernizer.structural.ImportRenameRule;
import modernizer.syntax.PyExpr;
import modernizer.syntax.PyStmt;
import modernizer.syntax.PyTreeWalker;
import modernizer.syntax.SourceText;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Collapses import fallbacks to the modern import.
 *
 * <pre>
 * try:
 *     import cPickle as pickle
 * except ImportError:
 *     import pickle
 * </pre>
 * becomes {@code import pickle} at the indentation of the {@code try}.
 *
 * <p>A fallback is collapsed only when the two branches bind the same names
 * and one branch imports the modern counterpart of the other's module (or the
 * same module, once the structural stage has renamed it). The modern branch is
 * kept wherever it sits. Other pairs, such as an optional third-party library
 * with a standard-library fallback, are left alone.
 */
public final class CompatImportDetector implements SemanticDetector {

    public static final String ID = "compat_import";

    /** Legacy modules outside the standard-library rename table. */
    private static final Map<String, String> EXTRA_RENAMES = Map.of("simplejson", "json");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String counter() {
        return "import_cleanups";
    }

    @Override
    public Detection detect(SemanticContext ctx) {
        SourceText text = ctx.parsed().text();
        List<TextEdit> edits = new ArrayList<>();
        int count = 0;
        for (PyStmt s : PyTreeWalker.statements(ctx.parsed().tree())) {
            if (!(s instanceof PyStmt.Try t) || !isImportFallback(t)) {
                continue;
            }
            PyStmt primary = t.body().get(0);
            PyStmt.Handler handler = t.handlers().get(0);
            PyStmt fallback = handler.body().get(0);
            int tryLine = t.span().line();
            if (primary.span().line() == tryLine || fallback.span().line() == handler.span().line()) {
                continue;
            }
            PyStmt kept;
            PyStmt dropped;
            if (upgrades(primary, fallback)) {
                kept = fallback;
                dropped = primary;
            } else if (upgrades(fallback, primary)) {
                kept = primary;
                dropped = fallback;
            } else {
                continue;
            }
            if (!kept.span().isSingleLine()) {
                continue;
            }
            edits.add(TextEdit.deleteLine(tryLine, ID));
            edits.add(TextEdit.deleteLine(handler.span().line(), ID));
            for (int n = dropped.span().line(); n <= dropped.span().endLine(); n++) {
                edits.add(TextEdit.deleteLine(n, ID));
            }
            int line = kept.span().line();
            edits.add(TextEdit.replace(line, 0, text.line(line).length(),
                    text.indentation(tryLine) + text.line(line).strip(), ID));
            count++;
        }
        return new Detection(edits, count, List.of());
    }

    /** True if {@code modern} imports what {@code legacy} imports, under its modern module name. */
    private static boolean upgrades(PyStmt legacy, PyStmt modern) {
        if (legacy instanceof PyStmt.Import a && modern instanceof PyStmt.Import b) {
            if (a.names().size() != b.names().size()) {
                return false;
            }
            for (int i = 0; i < a.names().size(); i++) {
                PyStmt.Alias x = a.names().get(i);
                PyStmt.Alias y = b.names().get(i);
                if (!modernName(x.name()).equals(y.name()) || !boundName(x).equals(boundName(y))) {
                    return false;
                }
            }
            return true;
        }
        if (legacy instanceof PyStmt.ImportFrom a && modern instanceof PyStmt.ImportFrom b) {
            return a.level() == 0 && b.level() == 0
                    && modernName(a.module()).equals(b.module())
                    && boundNames(a.names()).equals(boundNames(b.names()));
        }
        return false;
    }

    private static String modernName(String module) {
        String renamed = ImportRenameRule.modernModule(module);
        if (renamed != null) {
            return renamed;
        }
        return EXTRA_RENAMES.getOrDefault(module, module);
    }

    private static String boundName(PyStmt.Alias alias) {
        if (alias.asName() != null) {
            return alias.asName();
        }
        int dot = alias.name().indexOf('.');
        return dot < 0 ? alias.name() : alias.name().substring(0, dot);
    }

    private static List<String> boundNames(List<PyStmt.Alias> aliases) {
        List<String> out = new ArrayList<>(aliases.size());
        for (PyStmt.Alias a : aliases) {
            out.add(a.asName() != null ? a.asName() : a.name());
        }
        return out;
    }

    private static boolean isImportFallback(PyStmt.Try t) {
        if (t.handlers().size() != 1 || !t.orElse().isEmpty() || !t.finalBody().isEmpty() || t.body().size() != 1) {
            return false;
        }
        PyStmt.Handler h = t.handlers().get(0);
        return h.body().size() == 1 && h.name() == null && isImport(t.body().get(0)) && isImport(h.body().get(0))
                && h.type() instanceof PyExpr.Name n
                && (n.id().equals("ImportError") || n.id().equals("ModuleNotFoundError"));
    }

    private static boolean isImport(PyStmt s) {
        return s instanceof PyStmt.Import || s instanceof PyStmt.ImportFrom;
    }
}
