package modernizer.semantic;

import modernizer.syntax.PyStmt;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Removes {@code __future__} imports that the modern dialect makes redundant.
 *
 * <p>A statement importing only redundant names is deleted; one that also
 * imports a still-meaningful feature keeps just those names.
 */
public final class FutureCleanupDetector implements SemanticDetector {

    public static final String ID = "future_cleanup";

    static final Set<String> REDUNDANT = Set.of(
            "print_function", "unicode_literals", "absolute_import", "division",
            "with_statement", "generators", "nested_scopes");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String counter() {
        return "future_cleanups";
    }

    @Override
    public Detection detect(SemanticContext ctx) {
        List<TextEdit> edits = new ArrayList<>();
        int count = 0;
        for (PyStmt s : ctx.parsed().tree().body()) {
            if (!(s instanceof PyStmt.ImportFrom f) || !"__future__".equals(f.module())) {
                continue;
            }
            List<String> kept = new ArrayList<>();
            int removed = 0;
            for (PyStmt.Alias a : f.names()) {
                if (REDUNDANT.contains(a.name())) {
                    removed++;
                } else {
                    kept.add(a.asName() == null ? a.name() : a.name() + " as " + a.asName());
                }
            }
            if (removed == 0) {
                continue;
            }
            if (kept.isEmpty()) {
                for (int n = f.span().line(); n <= f.span().endLine(); n++) {
                    edits.add(TextEdit.deleteLine(n, ID));
                }
            } else if (f.span().isSingleLine()) {
                edits.add(TextEdit.replace(f.span().line(), f.span().column(), f.span().endColumn(),
                        "from __future__ import " + String.join(", ", kept), ID));
            } else {
                continue;
            }
            count += removed;
        }
        return new Detection(edits, count, List.of());
    }
}
