package modernizer.semantic;

import modernizer.syntax.ParsedSource;
import modernizer.syntax.PyStmt;

import java.util.Set;
import java.util.TreeSet;

/**
 * A parsed unit plus the {@code __future__} names it imports.
 *
 * <p>Future imports are read once, before any detector runs, so a detector
 * that removes them cannot change what another one sees.
 */
public final class SemanticContext {

    private final String unit;
    private final ParsedSource parsed;
    private final Set<String> futureImports;

    public SemanticContext(String unit, ParsedSource parsed) {
        this.unit = unit;
        this.parsed = parsed;
        Set<String> futures = new TreeSet<>();
        for (PyStmt s : parsed.tree().body()) {
            if (s instanceof PyStmt.ImportFrom f && "__future__".equals(f.module())) {
                f.names().forEach(a -> futures.add(a.name()));
            }
        }
        this.futureImports = Set.copyOf(futures);
    }

    public String unit() {
        return unit;
    }

    public ParsedSource parsed() {
        return parsed;
    }

    public boolean importsFuture(String name) {
        return futureImports.contains(name);
    }

    public Set<String> futureImports() {
        return futureImports;
    }
}
