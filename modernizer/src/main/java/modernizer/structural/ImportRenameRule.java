package modernizer.structural;

import modernizer.syntax.PyStmt;
import modernizer.syntax.PyTreeWalker;
import modernizer.syntax.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Renames modules that moved in the modern standard library.
 *
 * <p>{@code import X} becomes {@code import new as X} so that qualified uses of
 * {@code X} keep working; the alias is dropped when it would repeat the new
 * name. {@code from X import a} becomes {@code from new import a}.
 */
public final class ImportRenameRule implements StructuralRule {

    public static final String ID = "import_rename";

    static final Map<String, String> RENAMES = Map.ofEntries(
            entry("StringIO", "io"),
            entry("cStringIO", "io"),
            entry("cPickle", "pickle"),
            entry("ConfigParser", "configparser"),
            entry("Queue", "queue"),
            entry("SocketServer", "socketserver"),
            entry("xmlrpclib", "xmlrpc.client"),
            entry("SimpleXMLRPCServer", "xmlrpc.server"),
            entry("Cookie", "http.cookies"),
            entry("cookielib", "http.cookiejar"),
            entry("BaseHTTPServer", "http.server"),
            entry("SimpleHTTPServer", "http.server"),
            entry("HTMLParser", "html.parser"),
            entry("htmlentitydefs", "html.entities"),
            entry("httplib", "http.client"),
            entry("urllib2", "urllib.request"),
            entry("urlparse", "urllib.parse"),
            entry("__builtin__", "builtins"),
            entry("copy_reg", "copyreg"),
            entry("repr", "reprlib"),
            entry("Tkinter", "tkinter"),
            entry("commands", "subprocess"),
            entry("dummy_thread", "_dummy_thread"),
            entry("thread", "_thread"));

    private static final Pattern FROM_MODULE = Pattern.compile("\\bfrom\\s+([\\w.]+)");

    /** The modern name of a moved standard-library module, or null if it did not move. */
    public static String modernModule(String module) {
        return RENAMES.get(module);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<LineChange> apply(StructuralContext ctx) {
        List<LineChange> changes = new ArrayList<>();
        for (PyStmt s : PyTreeWalker.statements(ctx.tree())) {
            if (s instanceof PyStmt.Import imp) {
                renameImport(ctx, imp, changes);
            } else if (s instanceof PyStmt.ImportFrom from && from.level() == 0 && RENAMES.containsKey(from.module())) {
                renameFrom(ctx, from, changes);
            }
        }
        return changes;
    }

    private static void renameImport(StructuralContext ctx, PyStmt.Import imp, List<LineChange> changes) {
        for (PyStmt.Alias alias : imp.names()) {
            String target = RENAMES.get(alias.name());
            if (target == null) {
                continue;
            }
            int line = alias.span().line();
            if (!alias.span().isSingleLine()) {
                changes.add(LineChange.manual(ctx, line, ID, "Rename " + alias.name() + " to " + target));
                continue;
            }
            String bound = alias.asName() != null ? alias.asName() : alias.name();
            String replacement = target.equals(bound) ? target : target + " as " + bound;
            changes.add(LineChange.fixed(ctx, line, ID, List.of(TextEdit.replace(line,
                    alias.span().column(), alias.span().endColumn(), replacement, ID))));
        }
    }

    private static void renameFrom(StructuralContext ctx, PyStmt.ImportFrom from, List<LineChange> changes) {
        int line = from.span().line();
        Matcher m = FROM_MODULE.matcher(ctx.mask().code(line));
        if (!m.find(from.span().column()) || !m.group(1).equals(from.module())) {
            changes.add(LineChange.manual(ctx, line, ID, "Rename " + from.module() + " to " + RENAMES.get(from.module())));
            return;
        }
        changes.add(LineChange.fixed(ctx, line, ID,
                List.of(TextEdit.replace(line, m.start(1), m.end(1), RENAMES.get(from.module()), ID))));
    }
}
