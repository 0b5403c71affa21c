package modernizer.unit;

import java.nio.file.Path;

/**
 * Naming helpers shared by reports and artifacts.
 */
public final class UnitNames {

    private UnitNames() {}

    public static String reportKey(String relativePath) {
        String p = relativePath.replace('\\', '/');
        if (p.endsWith(".py")) {
            p = p.substring(0, p.length() - 3);
        }
        return p.replace("/", "__");
    }

    public static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
