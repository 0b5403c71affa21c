package modernizer.unit;

import modernizer.io.SourceTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Discovers source units below a tree root.
 *
 * <p>Every {@code *.py} file is a unit, except those inside
 * {@link SourceTrees#SKIPPED_DIRECTORIES}. Units are returned sorted by
 * relative path so stage output is deterministic.
 */
public final class UnitScanner {

    private static final Logger log = LoggerFactory.getLogger(UnitScanner.class);

    private UnitScanner() {}

    public static List<String> scan(Path root) throws IOException {
        List<String> found = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return found;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && SourceTrees.SKIPPED_DIRECTORIES.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && file.getFileName().toString().endsWith(".py")) {
                    found.add(UnitNames.relativePath(root, file));
                }
                return FileVisitResult.CONTINUE;
            }
        });
        found.sort(Comparator.naturalOrder());
        return found;
    }

    /** Loads every unit below {@code root}. */
    public static List<SourceUnit> load(Path root) throws IOException {
        List<SourceUnit> units = new ArrayList<>();
        for (String rel : scan(root)) {
            units.add(readUnit(root, rel));
        }
        log.debug("Loaded {} units from {}", units.size(), root);
        return units;
    }

    /** Reads one unit, remembering the charset it was decoded with. */
    public static SourceUnit readUnit(Path root, String relativePath) throws IOException {
        Path file = root.resolve(relativePath);
        byte[] bytes = Files.readAllBytes(file);
        Charset charset = detect(file, bytes);
        return SourceUnit.of(relativePath, new String(bytes, charset), charset);
    }

    /**
     * Reads a file as UTF-8, falling back to ISO-8859-1 for legacy byte content.
     */
    public static String read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return new String(bytes, detect(file, bytes));
    }

    /** Writes a unit in the charset it was read with, so legacy bytes survive unchanged. */
    public static void write(Path root, SourceUnit unit) throws IOException {
        Path target = root.resolve(unit.path());
        Files.createDirectories(target.getParent());
        Files.writeString(target, unit.content(), unit.encoding());
    }

    private static Charset detect(Path file, byte[] bytes) {
        try {
            StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes));
            return StandardCharsets.UTF_8;
        } catch (CharacterCodingException e) {
            log.warn("{} is not valid UTF-8, reading as ISO-8859-1", file);
            return StandardCharsets.ISO_8859_1;
        }
    }
}
