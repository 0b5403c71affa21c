package modernizer.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Copying and mirroring of source directory trees between stage directories.
 */
public final class SourceTrees {

    private static final Logger log = LoggerFactory.getLogger(SourceTrees.class);

    /** Directory names never copied or scanned. */
    public static final Set<String> SKIPPED_DIRECTORIES = Set.of(
            ".git", "__pycache__", ".venv", "venv", ".pytest_cache", "node_modules");

    private SourceTrees() {}

    /**
     * Copies every regular file under {@code from} accepted by {@code filter}
     * (given the path relative to {@code from}) into {@code to}.
     *
     * @return number of files copied
     */
    public static int copy(Path from, Path to, Predicate<Path> filter) throws IOException {
        Files.createDirectories(to);
        int[] copied = {0};
        Files.walkFileTree(from, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(from) && SKIPPED_DIRECTORIES.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Path rel = from.relativize(file);
                if (attrs.isRegularFile() && filter.test(rel)) {
                    Path target = to.resolve(rel.toString());
                    Files.createDirectories(target.getParent());
                    Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
                    copied[0]++;
                }
                return FileVisitResult.CONTINUE;
            }
        });
        log.debug("Copied {} files from {} to {}", copied[0], from, to);
        return copied[0];
    }

    public static int copy(Path from, Path to) throws IOException {
        return copy(from, to, rel -> true);
    }

    /**
     * Copies a stage tree, leaving out the stage's own metadata file at its root.
     */
    public static int copyStageTree(Path from, Path to) throws IOException {
        return copy(from, to, rel -> !isStageMetadata(rel));
    }

    /**
     * Copies everything in a stage tree that is not a source unit, so that data
     * files read by the units travel with them from stage to stage.
     */
    public static int copyAssets(Path from, Path to) throws IOException {
        return copy(from, to, rel -> !rel.toString().endsWith(".py") && !isStageMetadata(rel));
    }

    private static boolean isStageMetadata(Path rel) {
        return rel.getNameCount() == 1 && rel.toString().endsWith("_metadata.json");
    }

    /** Replaces the contents of {@code to} with a copy of the stage tree {@code from}. */
    public static void mirror(Path from, Path to) throws IOException {
        deleteRecursively(to);
        copyStageTree(from, to);
    }

    public static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path p : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(p);
            }
        }
    }
}
