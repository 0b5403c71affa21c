package modernizer.verify;

import modernizer.io.JsonFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads and writes {@code <unit>_diff.json} report files.
 */
public final class DiffReports {

    public static final String SUFFIX = "_diff.json";
    public static final String AFTER_REPAIR_SUFFIX = "_diff_after.json";

    private DiffReports() {}

    /** Writes the latest report of a unit, replacing any earlier one. */
    public static Path write(Path dir, VerificationReport report) throws IOException {
        Path target = dir.resolve(report.key() + SUFFIX);
        JsonFiles.writeAtomic(target, report.toMap());
        return target;
    }

    /** Writes the report produced after repairing a unit. */
    public static Path writeAfterRepair(Path dir, VerificationReport report) throws IOException {
        Path target = dir.resolve(report.key() + AFTER_REPAIR_SUFFIX);
        JsonFiles.writeAtomic(target, report.toMap());
        return target;
    }

    /** Reads every {@code *_diff.json} in {@code dir}, sorted by file name. */
    public static List<VerificationReport> readAll(Path dir) throws IOException {
        List<VerificationReport> reports = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return reports;
        }
        List<Path> files;
        try (Stream<Path> s = Files.list(dir)) {
            files = s.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).sorted().toList();
        }
        for (Path f : files) {
            reports.add(VerificationReport.fromMap(JsonFiles.readMap(f)));
        }
        return reports;
    }
}
