package modernizer.verify;

import modernizer.phase.StageContext;
import modernizer.plan.PipelineStage;
import modernizer.unit.UnitScanner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * One full verification pass over a migrated tree, shared by the verification
 * stage and the repair loop.
 *
 * <p>Each pass gets fresh workspaces under
 * {@code intermediate/stage3_verification/pass_<n>/}, records every report in
 * the ledger, writes it to {@code diff_reports/} and archives it under
 * {@code reports/pass_<n>/}.
 */
public final class VerificationRun {

    private VerificationRun() {}

    public static List<VerificationReport> run(StageContext ctx, VerificationEngine engine, Path migratedTree)
            throws IOException {
        int pass = ctx.ledger().nextVerificationPass();
        Path verificationDir = ctx.layout().stageDir(PipelineStage.VERIFICATION);
        Path passDir = verificationDir.resolve("pass_" + pass);
        Path legacyRoot = HarnessBuilder.prepare(ctx.originalDir(), passDir.resolve("legacy"));
        Path modernRoot = HarnessBuilder.prepare(migratedTree, passDir.resolve("modern"));

        List<String> units = UnitScanner.scan(migratedTree);
        List<VerificationReport> reports = engine.verifyAll(units, legacyRoot, modernRoot, pass,
                ctx.ledger()::isParseable);

        Path archive = verificationDir.resolve("reports").resolve("pass_" + pass);
        for (VerificationReport report : reports) {
            ctx.ledger().recordReport(report);
            DiffReports.write(ctx.layout().diffReports(), report);
            DiffReports.write(archive, report);
        }
        return reports;
    }
}
