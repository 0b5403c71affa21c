package modernizer.repair;

import modernizer.io.JsonFiles;
import modernizer.io.SourceTrees;
import modernizer.phase.StageContext;
import modernizer.plan.PipelineStage;
import modernizer.plan.StageOutcome;
import modernizer.plan.StageProcessor;
import modernizer.verify.DiffReports;
import modernizer.verify.VerificationEngine;
import modernizer.verify.VerificationRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 4: copies the migrated tree and repairs the units verification
 * flagged. Writes {@code repair_metadata.json} at the session root and a
 * {@code <unit>_diff_after.json} report for every unit a round changed.
 */
public final class RepairStage implements StageProcessor {

    private static final Logger log = LoggerFactory.getLogger(RepairStage.class);

    private final List<RepairStrategy> strategies;

    public RepairStage() {
        this(RepairLoop.standardStrategies());
    }

    public RepairStage(List<RepairStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.REPAIR;
    }

    @Override
    public StageOutcome process(StageContext ctx) throws IOException {
        SourceTrees.copyStageTree(ctx.inputDir(), ctx.outputDir());
        RepairLoop loop = new RepairLoop(strategies, ctx.config().maxRepairAttempts());

        RepairSummary summary;
        try (VerificationEngine engine = new VerificationEngine(ctx.executor(), ctx.config())) {
            summary = loop.run(ctx.outputDir(), ctx.ledger(),
                    tree -> VerificationRun.run(ctx, engine, tree),
                    report -> DiffReports.writeAfterRepair(ctx.layout().diffReports(), report));
        }
        JsonFiles.writeAtomic(ctx.layout().repairMetadataFile(),
                summary.units().stream().map(UnitRepair::toMap).toList());
        log.info("Repair: {} of {} failing units repaired in {} attempt(s)",
                summary.repairedCount(), summary.units().size(), summary.attempts());

        Map<String, Object> metrics = summary.toMap();
        Map<String, Object> metadata = new LinkedHashMap<>(metrics);
        metadata.put("files", summary.units().stream().map(UnitRepair::toMap).toList());
        List<String> warnings = summary.stillFailing().stream()
                .map(unit -> unit + ": still failing after repair")
                .toList();
        return new StageOutcome(metrics, metadata, warnings);
    }
}
