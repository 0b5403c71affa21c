package modernizer.structural;

import modernizer.io.SourceTrees;
import modernizer.phase.StageContext;
import modernizer.plan.PipelineStage;
import modernizer.plan.StageOutcome;
import modernizer.plan.StageProcessor;
import modernizer.unit.FindingLog;
import modernizer.unit.Severity;
import modernizer.unit.SourceUnit;
import modernizer.unit.UnitScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 1: applies the structural rule catalog to every parseable unit.
 */
public final class StructuralStage implements StageProcessor {

    private static final Logger log = LoggerFactory.getLogger(StructuralStage.class);

    private final StructuralTransformer transformer;

    public StructuralStage() {
        this(new StructuralTransformer(StructuralTransformer.standardRules()));
    }

    public StructuralStage(StructuralTransformer transformer) {
        this.transformer = transformer;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.STRUCTURAL;
    }

    @Override
    public StageOutcome process(StageContext ctx) throws IOException {
        SourceTrees.copyAssets(ctx.inputDir(), ctx.outputDir());
        List<StructuralResult> results = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        FindingLog all = FindingLog.empty();
        for (SourceUnit loaded : UnitScanner.load(ctx.inputDir())) {
            SourceUnit unit = loaded.withParseable(ctx.ledger().isParseable(loaded.path()));
            StructuralResult result = transformer.transform(unit);
            UnitScanner.write(ctx.outputDir(), result.unit());
            if (result.skipped()) {
                warnings.add(unit.path() + " skipped: not parseable");
            } else if (!result.modernParseable()) {
                warnings.add(unit.path() + " still uses syntax only the legacy dialect accepts");
            }
            all = all.plus(result.findings());
            results.add(result);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_files", results.size());
        summary.put("transformed_files", results.stream().filter(r -> !r.skipped()).count());
        summary.put("skipped_files", results.stream().filter(StructuralResult::skipped).count());
        summary.put("modern_parseable_files", results.stream().filter(StructuralResult::modernParseable).count());
        summary.put("fixed", all.count(Severity.FIXED));
        summary.put("flagged", all.count(Severity.FLAGGED));
        summary.put("manual", all.count(Severity.MANUAL));
        summary.put("rollbacks", results.stream().mapToInt(r -> r.rollbacks().size()).sum());
        summary.put("rules_applied", all.countsByRule());
        log.info("Structural rules: {} fixed, {} flagged, {} manual across {} units",
                summary.get("fixed"), summary.get("flagged"), summary.get("manual"), results.size());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("summary", summary);
        metadata.put("files", results.stream().map(StructuralResult::toMap).toList());
        return new StageOutcome(summary, metadata, warnings);
    }
}
