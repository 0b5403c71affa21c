package modernizer.semantic;

import modernizer.io.SourceTrees;
import modernizer.phase.StageContext;
import modernizer.plan.PipelineStage;
import modernizer.plan.StageOutcome;
import modernizer.plan.StageProcessor;
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
 * Stage 2: rewrites constructs whose runtime meaning changed between dialects.
 *
 * <p>Lines holding a rewritten division are recorded in the ledger for the
 * float division repair strategy.
 */
public final class SemanticStage implements StageProcessor {

    private static final Logger log = LoggerFactory.getLogger(SemanticStage.class);

    private final SemanticAnalyzer analyzer;

    public SemanticStage() {
        this(new SemanticAnalyzer(SemanticAnalyzer.standardDetectors()));
    }

    public SemanticStage(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.SEMANTIC;
    }

    @Override
    public StageOutcome process(StageContext ctx) throws IOException {
        SourceTrees.copyAssets(ctx.inputDir(), ctx.outputDir());
        List<SemanticResult> results = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Integer> totals = new LinkedHashMap<>();
        for (SourceUnit loaded : UnitScanner.load(ctx.inputDir())) {
            SourceUnit unit = loaded.withParseable(ctx.ledger().isParseable(loaded.path()));
            SemanticResult result = analyzer.analyze(unit);
            UnitScanner.write(ctx.outputDir(), result.unit());
            ctx.ledger().recordDivisionLines(unit.path(), result.divisionLines());
            result.counters().forEach((k, v) -> totals.merge(k, v, Integer::sum));
            result.warnings().forEach(w -> warnings.add(unit.path() + ": " + w));
            results.add(result);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_files", results.size());
        summary.put("skipped_files", results.stream().filter(SemanticResult::skipped).count());
        summary.put("reverted_files", results.stream().filter(SemanticResult::reverted).count());
        summary.putAll(totals);
        log.info("Semantic rewrites over {} units: {}", results.size(), totals);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("summary", summary);
        metadata.put("files", results.stream().map(SemanticResult::toMap).toList());
        return new StageOutcome(summary, metadata, warnings);
    }
}
