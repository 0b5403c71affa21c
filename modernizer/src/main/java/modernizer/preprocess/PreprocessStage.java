package modernizer.preprocess;

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
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stage 0: runs the {@link Preprocessor} over every unit of the input tree.
 *
 * <p>Every unit is written to the stage directory, parseable or not, and its
 * parseability is recorded in the ledger so later stages can skip it. Non-Python
 * files are copied unchanged.
 */
public final class PreprocessStage implements StageProcessor {

    private static final Logger log = LoggerFactory.getLogger(PreprocessStage.class);

    @Override
    public PipelineStage stage() {
        return PipelineStage.PREPROCESS;
    }

    @Override
    public StageOutcome process(StageContext ctx) throws IOException {
        Path input = ctx.inputDir();
        Path output = ctx.outputDir();
        Preprocessor preprocessor = new Preprocessor(ctx.config().maxFixIterations());

        SourceTrees.copyAssets(input, output);
        List<PreprocessResult> results = new ArrayList<>();
        for (SourceUnit unit : UnitScanner.load(input)) {
            PreprocessResult result = preprocessor.process(unit);
            UnitScanner.write(output, result.unit());
            ctx.ledger().recordParseable(unit.path(), result.parseable());
            results.add(result);
            log.debug("Preprocessed {}: {}", unit.path(), result.status());
        }

        Map<String, Object> summary = summarize(results);
        List<String> warnings = new ArrayList<>();
        for (PreprocessResult r : results) {
            if (!r.parseable()) {
                warnings.add(r.unit().path() + " is not parseable: " + String.join("; ", r.errors()));
            }
        }
        log.info("Preprocessed {} units, {} parseable", results.size(), summary.get("parseable_files"));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("summary", summary);
        metadata.put("files", results.stream().map(PreprocessResult::toMap).toList());
        return new StageOutcome(summary, metadata, warnings);
    }

    static Map<String, Object> summarize(List<PreprocessResult> results) {
        int parseable = 0;
        int skipped = 0;
        int changed = 0;
        int stubbed = 0;
        int marked = 0;
        Map<String, Integer> rules = new TreeMap<>();
        for (PreprocessResult r : results) {
            if (r.parseable()) parseable++;
            if (PreprocessResult.SKIPPED_EMPTY.equals(r.status())) skipped++;
            changed += r.linesChanged();
            stubbed += r.stubbedLines().size();
            marked += r.markedLines().size();
            r.rulesApplied().forEach(rule -> rules.merge(rule, 1, Integer::sum));
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_files", results.size());
        summary.put("parseable_files", parseable);
        summary.put("unparseable_files", results.size() - parseable);
        summary.put("skipped_empty", skipped);
        summary.put("total_lines_changed", changed);
        summary.put("total_lines_stubbed", stubbed);
        summary.put("total_lines_marked", marked);
        summary.put("rules_applied", rules);
        return summary;
    }
}
