package modernizer.review;

import modernizer.io.JsonFiles;
import modernizer.phase.StageContext;
import modernizer.plan.PipelineStage;
import modernizer.plan.StageOutcome;
import modernizer.plan.StageProcessor;
import modernizer.verify.DiffReports;
import modernizer.verify.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 5: one HTML page and one JSON snapshot per persisted verification
 * report, plus a {@code review_metadata.json} index. Source is not touched.
 */
public final class ReviewStage implements StageProcessor {

    private static final Logger log = LoggerFactory.getLogger(ReviewStage.class);

    private final ReviewGenerator generator = new ReviewGenerator();

    @Override
    public PipelineStage stage() {
        return PipelineStage.REVIEW;
    }

    @Override
    public StageOutcome process(StageContext ctx) throws IOException {
        Path out = ctx.outputDir();
        List<Map<String, Object>> snapshots = new ArrayList<>();
        for (VerificationReport report : DiffReports.readAll(ctx.layout().diffReports())) {
            Map<String, Object> snapshot = generator.snapshot(report);
            JsonFiles.writeStringAtomic(out.resolve(report.key() + "_review.html"), generator.html(report));
            JsonFiles.writeAtomic(out.resolve(report.key() + "_snapshot.json"), snapshot);
            snapshots.add(snapshot);
        }
        long accepted = snapshots.stream()
                .filter(s -> ReviewStatus.ACCEPTED.label().equals(s.get("status")))
                .count();
        log.info("Review: {} accepted, {} for manual review", accepted, snapshots.size() - accepted);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", snapshots.size());
        summary.put("accepted", accepted);
        summary.put("manual", snapshots.size() - accepted);
        Map<String, Object> metadata = new LinkedHashMap<>(summary);
        metadata.put("files", snapshots);
        JsonFiles.writeAtomic(out.resolve("review_metadata.json"), metadata);
        return StageOutcome.of(summary, metadata);
    }
}
