package modernizer.verify;

import modernizer.phase.StageContext;
import modernizer.plan.PipelineStage;
import modernizer.plan.StageOutcome;
import modernizer.plan.StageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 3: differential verification of the migrated tree against the
 * original input.
 */
public final class VerificationStage implements StageProcessor {

    private static final Logger log = LoggerFactory.getLogger(VerificationStage.class);

    @Override
    public PipelineStage stage() {
        return PipelineStage.VERIFICATION;
    }

    @Override
    public StageOutcome process(StageContext ctx) throws IOException {
        List<VerificationReport> reports;
        try (VerificationEngine engine = new VerificationEngine(ctx.executor(), ctx.config())) {
            reports = VerificationRun.run(ctx, engine, ctx.inputDir());
        }
        Map<String, Object> summary = aggregate(reports, ctx.executor().name());
        log.info("Verification: {} of {} units match", summary.get("matched"), summary.get("total"));

        List<String> warnings = new ArrayList<>();
        for (VerificationReport r : reports) {
            if (r.timedOut()) {
                warnings.add(r.unit() + ": " + r.details());
            }
        }
        Map<String, Object> metadata = new LinkedHashMap<>(summary);
        metadata.put("files", reports.stream().map(VerificationStage::brief).toList());
        return new StageOutcome(summary, metadata, warnings);
    }

    static Map<String, Object> aggregate(List<VerificationReport> reports, String executor) {
        long matched = reports.stream().filter(VerificationReport::match).count();
        long manual = reports.stream().filter(VerificationReport::manual).count();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", reports.size());
        summary.put("matched", matched);
        summary.put("mismatched", reports.size() - matched - manual);
        summary.put("manual", manual);
        summary.put("executor", executor);
        return summary;
    }

    private static Map<String, Object> brief(VerificationReport r) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", r.unit());
        map.put("match", r.match());
        map.put("manual", r.manual());
        map.put("timed_out", r.timedOut());
        map.put("details", r.details());
        return map;
    }
}
