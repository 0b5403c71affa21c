package modernizer.engine;

import modernizer.alert.PipelineAlertLogger;
import modernizer.config.ModernizerConfig;
import modernizer.config.ModernizerConfigLoader;
import modernizer.exceptions.ModernizeException;
import modernizer.exceptions.SandboxUnavailableException;
import modernizer.exceptions.StageFailureException;
import modernizer.io.JsonFiles;
import modernizer.io.SourceTrees;
import modernizer.metrics.SessionMetrics;
import modernizer.metrics.SessionMetricsCollector;
import modernizer.phase.NoopStageListener;
import modernizer.phase.StageContext;
import modernizer.phase.StageListener;
import modernizer.phase.UnitLedger;
import modernizer.plan.PipelinePlan;
import modernizer.plan.PipelineStage;
import modernizer.plan.StageOutcome;
import modernizer.plan.StageProcessor;
import modernizer.preprocess.PreprocessStage;
import modernizer.repair.RepairStage;
import modernizer.review.ReviewStage;
import modernizer.sandbox.Executor;
import modernizer.sandbox.ExecutorSelector;
import modernizer.semantic.SemanticStage;
import modernizer.state.Session;
import modernizer.state.SessionLayout;
import modernizer.state.SessionResult;
import modernizer.state.SessionStore;
import modernizer.state.StageRecord;
import modernizer.structural.StructuralStage;
import modernizer.unit.UnitScanner;
import modernizer.verify.VerificationReport;
import modernizer.verify.VerificationStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one modernization session end to end.
 *
 * <p>A session:
 * <ol>
 *   <li>gets a fresh id and directory under the sessions root</li>
 *   <li>snapshots the input into {@code intermediate/source/}</li>
 *   <li>runs the plan's stages strictly in order, each reading the output of
 *       the most recent source-producing stage</li>
 *   <li>after every stage writes the stage metadata, {@code logs/<stage>.json},
 *       {@code metadata.json} and {@code session_metadata.json}, and mirrors
 *       {@code final_output/}</li>
 * </ol>
 *
 * <p>An exception escaping a stage fails the session: the failure is recorded
 * with message and stack trace, no further stage is scheduled, and everything
 * already written is kept. A snapshot that cannot be taken fails the session
 * the same way, with {@value #SNAPSHOT_STEP} as the failed step. Nothing is shared between sessions, so the
 * orchestrator can be invoked again for a new session.
 *
 * <h2>Example:</h2>
 * <pre>
 * SessionOrchestrator orchestrator = new SessionOrchestrator(ModernizerConfigLoader.load());
 * SessionResult result = orchestrator.run(Path.of("legacy-src"));
 * </pre>
 */
public final class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    /** Chooses the executor of a session. Called once, at session start. */
    @FunctionalInterface
    public interface ExecutorSource {
        Executor select(ModernizerConfig config) throws SandboxUnavailableException;
    }

    /** Copies the input into the session and counts its units. */
    @FunctionalInterface
    interface SourceSnapshot {
        int take(Path sourceRoot, SessionLayout layout) throws IOException;
    }

    static final String SNAPSHOT_STEP = "snapshot";

    private final ModernizerConfig defaults;
    private final PipelinePlan plan;
    private final StageListener listener;
    private final ExecutorSource executorSource;
    private final SourceSnapshot snapshot;

    public SessionOrchestrator(ModernizerConfig defaults) throws ModernizeException {
        this(defaults, standardPlan(), null, config -> ExecutorSelector.select(config).executor());
    }

    public SessionOrchestrator(ModernizerConfig defaults, PipelinePlan plan, StageListener listener,
                               ExecutorSource executorSource) {
        this(defaults, plan, listener, executorSource, SessionOrchestrator::copyInput);
    }

    SessionOrchestrator(ModernizerConfig defaults, PipelinePlan plan, StageListener listener,
                        ExecutorSource executorSource, SourceSnapshot snapshot) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.plan = Objects.requireNonNull(plan, "plan");
        this.listener = listener == null ? NoopStageListener.INSTANCE : listener;
        this.executorSource = Objects.requireNonNull(executorSource, "executorSource");
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
    }

    /**
     * Creates an orchestrator from the classpath configuration.
     *
     * @see ModernizerConfigLoader#load()
     */
    public static SessionOrchestrator fromClasspathConfig() throws ModernizeException {
        return new SessionOrchestrator(ModernizerConfigLoader.load());
    }

    /** preprocess, structural, semantic, verification, repair, review. */
    public static PipelinePlan standardPlan() throws ModernizeException {
        List<StageProcessor> stages = List.of(
                new PreprocessStage(),
                new StructuralStage(),
                new SemanticStage(),
                new VerificationStage(),
                new RepairStage(),
                new ReviewStage());
        return PipelinePlan.build(stages);
    }

    public SessionResult run(Path sourceRoot) throws IOException, ModernizeException {
        return run(sourceRoot, defaults);
    }

    /**
     * Runs a session over {@code sourceRoot}.
     *
     * <p>Stage failures do not throw: they are reported through the returned
     * result and the session's {@code metadata.json}. So is a failure to copy
     * the input into the session.
     *
     * @throws ModernizeException if the session cannot be set up: the input is
     *         not a directory, or the sandbox is required but unavailable
     * @throws IOException if the session directory cannot be written
     */
    public SessionResult run(Path sourceRoot, ModernizerConfig config) throws IOException, ModernizeException {
        Objects.requireNonNull(config, "config");
        if (!Files.isDirectory(sourceRoot)) {
            throw new ModernizeException("Source root is not a directory: " + sourceRoot);
        }
        PipelineAlertLogger.setAlertLevel(config.alertLevel());
        Executor executor = executorSource.select(config);

        SessionStore store = new SessionStore(config.sessionsRoot());
        String sessionId = SessionStore.newSessionId();
        SessionLayout layout = store.create(sessionId);
        Session session = new Session(sessionId, layout, sourceRoot.toAbsolutePath().toString(),
                config.toMap(), executor.name());
        store.save(session);
        PipelineAlertLogger.sessionStarted(sessionId, sourceRoot.toString());

        int totalUnits;
        try {
            totalUnits = snapshot.take(sourceRoot, layout);
        } catch (IOException | RuntimeException e) {
            return failSnapshot(session, store, e);
        }

        SessionMetricsCollector metrics = new SessionMetricsCollector().start(sessionId);
        metrics.totalUnits(totalUnits);
        UnitLedger ledger = new UnitLedger();
        Map<String, Object> stageMetadata = new LinkedHashMap<>();
        Path input = layout.sourceSnapshot();
        int repaired = 0;

        for (StageProcessor processor : plan.processors()) {
            PipelineStage stage = processor.stage();
            StageContext ctx = new StageContext(sessionId, layout, config, executor, ledger, stage, input);
            Instant startedAt = Instant.now();
            try {
                PipelineAlertLogger.stageStarted(sessionId, stage);
                listener.onStageStarted(ctx);
                Files.createDirectories(ctx.outputDir());
                StageOutcome outcome = metrics.timed(stage, () -> runStage(processor, ctx, config));
                long duration = metrics.durationOf(stage);

                StageRecord record = StageRecord.ok(stage.dirName(), outcome.metrics(),
                        relative(layout, ctx.outputDir()), duration);
                session.append(record);
                JsonFiles.writeAtomic(layout.stageMetadata(stage), outcome.metadata());
                JsonFiles.writeAtomic(layout.stageLog(stage),
                        stageLog(stage, record.status(), startedAt, duration, outcome.warnings(), null, null));
                stageMetadata.put(stage.dirName(), outcome.metadata());

                if (stage.producesSource()) {
                    SourceTrees.mirror(ctx.outputDir(), layout.finalOutput());
                    Files.createDirectories(layout.finalOutput());
                    session.finalOutputMirrors(stage.dirName());
                    input = ctx.outputDir();
                }
                if (stage == PipelineStage.REPAIR && outcome.metrics().get("repaired") instanceof Number n) {
                    repaired = n.intValue();
                }
                store.save(session);
                writeSessionMetadata(layout, session, stageMetadata, totalUnits);
                PipelineAlertLogger.stageCompleted(sessionId, stage, duration);
                listener.onStageCompleted(ctx, record);
            } catch (Exception e) {
                StageFailureException failure = e instanceof StageFailureException sfe
                        ? sfe : new StageFailureException(stage.dirName(), e);
                return fail(session, store, ctx, failure, metrics, ledger, repaired, startedAt,
                        stageMetadata, totalUnits);
            }
        }

        SessionMetrics finished = finish(metrics, ledger, totalUnits, repaired);
        session.completed(finished.toMap());
        store.save(session);
        PipelineAlertLogger.sessionCompleted(sessionId, finished);
        log.info(finished.summary());
        return new SessionResult(sessionId, session.status(), layout.root(), session.stages(), finished, null);
    }

    /** Reads back the {@code metadata.json} of a session under the default sessions root. */
    public Map<String, Object> getStatus(String sessionId) throws IOException, ModernizeException {
        return new SessionStore(defaults.sessionsRoot()).getStatus(sessionId);
    }

    private static StageOutcome runStage(StageProcessor processor, StageContext ctx, ModernizerConfig config)
            throws Exception {
        return TimeoutExecutor.executeWithTimeoutChecked(ctx.stage().dirName(), config.stageTimeout(),
                () -> processor.process(ctx));
    }

    private static int copyInput(Path sourceRoot, SessionLayout layout) throws IOException {
        SourceTrees.copy(sourceRoot, layout.sourceSnapshot());
        return UnitScanner.scan(layout.sourceSnapshot()).size();
    }

    private static SessionResult failSnapshot(Session session, SessionStore store, Exception cause)
            throws IOException {
        String message = "Could not snapshot the input: " + StageFailureException.describe(cause);
        SessionMetrics empty = new SessionMetricsCollector().start(session.id()).finish();
        PipelineAlertLogger.setupFailed(session.id(), SNAPSHOT_STEP, cause);
        session.failed(SNAPSHOT_STEP, message, stackTrace(cause), empty.toMap());
        store.save(session);
        writeSessionMetadata(session.layout(), session, Map.of(), 0);
        return new SessionResult(session.id(), session.status(), session.layout().root(), session.stages(),
                empty, session.error());
    }

    private SessionResult fail(Session session, SessionStore store, StageContext ctx, StageFailureException failure,
                               SessionMetricsCollector metrics, UnitLedger ledger, int repaired, Instant startedAt,
                               Map<String, Object> stageMetadata, int totalUnits) throws IOException {
        PipelineStage stage = ctx.stage();
        String trace = stackTrace(failure.getCause() != null ? failure.getCause() : failure);
        String message = failure.getCause() != null ? StageFailureException.describe(failure.getCause())
                : failure.getMessage();
        long duration = metrics.durationOf(stage);

        PipelineAlertLogger.stageFailed(session.id(), stage, failure);
        try {
            listener.onStageFailed(ctx, failure);
        } catch (RuntimeException e) {
            log.warn("Stage listener failed for {}: {}", stage.dirName(), e.getMessage());
        }

        session.append(StageRecord.error(stage.dirName(), relative(session.layout(), ctx.outputDir()), duration,
                message));
        JsonFiles.writeAtomic(session.layout().stageLog(stage),
                stageLog(stage, StageRecord.Status.ERROR, startedAt, duration, List.of(), message, trace));

        SessionMetrics partial = finish(metrics, ledger, totalUnits, repaired);
        session.failed(stage.dirName(), message, trace, partial.toMap());
        store.save(session);
        writeSessionMetadata(session.layout(), session, stageMetadata, totalUnits);
        PipelineAlertLogger.sessionFailed(session.id(), stage, partial);
        return new SessionResult(session.id(), session.status(), session.layout().root(), session.stages(),
                partial, session.error());
    }

    private static SessionMetrics finish(SessionMetricsCollector metrics, UnitLedger ledger, int totalUnits,
                                         int repaired) throws IOException {
        Map<String, VerificationReport> reports = ledger.latestReports();
        int matched = (int) reports.values().stream().filter(VerificationReport::match).count();
        return metrics
                .parseableUnits(totalUnits - ledger.unparseableCount())
                .matchedUnits(matched)
                .repairedUnits(repaired)
                .manualUnits(reports.size() - matched)
                .finish();
    }

    private static void writeSessionMetadata(SessionLayout layout, Session session, Map<String, Object> stageMetadata,
                                             int totalUnits) throws IOException {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("session_name", session.id());
        merged.put("status", session.status().label());
        merged.put("stages", stageMetadata);
        merged.put("total_files", totalUnits);
        merged.put("completed_stages", new ArrayList<>(stageMetadata.keySet()));
        JsonFiles.writeAtomic(layout.sessionMetadataFile(), merged);
    }

    private static Map<String, Object> stageLog(PipelineStage stage, StageRecord.Status status, Instant startedAt,
                                                long durationMs, List<String> warnings, String error, String trace) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("stage", stage.dirName());
        map.put("status", status.name().toLowerCase());
        map.put("started_at", startedAt.toString());
        map.put("duration_ms", durationMs);
        map.put("warnings", warnings);
        if (error != null) {
            map.put("error", error);
            map.put("traceback", trace);
        }
        return map;
    }

    private static String relative(SessionLayout layout, Path dir) {
        return layout.root().relativize(dir).toString().replace('\\', '/');
    }

    private static String stackTrace(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
