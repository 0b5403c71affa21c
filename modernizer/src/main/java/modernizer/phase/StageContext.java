package modernizer.phase;

import modernizer.config.ModernizerConfig;
import modernizer.plan.PipelineStage;
import modernizer.sandbox.Executor;
import modernizer.state.SessionLayout;

import java.nio.file.Path;

/**
 * Context handed to a stage processor and to {@link StageListener} callbacks.
 *
 * <p>Provides:
 * <ul>
 *   <li>the session id and directory layout</li>
 *   <li>the stage being run, its input tree and its output directory</li>
 *   <li>configuration, the session's executor and the unit ledger</li>
 * </ul>
 */
public final class StageContext {

    private final String sessionId;
    private final SessionLayout layout;
    private final ModernizerConfig config;
    private final Executor executor;
    private final UnitLedger ledger;
    private final PipelineStage stage;
    private final Path inputDir;

    public StageContext(String sessionId, SessionLayout layout, ModernizerConfig config, Executor executor,
                        UnitLedger ledger, PipelineStage stage, Path inputDir) {
        this.sessionId = sessionId;
        this.layout = layout;
        this.config = config;
        this.executor = executor;
        this.ledger = ledger;
        this.stage = stage;
        this.inputDir = inputDir;
    }

    public String sessionId() {
        return sessionId;
    }

    public SessionLayout layout() {
        return layout;
    }

    public ModernizerConfig config() {
        return config;
    }

    public Executor executor() {
        return executor;
    }

    public UnitLedger ledger() {
        return ledger;
    }

    public PipelineStage stage() {
        return stage;
    }

    /** Output tree of the most recent source-producing stage, or the input snapshot. */
    public Path inputDir() {
        return inputDir;
    }

    /** This stage's directory under {@code intermediate/}. */
    public Path outputDir() {
        return layout.stageDir(stage);
    }

    /** The untouched snapshot of the session input. */
    public Path originalDir() {
        return layout.sourceSnapshot();
    }
}
