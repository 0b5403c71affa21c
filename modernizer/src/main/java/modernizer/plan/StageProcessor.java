package modernizer.plan;

import modernizer.exceptions.ModernizeException;
import modernizer.phase.StageContext;

import java.io.IOException;

/**
 * One stage of the pipeline.
 *
 * <p>A processor reads {@link StageContext#inputDir()} and writes into
 * {@link StageContext#outputDir()}. Stage-local problems are returned as data
 * in the {@link StageOutcome}; any exception that escapes is fatal to the session.
 */
public interface StageProcessor {

    PipelineStage stage();

    StageOutcome process(StageContext ctx) throws IOException, ModernizeException;
}
