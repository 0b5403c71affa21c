package modernizer.plan;

import modernizer.exceptions.ModernizeException;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, validated sequence of stage processors.
 *
 * <p>Plans are built using {@link #build(List)}, which checks that:
 * <ul>
 *   <li>the plan is not empty</li>
 *   <li>no stage appears twice</li>
 *   <li>stages appear in {@link PipelineStage} order</li>
 *   <li>the first stage produces a source tree</li>
 * </ul>
 *
 * @see modernizer.engine.SessionOrchestrator
 */
public final class PipelinePlan {

    private final List<StageProcessor> processors;

    private PipelinePlan(List<StageProcessor> processors) {
        this.processors = processors;
    }

    /** Processors in execution order. */
    public List<StageProcessor> processors() {
        return processors;
    }

    public int size() {
        return processors.size();
    }

    public boolean contains(PipelineStage stage) {
        return processors.stream().anyMatch(p -> p.stage() == stage);
    }

    /**
     * Builds a plan from processors given in execution order.
     *
     * @throws ModernizeException if validation fails
     */
    public static PipelinePlan build(List<StageProcessor> processors) throws ModernizeException {
        Objects.requireNonNull(processors, "processors");
        if (processors.isEmpty()) {
            throw new ModernizeException("Pipeline plan has no stages");
        }

        Set<PipelineStage> seen = EnumSet.noneOf(PipelineStage.class);
        PipelineStage previous = null;
        for (StageProcessor p : processors) {
            PipelineStage stage = Objects.requireNonNull(p.stage(), "stage");
            if (!seen.add(stage)) {
                throw new ModernizeException("Duplicate stage in plan: " + stage.dirName());
            }
            if (previous != null && stage.ordinal() < previous.ordinal()) {
                throw new ModernizeException(
                        "Stage " + stage.dirName() + " cannot run after " + previous.dirName());
            }
            previous = stage;
        }

        if (!processors.get(0).stage().producesSource()) {
            throw new ModernizeException(
                    "First stage must produce a source tree: " + processors.get(0).stage().dirName());
        }
        return new PipelinePlan(List.copyOf(processors));
    }
}
