package modernizer.plan;

import modernizer.engine.SessionOrchestrator;
import modernizer.exceptions.ModernizeException;
import modernizer.phase.StageContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PipelinePlan")
class PipelinePlanTest {

    private static StageProcessor stub(PipelineStage stage) {
        return new StageProcessor() {
            @Override
            public PipelineStage stage() {
                return stage;
            }

            @Override
            public StageOutcome process(StageContext ctx) {
                return StageOutcome.of(Map.of(), Map.of());
            }
        };
    }

    @Test
    @DisplayName("should hold the six standard stages in order")
    void shouldHoldStandardStages() throws Exception {
        PipelinePlan plan = SessionOrchestrator.standardPlan();

        assertThat(plan.processors()).extracting(StageProcessor::stage).containsExactly(PipelineStage.values());
    }

    @Test
    @DisplayName("should accept a prefix of the pipeline")
    void shouldAcceptPrefix() throws Exception {
        PipelinePlan plan = PipelinePlan.build(List.of(stub(PipelineStage.PREPROCESS), stub(PipelineStage.STRUCTURAL)));

        assertThat(plan.size()).isEqualTo(2);
        assertThat(plan.contains(PipelineStage.STRUCTURAL)).isTrue();
        assertThat(plan.contains(PipelineStage.REVIEW)).isFalse();
    }

    @Test
    @DisplayName("should reject an empty plan")
    void shouldRejectEmptyPlan() {
        assertThatThrownBy(() -> PipelinePlan.build(List.of()))
                .isInstanceOf(ModernizeException.class)
                .hasMessageContaining("no stages");
    }

    @Test
    @DisplayName("should reject duplicate stages")
    void shouldRejectDuplicates() {
        assertThatThrownBy(() -> PipelinePlan.build(List.of(stub(PipelineStage.PREPROCESS), stub(PipelineStage.PREPROCESS))))
                .isInstanceOf(ModernizeException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    @DisplayName("should reject stages out of order")
    void shouldRejectOutOfOrder() {
        assertThatThrownBy(() -> PipelinePlan.build(List.of(stub(PipelineStage.SEMANTIC), stub(PipelineStage.STRUCTURAL))))
                .isInstanceOf(ModernizeException.class)
                .hasMessageContaining("cannot run after");
    }

    @Test
    @DisplayName("should reject a plan that starts without producing source")
    void shouldRejectNonSourceFirstStage() {
        assertThatThrownBy(() -> PipelinePlan.build(List.of(stub(PipelineStage.VERIFICATION))))
                .isInstanceOf(ModernizeException.class)
                .hasMessageContaining("First stage");
    }

    @Test
    @DisplayName("should name stage directories and metadata files")
    void shouldNameStageFiles() {
        assertThat(PipelineStage.REPAIR.dirName()).isEqualTo("stage4_repair");
        assertThat(PipelineStage.REPAIR.metadataFileName()).isEqualTo("stage4_repair_metadata.json");
        assertThat(PipelineStage.VERIFICATION.producesSource()).isFalse();
    }
}
