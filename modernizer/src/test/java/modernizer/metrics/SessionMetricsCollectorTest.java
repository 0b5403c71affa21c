package modernizer.metrics;

import modernizer.plan.PipelineStage;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionMetricsCollectorTest {

    @Test
    void shouldCollectUnitCounts() {
        SessionMetricsCollector collector = new SessionMetricsCollector().start("s1");

        collector.totalUnits(4)
                .parseableUnits(3)
                .matchedUnits(2)
                .repairedUnits(1)
                .manualUnits(1);
        SessionMetrics metrics = collector.finish();

        assertThat(metrics.sessionId()).isEqualTo("s1");
        assertThat(metrics.totalUnits()).isEqualTo(4);
        assertThat(metrics.parseableUnits()).isEqualTo(3);
        assertThat(metrics.matchedUnits()).isEqualTo(2);
        assertThat(metrics.repairedUnits()).isEqualTo(1);
        assertThat(metrics.manualUnits()).isEqualTo(1);
        assertThat(metrics.startTime()).isNotNull();
        assertThat(metrics.endTime()).isNotNull();
        assertThat(metrics.totalDurationMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void shouldTimeStages() throws Exception {
        SessionMetricsCollector collector = new SessionMetricsCollector().start("s2");

        String result = collector.timed(PipelineStage.PREPROCESS, () -> {
            Thread.sleep(20);
            return "done";
        });
        SessionMetrics metrics = collector.finish();

        assertThat(result).isEqualTo("done");
        assertThat(collector.durationOf(PipelineStage.PREPROCESS)).isGreaterThanOrEqualTo(15);
        assertThat(metrics.stageDuration(PipelineStage.PREPROCESS)).isGreaterThanOrEqualTo(15);
        assertThat(metrics.stageDuration(PipelineStage.REVIEW)).isZero();
    }

    @Test
    void shouldRecordDurationOfFailedStage() {
        SessionMetricsCollector collector = new SessionMetricsCollector().start("s3");

        assertThatThrownBy(() -> collector.timed(PipelineStage.SEMANTIC, () -> {
            throw new IOException("boom");
        })).isInstanceOf(IOException.class);

        assertThat(collector.finish().stageDurations()).containsKey(PipelineStage.SEMANTIC);
    }

    @Test
    void shouldSerializeWithStageDurations() throws Exception {
        SessionMetricsCollector collector = new SessionMetricsCollector().start("s4");
        collector.timed(PipelineStage.REPAIR, () -> 1);

        Map<String, Object> map = collector.totalUnits(2).finish().toMap();

        assertThat(map).containsEntry("session_id", "s4")
                .containsEntry("total_units", 2)
                .containsKey("stage4_repair_duration_ms");
        assertThat(collector.finish().summary()).contains("Units: 2");
    }
}
