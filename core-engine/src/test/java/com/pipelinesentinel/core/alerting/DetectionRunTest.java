package com.pipelinesentinel.core.alerting;

import com.pipelinesentinel.core.config.MetricRule;
import com.pipelinesentinel.core.config.MonitorConfig;
import com.pipelinesentinel.core.detection.AnomalyDetector;
import com.pipelinesentinel.core.detection.MetricCrossing;
import com.pipelinesentinel.core.detection.PeerOutlierDetector;
import com.pipelinesentinel.core.model.Alert;
import com.pipelinesentinel.core.model.HealthMetric;
import com.pipelinesentinel.core.model.PipelineHealth;
import com.pipelinesentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectionRun}.
 */
class DetectionRunTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private static final List<PipelineHealth> SNAPSHOT = List.of(
            new PipelineHealth("pipeline-a", "data-eng", 95, 5, 100.0, 1000.0, NOW),
            new PipelineHealth("pipeline-b", "data-eng", 96, 4, 100.0, 1000.0, NOW),
            new PipelineHealth("pipeline-c", "ml-platform", 40, 60, 100.0, 1000.0, NOW));

    @Test
    @DisplayName("Should route the scenario outlier to its team")
    void shouldRouteOutlier() {
        RoutedAlerts routed = DetectionRun.fromConfig(MonitorConfig.defaults()).run(SNAPSHOT, NOW);

        assertThat(routed.teams()).containsExactly("ml-platform");
        List<Alert> alerts = routed.alertsFor("ml-platform", Severity.MEDIUM);
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getPipelineId()).isEqualTo("pipeline-c");
        assertThat(alerts.get(0).getMetric()).isEqualTo(HealthMetric.SUCCESS_RATE);
        assertThat(alerts.get(0).getDetectedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should keep running the remaining detectors when one fails")
    void shouldIsolateFailingDetector() {
        AnomalyDetector broken = new AnomalyDetector() {
            @Override
            public List<MetricCrossing> detect(List<PipelineHealth> snapshot) {
                throw new IllegalStateException("boom");
            }

            @Override
            public HealthMetric getMetric() {
                return HealthMetric.AVG_DURATION;
            }
        };
        AnomalyDetector successRate = new PeerOutlierDetector(
                MetricRule.defaultFor(HealthMetric.SUCCESS_RATE), 2, 1);
        DetectionRun run = new DetectionRun(List.of(broken, successRate), new AlertClassifier(1.0), new AlertRouter());

        RoutedAlerts routed = run.run(SNAPSHOT, NOW);

        assertThat(routed.size()).isEqualTo(1);
        assertThat(run.getDetectors()).hasSize(2);
    }

    @Test
    @DisplayName("Should report nothing when the population has a single pipeline")
    void shouldReportNothingForLonePipeline() {
        RoutedAlerts routed = DetectionRun.fromConfig(MonitorConfig.defaults())
                .run(List.of(SNAPSHOT.get(2)), NOW);

        assertThat(routed.isEmpty()).isTrue();
    }
}
