package com.pipelinesentinel.core.detection;

import com.pipelinesentinel.core.config.MetricRule;
import com.pipelinesentinel.core.config.MonitorConfig;
import com.pipelinesentinel.core.model.HealthMetric;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create one detector per metric with default thresholds")
    void shouldCreateDefaultDetectors() {
        List<AnomalyDetector> detectors = DetectorFactory.createAll(MonitorConfig.defaults());

        assertThat(detectors).extracting(AnomalyDetector::getMetric)
                .containsExactly(HealthMetric.SUCCESS_RATE, HealthMetric.AVG_DURATION,
                        HealthMetric.AVG_RECORDS_PROCESSED);
        assertThat(detectors).allSatisfy(d -> assertThat(d).isInstanceOf(PeerOutlierDetector.class));
        assertThat(((PeerOutlierDetector) detectors.get(0)).getSigmaMultiplier()).isEqualTo(1.0);
        assertThat(((PeerOutlierDetector) detectors.get(1)).getSigmaMultiplier()).isEqualTo(2.0);
        assertThat(((PeerOutlierDetector) detectors.get(2)).getFallbackStdDev()).isZero();
    }

    @Test
    @DisplayName("Should apply configured rules over the defaults")
    void shouldApplyConfiguredRules() {
        MonitorConfig config = MonitorConfig.defaults();
        config.setMetrics(List.of(new MetricRule(HealthMetric.AVG_DURATION, 3.5, 1.0)));

        List<AnomalyDetector> detectors = DetectorFactory.createAll(config);

        PeerOutlierDetector duration = (PeerOutlierDetector) detectors.get(1);
        assertThat(detectors).hasSize(3);
        assertThat(duration.getMetric()).isEqualTo(HealthMetric.AVG_DURATION);
        assertThat(duration.getSigmaMultiplier()).isEqualTo(3.5);
        assertThat(duration.getFallbackStdDev()).isEqualTo(1.0);
    }
}
