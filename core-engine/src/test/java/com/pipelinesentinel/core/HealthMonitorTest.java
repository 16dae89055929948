package com.pipelinesentinel.core;

import com.pipelinesentinel.core.aggregation.ApplyResult;
import com.pipelinesentinel.core.alerting.RoutedAlerts;
import com.pipelinesentinel.core.config.MonitorConfig;
import com.pipelinesentinel.core.model.Alert;
import com.pipelinesentinel.core.model.ExecutionEvent;
import com.pipelinesentinel.core.model.ExecutionStatus;
import com.pipelinesentinel.core.model.HealthMetric;
import com.pipelinesentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link HealthMonitor}.
 */
class HealthMonitorTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    @Test
    @DisplayName("Should detect and route a failing pipeline from raw events")
    void shouldDetectFailingPipeline() {
        HealthMonitor monitor = new HealthMonitor(MonitorConfig.defaults());
        List<ExecutionEvent> events = new ArrayList<>();
        for (String pipeline : List.of("orders_etl", "users_sync", "billing_load")) {
            for (int i = 0; i < 10; i++) {
                events.add(event(pipeline, "data-eng", pipeline + "-" + i, ExecutionStatus.SUCCESS));
            }
        }
        for (int i = 0; i < 10; i++) {
            ExecutionStatus status = i < 4 ? ExecutionStatus.SUCCESS : ExecutionStatus.FAILED;
            events.add(event("feature_build", "ml-platform", "fb-" + i, status));
        }
        monitor.applyAll(events);

        RoutedAlerts routed = monitor.detect(T0.plusSeconds(3600));

        assertThat(routed.teams()).containsExactly("ml-platform");
        List<Alert> alerts = routed.alertsFor("ml-platform", Severity.MEDIUM);
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getPipelineId()).isEqualTo("feature_build");
        assertThat(alerts.get(0).getMetric()).isEqualTo(HealthMetric.SUCCESS_RATE);
        assertThat(monitor.reporter().getTotalExecutions()).isEqualTo(40);
    }

    @Test
    @DisplayName("Should treat redelivered events as no-ops")
    void shouldIgnoreRedelivery() {
        HealthMonitor monitor = new HealthMonitor(MonitorConfig.defaults());
        ExecutionEvent event = event("orders_etl", "data-eng", "exec-1", ExecutionStatus.SUCCESS);

        assertThat(monitor.apply(event)).isEqualTo(ApplyResult.APPLIED);
        assertThat(monitor.apply(event)).isEqualTo(ApplyResult.DUPLICATE);
        assertThat(monitor.reporter().getPipelineHealth("orders_etl").getTotalCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should refuse an invalid configuration")
    void shouldRejectInvalidConfig() {
        MonitorConfig config = MonitorConfig.defaults();
        config.setMinPeerPopulation(1);

        assertThatThrownBy(() -> new HealthMonitor(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("minPeerPopulation");
    }

    private static ExecutionEvent event(String pipeline, String team, String id, ExecutionStatus status) {
        return ExecutionEvent.builder()
                .executionId(id)
                .pipelineId(pipeline)
                .team(team)
                .status(status)
                .duration(120.0)
                .recordsProcessed(5_000L)
                .timestamp(T0)
                .build();
    }
}
