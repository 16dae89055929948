package com.pipelinesentinel.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipelinesentinel.core.alerting.AlertRouter;
import com.pipelinesentinel.core.alerting.RoutedAlerts;
import com.pipelinesentinel.core.model.Alert;
import com.pipelinesentinel.core.model.HealthMetric;
import com.pipelinesentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RoutedAlertsSerializationSchema}.
 */
class RoutedAlertsSerializationSchemaTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:05:00Z");

    @Test
    @DisplayName("Should encode a routed batch as team → severity → alerts with ISO timestamps")
    void shouldEncodeRoutedAlerts() throws Exception {
        Alert alert = Alert.builder()
                .pipelineId("orders_etl")
                .team("data-eng")
                .metric(HealthMetric.AVG_DURATION)
                .observed(900.0)
                .peerMean(120.0)
                .peerStdDev(30.0)
                .severity(Severity.CRITICAL)
                .message("Pipeline orders_etl shows high average duration")
                .detectedAt(NOW)
                .build();
        RoutedAlerts routed = new AlertRouter().route(List.of(alert), NOW);

        byte[] bytes = new RoutedAlertsSerializationSchema().serialize(routed);
        JsonNode root = new ObjectMapper().readTree(bytes);

        assertThat(root.get("detectedAt").asText()).isEqualTo("2024-01-15T10:05:00Z");
        JsonNode encoded = root.get("alertsByTeam").get("data-eng").get("CRITICAL").get(0);
        assertThat(encoded.get("pipelineId").asText()).isEqualTo("orders_etl");
        assertThat(encoded.get("metric").asText()).isEqualTo("avg_duration");
        assertThat(encoded.get("severity").asText()).isEqualTo("CRITICAL");
        assertThat(encoded.get("observed").asDouble()).isEqualTo(900.0);
        assertThat(root.has("empty")).isFalse();
    }
}
