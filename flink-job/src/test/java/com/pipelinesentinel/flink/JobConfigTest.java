package com.pipelinesentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should apply defaults for every unset value")
    void shouldApplyDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaInputTopic()).isEqualTo("pipeline-executions");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("pipeline-alerts");
        assertThat(config.getKafkaGroupId()).isEqualTo("pipeline-sentinel");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getCheckpointIntervalMs()).isEqualTo(60_000);
        assertThat(config.getDetectionIntervalMs()).isEqualTo(60_000);
        assertThat(config.getMonitorConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a blank topic name")
    void shouldRejectBlankTopic() {
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaInputTopic("  ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaInputTopic must not be null or blank");
    }

    @Test
    @DisplayName("Should reject non-positive parallelism and intervals")
    void shouldRejectNonPositiveNumbers() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism must be >= 1");
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("checkpointIntervalMs");
        assertThatThrownBy(() -> new JobConfig.Builder().detectionIntervalMs(-5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("detectionIntervalMs");
    }

    @Test
    @DisplayName("Should treat a null monitor config path as unset")
    void shouldNormaliseNullMonitorConfigPath() {
        JobConfig config = new JobConfig.Builder().monitorConfigPath(null).build();

        assertThat(config.getMonitorConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Should report every invalid setting in one exception")
    void shouldCollectAllErrors() {
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaGroupId("").parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaGroupId")
                .hasMessageContaining("parallelism");
    }

    @Test
    @DisplayName("Should read set variables and keep defaults for blank ones")
    void shouldReadEnvironment() {
        Map<String, String> env = Map.of(
                "KAFKA_BOOTSTRAP_SERVERS", "broker-1:9092,broker-2:9092",
                "KAFKA_ALERT_TOPIC", "  ",
                "FLINK_PARALLELISM", "4",
                "DETECTION_INTERVAL_MS", "15000",
                "MONITOR_CONFIG_PATH", "/etc/sentinel/monitor.yml");

        JobConfig config = JobConfig.fromEnvironment(env::get);

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("broker-1:9092,broker-2:9092");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("pipeline-alerts");
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getDetectionIntervalMs()).isEqualTo(15_000);
        assertThat(config.getMonitorConfigPath()).isEqualTo("/etc/sentinel/monitor.yml");
    }

    @Test
    @DisplayName("Should name the variable that holds an unparseable number")
    void shouldRejectUnparseableNumber() {
        Map<String, String> env = Map.of(
                "FLINK_PARALLELISM", "four",
                "FLINK_CHECKPOINT_INTERVAL_MS", "99999999999999999999");

        assertThatThrownBy(() -> JobConfig.fromEnvironment(env::get))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("FLINK_PARALLELISM")
                .hasMessageContaining("FLINK_CHECKPOINT_INTERVAL_MS");
    }
}
