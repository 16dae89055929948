package com.pipelinesentinel.flink;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.LongConsumer;

/**
 * Deployment settings of the Pipeline Sentinel job: where the execution
 * events come from, where routed alerts go, and how often detection runs.
 *
 * <p>
 * Peer thresholds are not part of this object; they live in the monitor
 * YAML named by {@link #getMonitorConfigPath()}.
 * </p>
 *
 * <h3>Environment variables</h3>
 * <table>
 * <tr><td>{@value #ENV_BOOTSTRAP_SERVERS}</td><td>{@code localhost:9092}</td></tr>
 * <tr><td>{@value #ENV_INPUT_TOPIC}</td><td>{@code pipeline-executions}</td></tr>
 * <tr><td>{@value #ENV_ALERT_TOPIC}</td><td>{@code pipeline-alerts}</td></tr>
 * <tr><td>{@value #ENV_GROUP_ID}</td><td>{@code pipeline-sentinel}</td></tr>
 * <tr><td>{@value #ENV_PARALLELISM}</td><td>{@code 1}</td></tr>
 * <tr><td>{@value #ENV_CHECKPOINT_INTERVAL}</td><td>{@code 60000}</td></tr>
 * <tr><td>{@value #ENV_MONITOR_CONFIG}</td><td>unset: classpath, then defaults</td></tr>
 * <tr><td>{@value #ENV_DETECTION_INTERVAL}</td><td>{@code 60000}</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    static final String ENV_BOOTSTRAP_SERVERS = "KAFKA_BOOTSTRAP_SERVERS";
    static final String ENV_INPUT_TOPIC = "KAFKA_INPUT_TOPIC";
    static final String ENV_ALERT_TOPIC = "KAFKA_ALERT_TOPIC";
    static final String ENV_GROUP_ID = "KAFKA_GROUP_ID";
    static final String ENV_PARALLELISM = "FLINK_PARALLELISM";
    static final String ENV_CHECKPOINT_INTERVAL = "FLINK_CHECKPOINT_INTERVAL_MS";
    static final String ENV_MONITOR_CONFIG = "MONITOR_CONFIG_PATH";
    static final String ENV_DETECTION_INTERVAL = "DETECTION_INTERVAL_MS";

    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final String monitorConfigPath;
    private final long detectionIntervalMs;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.monitorConfigPath = b.monitorConfigPath == null ? "" : b.monitorConfigPath;
        this.detectionIntervalMs = b.detectionIntervalMs;
    }

    /**
     * @return settings read from the process environment
     * @throws IllegalArgumentException if a variable is unparseable or a
     *                                  setting is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Read settings through {@code lookup}; blank values count as unset.
     */
    static JobConfig fromEnvironment(Function<String, String> lookup) {
        EnvReader env = new EnvReader(lookup);
        Builder builder = new Builder();
        env.text(ENV_BOOTSTRAP_SERVERS, builder::kafkaBootstrapServers);
        env.text(ENV_INPUT_TOPIC, builder::kafkaInputTopic);
        env.text(ENV_ALERT_TOPIC, builder::kafkaAlertTopic);
        env.text(ENV_GROUP_ID, builder::kafkaGroupId);
        env.number(ENV_PARALLELISM, v -> builder.parallelism(Math.toIntExact(v)));
        env.number(ENV_CHECKPOINT_INTERVAL, builder::checkpointIntervalMs);
        env.text(ENV_MONITOR_CONFIG, builder::monitorConfigPath);
        env.number(ENV_DETECTION_INTERVAL, builder::detectionIntervalMs);
        env.failOnErrors();
        return builder.build();
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return path of the monitor YAML, or empty to use classpath / defaults
     */
    public String getMonitorConfigPath() {
        return monitorConfigPath;
    }

    public long getDetectionIntervalMs() {
        return detectionIntervalMs;
    }

    @Override
    public String toString() {
        return "JobConfig{kafka=" + kafkaBootstrapServers
                + ", topics=" + kafkaInputTopic + " -> " + kafkaAlertTopic
                + ", group=" + kafkaGroupId
                + ", parallelism=" + parallelism
                + ", checkpointEvery=" + checkpointIntervalMs + "ms"
                + ", detectEvery=" + detectionIntervalMs + "ms"
                + ", monitorConfig='" + monitorConfigPath + "'}";
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder; {@link #build()} reports every invalid setting at once.
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "pipeline-executions";
        private String kafkaAlertTopic = "pipeline-alerts";
        private String kafkaGroupId = "pipeline-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String monitorConfigPath = "";
        private long detectionIntervalMs = 60_000;

        public Builder kafkaBootstrapServers(String servers) {
            this.kafkaBootstrapServers = servers;
            return this;
        }

        public Builder kafkaInputTopic(String topic) {
            this.kafkaInputTopic = topic;
            return this;
        }

        public Builder kafkaAlertTopic(String topic) {
            this.kafkaAlertTopic = topic;
            return this;
        }

        public Builder kafkaGroupId(String groupId) {
            this.kafkaGroupId = groupId;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder checkpointIntervalMs(long intervalMs) {
            this.checkpointIntervalMs = intervalMs;
            return this;
        }

        /** Blank or {@code null} means "not configured". */
        public Builder monitorConfigPath(String path) {
            this.monitorConfigPath = path;
            return this;
        }

        public Builder detectionIntervalMs(long intervalMs) {
            this.detectionIntervalMs = intervalMs;
            return this;
        }

        /**
         * @return the validated settings
         * @throws IllegalArgumentException listing every invalid setting
         */
        public JobConfig build() {
            List<String> errors = new ArrayList<>();
            for (String[] named : new String[][]{
                    {"kafkaBootstrapServers", kafkaBootstrapServers},
                    {"kafkaInputTopic", kafkaInputTopic},
                    {"kafkaAlertTopic", kafkaAlertTopic},
                    {"kafkaGroupId", kafkaGroupId}}) {
                if (named[1] == null || named[1].isBlank()) {
                    errors.add(named[0] + " must not be null or blank");
                }
            }
            if (parallelism < 1) {
                errors.add("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                errors.add("checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (detectionIntervalMs < 1) {
                errors.add("detectionIntervalMs must be >= 1, got: " + detectionIntervalMs);
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("Invalid job configuration: " + String.join("; ", errors));
            }
            return new JobConfig(this);
        }
    }

    /** Applies set variables to a builder, collecting parse failures. */
    private static final class EnvReader {

        private final Function<String, String> lookup;
        private final List<String> errors = new ArrayList<>();

        EnvReader(Function<String, String> lookup) {
            this.lookup = lookup;
        }

        void text(String name, Consumer<String> target) {
            String value = lookup.apply(name);
            if (value != null && !value.isBlank()) {
                target.accept(value.trim());
            }
        }

        void number(String name, LongConsumer target) {
            text(name, raw -> {
                try {
                    target.accept(Long.parseLong(raw));
                } catch (NumberFormatException | ArithmeticException e) {
                    errors.add(name + " is not a valid number: '" + raw + "'");
                }
            });
        }

        void failOnErrors() {
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("Invalid environment: " + String.join("; ", errors));
            }
        }
    }
}
