package com.pipelinesentinel.flink;

import com.pipelinesentinel.core.alerting.RoutedAlerts;
import com.pipelinesentinel.core.config.MonitorConfig;
import com.pipelinesentinel.core.config.MonitorConfigLoader;
import com.pipelinesentinel.core.model.ExecutionEvent;
import com.pipelinesentinel.core.model.PipelineHealth;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the Pipeline Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (execution events topic)
 *     → Deserialize JSON → ExecutionEvent
 *     → Key by pipeline_id
 *     → AggregationFunction (one writer per pipeline, emits PipelineHealth)
 *     → Key by a single constant
 *     → DetectionFunction (timer-driven peer detection, emits RoutedAlerts)
 *     → Serialize RoutedAlerts → JSON
 *     → Kafka (alerts topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings come from environment variables via {@link JobConfig};
 * detection thresholds from the monitor YAML via {@link MonitorConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(PipelineSentinelJob.class);

        private PipelineSentinelJob() {
                // entry-point class: not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Pipeline Sentinel with config: {}", config);

                // 2. Load detection thresholds
                MonitorConfig monitorConfig = loadMonitorConfig(config);

                // 3. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                // Health snapshots and alerts are immutable once emitted
                env.getConfig().enableObjectReuse();
                configureCheckpointing(env, config);

                // 4. Build pipeline
                buildPipeline(env, config, monitorConfig);

                // 5. Execute
                env.execute("Pipeline Sentinel – Pipeline Health Monitoring");
        }

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        MonitorConfig monitorConfig) {
                KafkaSource<ExecutionEvent> kafkaSource = KafkaSource.<ExecutionEvent>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new ExecutionEventDeserializationSchema())
                                .build();

                DataStream<ExecutionEvent> events = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-execution-events-source");

                // Missing pipeline ids key to "" and are rejected by validation downstream
                DataStream<PipelineHealth> health = events
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(event -> Objects.requireNonNullElse(event.getPipelineId(), ""))
                                .process(new AggregationFunction(monitorConfig))
                                .name("pipeline-aggregation");

                DataStream<RoutedAlerts> alerts = health
                                .keyBy(h -> DetectionFunction.GLOBAL_KEY)
                                .process(new DetectionFunction(monitorConfig, config.getDetectionIntervalMs()))
                                .setParallelism(1)
                                .name("peer-anomaly-detection");

                KafkaSink<RoutedAlerts> kafkaSink = KafkaSink.<RoutedAlerts>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaAlertTopic())
                                                                .setValueSerializationSchema(
                                                                                new RoutedAlertsSerializationSchema())
                                                                .build())
                                .build();

                alerts.sinkTo(kafkaSink).setParallelism(1).name("kafka-alerts-sink");
        }

        private static MonitorConfig loadMonitorConfig(JobConfig config) {
                String path = config.getMonitorConfigPath();
                if (path != null && !path.isBlank()) {
                        return MonitorConfigLoader.fromFile(path);
                }
                return MonitorConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // Retain checkpoints on cancellation so aggregates can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
