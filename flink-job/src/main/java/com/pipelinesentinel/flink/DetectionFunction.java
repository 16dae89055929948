package com.pipelinesentinel.flink;

import com.pipelinesentinel.core.alerting.DetectionRun;
import com.pipelinesentinel.core.alerting.RoutedAlerts;
import com.pipelinesentinel.core.config.MonitorConfig;
import com.pipelinesentinel.core.model.PipelineHealth;
import org.apache.flink.api.common.state.MapState;
import org.apache.flink.api.common.state.MapStateDescriptor;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs peer anomaly detection on a processing-time schedule.
 *
 * <p>
 * The input is keyed by a single constant, so one task holds the latest
 * {@link PipelineHealth} of every pipeline in {@link MapState}. Because the
 * task is single-threaded, the list copied out at timer time is a consistent
 * snapshot: no update can land halfway through a detection pass.
 * </p>
 *
 * <p>
 * Each timer firing runs one {@link DetectionRun} and emits its
 * {@link RoutedAlerts} if any alert survived deduplication.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionFunction extends KeyedProcessFunction<String, PipelineHealth, RoutedAlerts> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DetectionFunction.class);

    /** Key every health update is routed under. */
    static final String GLOBAL_KEY = "all-pipelines";

    private final MonitorConfig config;
    private final long intervalMs;

    private transient MapState<String, PipelineHealth> latestHealth;
    private transient ValueState<Long> nextRunState;
    private transient DetectionRun detectionRun;
    private transient MonitorMetrics metrics;

    /**
     * @param config     detection thresholds
     * @param intervalMs time between detection passes; must be positive
     */
    public DetectionFunction(MonitorConfig config, long intervalMs) {
        this.config = Objects.requireNonNull(config, "MonitorConfig must not be null");
        if (intervalMs < 1) {
            throw new IllegalArgumentException("intervalMs must be >= 1, got: " + intervalMs);
        }
        this.intervalMs = intervalMs;
    }

    @Override
    public void open(Configuration parameters) {
        latestHealth = getRuntimeContext().getMapState(
                new MapStateDescriptor<>("latest-health", String.class, PipelineHealth.class));
        nextRunState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("next-detection-run", Long.class));
        detectionRun = DetectionRun.fromConfig(config);
        metrics = new MonitorMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("DetectionFunction opened with interval {} ms", intervalMs);
    }

    @Override
    public void processElement(PipelineHealth health,
            KeyedProcessFunction<String, PipelineHealth, RoutedAlerts>.Context ctx,
            Collector<RoutedAlerts> out) throws Exception {
        latestHealth.put(health.getPipelineId(), health);

        if (nextRunState.value() == null) {
            long now = ctx.timerService().currentProcessingTime();
            scheduleAfter(now, ctx);
            LOG.debug("First health update at {}, detection scheduled", now);
        }
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, PipelineHealth, RoutedAlerts>.OnTimerContext ctx,
            Collector<RoutedAlerts> out) throws Exception {
        List<PipelineHealth> snapshot = new ArrayList<>();
        for (PipelineHealth health : latestHealth.values()) {
            snapshot.add(health);
        }

        RoutedAlerts routed = detectionRun.run(snapshot, Instant.ofEpochMilli(timestamp));
        if (!routed.isEmpty()) {
            out.collect(routed);
            metrics.addAlertsEmitted(routed.size());
        }

        scheduleAfter(timestamp, ctx);
    }

    private void scheduleAfter(long from,
            KeyedProcessFunction<String, PipelineHealth, RoutedAlerts>.Context ctx) throws Exception {
        long next = from + intervalMs;
        ctx.timerService().registerProcessingTimeTimer(next);
        nextRunState.update(next);
    }
}
