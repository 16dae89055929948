package com.pipelinesentinel.core;

import com.pipelinesentinel.core.aggregation.AggregateStore;
import com.pipelinesentinel.core.aggregation.Aggregator;
import com.pipelinesentinel.core.aggregation.ApplyResult;
import com.pipelinesentinel.core.aggregation.ApplySummary;
import com.pipelinesentinel.core.alerting.DetectionRun;
import com.pipelinesentinel.core.alerting.RoutedAlerts;
import com.pipelinesentinel.core.config.MonitorConfig;
import com.pipelinesentinel.core.health.HealthReporter;
import com.pipelinesentinel.core.model.ExecutionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Entry point that wires the aggregate store, aggregator, health reporter
 * and detection pass together for embedded use.
 *
 * <pre>
 *   events → Aggregator → AggregateStore ─┬→ HealthReporter
 *                                         └→ snapshot → DetectionRun → RoutedAlerts
 * </pre>
 *
 * <p>
 * Safe for concurrent use: applies to different pipelines proceed in
 * parallel, and every detection pass reads one consistent snapshot.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(HealthMonitor.class);

    private final AggregateStore store;
    private final Aggregator aggregator;
    private final HealthReporter reporter;
    private final DetectionRun detectionRun;

    /**
     * @param config validated monitor configuration
     */
    public HealthMonitor(MonitorConfig config) {
        Objects.requireNonNull(config, "MonitorConfig must not be null");
        config.validate();
        this.store = AggregateStore.fromConfig(config);
        this.aggregator = new Aggregator(store);
        this.reporter = new HealthReporter(store);
        this.detectionRun = DetectionRun.fromConfig(config);
        LOG.info("Health monitor started with {} shard(s)", store.getShardCount());
    }

    /**
     * @see Aggregator#apply(ExecutionEvent)
     */
    public ApplyResult apply(ExecutionEvent event) {
        return aggregator.apply(event);
    }

    /**
     * @see Aggregator#applyAll(Iterable)
     */
    public ApplySummary applyAll(Iterable<ExecutionEvent> events) {
        return aggregator.applyAll(events);
    }

    /**
     * Run every detector over a fresh snapshot of the store.
     *
     * @param detectedAt timestamp stamped on the resulting alerts
     * @return routed, deduplicated alerts
     */
    public RoutedAlerts detect(Instant detectedAt) {
        return detectionRun.run(store.snapshot(), detectedAt);
    }

    public HealthReporter reporter() {
        return reporter;
    }
}
