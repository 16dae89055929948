package com.pipelinesentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for Pipeline Sentinel.
 * <p>
 * Exposed through the cluster's configured metric reporters.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code events_applied_total} – events folded into an aggregate</li>
 *   <li>{@code events_duplicate_total} – re-delivered executions ignored</li>
 *   <li>{@code events_rejected_total} – malformed events dropped</li>
 *   <li>{@code alerts_emitted_total} – alerts sent after deduplication</li>
 *   <li>{@code apply_latency_ms} – histogram of per-event apply time</li>
 * </ul>
 */
public class MonitorMetrics {

    private final Counter eventsApplied;
    private final Counter eventsDuplicate;
    private final Counter eventsRejected;
    private final Counter alertsEmitted;
    private final Histogram applyLatency;

    public MonitorMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("pipeline_sentinel");

        this.eventsApplied = group.counter("events_applied_total");
        this.eventsDuplicate = group.counter("events_duplicate_total");
        this.eventsRejected = group.counter("events_rejected_total");
        this.alertsEmitted = group.counter("alerts_emitted_total");
        this.applyLatency = group.histogram("apply_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementApplied() {
        eventsApplied.inc();
    }

    public void incrementDuplicate() {
        eventsDuplicate.inc();
    }

    public void incrementRejected() {
        eventsRejected.inc();
    }

    public void addAlertsEmitted(int count) {
        alertsEmitted.inc(count);
    }

    public void recordApplyLatency(long milliseconds) {
        applyLatency.update(milliseconds);
    }
}
