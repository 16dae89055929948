package com.pipelinesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Per-pipeline metrics compared across the peer population.
 *
 * <p>
 * Each metric knows which direction is bad: a low success rate, a high
 * average duration, or a low average record count.
 * </p>
 *
 * @since 1.0.0
 */
public enum HealthMetric {

    SUCCESS_RATE("success_rate", "low success rate", false),
    AVG_DURATION("avg_duration", "high average duration", true),
    AVG_RECORDS_PROCESSED("avg_records_processed", "low average records processed", false);

    private final String key;
    private final String label;
    private final boolean highIsBad;

    HealthMetric(String key, String label, boolean highIsBad) {
        this.key = key;
        this.label = label;
        this.highIsBad = highIsBad;
    }

    /**
     * @return configuration / wire name, e.g. {@code success_rate}
     */
    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * @return human-readable description of the bad direction
     */
    public String getLabel() {
        return label;
    }

    public boolean isHighBad() {
        return highIsBad;
    }

    /**
     * Read this metric from a pipeline snapshot.
     *
     * @param health snapshot to read
     * @return the value, or empty when the pipeline has no executions yet
     */
    public OptionalDouble valueOf(PipelineHealth health) {
        if (health.getTotalCount() == 0) {
            return OptionalDouble.empty();
        }
        return switch (this) {
            case SUCCESS_RATE -> health.getSuccessRate();
            case AVG_DURATION -> OptionalDouble.of(health.getAvgDuration());
            case AVG_RECORDS_PROCESSED -> OptionalDouble.of(health.getAvgRecordsProcessed());
        };
    }

    /**
     * Resolve a metric from its configuration key (case-insensitive).
     *
     * @param key metric key such as {@code avg_duration}
     * @return matching metric
     * @throws IllegalArgumentException if the key is unknown
     */
    public static HealthMetric fromKey(String key) {
        if (key != null) {
            String normalised = key.trim().toLowerCase(Locale.ROOT);
            for (HealthMetric metric : values()) {
                if (metric.key.equals(normalised)) {
                    return metric;
                }
            }
        }
        throw new IllegalArgumentException("Unknown metric: '" + key
                + "'. Supported: success_rate, avg_duration, avg_records_processed");
    }

    @Override
    public String toString() {
        return key;
    }
}
