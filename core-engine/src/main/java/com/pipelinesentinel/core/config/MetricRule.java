package com.pipelinesentinel.core.config;

import com.pipelinesentinel.core.model.HealthMetric;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outlier threshold settings for one {@link HealthMetric}.
 *
 * <p>
 * A pipeline crosses the threshold when its value lies more than
 * {@code sigmaMultiplier × σ} from the peer mean, on the metric's bad side.
 * When every peer shares the same value (σ = 0) and {@code fallbackStdDev}
 * is positive, the fallback is used in place of σ.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Metric key: "success_rate", "avg_duration" or "avg_records_processed". */
    private String metric;

    /** Number of standard deviations past the mean that triggers a crossing. */
    private double sigmaMultiplier;

    /** Substitute σ when the population has zero spread; 0 disables it. */
    private double fallbackStdDev;

    /** No-arg constructor required by SnakeYAML. */
    public MetricRule() {
    }

    public MetricRule(HealthMetric metric, double sigmaMultiplier, double fallbackStdDev) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null").getKey();
        this.sigmaMultiplier = sigmaMultiplier;
        this.fallbackStdDev = fallbackStdDev;
    }

    /**
     * Built-in rule for a metric: k=1 with a 0.05 fallback σ for success rate,
     * k=2 without fallback for the two averages.
     *
     * @param metric the metric
     * @return a new default rule
     */
    public static MetricRule defaultFor(HealthMetric metric) {
        return switch (metric) {
            case SUCCESS_RATE -> new MetricRule(metric, 1.0, 0.05);
            case AVG_DURATION, AVG_RECORDS_PROCESSED -> new MetricRule(metric, 2.0, 0.0);
        };
    }

    /**
     * Validate this rule.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (metric == null || metric.isBlank()) {
            errors.add("Metric rule 'metric' is required");
        } else {
            try {
                HealthMetric.fromKey(metric);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (!(sigmaMultiplier > 0)) {
            errors.add("Metric rule '" + metric + "' requires 'sigmaMultiplier' > 0");
        }
        if (!(fallbackStdDev >= 0)) {
            errors.add("Metric rule '" + metric + "' requires 'fallbackStdDev' >= 0");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid MetricRule: " + String.join("; ", errors));
        }
    }

    /**
     * @return the resolved metric
     * @throws IllegalArgumentException if the key is unknown
     */
    public HealthMetric healthMetric() {
        return HealthMetric.fromKey(metric);
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public double getSigmaMultiplier() {
        return sigmaMultiplier;
    }

    public void setSigmaMultiplier(double sigmaMultiplier) {
        this.sigmaMultiplier = sigmaMultiplier;
    }

    public double getFallbackStdDev() {
        return fallbackStdDev;
    }

    public void setFallbackStdDev(double fallbackStdDev) {
        this.fallbackStdDev = fallbackStdDev;
    }

    @Override
    public String toString() {
        return "MetricRule{" +
                "metric='" + metric + '\'' +
                ", sigmaMultiplier=" + sigmaMultiplier +
                ", fallbackStdDev=" + fallbackStdDev +
                '}';
    }
}
