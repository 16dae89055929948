package com.pipelinesentinel.core.config;

import com.pipelinesentinel.core.model.HealthMetric;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level POJO for the monitor YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional):
 * </p>
 *
 * <pre>
 * shardCount: 16
 * trackedExecutionIds: 100000
 * historyCapacity: 0
 * minPeerPopulation: 2
 * minExecutions: 1
 * highDelta: 1.0
 * metrics:
 *   - metric: success_rate
 *     sigmaMultiplier: 1.0
 *     fallbackStdDev: 0.05
 *   - metric: avg_duration
 *     sigmaMultiplier: 2.0
 * </pre>
 *
 * <p>
 * Metrics missing from {@code metrics} use {@link MetricRule#defaultFor}.
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Aggregation ---
    /** Number of single-writer partitions in the aggregate store. */
    private int shardCount = 16;

    /** Execution ids remembered per pipeline for duplicate detection. */
    private int trackedExecutionIds = 100_000;

    /** Recent runs kept per pipeline for trend queries; 0 disables history. */
    private int historyCapacity = 0;

    // --- Detection ---
    /** Fewest peers a metric needs before outliers are looked for. */
    private int minPeerPopulation = 2;

    /** Fewest executions a pipeline needs to join the peer population. */
    private int minExecutions = 1;

    /** Width, in σ, of each severity band past the trigger threshold. */
    private double highDelta = 1.0;

    private List<MetricRule> metrics = new ArrayList<>();

    /**
     * @return a configuration with every default applied
     */
    public static MonitorConfig defaults() {
        return new MonitorConfig();
    }

    /**
     * Validate every setting and every metric rule, reporting all problems in
     * a single exception.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (shardCount < 1) {
            errors.add("'shardCount' must be >= 1, got: " + shardCount);
        }
        if (trackedExecutionIds < 1) {
            errors.add("'trackedExecutionIds' must be >= 1, got: " + trackedExecutionIds);
        }
        if (historyCapacity < 0) {
            errors.add("'historyCapacity' must be >= 0, got: " + historyCapacity);
        }
        if (minPeerPopulation < 2) {
            errors.add("'minPeerPopulation' must be >= 2, got: " + minPeerPopulation);
        }
        if (minExecutions < 1) {
            errors.add("'minExecutions' must be >= 1, got: " + minExecutions);
        }
        if (!(highDelta > 0)) {
            errors.add("'highDelta' must be > 0, got: " + highDelta);
        }

        List<String> seen = new ArrayList<>();
        for (int i = 0; i < metrics.size(); i++) {
            MetricRule rule = metrics.get(i);
            if (rule == null) {
                errors.add("Metric rule at index " + i + " is empty");
                continue;
            }
            try {
                rule.validate();
                String key = rule.healthMetric().getKey();
                if (seen.contains(key)) {
                    errors.add("Duplicate metric rule for '" + key + "'");
                }
                seen.add(key);
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Monitor configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Resolve the effective rule for each metric, configured or default.
     *
     * @return rules keyed by metric, in {@link HealthMetric} declaration order
     */
    public Map<HealthMetric, MetricRule> effectiveRules() {
        Map<HealthMetric, MetricRule> rules = new EnumMap<>(HealthMetric.class);
        for (HealthMetric metric : HealthMetric.values()) {
            rules.put(metric, MetricRule.defaultFor(metric));
        }
        for (MetricRule rule : metrics) {
            rules.put(rule.healthMetric(), rule);
        }
        return rules;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getShardCount() {
        return shardCount;
    }

    public void setShardCount(int shardCount) {
        this.shardCount = shardCount;
    }

    public int getTrackedExecutionIds() {
        return trackedExecutionIds;
    }

    public void setTrackedExecutionIds(int trackedExecutionIds) {
        this.trackedExecutionIds = trackedExecutionIds;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public int getMinPeerPopulation() {
        return minPeerPopulation;
    }

    public void setMinPeerPopulation(int minPeerPopulation) {
        this.minPeerPopulation = minPeerPopulation;
    }

    public int getMinExecutions() {
        return minExecutions;
    }

    public void setMinExecutions(int minExecutions) {
        this.minExecutions = minExecutions;
    }

    public double getHighDelta() {
        return highDelta;
    }

    public void setHighDelta(double highDelta) {
        this.highDelta = highDelta;
    }

    /**
     * @return unmodifiable list of configured metric rules
     */
    public List<MetricRule> getMetrics() {
        return Collections.unmodifiableList(metrics);
    }

    public void setMetrics(List<MetricRule> metrics) {
        this.metrics = metrics != null ? new ArrayList<>(metrics) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "shardCount=" + shardCount +
                ", trackedExecutionIds=" + trackedExecutionIds +
                ", historyCapacity=" + historyCapacity +
                ", minPeerPopulation=" + minPeerPopulation +
                ", minExecutions=" + minExecutions +
                ", highDelta=" + highDelta +
                ", metrics=" + metrics +
                '}';
    }
}
