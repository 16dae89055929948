package com.pipelinesentinel.core.detection;

import com.pipelinesentinel.core.config.MetricRule;
import com.pipelinesentinel.core.model.HealthMetric;
import com.pipelinesentinel.core.model.PipelineHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Flags pipelines whose metric lies more than {@code k × σ} from the peer
 * mean, on the metric's bad side.
 *
 * <h3>Peer population</h3>
 * <p>
 * Pipelines with fewer than {@code minExecutions} runs are left out before
 * μ and σ are computed. If fewer than {@code minPeerPopulation} remain, the
 * pass is skipped and returns nothing.
 * </p>
 *
 * <h3>Zero spread</h3>
 * <p>
 * When every peer has the same value, σ is 0. If the rule defines a
 * positive {@code fallbackStdDev}, that value stands in for σ; otherwise
 * the threshold collapses onto the mean and, since no value lies strictly
 * past it, nothing is flagged.
 * </p>
 *
 * @since 1.0.0
 */
public class PeerOutlierDetector implements AnomalyDetector {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(PeerOutlierDetector.class);

    private final HealthMetric metric;
    private final double sigmaMultiplier;
    private final double fallbackStdDev;
    private final int minPeerPopulation;
    private final int minExecutions;

    /**
     * @param rule              threshold settings; must be valid
     * @param minPeerPopulation fewest peers needed, at least 2
     * @param minExecutions     fewest runs a pipeline needs to be a peer, at
     *                          least 1
     * @throws IllegalArgumentException if a value is out of range
     */
    public PeerOutlierDetector(MetricRule rule, int minPeerPopulation, int minExecutions) {
        Objects.requireNonNull(rule, "MetricRule must not be null");
        this.metric = rule.healthMetric();
        this.sigmaMultiplier = rule.getSigmaMultiplier();
        this.fallbackStdDev = rule.getFallbackStdDev();
        this.minPeerPopulation = minPeerPopulation;
        this.minExecutions = minExecutions;

        if (!(sigmaMultiplier > 0)) {
            throw new IllegalArgumentException(
                    "sigmaMultiplier must be > 0 for metric '" + metric + "', got: " + sigmaMultiplier);
        }
        if (!(fallbackStdDev >= 0)) {
            throw new IllegalArgumentException(
                    "fallbackStdDev must be >= 0 for metric '" + metric + "', got: " + fallbackStdDev);
        }
        if (minPeerPopulation < 2) {
            throw new IllegalArgumentException("minPeerPopulation must be >= 2, got: " + minPeerPopulation);
        }
        if (minExecutions < 1) {
            throw new IllegalArgumentException("minExecutions must be >= 1, got: " + minExecutions);
        }
    }

    @Override
    public List<MetricCrossing> detect(List<PipelineHealth> snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");

        List<PipelineHealth> peers = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        PeerStatistics stats = new PeerStatistics();
        for (PipelineHealth health : snapshot) {
            if (health.getTotalCount() < minExecutions) {
                continue;
            }
            OptionalDouble value = metric.valueOf(health);
            if (value.isEmpty() || !Double.isFinite(value.getAsDouble())) {
                LOG.trace("Metric [{}]: pipeline '{}' has no usable value – skipping",
                        metric, health.getPipelineId());
                continue;
            }
            peers.add(health);
            values.add(value.getAsDouble());
            stats.add(value.getAsDouble());
        }

        if (peers.size() < minPeerPopulation) {
            LOG.debug("Metric [{}]: {} peer(s) below minimum population {} – skipping",
                    metric, peers.size(), minPeerPopulation);
            return Collections.emptyList();
        }

        double mean = stats.getMean();
        double stdDev = stats.getStdDev();
        double effectiveStdDev = stdDev == 0 && fallbackStdDev > 0 ? fallbackStdDev : stdDev;
        double allowedDeviation = sigmaMultiplier * effectiveStdDev;
        double threshold = metric.isHighBad() ? mean + allowedDeviation : mean - allowedDeviation;

        List<MetricCrossing> crossings = new ArrayList<>();
        for (int i = 0; i < peers.size(); i++) {
            double value = values.get(i);
            boolean crossed = metric.isHighBad() ? value > threshold : value < threshold;
            if (!crossed) {
                continue;
            }
            PipelineHealth health = peers.get(i);
            LOG.debug("Metric [{}] fired for '{}': value={} mean={} stddev={} threshold={}",
                    metric, health.getPipelineId(), value, mean, effectiveStdDev, threshold);
            crossings.add(new MetricCrossing(health.getPipelineId(), health.getTeam(), metric,
                    value, mean, stdDev, effectiveStdDev, sigmaMultiplier));
        }
        return crossings;
    }

    @Override
    public HealthMetric getMetric() {
        return metric;
    }

    public double getSigmaMultiplier() {
        return sigmaMultiplier;
    }

    public double getFallbackStdDev() {
        return fallbackStdDev;
    }
}
