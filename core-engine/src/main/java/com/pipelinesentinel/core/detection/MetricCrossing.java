package com.pipelinesentinel.core.detection;

import com.pipelinesentinel.core.model.HealthMetric;

import java.util.Objects;

/**
 * One pipeline found past the outlier threshold for one metric in a
 * detector pass. Not persisted.
 *
 * @since 1.0.0
 */
public final class MetricCrossing {

    private final String pipelineId;
    private final String team;
    private final HealthMetric metric;
    private final double observed;
    private final double peerMean;
    private final double peerStdDev;
    private final double effectiveStdDev;
    private final double sigmaMultiplier;

    /**
     * @param peerStdDev      σ measured across the peers
     * @param effectiveStdDev σ the threshold was computed with (the fallback
     *                        when the measured σ was zero)
     * @param sigmaMultiplier trigger multiplier k
     */
    public MetricCrossing(String pipelineId, String team, HealthMetric metric, double observed,
            double peerMean, double peerStdDev, double effectiveStdDev, double sigmaMultiplier) {
        this.pipelineId = Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        this.team = Objects.requireNonNull(team, "team must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.observed = observed;
        this.peerMean = peerMean;
        this.peerStdDev = peerStdDev;
        this.effectiveStdDev = effectiveStdDev;
        this.sigmaMultiplier = sigmaMultiplier;
    }

    /**
     * @return distance from the peer mean in units of the effective σ
     */
    public double deviationInSigmas() {
        return Math.abs(observed - peerMean) / effectiveStdDev;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public String getTeam() {
        return team;
    }

    public HealthMetric getMetric() {
        return metric;
    }

    public double getObserved() {
        return observed;
    }

    public double getPeerMean() {
        return peerMean;
    }

    public double getPeerStdDev() {
        return peerStdDev;
    }

    public double getEffectiveStdDev() {
        return effectiveStdDev;
    }

    public double getSigmaMultiplier() {
        return sigmaMultiplier;
    }

    @Override
    public String toString() {
        return "MetricCrossing{" +
                "pipelineId='" + pipelineId + '\'' +
                ", metric=" + metric +
                ", observed=" + observed +
                ", peerMean=" + peerMean +
                ", peerStdDev=" + peerStdDev +
                ", effectiveStdDev=" + effectiveStdDev +
                '}';
    }
}
