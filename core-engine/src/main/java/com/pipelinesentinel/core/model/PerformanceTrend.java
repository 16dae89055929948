package com.pipelinesentinel.core.model;

import java.io.Serializable;

/**
 * Summary of a pipeline's recent runs inside a look-back window.
 *
 * <p>
 * Built from the bounded execution history, so it only covers as many runs
 * as the history retains.
 * </p>
 *
 * @since 1.0.0
 */
public final class PerformanceTrend implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String pipelineId;
    private final int executions;
    private final double successRate;
    private final double avgDuration;
    private final double minDuration;
    private final double maxDuration;

    public PerformanceTrend(String pipelineId, int executions, double successRate,
            double avgDuration, double minDuration, double maxDuration) {
        this.pipelineId = pipelineId;
        this.executions = executions;
        this.successRate = successRate;
        this.avgDuration = avgDuration;
        this.minDuration = minDuration;
        this.maxDuration = maxDuration;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public int getExecutions() {
        return executions;
    }

    public double getSuccessRate() {
        return successRate;
    }

    public double getAvgDuration() {
        return avgDuration;
    }

    public double getMinDuration() {
        return minDuration;
    }

    public double getMaxDuration() {
        return maxDuration;
    }

    @Override
    public String toString() {
        return "PerformanceTrend{" +
                "pipelineId='" + pipelineId + '\'' +
                ", executions=" + executions +
                ", successRate=" + successRate +
                ", avgDuration=" + avgDuration +
                ", minDuration=" + minDuration +
                ", maxDuration=" + maxDuration +
                '}';
    }
}
