package com.pipelinesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable point-in-time view of one pipeline's running aggregate.
 *
 * <p>
 * Instances are produced by the aggregate store and never change after
 * construction, so they can be shared across threads and compared freely.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineHealth implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String pipelineId;
    private final String team;
    private final long totalCount;
    private final long successCount;
    private final long failedCount;
    private final double avgDuration;
    private final double avgRecordsProcessed;
    private final Instant lastExecutionTime;

    public PipelineHealth(String pipelineId,
            String team,
            long successCount,
            long failedCount,
            double avgDuration,
            double avgRecordsProcessed,
            Instant lastExecutionTime) {
        this.pipelineId = Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        this.team = Objects.requireNonNull(team, "team must not be null");
        this.successCount = successCount;
        this.failedCount = failedCount;
        this.totalCount = successCount + failedCount;
        this.avgDuration = avgDuration;
        this.avgRecordsProcessed = avgRecordsProcessed;
        this.lastExecutionTime = lastExecutionTime;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public String getTeam() {
        return team;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public long getSuccessCount() {
        return successCount;
    }

    public long getFailedCount() {
        return failedCount;
    }

    /**
     * @return success ratio in [0, 1], or empty ("no data") when no run has
     *         been recorded
     */
    public OptionalDouble getSuccessRate() {
        return totalCount == 0
                ? OptionalDouble.empty()
                : OptionalDouble.of((double) successCount / totalCount);
    }

    /** Mean duration in seconds. */
    public double getAvgDuration() {
        return avgDuration;
    }

    public double getAvgRecordsProcessed() {
        return avgRecordsProcessed;
    }

    /**
     * @return newest execution timestamp seen, or {@code null} if none
     */
    public Instant getLastExecutionTime() {
        return lastExecutionTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PipelineHealth that))
            return false;
        return successCount == that.successCount
                && failedCount == that.failedCount
                && Double.compare(avgDuration, that.avgDuration) == 0
                && Double.compare(avgRecordsProcessed, that.avgRecordsProcessed) == 0
                && pipelineId.equals(that.pipelineId)
                && team.equals(that.team)
                && Objects.equals(lastExecutionTime, that.lastExecutionTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pipelineId, team, successCount, failedCount,
                avgDuration, avgRecordsProcessed, lastExecutionTime);
    }

    @Override
    public String toString() {
        return "PipelineHealth{" +
                "pipelineId='" + pipelineId + '\'' +
                ", team='" + team + '\'' +
                ", totalCount=" + totalCount +
                ", successCount=" + successCount +
                ", failedCount=" + failedCount +
                ", avgDuration=" + avgDuration +
                ", avgRecordsProcessed=" + avgRecordsProcessed +
                ", lastExecutionTime=" + lastExecutionTime +
                '}';
    }
}
