package com.pipelinesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Health of every pipeline owned by one team, rolled up.
 *
 * <p>
 * Averages are weighted by each pipeline's execution count, so a busy
 * pipeline counts for more than one that ran once. Never cached: build a
 * fresh instance from a snapshot each time it is requested.
 * </p>
 *
 * @since 1.0.0
 */
public final class TeamHealth implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String team;
    private final int pipelineCount;
    private final long totalCount;
    private final long successCount;
    private final long failedCount;
    private final double avgDuration;
    private final double avgRecordsProcessed;
    private final Instant lastExecutionTime;

    private TeamHealth(String team, int pipelineCount, long successCount, long failedCount,
            double avgDuration, double avgRecordsProcessed, Instant lastExecutionTime) {
        this.team = team;
        this.pipelineCount = pipelineCount;
        this.successCount = successCount;
        this.failedCount = failedCount;
        this.totalCount = successCount + failedCount;
        this.avgDuration = avgDuration;
        this.avgRecordsProcessed = avgRecordsProcessed;
        this.lastExecutionTime = lastExecutionTime;
    }

    /**
     * Roll up the given pipelines, all of which must belong to {@code team}.
     *
     * @param team      owning team
     * @param pipelines snapshots of the team's pipelines; must not be empty
     * @return the combined view
     * @throws IllegalArgumentException if {@code pipelines} is empty or holds
     *                                  another team's pipeline
     */
    public static TeamHealth of(String team, Iterable<PipelineHealth> pipelines) {
        Objects.requireNonNull(team, "team must not be null");
        int pipelineCount = 0;
        long success = 0;
        long failed = 0;
        double weightedDuration = 0;
        double weightedRecords = 0;
        Instant last = null;

        for (PipelineHealth p : pipelines) {
            if (!team.equals(p.getTeam())) {
                throw new IllegalArgumentException("Pipeline '" + p.getPipelineId()
                        + "' belongs to team '" + p.getTeam() + "', not '" + team + "'");
            }
            pipelineCount++;
            success += p.getSuccessCount();
            failed += p.getFailedCount();
            weightedDuration += p.getTotalCount() * p.getAvgDuration();
            weightedRecords += p.getTotalCount() * p.getAvgRecordsProcessed();
            Instant t = p.getLastExecutionTime();
            if (t != null && (last == null || t.isAfter(last))) {
                last = t;
            }
        }
        if (pipelineCount == 0) {
            throw new IllegalArgumentException("Team '" + team + "' has no pipelines");
        }

        long total = success + failed;
        double avgDuration = total == 0 ? 0 : weightedDuration / total;
        double avgRecords = total == 0 ? 0 : weightedRecords / total;
        return new TeamHealth(team, pipelineCount, success, failed, avgDuration, avgRecords, last);
    }

    public String getTeam() {
        return team;
    }

    public int getPipelineCount() {
        return pipelineCount;
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
     * @return overall success ratio in [0, 1], or empty when the team has no
     *         recorded runs
     */
    public OptionalDouble getSuccessRate() {
        return totalCount == 0
                ? OptionalDouble.empty()
                : OptionalDouble.of((double) successCount / totalCount);
    }

    /** Count-weighted mean duration in seconds. */
    public double getAvgDuration() {
        return avgDuration;
    }

    /** Count-weighted mean records processed. */
    public double getAvgRecordsProcessed() {
        return avgRecordsProcessed;
    }

    public Instant getLastExecutionTime() {
        return lastExecutionTime;
    }

    @Override
    public String toString() {
        return "TeamHealth{" +
                "team='" + team + '\'' +
                ", pipelineCount=" + pipelineCount +
                ", totalCount=" + totalCount +
                ", successCount=" + successCount +
                ", failedCount=" + failedCount +
                ", avgDuration=" + avgDuration +
                ", avgRecordsProcessed=" + avgRecordsProcessed +
                '}';
    }
}
