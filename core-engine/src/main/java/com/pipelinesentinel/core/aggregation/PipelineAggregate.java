package com.pipelinesentinel.core.aggregation;

import com.pipelinesentinel.core.model.ExecutionEvent;
import com.pipelinesentinel.core.model.ExecutionStatus;
import com.pipelinesentinel.core.model.PipelineHealth;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Running statistics for one pipeline.
 *
 * <p>
 * Means are maintained incrementally ({@code mean += (x - mean) / n}), so
 * each update costs O(1) no matter how many runs came before. Applied
 * execution ids are remembered in insertion order up to a fixed capacity;
 * once full, the oldest id is forgotten first.
 * </p>
 *
 * <p>
 * An optional bounded history of recent runs feeds trend queries. It is
 * off when {@code historyCapacity} is 0 and never replaces the running
 * means.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. The
 * {@link AggregateStore} serializes access per shard; in the Flink job each
 * instance lives in keyed state and is touched by one task only.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineAggregate implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String pipelineId;
    private final String team;

    private long successCount;
    private long failedCount;
    private double avgDuration;
    private double avgRecordsProcessed;
    private Instant lastExecutionTime;

    private final int trackedIdCapacity;
    private final Set<String> appliedExecutionIds = new LinkedHashSet<>();

    private final int historyCapacity;
    private final Deque<ExecutionSample> history = new ArrayDeque<>();

    /**
     * @param pipelineId        pipeline identifier; must not be {@code null}
     * @param team              owning team; must not be {@code null}
     * @param trackedIdCapacity execution ids remembered for duplicate checks
     * @param historyCapacity   recent runs kept for trends, 0 to disable
     * @throws IllegalArgumentException if a capacity is out of range
     */
    public PipelineAggregate(String pipelineId, String team, int trackedIdCapacity, int historyCapacity) {
        this.pipelineId = Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        this.team = Objects.requireNonNull(team, "team must not be null");
        if (trackedIdCapacity < 1) {
            throw new IllegalArgumentException("trackedIdCapacity must be >= 1, got: " + trackedIdCapacity);
        }
        if (historyCapacity < 0) {
            throw new IllegalArgumentException("historyCapacity must be >= 0, got: " + historyCapacity);
        }
        this.trackedIdCapacity = trackedIdCapacity;
        this.historyCapacity = historyCapacity;
    }

    /**
     * Fold a validated event into this aggregate.
     *
     * <p>
     * An event whose timestamp is older than the newest one seen still
     * counts towards totals and means but leaves
     * {@link #getLastExecutionTime()} untouched.
     * </p>
     *
     * @param event a validated event for this pipeline
     * @return {@link ApplyResult#DUPLICATE} if the execution id was seen
     *         before, {@link ApplyResult#APPLIED} otherwise
     * @throws IllegalArgumentException if the event targets another pipeline
     */
    public ApplyResult apply(ExecutionEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        if (!pipelineId.equals(event.getPipelineId())) {
            throw new IllegalArgumentException("Event for pipeline '" + event.getPipelineId()
                    + "' cannot be applied to aggregate of '" + pipelineId + "'");
        }
        if (appliedExecutionIds.contains(event.getExecutionId())) {
            return ApplyResult.DUPLICATE;
        }
        rememberExecutionId(event.getExecutionId());

        boolean success = event.getStatus() == ExecutionStatus.SUCCESS;
        if (success) {
            successCount++;
        } else {
            failedCount++;
        }

        long n = getTotalCount();
        double duration = event.getDuration();
        avgDuration += (duration - avgDuration) / n;
        avgRecordsProcessed += (event.getRecordsProcessed() - avgRecordsProcessed) / n;

        Instant timestamp = event.getTimestamp();
        if (lastExecutionTime == null || timestamp.isAfter(lastExecutionTime)) {
            lastExecutionTime = timestamp;
        }

        if (historyCapacity > 0) {
            history.addLast(new ExecutionSample(timestamp, success, duration));
            if (history.size() > historyCapacity) {
                history.pollFirst();
            }
        }
        return ApplyResult.APPLIED;
    }

    private void rememberExecutionId(String executionId) {
        appliedExecutionIds.add(executionId);
        if (appliedExecutionIds.size() > trackedIdCapacity) {
            Iterator<String> oldest = appliedExecutionIds.iterator();
            oldest.next();
            oldest.remove();
        }
    }

    /**
     * @return an immutable copy of the current statistics
     */
    public PipelineHealth snapshot() {
        return new PipelineHealth(pipelineId, team, successCount, failedCount,
                avgDuration, avgRecordsProcessed, lastExecutionTime);
    }

    /**
     * @return copy of the retained recent runs, oldest first
     */
    public List<ExecutionSample> recentExecutions() {
        return new ArrayList<>(history);
    }

    public boolean isHistoryEnabled() {
        return historyCapacity > 0;
    }

    public boolean hasApplied(String executionId) {
        return appliedExecutionIds.contains(executionId);
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public String getTeam() {
        return team;
    }

    public long getTotalCount() {
        return successCount + failedCount;
    }

    public Instant getLastExecutionTime() {
        return lastExecutionTime;
    }

    @Override
    public String toString() {
        return "PipelineAggregate{" +
                "pipelineId='" + pipelineId + '\'' +
                ", team='" + team + '\'' +
                ", successCount=" + successCount +
                ", failedCount=" + failedCount +
                ", avgDuration=" + avgDuration +
                ", avgRecordsProcessed=" + avgRecordsProcessed +
                ", lastExecutionTime=" + lastExecutionTime +
                '}';
    }
}
