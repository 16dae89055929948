package com.pipelinesentinel.core.health;

import com.pipelinesentinel.core.aggregation.AggregateStore;
import com.pipelinesentinel.core.aggregation.ExecutionSample;
import com.pipelinesentinel.core.model.PerformanceTrend;
import com.pipelinesentinel.core.model.PipelineHealth;
import com.pipelinesentinel.core.model.TeamHealth;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only queries over the {@link AggregateStore}.
 *
 * <p>
 * Multi-pipeline queries work on one consistent store snapshot. Team views
 * are rebuilt on every call and never cached.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthReporter {

    private final AggregateStore store;

    public HealthReporter(AggregateStore store) {
        this.store = Objects.requireNonNull(store, "AggregateStore must not be null");
    }

    /**
     * @param pipelineId pipeline identifier
     * @return current snapshot of the pipeline
     * @throws PipelineNotFoundException if the pipeline never received an
     *                                   event
     */
    public PipelineHealth getPipelineHealth(String pipelineId) {
        Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        return store.find(pipelineId).orElseThrow(() -> new PipelineNotFoundException(pipelineId));
    }

    /**
     * Every pipeline's health as a lazy, restartable sequence.
     *
     * <p>
     * Nothing is read until iteration starts; each new iterator takes its
     * own consistent snapshot. Order is unspecified.
     * </p>
     *
     * @return iterable over pipeline snapshots
     */
    public Iterable<PipelineHealth> getAllHealth() {
        return () -> store.snapshot().iterator();
    }

    /**
     * Roll up all pipelines owned by {@code team}, weighting averages by
     * execution count.
     *
     * @param team team name
     * @return the team view
     * @throws TeamNotFoundException if no pipeline belongs to the team
     */
    public TeamHealth getTeamHealth(String team) {
        Objects.requireNonNull(team, "team must not be null");
        List<PipelineHealth> owned = new ArrayList<>();
        for (PipelineHealth health : store.snapshot()) {
            if (team.equals(health.getTeam())) {
                owned.add(health);
            }
        }
        if (owned.isEmpty()) {
            throw new TeamNotFoundException(team);
        }
        return TeamHealth.of(team, owned);
    }

    /**
     * Team views for every team, taken from a single snapshot.
     *
     * @return team views keyed by team name, in no particular order
     */
    public Map<String, TeamHealth> getAllTeamHealth() {
        Map<String, List<PipelineHealth>> byTeam = new LinkedHashMap<>();
        for (PipelineHealth health : store.snapshot()) {
            byTeam.computeIfAbsent(health.getTeam(), t -> new ArrayList<>()).add(health);
        }
        Map<String, TeamHealth> result = new LinkedHashMap<>();
        byTeam.forEach((team, pipelines) -> result.put(team, TeamHealth.of(team, pipelines)));
        return result;
    }

    /**
     * @return number of executions applied across all pipelines
     */
    public long getTotalExecutions() {
        long total = 0;
        for (PipelineHealth health : store.snapshot()) {
            total += health.getTotalCount();
        }
        return total;
    }

    /**
     * Summarise a pipeline's retained runs that started within
     * {@code window} before {@code now}.
     *
     * @param pipelineId pipeline identifier
     * @param window     look-back window; must be positive
     * @param now        reference instant
     * @return the trend, or empty if no retained run falls in the window
     * @throws PipelineNotFoundException if the pipeline is unknown
     * @throws IllegalStateException     if execution history is disabled
     */
    public Optional<PerformanceTrend> getPerformanceTrend(String pipelineId, Duration window, Instant now) {
        Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
        if (!store.isHistoryEnabled()) {
            throw new IllegalStateException(
                    "Execution history is disabled; set 'historyCapacity' > 0 to query trends");
        }

        List<ExecutionSample> samples = store.recentExecutions(pipelineId)
                .orElseThrow(() -> new PipelineNotFoundException(pipelineId));

        Instant cutoff = now.minus(window);
        int count = 0;
        int successes = 0;
        double durationSum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (ExecutionSample sample : samples) {
            if (sample.getTimestamp().isBefore(cutoff)) {
                continue;
            }
            count++;
            if (sample.isSuccess()) {
                successes++;
            }
            durationSum += sample.getDuration();
            min = Math.min(min, sample.getDuration());
            max = Math.max(max, sample.getDuration());
        }
        if (count == 0) {
            return Optional.empty();
        }
        return Optional.of(new PerformanceTrend(pipelineId, count,
                (double) successes / count, durationSum / count, min, max));
    }
}
