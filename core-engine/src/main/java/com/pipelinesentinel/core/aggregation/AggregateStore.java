package com.pipelinesentinel.core.aggregation;

import com.pipelinesentinel.core.config.MonitorConfig;
import com.pipelinesentinel.core.model.PipelineHealth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * In-memory owner of every {@link PipelineAggregate}, partitioned by
 * pipeline id.
 *
 * <h3>Concurrency</h3>
 * <p>
 * Pipelines are spread over a fixed number of shards by
 * {@code pipelineId.hashCode()}. Each shard has a single writer at a time
 * (its monitor), so updates to one pipeline never interleave while
 * pipelines on different shards update in parallel.
 * </p>
 * <p>
 * A store-wide read/write lock provides snapshot isolation. Single-pipeline
 * work holds the shared side; {@link #snapshot()} holds the exclusive side
 * while it copies every aggregate, so a snapshot never sees some pipelines
 * updated and others not.
 * </p>
 *
 * <p>
 * Aggregates are created lazily and never removed.
 * </p>
 *
 * @since 1.0.0
 */
public class AggregateStore {

    private final ReadWriteLock snapshotLock = new ReentrantReadWriteLock();
    private final List<Map<String, PipelineAggregate>> shards;
    private final int trackedExecutionIds;
    private final int historyCapacity;

    /**
     * @param shardCount          number of partitions, at least 1
     * @param trackedExecutionIds execution ids remembered per pipeline
     * @param historyCapacity     recent runs kept per pipeline, 0 to disable
     * @throws IllegalArgumentException if a value is out of range
     */
    public AggregateStore(int shardCount, int trackedExecutionIds, int historyCapacity) {
        if (shardCount < 1) {
            throw new IllegalArgumentException("shardCount must be >= 1, got: " + shardCount);
        }
        if (trackedExecutionIds < 1) {
            throw new IllegalArgumentException(
                    "trackedExecutionIds must be >= 1, got: " + trackedExecutionIds);
        }
        if (historyCapacity < 0) {
            throw new IllegalArgumentException("historyCapacity must be >= 0, got: " + historyCapacity);
        }
        List<Map<String, PipelineAggregate>> partitions = new ArrayList<>(shardCount);
        for (int i = 0; i < shardCount; i++) {
            partitions.add(new HashMap<>());
        }
        this.shards = Collections.unmodifiableList(partitions);
        this.trackedExecutionIds = trackedExecutionIds;
        this.historyCapacity = historyCapacity;
    }

    public static AggregateStore fromConfig(MonitorConfig config) {
        Objects.requireNonNull(config, "MonitorConfig must not be null");
        return new AggregateStore(config.getShardCount(), config.getTrackedExecutionIds(),
                config.getHistoryCapacity());
    }

    /**
     * Run {@code action} against the pipeline's aggregate, creating it for
     * {@code team} if this is the pipeline's first event. Only the
     * {@link Aggregator} mutates aggregates.
     */
    <R> R update(String pipelineId, String team, Function<PipelineAggregate, R> action) {
        Map<String, PipelineAggregate> shard = shardOf(pipelineId);
        snapshotLock.readLock().lock();
        try {
            synchronized (shard) {
                PipelineAggregate aggregate = shard.computeIfAbsent(pipelineId,
                        id -> new PipelineAggregate(id, team, trackedExecutionIds, historyCapacity));
                return action.apply(aggregate);
            }
        } finally {
            snapshotLock.readLock().unlock();
        }
    }

    /**
     * @param pipelineId pipeline identifier
     * @return snapshot of the pipeline, or empty if it never received an event
     */
    public Optional<PipelineHealth> find(String pipelineId) {
        return read(pipelineId, PipelineAggregate::snapshot);
    }

    /**
     * @param pipelineId pipeline identifier
     * @return the pipeline's retained recent runs, or empty if the pipeline
     *         is unknown
     */
    public Optional<List<ExecutionSample>> recentExecutions(String pipelineId) {
        return read(pipelineId, PipelineAggregate::recentExecutions);
    }

    public boolean isHistoryEnabled() {
        return historyCapacity > 0;
    }

    /**
     * Copy every aggregate at a single point in time.
     *
     * @return unmodifiable list of snapshots, in no particular order
     */
    public List<PipelineHealth> snapshot() {
        snapshotLock.writeLock().lock();
        try {
            List<PipelineHealth> result = new ArrayList<>();
            for (Map<String, PipelineAggregate> shard : shards) {
                synchronized (shard) {
                    for (PipelineAggregate aggregate : shard.values()) {
                        result.add(aggregate.snapshot());
                    }
                }
            }
            return Collections.unmodifiableList(result);
        } finally {
            snapshotLock.writeLock().unlock();
        }
    }

    /**
     * @return number of pipelines seen so far
     */
    public int size() {
        snapshotLock.writeLock().lock();
        try {
            int size = 0;
            for (Map<String, PipelineAggregate> shard : shards) {
                synchronized (shard) {
                    size += shard.size();
                }
            }
            return size;
        } finally {
            snapshotLock.writeLock().unlock();
        }
    }

    public int getShardCount() {
        return shards.size();
    }

    /**
     * @return index of the shard that owns {@code pipelineId}
     */
    public int shardIndex(String pipelineId) {
        Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        return Math.floorMod(pipelineId.hashCode(), shards.size());
    }

    private Map<String, PipelineAggregate> shardOf(String pipelineId) {
        return shards.get(shardIndex(pipelineId));
    }

    private <R> Optional<R> read(String pipelineId, Function<PipelineAggregate, R> reader) {
        Map<String, PipelineAggregate> shard = shardOf(pipelineId);
        snapshotLock.readLock().lock();
        try {
            synchronized (shard) {
                PipelineAggregate aggregate = shard.get(pipelineId);
                return aggregate == null ? Optional.empty() : Optional.of(reader.apply(aggregate));
            }
        } finally {
            snapshotLock.readLock().unlock();
        }
    }
}
