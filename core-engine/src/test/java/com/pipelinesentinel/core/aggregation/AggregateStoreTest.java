package com.pipelinesentinel.core.aggregation;

import com.pipelinesentinel.core.config.MonitorConfig;
import com.pipelinesentinel.core.model.ExecutionEvent;
import com.pipelinesentinel.core.model.ExecutionStatus;
import com.pipelinesentinel.core.model.PipelineHealth;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AggregateStore}.
 */
class AggregateStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    @Test
    @DisplayName("Should take its sizing from the monitor configuration")
    void shouldBuildFromConfig() {
        MonitorConfig config = MonitorConfig.defaults();
        config.setShardCount(8);
        config.setHistoryCapacity(10);

        AggregateStore store = AggregateStore.fromConfig(config);

        assertThat(store.getShardCount()).isEqualTo(8);
        assertThat(store.isHistoryEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should always route a pipeline to the same shard")
    void shouldRouteToStableShard() {
        AggregateStore store = new AggregateStore(16, 100, 0);

        for (String id : List.of("orders_etl", "billing", "", "a-very-long-pipeline-name")) {
            int index = store.shardIndex(id);
            assertThat(index).isBetween(0, 15).isEqualTo(store.shardIndex(id));
        }
    }

    @Test
    @DisplayName("Should reject invalid sizing")
    void shouldRejectInvalidSizing() {
        assertThatThrownBy(() -> new AggregateStore(0, 100, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AggregateStore(4, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AggregateStore(4, 100, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should return an unmodifiable snapshot detached from later applies")
    void shouldDetachSnapshot() {
        AggregateStore store = new AggregateStore(4, 100, 0);
        Aggregator aggregator = new Aggregator(store);
        aggregator.apply(event("e1", "orders_etl", 1.0));

        List<PipelineHealth> snapshot = store.snapshot();
        aggregator.apply(event("e2", "orders_etl", 2.0));
        aggregator.apply(event("e3", "billing", 2.0));

        assertThat(snapshot).hasSize(1);
        assertThat(snapshot.get(0).getTotalCount()).isEqualTo(1);
        assertThat(store.snapshot()).hasSize(2);
        assertThatThrownBy(() -> snapshot.add(snapshot.get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should never expose a half-applied aggregate to a concurrent snapshot")
    void shouldTakeConsistentSnapshotsUnderConcurrentWrites() throws Exception {
        AggregateStore store = new AggregateStore(4, 10_000, 0);
        Aggregator aggregator = new Aggregator(store);
        int pipelines = 6;
        int perPipeline = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(pipelines + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        try {
            List<Future<?>> writers = new ArrayList<>();
            for (int p = 0; p < pipelines; p++) {
                String pipelineId = "pipeline-" + p;
                writers.add(pool.submit(() -> {
                    start.await();
                    // the n-th event has duration n, so the mean after n events is (n + 1) / 2
                    for (int n = 1; n <= perPipeline; n++) {
                        aggregator.apply(event(pipelineId + "-" + n, pipelineId, n));
                    }
                    return null;
                }));
            }
            Future<Integer> reader = pool.submit(() -> {
                start.await();
                int checked = 0;
                while (writing.get()) {
                    for (PipelineHealth health : store.snapshot()) {
                        double expected = (health.getTotalCount() + 1) / 2.0;
                        if (Math.abs(health.getAvgDuration() - expected) > 1e-6
                                || health.getSuccessCount() + health.getFailedCount() != health.getTotalCount()) {
                            throw new AssertionError("Inconsistent snapshot: " + health);
                        }
                        checked++;
                    }
                }
                return checked;
            });

            start.countDown();
            for (Future<?> writer : writers) {
                writer.get(30, TimeUnit.SECONDS);
            }
            writing.set(false);
            reader.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.snapshot())
                .hasSize(pipelines)
                .allSatisfy(health -> assertThat(health.getTotalCount()).isEqualTo(perPipeline));
    }

    private static ExecutionEvent event(String id, String pipeline, double duration) {
        return ExecutionEvent.builder()
                .executionId(id)
                .pipelineId(pipeline)
                .team("data-eng")
                .status(ExecutionStatus.SUCCESS)
                .duration(duration)
                .recordsProcessed(1L)
                .timestamp(T0)
                .build();
    }
}
