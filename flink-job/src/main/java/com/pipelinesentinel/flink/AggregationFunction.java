package com.pipelinesentinel.flink;

import com.pipelinesentinel.core.aggregation.ApplyResult;
import com.pipelinesentinel.core.aggregation.PipelineAggregate;
import com.pipelinesentinel.core.config.MonitorConfig;
import com.pipelinesentinel.core.model.EventValidationException;
import com.pipelinesentinel.core.model.ExecutionEvent;
import com.pipelinesentinel.core.model.PipelineHealth;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Keyed by pipeline id: folds each execution event into that pipeline's
 * {@link PipelineAggregate} and emits the updated {@link PipelineHealth}.
 *
 * <p>
 * Keying by pipeline id gives every pipeline exactly one writer, so the
 * aggregate's read-modify-write never interleaves. The aggregate lives in
 * Flink managed keyed state and is checkpointed with it.
 * </p>
 *
 * <p>
 * Malformed events are logged and counted, never rethrown, so one bad
 * record cannot fail the job. Duplicates emit nothing.
 * </p>
 *
 * @since 1.0.0
 */
public class AggregationFunction extends KeyedProcessFunction<String, ExecutionEvent, PipelineHealth> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AggregationFunction.class);

    private final int trackedExecutionIds;
    private final int historyCapacity;

    private transient ValueState<PipelineAggregate> aggregateState;
    private transient MonitorMetrics metrics;

    public AggregationFunction(MonitorConfig config) {
        Objects.requireNonNull(config, "MonitorConfig must not be null");
        this.trackedExecutionIds = config.getTrackedExecutionIds();
        this.historyCapacity = config.getHistoryCapacity();
    }

    @Override
    public void open(Configuration parameters) {
        aggregateState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("pipeline-aggregate", PipelineAggregate.class));
        metrics = new MonitorMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AggregationFunction opened (trackedExecutionIds={}, historyCapacity={})",
                trackedExecutionIds, historyCapacity);
    }

    @Override
    public void processElement(ExecutionEvent event,
            KeyedProcessFunction<String, ExecutionEvent, PipelineHealth>.Context ctx,
            Collector<PipelineHealth> out) throws Exception {
        long startNanos = System.nanoTime();
        try {
            event.validate();
        } catch (EventValidationException e) {
            metrics.incrementRejected();
            LOG.warn("Rejected execution event: {}", e.getMessage());
            return;
        }

        PipelineAggregate aggregate = aggregateState.value();
        if (aggregate == null) {
            aggregate = new PipelineAggregate(event.getPipelineId(), event.getTeam(),
                    trackedExecutionIds, historyCapacity);
        }

        if (aggregate.apply(event) == ApplyResult.DUPLICATE) {
            metrics.incrementDuplicate();
            LOG.debug("Duplicate execution '{}' for pipeline '{}' ignored",
                    event.getExecutionId(), event.getPipelineId());
            return;
        }

        aggregateState.update(aggregate);
        out.collect(aggregate.snapshot());

        metrics.incrementApplied();
        metrics.recordApplyLatency((System.nanoTime() - startNanos) / 1_000_000);
    }
}
