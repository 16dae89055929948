package com.pipelinesentinel.core.aggregation;

import com.pipelinesentinel.core.model.EventValidationException;
import com.pipelinesentinel.core.model.ExecutionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Applies execution events to the {@link AggregateStore}.
 *
 * <p>
 * Delivery is assumed to be at-least-once: re-applying an execution id that
 * the pipeline already counted is a successful no-op.
 * </p>
 *
 * @since 1.0.0
 */
public class Aggregator {

    private static final Logger LOG = LoggerFactory.getLogger(Aggregator.class);

    private final AggregateStore store;

    public Aggregator(AggregateStore store) {
        this.store = Objects.requireNonNull(store, "AggregateStore must not be null");
    }

    /**
     * Validate and apply one event.
     *
     * @param event the event; must not be {@code null}
     * @return whether the event was applied or was a duplicate
     * @throws EventValidationException if the event is malformed; nothing is
     *                                  applied
     */
    public ApplyResult apply(ExecutionEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        event.validate();

        ApplyResult result = store.update(event.getPipelineId(), event.getTeam(),
                aggregate -> aggregate.apply(event));

        if (result == ApplyResult.DUPLICATE) {
            LOG.debug("Duplicate execution '{}' for pipeline '{}' ignored",
                    event.getExecutionId(), event.getPipelineId());
        } else {
            LOG.trace("Applied execution '{}' to pipeline '{}'",
                    event.getExecutionId(), event.getPipelineId());
        }
        return result;
    }

    /**
     * Apply a batch, skipping malformed events.
     *
     * <p>
     * A rejected event is logged and counted; it never stops the batch or
     * touches another pipeline's aggregate.
     * </p>
     *
     * @param events events in delivery order; must not be {@code null}
     * @return counts of applied, duplicate and rejected events
     */
    public ApplySummary applyAll(Iterable<ExecutionEvent> events) {
        Objects.requireNonNull(events, "Events must not be null");
        long applied = 0;
        long duplicates = 0;
        long rejected = 0;
        for (ExecutionEvent event : events) {
            try {
                if (apply(event) == ApplyResult.APPLIED) {
                    applied++;
                } else {
                    duplicates++;
                }
            } catch (EventValidationException e) {
                rejected++;
                LOG.warn("Rejected execution event: {}", e.getMessage());
            }
        }
        ApplySummary summary = new ApplySummary(applied, duplicates, rejected);
        LOG.info("Applied event batch: {}", summary);
        return summary;
    }
}
