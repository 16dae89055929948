/**
 * Running per-pipeline statistics.
 *
 * <p>
 * {@link com.pipelinesentinel.core.aggregation.Aggregator} validates events
 * and folds them into
 * {@link com.pipelinesentinel.core.aggregation.PipelineAggregate} instances
 * owned by the sharded
 * {@link com.pipelinesentinel.core.aggregation.AggregateStore}.
 * </p>
 *
 * @since 1.0.0
 */
package com.pipelinesentinel.core.aggregation;
