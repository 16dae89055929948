/**
 * Apache Flink streaming job for Pipeline Sentinel.
 *
 * <p>
 * Wires the core engine into a Flink pipeline that consumes execution
 * events from Kafka, aggregates them per pipeline, runs peer anomaly
 * detection on a timer, and publishes routed alerts back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.pipelinesentinel.flink.PipelineSentinelJob}: main entry
 * point</li>
 * <li>{@link com.pipelinesentinel.flink.AggregationFunction}: per-pipeline
 * keyed aggregation</li>
 * <li>{@link com.pipelinesentinel.flink.DetectionFunction}: scheduled
 * detection over the latest health of every pipeline</li>
 * <li>{@link com.pipelinesentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.pipelinesentinel.flink;
