/**
 * Domain model classes for Pipeline Sentinel.
 *
 * <p>
 * Shared between the core engine and the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.pipelinesentinel.core.model.ExecutionEvent}: one finished
 * pipeline run (input)</li>
 * <li>{@link com.pipelinesentinel.core.model.PipelineHealth} and
 * {@link com.pipelinesentinel.core.model.TeamHealth}: read-only health
 * snapshots</li>
 * <li>{@link com.pipelinesentinel.core.model.Alert}: peer outlier alert
 * (output)</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.pipelinesentinel.core.model;
