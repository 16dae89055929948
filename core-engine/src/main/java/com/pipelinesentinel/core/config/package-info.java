/**
 * Configuration loading and validation for the monitor.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.pipelinesentinel.core.config.MonitorConfigLoader} into a
 * {@link com.pipelinesentinel.core.config.MonitorConfig}. Validation runs
 * right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.pipelinesentinel.core.config;
