/**
 * Alert classification and routing.
 *
 * <p>
 * {@link com.pipelinesentinel.core.alerting.DetectionRun} drives a pass:
 * detector crossings are levelled by
 * {@link com.pipelinesentinel.core.alerting.AlertClassifier}, then
 * deduplicated and grouped by
 * {@link com.pipelinesentinel.core.alerting.AlertRouter} into
 * {@link com.pipelinesentinel.core.alerting.RoutedAlerts}.
 * </p>
 *
 * @since 1.0.0
 */
package com.pipelinesentinel.core.alerting;
