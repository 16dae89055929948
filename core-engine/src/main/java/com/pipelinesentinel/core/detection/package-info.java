/**
 * Peer-population anomaly detection.
 *
 * <p>
 * Each {@link com.pipelinesentinel.core.detection.AnomalyDetector} watches one
 * metric and compares every pipeline in a snapshot with its peers. The
 * built-in {@link com.pipelinesentinel.core.detection.PeerOutlierDetector}
 * flags values past {@code μ ± k·σ}; detectors are created by
 * {@link com.pipelinesentinel.core.detection.DetectorFactory}.
 * </p>
 *
 * @since 1.0.0
 */
package com.pipelinesentinel.core.detection;
