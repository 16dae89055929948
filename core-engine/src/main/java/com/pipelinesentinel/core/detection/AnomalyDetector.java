package com.pipelinesentinel.core.detection;

import com.pipelinesentinel.core.model.HealthMetric;
import com.pipelinesentinel.core.model.PipelineHealth;

import java.io.Serializable;
import java.util.List;

/**
 * Contract for peer-population detectors.
 * <p>
 * A detector compares every pipeline in a snapshot against the rest for a
 * single metric. Implementations are <strong>stateless</strong> between
 * calls: each pass looks only at the snapshot it is given.
 * </p>
 * <p>
 * Detectors must be {@link Serializable} because the Flink job ships them
 * to task managers inside its process functions.
 * </p>
 */
public interface AnomalyDetector extends Serializable {

    /**
     * Find pipelines past the outlier threshold.
     *
     * @param snapshot point-in-time health of every pipeline; must not change
     *                 during the call
     * @return crossings in snapshot order; empty when nothing is flagged or
     *         there are too few peers
     */
    List<MetricCrossing> detect(List<PipelineHealth> snapshot);

    /**
     * @return the metric this detector watches
     */
    HealthMetric getMetric();
}
