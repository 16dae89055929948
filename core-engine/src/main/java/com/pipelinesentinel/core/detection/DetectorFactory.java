package com.pipelinesentinel.core.detection;

import com.pipelinesentinel.core.config.MetricRule;
import com.pipelinesentinel.core.config.MonitorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Creates one {@link AnomalyDetector} per tracked metric from a
 * {@link MonitorConfig}.
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create the detector for a single metric rule.
     *
     * @param rule   the metric rule; must not be {@code null}
     * @param config supplies the population limits; must not be {@code null}
     * @return a new detector
     */
    public static AnomalyDetector create(MetricRule rule, MonitorConfig config) {
        Objects.requireNonNull(rule, "MetricRule must not be null");
        Objects.requireNonNull(config, "MonitorConfig must not be null");
        return new PeerOutlierDetector(rule, config.getMinPeerPopulation(), config.getMinExecutions());
    }

    /**
     * Create detectors for every metric, using the default rule for metrics
     * the configuration leaves out.
     *
     * @param config the monitor configuration; must not be {@code null}
     * @return unmodifiable list of detectors, one per metric in declaration
     *         order
     */
    public static List<AnomalyDetector> createAll(MonitorConfig config) {
        Objects.requireNonNull(config, "MonitorConfig must not be null");
        List<AnomalyDetector> detectors = new ArrayList<>();
        for (MetricRule rule : config.effectiveRules().values()) {
            detectors.add(create(rule, config));
        }
        LOG.info("Created {} detector(s) from configuration", detectors.size());
        return Collections.unmodifiableList(detectors);
    }
}
