package com.pipelinesentinel.core.alerting;

import com.pipelinesentinel.core.config.MonitorConfig;
import com.pipelinesentinel.core.detection.AnomalyDetector;
import com.pipelinesentinel.core.detection.DetectorFactory;
import com.pipelinesentinel.core.detection.MetricCrossing;
import com.pipelinesentinel.core.model.Alert;
import com.pipelinesentinel.core.model.PipelineHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One full detection pass: every detector over the same snapshot, then
 * classification, then routing.
 *
 * <p>
 * A detector that throws is logged and skipped so that the remaining
 * metrics still produce alerts.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionRun implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DetectionRun.class);

    private final List<AnomalyDetector> detectors;
    private final AlertClassifier classifier;
    private final AlertRouter router;

    public DetectionRun(List<AnomalyDetector> detectors, AlertClassifier classifier, AlertRouter router) {
        Objects.requireNonNull(detectors, "Detectors must not be null");
        this.detectors = Collections.unmodifiableList(new ArrayList<>(detectors));
        this.classifier = Objects.requireNonNull(classifier, "AlertClassifier must not be null");
        this.router = Objects.requireNonNull(router, "AlertRouter must not be null");
    }

    public static DetectionRun fromConfig(MonitorConfig config) {
        Objects.requireNonNull(config, "MonitorConfig must not be null");
        return new DetectionRun(DetectorFactory.createAll(config),
                new AlertClassifier(config.getHighDelta()), new AlertRouter());
    }

    /**
     * @param snapshot   consistent point-in-time health of every pipeline
     * @param detectedAt timestamp stamped on every alert
     * @return routed, deduplicated alerts
     */
    public RoutedAlerts run(List<PipelineHealth> snapshot, Instant detectedAt) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        Objects.requireNonNull(detectedAt, "detectedAt must not be null");

        List<Alert> alerts = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            try {
                for (MetricCrossing crossing : detector.detect(snapshot)) {
                    alerts.add(classifier.classify(crossing, detectedAt));
                }
            } catch (RuntimeException e) {
                LOG.error("Detector [{}] threw an exception – continuing with next detector",
                        detector.getMetric(), e);
            }
        }

        RoutedAlerts routed = router.route(alerts, detectedAt);
        LOG.info("Detection run over {} pipeline(s) produced {} alert(s) for {} team(s)",
                snapshot.size(), routed.size(), routed.teams().size());
        return routed;
    }

    public List<AnomalyDetector> getDetectors() {
        return detectors;
    }
}
