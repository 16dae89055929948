package com.pipelinesentinel.core.alerting;

import com.pipelinesentinel.core.detection.MetricCrossing;
import com.pipelinesentinel.core.model.Alert;
import com.pipelinesentinel.core.model.Severity;

import java.io.Serializable;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns a {@link MetricCrossing} into a severity-levelled {@link Alert}.
 *
 * <p>
 * Severity depends on how far past the trigger the value lies, measured in
 * σ. With trigger multiplier {@code k} and band width {@code highDelta}:
 * </p>
 * <ul>
 * <li>{@code MEDIUM}: {@code d ≤ k + highDelta}</li>
 * <li>{@code HIGH}: {@code k + highDelta < d ≤ k + 2·highDelta}</li>
 * <li>{@code CRITICAL}: {@code d > k + 2·highDelta}</li>
 * </ul>
 *
 * <p>
 * Messages depend only on pipeline, metric, observed value and peer mean,
 * and are formatted with {@link Locale#ROOT}, so equal inputs always render
 * the same text.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertClassifier implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double highDelta;

    /**
     * @param highDelta width of each severity band in σ; must be positive
     */
    public AlertClassifier(double highDelta) {
        if (!(highDelta > 0)) {
            throw new IllegalArgumentException("highDelta must be > 0, got: " + highDelta);
        }
        this.highDelta = highDelta;
    }

    /**
     * @param crossing    detector output
     * @param detectedAt  timestamp of the detection run
     * @return the classified alert
     */
    public Alert classify(MetricCrossing crossing, Instant detectedAt) {
        Objects.requireNonNull(crossing, "MetricCrossing must not be null");
        Objects.requireNonNull(detectedAt, "detectedAt must not be null");

        return Alert.builder()
                .pipelineId(crossing.getPipelineId())
                .team(crossing.getTeam())
                .metric(crossing.getMetric())
                .observed(crossing.getObserved())
                .peerMean(crossing.getPeerMean())
                .peerStdDev(crossing.getEffectiveStdDev())
                .severity(severityFor(crossing.deviationInSigmas(), crossing.getSigmaMultiplier()))
                .message(message(crossing))
                .detectedAt(detectedAt)
                .build();
    }

    /**
     * @param deviationInSigmas distance from the peer mean in σ
     * @param sigmaMultiplier   trigger multiplier k
     * @return severity band the deviation falls in
     */
    public Severity severityFor(double deviationInSigmas, double sigmaMultiplier) {
        if (deviationInSigmas > sigmaMultiplier + 2 * highDelta) {
            return Severity.CRITICAL;
        }
        if (deviationInSigmas > sigmaMultiplier + highDelta) {
            return Severity.HIGH;
        }
        return Severity.MEDIUM;
    }

    static String message(MetricCrossing crossing) {
        return String.format(Locale.ROOT,
                "Pipeline %s shows %s: %s=%.4f (peer mean %.4f)",
                crossing.getPipelineId(),
                crossing.getMetric().getLabel(),
                crossing.getMetric().getKey(),
                crossing.getObserved(),
                crossing.getPeerMean());
    }

    public double getHighDelta() {
        return highDelta;
    }
}
