package com.pipelinesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Alert raised when a pipeline is an outlier among its peers for one metric.
 *
 * <p>
 * Alerts are produced fresh by every detection run and are not persisted by
 * the engine. Once built they are not mutated; the router only reorders,
 * groups and drops them.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code pipelineId}, {@code team}, {@code metric},
 * {@code severity}, {@code message} and {@code detectedAt} are required;
 * omitting any of them throws {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String pipelineId;
    private final String team;
    private final HealthMetric metric;
    private final double observed;
    private final double peerMean;
    private final double peerStdDev;
    private final Severity severity;
    private final String message;
    private final Instant detectedAt;

    private Alert(Builder builder) {
        this.pipelineId = Objects.requireNonNull(builder.pipelineId, "pipelineId must not be null");
        this.team = Objects.requireNonNull(builder.team, "team must not be null");
        this.metric = Objects.requireNonNull(builder.metric, "metric must not be null");
        this.observed = builder.observed;
        this.peerMean = builder.peerMean;
        this.peerStdDev = builder.peerStdDev;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.message = Objects.requireNonNull(builder.message, "message must not be null");
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String pipelineId;
        private String team;
        private HealthMetric metric;
        private double observed;
        private double peerMean;
        private double peerStdDev;
        private Severity severity;
        private String message;
        private Instant detectedAt;

        public Builder pipelineId(String pipelineId) {
            this.pipelineId = pipelineId;
            return this;
        }

        public Builder team(String team) {
            this.team = team;
            return this;
        }

        public Builder metric(HealthMetric metric) {
            this.metric = metric;
            return this;
        }

        public Builder observed(double observed) {
            this.observed = observed;
            return this;
        }

        public Builder peerMean(double peerMean) {
            this.peerMean = peerMean;
            return this;
        }

        public Builder peerStdDev(double peerStdDev) {
            this.peerStdDev = peerStdDev;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public String getTeam() {
        return team;
    }

    public HealthMetric getMetric() {
        return metric;
    }

    public double getObserved() {
        return observed;
    }

    public double getPeerMean() {
        return peerMean;
    }

    public double getPeerStdDev() {
        return peerStdDev;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return pipelineId.equals(alert.pipelineId)
                && metric == alert.metric
                && severity == alert.severity
                && message.equals(alert.message)
                && detectedAt.equals(alert.detectedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pipelineId, metric, severity, message, detectedAt);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "pipelineId='" + pipelineId + '\'' +
                ", team='" + team + '\'' +
                ", metric=" + metric +
                ", severity=" + severity +
                ", message='" + message + '\'' +
                ", detectedAt=" + detectedAt +
                '}';
    }
}
