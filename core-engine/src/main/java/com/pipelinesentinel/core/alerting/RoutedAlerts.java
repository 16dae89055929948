package com.pipelinesentinel.core.alerting;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.pipelinesentinel.core.model.Alert;
import com.pipelinesentinel.core.model.Severity;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Output of one detection run: alerts grouped by team, then by severity.
 *
 * <p>
 * Teams appear in the order their first alert was detected; severities in
 * ascending order; alerts within a bucket in detection order. The nested
 * maps and lists are unmodifiable. This is what notification adapters
 * receive.
 * </p>
 *
 * @since 1.0.0
 */
public final class RoutedAlerts implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant detectedAt;
    private final Map<String, Map<Severity, List<Alert>>> alertsByTeam;

    RoutedAlerts(Instant detectedAt, Map<String, Map<Severity, List<Alert>>> alertsByTeam) {
        this.detectedAt = Objects.requireNonNull(detectedAt, "detectedAt must not be null");
        this.alertsByTeam = Collections.unmodifiableMap(alertsByTeam);
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public Map<String, Map<Severity, List<Alert>>> getAlertsByTeam() {
        return alertsByTeam;
    }

    /**
     * @return teams with at least one alert
     */
    public Set<String> teams() {
        return alertsByTeam.keySet();
    }

    /**
     * @return the bucket for {@code team} and {@code severity}, empty if none
     */
    public List<Alert> alertsFor(String team, Severity severity) {
        Map<Severity, List<Alert>> bySeverity = alertsByTeam.get(team);
        if (bySeverity == null) {
            return Collections.emptyList();
        }
        return bySeverity.getOrDefault(severity, Collections.emptyList());
    }

    /**
     * @return every alert, flattened team by team then severity by severity
     */
    public List<Alert> allAlerts() {
        List<Alert> all = new ArrayList<>();
        alertsByTeam.values().forEach(bySeverity -> bySeverity.values().forEach(all::addAll));
        return all;
    }

    public int size() {
        int size = 0;
        for (Map<Severity, List<Alert>> bySeverity : alertsByTeam.values()) {
            for (List<Alert> alerts : bySeverity.values()) {
                size += alerts.size();
            }
        }
        return size;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return alertsByTeam.isEmpty();
    }

    @Override
    public String toString() {
        return "RoutedAlerts{detectedAt=" + detectedAt + ", teams=" + alertsByTeam.keySet()
                + ", alerts=" + size() + '}';
    }
}
