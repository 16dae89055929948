package com.pipelinesentinel.core.alerting;

import com.pipelinesentinel.core.model.Alert;
import com.pipelinesentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Deduplicates the alerts of one detection run and groups them by team and
 * severity.
 *
 * <p>
 * Two alerts are duplicates when they share pipeline id and message. The
 * first one seen is kept and later ones are dropped, regardless of severity.
 * Alerts themselves are never modified.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertRouter implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AlertRouter.class);

    /**
     * @param alerts     alerts in detection order; must not be {@code null}
     * @param detectedAt timestamp of the run
     * @return team → severity → alerts
     */
    public RoutedAlerts route(List<Alert> alerts, Instant detectedAt) {
        Objects.requireNonNull(alerts, "Alerts must not be null");

        Set<List<String>> seen = new HashSet<>();
        Map<String, Map<Severity, List<Alert>>> grouped = new LinkedHashMap<>();
        for (Alert alert : alerts) {
            if (!seen.add(List.of(alert.getPipelineId(), alert.getMessage()))) {
                LOG.debug("Dropping duplicate alert for '{}': {}", alert.getPipelineId(), alert.getMessage());
                continue;
            }
            grouped.computeIfAbsent(alert.getTeam(), t -> new EnumMap<>(Severity.class))
                    .computeIfAbsent(alert.getSeverity(), s -> new ArrayList<>())
                    .add(alert);
        }

        Map<String, Map<Severity, List<Alert>>> frozen = new LinkedHashMap<>();
        grouped.forEach((team, bySeverity) -> {
            Map<Severity, List<Alert>> buckets = new EnumMap<>(Severity.class);
            bySeverity.forEach((severity, list) -> buckets.put(severity, Collections.unmodifiableList(list)));
            frozen.put(team, Collections.unmodifiableMap(buckets));
        });
        return new RoutedAlerts(detectedAt, frozen);
    }
}
