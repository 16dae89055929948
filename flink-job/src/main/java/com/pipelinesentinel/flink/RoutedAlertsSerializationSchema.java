package com.pipelinesentinel.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pipelinesentinel.core.alerting.RoutedAlerts;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts one detection run's
 * {@link RoutedAlerts} → JSON bytes for the Kafka alerts topic.
 *
 * <pre>
 * {"detectedAt":"2024-01-15T10:05:00Z",
 *  "alertsByTeam":{"data-eng":{"HIGH":[{"pipelineId":"orders_etl", ...}]}}}
 * </pre>
 */
public class RoutedAlertsSerializationSchema implements SerializationSchema<RoutedAlerts> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RoutedAlertsSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(RoutedAlerts alerts) {
        try {
            return objectMapper().writeValueAsBytes(alerts);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize alerts of run {}: {}", alerts.getDetectedAt(), e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
