package com.pipelinesentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pipelinesentinel.core.model.ExecutionEvent;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes → {@link ExecutionEvent}.
 * <p>
 * Unparseable messages are logged and dropped (returns {@code null}). Events
 * that parse but are incomplete pass through and are rejected later by
 * validation, where they are counted.
 * </p>
 */
public class ExecutionEventDeserializationSchema implements DeserializationSchema<ExecutionEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionEventDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public ExecutionEvent deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, ExecutionEvent.class);
        } catch (IOException e) {
            LOG.warn("Failed to deserialize execution event – skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(ExecutionEvent nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<ExecutionEvent> getProducedType() {
        return TypeInformation.of(ExecutionEvent.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            // records_processed is a count; 12.9 or -0.7 must not be truncated into range
            mapper.configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
        }
        return mapper;
    }
}
