package com.pipelinesentinel.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Unit tests for {@link ExecutionEvent}.
 */
class ExecutionEventTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    @DisplayName("Should accept a complete event")
    void shouldAcceptCompleteEvent() {
        assertThatCode(() -> validEvent().build().validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should accept zero duration and zero records")
    void shouldAcceptZeroValues() {
        ExecutionEvent event = validEvent().duration(0.0).recordsProcessed(0L).build();
        assertThatCode(event::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should report every missing field at once")
    void shouldCollectAllErrors() {
        EventValidationException e = catchThrowableOfType(
                () -> ExecutionEvent.builder().executionId("exec-1").build().validate(),
                EventValidationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getErrors()).hasSize(6);
        assertThat(e.getMessage())
                .contains("exec-1")
                .contains("'pipeline_id' is required")
                .contains("'records_processed' is required");
    }

    @Test
    @DisplayName("Should reject negative duration")
    void shouldRejectNegativeDuration() {
        assertThatThrownBy(() -> validEvent().duration(-1.0).build().validate())
                .isInstanceOf(EventValidationException.class)
                .hasMessageContaining("'duration' must be a finite non-negative number");
    }

    @Test
    @DisplayName("Should reject negative records processed")
    void shouldRejectNegativeRecords() {
        assertThatThrownBy(() -> validEvent().recordsProcessed(-5L).build().validate())
                .isInstanceOf(EventValidationException.class)
                .hasMessageContaining("'records_processed' must be non-negative");
    }

    @Test
    @DisplayName("Should parse snake_case JSON and accept start_time as the timestamp")
    void shouldParseWireFormat() throws Exception {
        String json = "{\"execution_id\":\"exec-9\",\"pipeline_id\":\"orders_etl\",\"team\":\"data-eng\","
                + "\"status\":\"success\",\"duration\":312,\"records_processed\":15000,"
                + "\"start_time\":\"2024-01-15T10:00:00Z\",\"end_time\":\"2024-01-15T10:05:12Z\"}";

        ExecutionEvent event = mapper.readValue(json, ExecutionEvent.class);

        assertThat(event.getExecutionId()).isEqualTo("exec-9");
        assertThat(event.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(event.getDuration()).isEqualTo(312.0);
        assertThat(event.getRecordsProcessed()).isEqualTo(15_000L);
        assertThat(event.getTimestamp()).isEqualTo(Instant.parse("2024-01-15T10:00:00Z"));
        assertThatCode(event::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject statuses other than SUCCESS and FAILED")
    void shouldRejectUnsupportedStatus() throws Exception {
        String json = "{\"execution_id\":\"exec-10\",\"pipeline_id\":\"orders_etl\",\"team\":\"data-eng\","
                + "\"status\":\"RUNNING\",\"duration\":5,\"records_processed\":0,"
                + "\"timestamp\":\"2024-01-15T10:00:00Z\"}";

        ExecutionEvent event = mapper.readValue(json, ExecutionEvent.class);

        assertThat(event.getStatus()).isNull();
        assertThatThrownBy(event::validate)
                .isInstanceOf(EventValidationException.class)
                .hasMessageContaining("'status'");
    }

    private static ExecutionEvent.Builder validEvent() {
        return ExecutionEvent.builder()
                .executionId("exec-1")
                .pipelineId("orders_etl")
                .team("data-eng")
                .status(ExecutionStatus.SUCCESS)
                .duration(120.0)
                .recordsProcessed(1_000L)
                .timestamp(Instant.parse("2024-01-15T10:00:00Z"));
    }
}
