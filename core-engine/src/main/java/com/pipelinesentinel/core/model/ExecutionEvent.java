package com.pipelinesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single finished pipeline run, as reported by the ingestion layer.
 *
 * <p>
 * JSON payloads use snake_case field names:
 * </p>
 *
 * <pre>
 * {"execution_id": "exec-001", "pipeline_id": "orders_etl", "team": "data-eng",
 *  "status": "SUCCESS", "duration": 312, "records_processed": 15000,
 *  "timestamp": "2024-01-15T10:00:00Z"}
 * </pre>
 *
 * <p>
 * The older {@code start_time} field name is accepted in place of
 * {@code timestamp}. Numeric fields are boxed so that a missing value can be
 * told apart from zero; call {@link #validate()} before handing the event to
 * the aggregator.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecutionEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonProperty("execution_id")
    private String executionId;

    @JsonProperty("pipeline_id")
    private String pipelineId;

    @JsonProperty("team")
    private String team;

    @JsonProperty("status")
    private ExecutionStatus status;

    /** Run duration in seconds. */
    @JsonProperty("duration")
    private Double duration;

    @JsonProperty("records_processed")
    private Long recordsProcessed;

    @JsonProperty("timestamp")
    @JsonAlias("start_time")
    private Instant timestamp;

    /** No-arg constructor required by Jackson. */
    public ExecutionEvent() {
    }

    private ExecutionEvent(Builder builder) {
        this.executionId = builder.executionId;
        this.pipelineId = builder.pipelineId;
        this.team = builder.team;
        this.status = builder.status;
        this.duration = builder.duration;
        this.recordsProcessed = builder.recordsProcessed;
        this.timestamp = builder.timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ExecutionEvent}. No field is checked at build
     * time; use {@link ExecutionEvent#validate()}.
     */
    public static class Builder {
        private String executionId;
        private String pipelineId;
        private String team;
        private ExecutionStatus status;
        private Double duration;
        private Long recordsProcessed;
        private Instant timestamp;

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder pipelineId(String pipelineId) {
            this.pipelineId = pipelineId;
            return this;
        }

        public Builder team(String team) {
            this.team = team;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder duration(Double duration) {
            this.duration = duration;
            return this;
        }

        public Builder recordsProcessed(Long recordsProcessed) {
            this.recordsProcessed = recordsProcessed;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public ExecutionEvent build() {
            return new ExecutionEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check that every required field is present and within range.
     *
     * @throws EventValidationException listing all problems found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (isBlank(executionId)) {
            errors.add("'execution_id' is required");
        }
        if (isBlank(pipelineId)) {
            errors.add("'pipeline_id' is required");
        }
        if (isBlank(team)) {
            errors.add("'team' is required");
        }
        if (status == null) {
            errors.add("'status' is required and must be SUCCESS or FAILED");
        }
        if (duration == null) {
            errors.add("'duration' is required");
        } else if (duration.isNaN() || duration.isInfinite() || duration < 0) {
            errors.add("'duration' must be a finite non-negative number, got: " + duration);
        }
        if (recordsProcessed == null) {
            errors.add("'records_processed' is required");
        } else if (recordsProcessed < 0) {
            errors.add("'records_processed' must be non-negative, got: " + recordsProcessed);
        }
        if (timestamp == null) {
            errors.add("'timestamp' is required");
        }

        if (!errors.isEmpty()) {
            throw new EventValidationException(executionId, errors);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getExecutionId() {
        return executionId;
    }

    public void setExecutionId(String executionId) {
        this.executionId = executionId;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public void setPipelineId(String pipelineId) {
        this.pipelineId = pipelineId;
    }

    public String getTeam() {
        return team;
    }

    public void setTeam(String team) {
        this.team = team;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public Double getDuration() {
        return duration;
    }

    public void setDuration(Double duration) {
        this.duration = duration;
    }

    public Long getRecordsProcessed() {
        return recordsProcessed;
    }

    public void setRecordsProcessed(Long recordsProcessed) {
        this.recordsProcessed = recordsProcessed;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ExecutionEvent that))
            return false;
        return Objects.equals(executionId, that.executionId)
                && Objects.equals(pipelineId, that.pipelineId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId, pipelineId);
    }

    @Override
    public String toString() {
        return "ExecutionEvent{" +
                "executionId='" + executionId + '\'' +
                ", pipelineId='" + pipelineId + '\'' +
                ", team='" + team + '\'' +
                ", status=" + status +
                ", duration=" + duration +
                ", recordsProcessed=" + recordsProcessed +
                ", timestamp=" + timestamp +
                '}';
    }
}
