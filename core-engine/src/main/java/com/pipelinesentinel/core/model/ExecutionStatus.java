package com.pipelinesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Terminal outcome of a single pipeline run.
 *
 * <p>
 * Only finished runs are aggregated. Any other status found on the wire
 * (for example {@code RUNNING} or {@code CANCELLED}) deserializes to
 * {@code null} and is rejected by {@link ExecutionEvent#validate()}.
 * </p>
 *
 * @since 1.0.0
 */
public enum ExecutionStatus {

    SUCCESS,
    FAILED;

    /**
     * Resolve a wire value, case-insensitively.
     *
     * @param value status string, may be {@code null}
     * @return the matching status, or {@code null} if unsupported
     */
    @JsonCreator
    public static ExecutionStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "SUCCESS" -> SUCCESS;
            case "FAILED", "FAILURE" -> FAILED;
            default -> null;
        };
    }

    @JsonValue
    public String toValue() {
        return name();
    }
}
