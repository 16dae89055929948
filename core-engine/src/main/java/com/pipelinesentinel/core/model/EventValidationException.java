package com.pipelinesentinel.core.model;

import java.util.List;

/**
 * Thrown when an {@link ExecutionEvent} is malformed and cannot be applied.
 *
 * <p>
 * Carries every problem found on the event, not just the first one.
 * </p>
 *
 * @since 1.0.0
 */
public class EventValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public EventValidationException(String executionId, List<String> errors) {
        super("Invalid execution event '" + executionId + "': " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * @return unmodifiable list of validation errors
     */
    public List<String> getErrors() {
        return errors;
    }
}
