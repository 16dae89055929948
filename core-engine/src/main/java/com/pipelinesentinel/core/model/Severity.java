package com.pipelinesentinel.core.model;

/**
 * Ordinal severity of an alert, lowest first.
 *
 * @since 1.0.0
 */
public enum Severity {
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isHigherThan(Severity other) {
        return compareTo(other) > 0;
    }
}
