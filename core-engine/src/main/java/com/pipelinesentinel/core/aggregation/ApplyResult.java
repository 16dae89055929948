package com.pipelinesentinel.core.aggregation;

/**
 * Outcome of applying one execution event.
 *
 * @since 1.0.0
 */
public enum ApplyResult {
    /** The event changed the pipeline's aggregate. */
    APPLIED,
    /** The execution id was already applied; nothing changed. */
    DUPLICATE
}
