package com.pipelinesentinel.core.aggregation;

import java.io.Serializable;
import java.time.Instant;

/**
 * Minimal record of one run, kept in a pipeline's bounded history.
 *
 * @since 1.0.0
 */
public final class ExecutionSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final boolean success;
    private final double duration;

    public ExecutionSample(Instant timestamp, boolean success, double duration) {
        this.timestamp = timestamp;
        this.success = success;
        this.duration = duration;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isSuccess() {
        return success;
    }

    public double getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "ExecutionSample{timestamp=" + timestamp + ", success=" + success
                + ", duration=" + duration + '}';
    }
}
