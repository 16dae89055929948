package com.pipelinesentinel.core.aggregation;

/**
 * Counts from applying a batch of events.
 *
 * @since 1.0.0
 */
public final class ApplySummary {

    private final long applied;
    private final long duplicates;
    private final long rejected;

    public ApplySummary(long applied, long duplicates, long rejected) {
        this.applied = applied;
        this.duplicates = duplicates;
        this.rejected = rejected;
    }

    public long getApplied() {
        return applied;
    }

    public long getDuplicates() {
        return duplicates;
    }

    public long getRejected() {
        return rejected;
    }

    public long getTotal() {
        return applied + duplicates + rejected;
    }

    @Override
    public String toString() {
        return "ApplySummary{applied=" + applied + ", duplicates=" + duplicates
                + ", rejected=" + rejected + '}';
    }
}
