package com.pipelinesentinel.core.detection;

/**
 * Population mean and standard deviation of a set of values.
 *
 * <p>
 * Uses Welford's single-pass update, which keeps the mean of identical
 * values exactly equal to that value, so a population with no spread
 * yields σ = 0 rather than a rounding residue.
 * </p>
 *
 * @since 1.0.0
 */
public final class PeerStatistics {

    private long count;
    private double mean;
    private double sumSquaredDiff;

    public void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        sumSquaredDiff += delta * (value - mean);
    }

    public long getCount() {
        return count;
    }

    /**
     * @return population mean, or {@code NaN} when empty
     */
    public double getMean() {
        return count == 0 ? Double.NaN : mean;
    }

    /**
     * @return population (not sample) standard deviation, or {@code NaN}
     *         when empty
     */
    public double getStdDev() {
        if (count == 0) {
            return Double.NaN;
        }
        return Math.sqrt(Math.max(0.0, sumSquaredDiff / count));
    }
}
