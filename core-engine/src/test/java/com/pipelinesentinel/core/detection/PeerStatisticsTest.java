package com.pipelinesentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PeerStatistics}.
 */
class PeerStatisticsTest {

    @Test
    @DisplayName("Should compute population mean and standard deviation")
    void shouldComputePopulationStatistics() {
        PeerStatistics stats = new PeerStatistics();
        for (double v : new double[]{2, 4, 4, 4, 5, 5, 7, 9}) {
            stats.add(v);
        }

        assertThat(stats.getCount()).isEqualTo(8);
        assertThat(stats.getMean()).isCloseTo(5.0, within(1e-12));
        assertThat(stats.getStdDev()).isCloseTo(2.0, within(1e-12));
    }

    @Test
    @DisplayName("Should report exactly zero spread for identical values")
    void shouldReportZeroSpreadForIdenticalValues() {
        PeerStatistics stats = new PeerStatistics();
        for (int i = 0; i < 7; i++) {
            stats.add(0.1);
        }

        assertThat(stats.getMean()).isEqualTo(0.1);
        assertThat(stats.getStdDev()).isZero();
    }

    @Test
    @DisplayName("Should report NaN when empty")
    void shouldReportNaNWhenEmpty() {
        PeerStatistics stats = new PeerStatistics();

        assertThat(stats.getMean()).isNaN();
        assertThat(stats.getStdDev()).isNaN();
    }
}
