package com.pipelinesentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Severity}.
 */
class SeverityTest {

    @Test
    @DisplayName("Should order severities from MEDIUM up to CRITICAL")
    void shouldOrderSeverities() {
        assertThat(Severity.values()).containsExactly(Severity.MEDIUM, Severity.HIGH, Severity.CRITICAL);
        assertThat(Severity.CRITICAL.isHigherThan(Severity.HIGH)).isTrue();
        assertThat(Severity.HIGH.isHigherThan(Severity.MEDIUM)).isTrue();
        assertThat(Severity.MEDIUM.isHigherThan(Severity.MEDIUM)).isFalse();
        assertThat(Severity.MEDIUM.isHigherThan(Severity.CRITICAL)).isFalse();
    }
}
