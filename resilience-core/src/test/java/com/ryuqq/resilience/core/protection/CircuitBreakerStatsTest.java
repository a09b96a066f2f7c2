package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.ResourceId;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * CircuitBreakerStats 비율 계산 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class CircuitBreakerStatsTest {

    private static final ResourceId RESOURCE = ResourceId.of("orders");

    @Test
    void rates_UseTotalCallsIncludingRejected() {
        // Given
        CircuitBreakerStats stats = new CircuitBreakerStats(
            RESOURCE, CircuitBreakerState.OPEN, 3, 0, null, null, 10, 3, 5, 2
        );

        // When & Then
        assertThat(stats.failureRate()).isCloseTo(0.3, within(1e-9));
        assertThat(stats.successRate()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void rates_NoCalls_AreZero() {
        // Given
        CircuitBreakerStats stats = new CircuitBreakerStats(
            RESOURCE, CircuitBreakerState.CLOSED, 0, 0, null, null, 0, 0, 0, 0
        );

        // When & Then
        assertThat(stats.failureRate()).isZero();
        assertThat(stats.successRate()).isZero();
    }
}
