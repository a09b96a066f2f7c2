package com.ryuqq.resilience.core.protection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RateLimiterConfig 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class RateLimiterConfigTest {

    @Test
    void unlimited_IsDisabled() {
        // When
        RateLimiterConfig config = RateLimiterConfig.unlimited();

        // Then
        assertFalse(config.isEnabled());
        assertNull(config.permitsPerSecond());
        assertEquals(1, config.maxBurstSize());
        assertEquals(0.0, config.intervalMs());
    }

    @Test
    void intervalMs_ComputedFromPermitsPerSecond() {
        // When
        RateLimiterConfig config = new RateLimiterConfig(2.0, 1);

        // Then
        assertTrue(config.isEnabled());
        assertEquals(500.0, config.intervalMs());
    }

    @Test
    void constructor_NonPositiveRate_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RateLimiterConfig(0.0, 1)
        );
        assertTrue(exception.getMessage().contains("permitsPerSecond"));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiterConfig(Double.POSITIVE_INFINITY, 1));
    }

    @Test
    void constructor_ZeroBurst_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RateLimiterConfig(10.0, 0)
        );
        assertTrue(exception.getMessage().contains("(current: 0)"));
    }
}
