package com.ryuqq.resilience.core.protection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BulkheadConfig 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class BulkheadConfigTest {

    @Test
    void defaultConstructor_IsUnbounded() {
        // When
        BulkheadConfig config = new BulkheadConfig();

        // Then
        assertFalse(config.enabled());
        assertFalse(config.isBounded());
    }

    @Test
    void of_CreatesEnabledBoundedConfig() {
        // When
        BulkheadConfig config = BulkheadConfig.of(2, 100);

        // Then
        assertTrue(config.enabled());
        assertTrue(config.isBounded());
        assertEquals(2, config.maxConcurrentCalls());
        assertEquals(100L, config.maxWaitDurationMs());
    }

    @Test
    void isBounded_NullOrNonPositiveLimit_TreatedAsUnbounded() {
        // When & Then
        assertFalse(new BulkheadConfig(true, null, 0).isBounded());
        assertFalse(BulkheadConfig.of(0, 0).isBounded());
        assertFalse(BulkheadConfig.of(-3, 0).isBounded());
    }

    @Test
    void constructor_NegativeWait_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> BulkheadConfig.of(2, -1)
        );
        assertTrue(exception.getMessage().contains("maxWaitDurationMs"));
    }
}
