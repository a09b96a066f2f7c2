package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.classify.Classifiers;
import com.ryuqq.resilience.core.model.ResourceId;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryConfig 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class RetryConfigTest {

    @Test
    void defaultConstructor_UsesDefaults() {
        // When
        RetryConfig config = new RetryConfig();

        // Then
        assertEquals(3, config.maxRetries());
        assertEquals(1000L, config.baseDelayMs());
        assertEquals(2.0, config.backoffFactor());
        assertEquals(60000L, config.maxDelayMs());
        assertFalse(config.jitter());
    }

    @Test
    void constructor_NegativeMaxRetries_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryConfig().withMaxRetries(-1)
        );
        assertTrue(exception.getMessage().contains("maxRetries"));
    }

    @Test
    void constructor_BackoffFactorBelowOne_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new RetryConfig().withBackoffFactor(0.5));
        assertThrows(IllegalArgumentException.class, () -> new RetryConfig().withBackoffFactor(Double.NaN));
    }

    @Test
    void constructor_MaxDelayBelowBaseDelay_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryConfig(1, 500, 2.0, 100, false, null, null)
        );
        assertTrue(exception.getMessage().contains("maxDelayMs"));
    }

    @Test
    void isRetryableResult_NoPredicate_ReturnsFalse() {
        // When & Then
        assertFalse(new RetryConfig().isRetryableResult("anything"));
    }

    @Test
    void isRetryableResult_WithPredicate_DelegatesToPredicate() {
        // Given
        RetryConfig config = new RetryConfig().withRetryableResult(result -> "retry".equals(result));

        // When & Then
        assertTrue(config.isRetryableResult("retry"));
        assertFalse(config.isRetryableResult("done"));
    }

    @Test
    void isRetryableError_NoPredicate_RetriesEverythingButOpenCircuit() {
        // Given
        RetryConfig config = new RetryConfig();
        ResourceId resourceId = ResourceId.of("orders");

        // When & Then
        assertTrue(config.isRetryableError(new IOException("reset")));
        assertTrue(config.isRetryableError(new BulkheadRejectedException(resourceId, 2, 0)));
        assertFalse(config.isRetryableError(new CircuitOpenException(resourceId, Instant.EPOCH, 1000)));
    }

    @Test
    void isRetryableError_WithPredicate_DelegatesToPredicate() {
        // Given
        RetryConfig config = new RetryConfig().withRetryableError(Classifiers.errorTypes(IOException.class));

        // When & Then
        assertTrue(config.isRetryableError(new IOException()));
        assertFalse(config.isRetryableError(new IllegalStateException()));
    }
}
