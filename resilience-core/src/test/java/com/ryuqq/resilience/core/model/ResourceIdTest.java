package com.ryuqq.resilience.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ResourceId Value Object 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class ResourceIdTest {

    @Test
    void of_SimpleName_HasNoOperation() {
        // When
        ResourceId resourceId = ResourceId.of("payment-api");

        // Then
        assertEquals("payment-api", resourceId.getValue());
        assertEquals("payment-api", resourceId.service());
        assertNull(resourceId.operation());
    }

    @Test
    void of_ServiceAndOperation_JoinsWithColon() {
        // When
        ResourceId resourceId = ResourceId.of("api.example.com", "list_orders");

        // Then
        assertEquals("api.example.com:list_orders", resourceId.getValue());
        assertEquals("api.example.com", resourceId.service());
        assertEquals("list_orders", resourceId.operation());
        assertEquals(resourceId, ResourceId.of("api.example.com:list_orders"));
    }

    @Test
    void withOperation_KeepsServiceAndReplacesOperation() {
        // Given
        ResourceId refund = ResourceId.of("payment-api", "refund");

        // When
        ResourceId capture = refund.withOperation("capture");

        // Then
        assertEquals(ResourceId.of("payment-api:capture"), capture);
        assertEquals(ResourceId.of("payment-api:charge"), ResourceId.of("payment-api").withOperation("charge"));
        assertNotEquals(refund, capture);
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ResourceId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
        assertThrows(IllegalArgumentException.class, () -> ResourceId.of("payment-api", null));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ResourceId.of("   ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        // Given
        String value = "a".repeat(256);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ResourceId.of(value)
        );
        assertTrue(exception.getMessage().contains("255"));
    }

    @Test
    void of_MalformedValue_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> ResourceId.of("https://api/orders"));
        assertThrows(IllegalArgumentException.class, () -> ResourceId.of("orders api"));
        assertThrows(IllegalArgumentException.class, () -> ResourceId.of("a:b:c"));
        assertThrows(IllegalArgumentException.class, () -> ResourceId.of("payment-api", ""));
        assertThrows(IllegalArgumentException.class, () -> ResourceId.of(":refund"));
    }

    @Test
    void toString_ContainsValue() {
        // When
        String text = ResourceId.of("orders", "list").toString();

        // Then
        assertEquals("ResourceId{orders:list}", text);
    }
}
