package com.ryuqq.resilience.testkit.fixture;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MutableClock}.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class MutableClockTest {

    @Test
    void startingAt_ReturnsFixedInstantUntilAdvanced() {
        // Given
        Instant start = Instant.parse("2024-05-01T10:00:00Z");
        MutableClock clock = MutableClock.startingAt(start);

        // When & Then
        assertEquals(start, clock.instant());
        assertEquals(start, clock.instant());

        clock.advance(Duration.ofMillis(1_500));
        assertEquals(start.plusMillis(1_500), clock.instant());
        assertEquals(start.toEpochMilli() + 1_500, clock.millis());
    }

    @Test
    void advance_NegativeDuration_ThrowsException() {
        // Given
        MutableClock clock = MutableClock.create();

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> clock.advance(Duration.ofMillis(-1)));
    }

    @Test
    void withZone_SharesTime() {
        // Given
        MutableClock clock = MutableClock.create();
        Clock seoul = clock.withZone(ZoneId.of("Asia/Seoul"));

        // When
        clock.advanceMillis(42);

        // Then
        assertEquals(clock.instant(), seoul.instant());
        assertEquals(ZoneId.of("Asia/Seoul"), seoul.getZone());
    }
}
