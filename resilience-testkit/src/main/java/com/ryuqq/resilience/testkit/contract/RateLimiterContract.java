package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.testkit.fixture.RecordingSuspender;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract every {@link RateLimiter} implementation must satisfy.
 *
 * <p>The pacing algorithm is asserted through exact wait durations: a burst of
 * {@code maxBurstSize} calls passes, after which calls are spaced by {@code 1 / permitsPerSecond}.
 * Implementations must read time from {@link #clock} and wait through {@link #suspender}.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class RateLimiterContract extends AbstractContractTest {

    protected abstract RateLimiter createRateLimiter(RateLimiterConfig config);

    @Test
    void testTwoCallsTenMillisApart_SecondWaitsRemainderOfInterval() throws Exception {
        // Given
        RateLimiter limiter = createRateLimiter(new RateLimiterConfig(2.0, 1));
        AtomicInteger calls = new AtomicInteger();

        // When
        limiter.throttle(counting(calls, "first"));
        clock.advanceMillis(10);
        limiter.throttle(counting(calls, "second"));

        // Then
        assertEquals(2, calls.get());
        assertEquals(List.of(490L), suspender.getSuspensions());
    }

    @Test
    void testWaitHappensBeforeInvocation() throws Exception {
        // Given
        RateLimiter limiter = createRateLimiter(new RateLimiterConfig(2.0, 1));
        limiter.throttle(() -> "first");
        long before = clock.millis();

        // When
        long invokedAt = limiter.<Long>throttle(clock::millis);

        // Then
        assertEquals(before + 500, invokedAt, "Operation must run after the pacing wait");
    }

    @Test
    void testDisabled_NeverWaits() throws Exception {
        // Given
        RateLimiter limiter = createRateLimiter(RateLimiterConfig.unlimited());
        AtomicInteger calls = new AtomicInteger();

        // When
        for (int i = 0; i < 10; i++) {
            limiter.throttle(counting(calls, i));
        }

        // Then
        assertEquals(10, calls.get());
        assertTrue(suspender.getSuspensions().isEmpty());
    }

    @Test
    void testBurst_AllowsBurstThenPaces() throws Exception {
        // Given
        RateLimiter limiter = createRateLimiter(new RateLimiterConfig(2.0, 3));

        // When
        for (int i = 0; i < 3; i++) {
            limiter.throttle(() -> "burst");
        }
        assertTrue(suspender.getSuspensions().isEmpty(), "Burst calls must not wait");
        limiter.throttle(() -> "paced");

        // Then
        assertEquals(List.of(500L), suspender.getSuspensions());
    }

    @Test
    void testIntervalElapsed_BurstCountResets() throws Exception {
        // Given
        RateLimiter limiter = createRateLimiter(new RateLimiterConfig(2.0, 1));
        limiter.throttle(() -> "first");

        // When
        clock.advanceMillis(500);
        limiter.throttle(() -> "second");
        clock.advanceMillis(600);
        limiter.throttle(() -> "third");

        // Then
        assertTrue(suspender.getSuspensions().isEmpty());
    }

    @Test
    void testOperationFailure_PropagatedAfterPacing() throws Exception {
        // Given
        RateLimiter limiter = createRateLimiter(new RateLimiterConfig(4.0, 1));
        limiter.throttle(() -> "first");
        IOException error = new IOException("down");

        // When
        IOException thrown = assertThrows(IOException.class, () -> limiter.throttle(() -> {
            throw error;
        }));

        // Then
        assertSame(error, thrown);
        assertEquals(List.of(250L), suspender.getSuspensions());
    }

    @Test
    void testAsync_TwoCallsTenMillisApart_SecondWaits() {
        // Given
        RateLimiter limiter = createRateLimiter(new RateLimiterConfig(2.0, 1));

        // When
        limiter.throttleAsync(() -> CompletableFuture.completedFuture("first")).join();
        clock.advanceMillis(10);
        String result = limiter.throttleAsync(() -> CompletableFuture.completedFuture("second")).join();

        // Then
        assertEquals("second", result);
        assertEquals(List.of(490L), suspender.getSuspensions());
    }

    @Test
    void testAsync_BurstWhileSlotPending_LaterCallersQueueBehindIt() {
        // Given: waits stay pending until released, so reservations overlap
        suspender = RecordingSuspender.holding(clock);
        RateLimiter limiter = createRateLimiter(new RateLimiterConfig(1.0, 3));
        List<Integer> invocationOrder = new CopyOnWriteArrayList<>();
        List<CompletableFuture<Integer>> results = new ArrayList<>();

        // When: six callers arrive 1ms apart
        for (int i = 0; i < 6; i++) {
            int index = i;
            results.add(limiter.throttleAsync(() -> {
                invocationOrder.add(index);
                return CompletableFuture.completedFuture(index);
            }));
            clock.advanceMillis(1);
        }

        // Then: only the burst runs within the first interval
        assertEquals(List.of(0, 1, 2), invocationOrder, "Callers behind a pending slot must not skip pacing");
        assertEquals(3, suspender.pendingCount());

        suspender.releasePending();
        assertEquals(List.of(0, 1, 2, 3, 4, 5), invocationOrder, "Paced callers run in arrival order");
        assertEquals(List.of(999L, 998L, 997L), suspender.getSuspensions());
        for (int i = 0; i < 6; i++) {
            assertEquals(i, results.get(i).join());
        }
    }
}
