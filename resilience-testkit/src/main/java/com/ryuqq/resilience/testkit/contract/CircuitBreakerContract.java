package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.classify.FailureClassifier;
import com.ryuqq.resilience.core.protection.BulkheadRejectedException;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.CircuitBreakerStats;
import com.ryuqq.resilience.core.protection.CircuitOpenException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract every {@link CircuitBreaker} implementation must satisfy.
 *
 * <p><strong>Scenarios:</strong></p>
 * <ul>
 *   <li>N consecutive failures open the circuit on the Nth failure</li>
 *   <li>The recovery window is honoured on both edges</li>
 *   <li>HALF_OPEN closes after K successes and reopens on a single failure</li>
 *   <li>Rejections never invoke the operation and never count as failures</li>
 *   <li>{@code reset()} always returns to a clean CLOSED state</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class CircuitBreakerContract extends AbstractContractTest {

    /**
     * Creates the breaker under test. Implementations must read time from {@link #clock}.
     *
     * @param config breaker configuration
     * @return breaker under test
     */
    protected abstract CircuitBreaker createCircuitBreaker(CircuitBreakerConfig config);

    protected CircuitBreakerConfig enabledConfig(int failureThreshold, long recoveryTimeoutMs, int successThreshold) {
        return new CircuitBreakerConfig(true, failureThreshold, recoveryTimeoutMs, successThreshold,
            FailureClassifier.defaults());
    }

    @Test
    void testFailureThreshold_NthFailureOpens_NextCallRejectedWithoutInvocation() throws Exception {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(enabledConfig(3, 60_000, 2));
        AtomicInteger calls = new AtomicInteger();

        // When: two failures keep the circuit closed
        for (int i = 0; i < 2; i++) {
            assertThrows(IOException.class, () -> breaker.protect(failing(calls, new IOException("down"))));
        }
        assertTrue(breaker.isClosed(), "Circuit must stay CLOSED below the threshold");

        // Third failure opens it
        assertThrows(IOException.class, () -> breaker.protect(failing(calls, new IOException("down"))));
        assertTrue(breaker.isOpen(), "Circuit must be OPEN after the Nth failure");

        // Then
        AtomicInteger rejectedCalls = new AtomicInteger();
        assertThrows(CircuitOpenException.class, () -> breaker.protect(counting(rejectedCalls, "never")));
        assertEquals(0, rejectedCalls.get(), "Rejected call must not invoke the operation");
        assertEquals(3, calls.get());
    }

    @Test
    void testSuccessInClosed_ResetsConsecutiveFailureCount() throws Exception {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(enabledConfig(2, 60_000, 1));
        AtomicInteger calls = new AtomicInteger();

        // When
        assertThrows(IOException.class, () -> breaker.protect(failing(calls, new IOException())));
        breaker.protect(counting(calls, "ok"));
        assertThrows(IOException.class, () -> breaker.protect(failing(calls, new IOException())));

        // Then
        assertTrue(breaker.isClosed(), "Failures separated by a success are not consecutive");
        assertEquals(1, breaker.getStats().failureCount());
    }

    @Test
    void testRecoveryWindow_RejectsJustBeforeAndAdmitsTrialJustAfter() throws Exception {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(enabledConfig(1, 1_000, 2));
        assertThrows(IOException.class, () -> breaker.protect(failing(new AtomicInteger(), new IOException())));
        assertTrue(breaker.isOpen());

        // When: just before the window ends
        clock.advanceMillis(999);
        AtomicInteger calls = new AtomicInteger();
        CircuitOpenException rejection = assertThrows(CircuitOpenException.class,
            () -> breaker.protect(counting(calls, "trial")));

        // Then
        assertEquals(0, calls.get());
        assertEquals(resourceId, rejection.getResourceId());
        assertEquals(1L, rejection.getRemainingMs());

        // When: just after the window ends
        clock.advanceMillis(2);
        String result = breaker.protect(counting(calls, "trial"));

        // Then
        assertEquals("trial", result);
        assertEquals(1, calls.get(), "Trial call must invoke the operation");
        assertTrue(breaker.isHalfOpen(), "One success below successThreshold keeps HALF_OPEN");
    }

    @Test
    void testHalfOpen_SuccessThresholdReached_ClosesWithCountersReset() throws Exception {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(enabledConfig(1, 1_000, 2));
        assertThrows(IOException.class, () -> breaker.protect(failing(new AtomicInteger(), new IOException())));
        clock.advanceMillis(1_001);

        // When
        AtomicInteger calls = new AtomicInteger();
        breaker.protect(counting(calls, "first"));
        breaker.protect(counting(calls, "second"));

        // Then
        CircuitBreakerStats stats = breaker.getStats();
        assertEquals(CircuitBreakerState.CLOSED, stats.state());
        assertEquals(0, stats.failureCount());
        assertEquals(0, stats.successCount());
    }

    @Test
    void testHalfOpen_SingleFailure_ReopensImmediately() throws Exception {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(enabledConfig(3, 1_000, 3));
        for (int i = 0; i < 3; i++) {
            assertThrows(IOException.class, () -> breaker.protect(failing(new AtomicInteger(), new IOException())));
        }
        clock.advanceMillis(1_000);
        breaker.protect(counting(new AtomicInteger(), "trial"));
        assertTrue(breaker.isHalfOpen());

        // When
        assertThrows(IOException.class, () -> breaker.protect(failing(new AtomicInteger(), new IOException())));

        // Then
        assertTrue(breaker.isOpen(), "A single failure while probing must reopen the circuit");
        assertThrows(CircuitOpenException.class, () -> breaker.protect(counting(new AtomicInteger(), "x")));
    }

    @Test
    void testRejection_NotCountedAsFailure() throws Exception {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(enabledConfig(1, 60_000, 1));
        assertThrows(IOException.class, () -> breaker.protect(failing(new AtomicInteger(), new IOException())));

        // When
        for (int i = 0; i < 3; i++) {
            assertThrows(CircuitOpenException.class, () -> breaker.protect(counting(new AtomicInteger(), "x")));
        }

        // Then
        CircuitBreakerStats stats = breaker.getStats();
        assertEquals(1L, stats.totalFailures());
        assertEquals(3L, stats.totalRejected());
        assertEquals(4L, stats.totalCalls(), "Rejected calls are part of totalCalls");
    }

    @Test
    void testInnerRejection_NeitherSuccessNorFailure() throws Exception {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(enabledConfig(1, 60_000, 1));
        BulkheadRejectedException inner = new BulkheadRejectedException(resourceId, 1, 0);

        // When
        BulkheadRejectedException thrown = assertThrows(BulkheadRejectedException.class,
            () -> breaker.protect(() -> {
                throw inner;
            }));

        // Then
        assertSame(inner, thrown);
        assertTrue(breaker.isClosed(), "Inner rejection must not trip the breaker");
        assertEquals(0L, breaker.getStats().totalFailures());
        assertEquals(0L, breaker.getStats().totalSuccesses());
    }

    @Test
    void testClassifiedFailureResult_ReturnedAndCounted() throws Exception {
        // Given
        CircuitBreakerConfig config = enabledConfig(2, 60_000, 1)
            .withFailureClassifier(FailureClassifier.of("503"::equals, error -> true));
        CircuitBreaker breaker = createCircuitBreaker(config);

        // When
        String first = breaker.protect(() -> "503");
        String second = breaker.protect(() -> "503");

        // Then
        assertEquals("503", first, "Failure results are returned to the caller");
        assertEquals("503", second);
        assertTrue(breaker.isOpen());
        assertNotNull(breaker.getStats().lastFailureTime());
    }

    @Test
    void testUnclassifiedError_CountsAsSuccess() throws Exception {
        // Given
        CircuitBreakerConfig config = enabledConfig(1, 60_000, 1)
            .withFailureClassifier(FailureClassifier.of(result -> false, error -> error instanceof IOException));
        CircuitBreaker breaker = createCircuitBreaker(config);

        // When
        assertThrows(IllegalArgumentException.class, () -> breaker.protect(() -> {
            throw new IllegalArgumentException("bad request");
        }));

        // Then
        assertTrue(breaker.isClosed());
        assertEquals(0L, breaker.getStats().totalFailures());
    }

    @Test
    void testReset_FromOpen_AlwaysClosedAndClean() throws Exception {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(enabledConfig(2, 60_000, 1));
        for (int i = 0; i < 2; i++) {
            assertThrows(IOException.class, () -> breaker.protect(failing(new AtomicInteger(), new IOException())));
        }
        assertTrue(breaker.isOpen());

        // When
        breaker.reset();

        // Then
        assertTrue(breaker.isClosed());
        assertEquals(0, breaker.getStats().failureCount());
        assertEquals(0, breaker.getStats().successCount());
        assertEquals("ok", breaker.protect(() -> "ok"));
    }

    @Test
    void testForceOpen_RejectsUntilRecoveryTimeoutElapses() throws Exception {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(enabledConfig(5, 1_000, 1));

        // When
        breaker.forceOpen();

        // Then
        assertTrue(breaker.isOpen());
        assertThrows(CircuitOpenException.class, () -> breaker.protect(() -> "x"));

        clock.advanceMillis(1_000);
        assertEquals("x", breaker.protect(() -> "x"));
        assertTrue(breaker.isClosed(), "successThreshold 1 closes on the first trial call");
    }

    @Test
    void testDisabled_PassesThroughAndNeverOpens() throws Exception {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(new CircuitBreakerConfig().withFailureThreshold(1));
        AtomicInteger calls = new AtomicInteger();

        // When
        for (int i = 0; i < 5; i++) {
            assertThrows(IOException.class, () -> breaker.protect(failing(calls, new IOException())));
        }

        // Then
        assertEquals(5, calls.get());
        assertTrue(breaker.isClosed());
    }

    @Test
    void testAsync_FailuresOpenAndRejectionFailsFuture() {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(enabledConfig(2, 60_000, 1));
        IOException error = new IOException("down");

        // When
        for (int i = 0; i < 2; i++) {
            CompletableFuture<String> future = breaker.protectAsync(() -> CompletableFuture.failedFuture(error));
            CompletionException thrown = assertThrows(CompletionException.class, future::join);
            assertSame(error, thrown.getCause(), "Original error must surface unwrapped");
        }

        // Then
        assertTrue(breaker.isOpen());
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<String> rejected = breaker.protectAsync(() -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("never");
        });
        CompletionException thrown = assertThrows(CompletionException.class, rejected::join);
        assertInstanceOf(CircuitOpenException.class, thrown.getCause());
        assertEquals(0, calls.get());
    }

    @Test
    void testAsync_HalfOpenTrialSucceeds_Closes() {
        // Given
        CircuitBreaker breaker = createCircuitBreaker(enabledConfig(1, 500, 1));
        breaker.protectAsync(() -> CompletableFuture.failedFuture(new IOException())).exceptionally(e -> null).join();
        clock.advanceMillis(500);

        // When
        String result = breaker.protectAsync(() -> CompletableFuture.completedFuture("ok")).join();

        // Then
        assertEquals("ok", result);
        assertTrue(breaker.isClosed());
    }

    @Test
    void testConcurrentFailures_TransitionCommittedOnceAndCountsConsistent() throws Exception {
        // Given
        int threads = 16;
        CircuitBreaker breaker = createCircuitBreaker(enabledConfig(5, 60_000, 1));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger invoked = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        return breaker.protect(failing(invoked, new IOException("down")));
                    } catch (IOException | CircuitOpenException expected) {
                        return null;
                    }
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        CircuitBreakerStats stats = breaker.getStats();
        assertEquals(CircuitBreakerState.OPEN, stats.state());
        assertEquals(threads, stats.totalCalls());
        assertEquals(threads, stats.totalFailures() + stats.totalRejected());
        assertEquals(invoked.get(), stats.totalFailures(), "Every invoked call is recorded exactly once");
        assertTrue(stats.totalFailures() >= 5);
    }
}
