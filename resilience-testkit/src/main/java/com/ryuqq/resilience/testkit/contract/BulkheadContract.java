package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.BulkheadRejectedException;
import com.ryuqq.resilience.testkit.fixture.ConcurrencyTracker;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract every {@link Bulkhead} implementation must satisfy.
 *
 * <p>These scenarios run on real threads because permit acquisition is a genuine blocking
 * operation.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class BulkheadContract extends AbstractContractTest {

    protected abstract Bulkhead createBulkhead(BulkheadConfig config);

    @Test
    void testThreeCallersTwoPermitsNoWait_ExactlyOneRejected() throws Exception {
        // Given
        Bulkhead bulkhead = createBulkhead(BulkheadConfig.of(2, 0));
        ConcurrencyTracker tracker = new ConcurrencyTracker();
        CountDownLatch bothRunning = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(3);
        List<Future<String>> holders = new ArrayList<>();

        try {
            // When: two callers occupy both permits
            for (int i = 0; i < 2; i++) {
                holders.add(executor.submit(() -> bulkhead.withinCapacity(tracker.track(() -> {
                    bothRunning.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    return "done";
                }))));
            }
            assertTrue(bothRunning.await(5, TimeUnit.SECONDS), "Two callers should run concurrently");

            Future<String> third = executor.submit(() -> bulkhead.withinCapacity(tracker.track(() -> "third")));
            ExecutionException rejected = assertThrows(ExecutionException.class,
                () -> third.get(5, TimeUnit.SECONDS));
            release.countDown();

            // Then
            assertInstanceOf(BulkheadRejectedException.class, rejected.getCause());
            for (Future<String> holder : holders) {
                assertEquals("done", holder.get(5, TimeUnit.SECONDS));
            }
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        assertEquals(2, tracker.getPeak(), "Peak concurrency must never exceed the permit count");
        assertEquals(2, tracker.getInvocations(), "Rejected caller must not invoke the operation");
        assertEquals(2, bulkhead.getAvailablePermits());
        assertEquals(0, bulkhead.getCurrentConcurrency());
    }

    @Test
    void testManyCallers_PeakNeverExceedsLimit() throws Exception {
        // Given
        Bulkhead bulkhead = createBulkhead(BulkheadConfig.of(2, 2_000));
        ConcurrencyTracker tracker = new ConcurrencyTracker();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<Integer>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < 8; i++) {
                int value = i;
                futures.add(executor.submit(() -> bulkhead.withinCapacity(tracker.track(() -> {
                    sleep(20);
                    return value;
                }))));
            }
            for (Future<Integer> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertTrue(tracker.getPeak() <= 2, "peak: " + tracker.getPeak());
        assertEquals(8, tracker.getInvocations());
    }

    @Test
    void testAcquireTimeout_RejectsAfterWaiting() throws Exception {
        // Given
        Bulkhead bulkhead = createBulkhead(BulkheadConfig.of(1, 50));
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            executor.submit(() -> bulkhead.withinCapacity(() -> {
                holding.countDown();
                return release.await(5, TimeUnit.SECONDS);
            }));
            assertTrue(holding.await(5, TimeUnit.SECONDS));

            // When
            long start = System.nanoTime();
            BulkheadRejectedException rejected = assertThrows(BulkheadRejectedException.class,
                () -> bulkhead.withinCapacity(() -> "blocked"));
            long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            // Then
            assertTrue(waitedMs >= 40, "Caller should wait for the acquire timeout, waited " + waitedMs + "ms");
            assertEquals(1, rejected.getMaxConcurrentCalls());
            assertEquals(resourceId, rejected.getResourceId());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void testPermitReleasedOnFailure() {
        // Given
        Bulkhead bulkhead = createBulkhead(BulkheadConfig.of(1, 0));
        IOException error = new IOException("down");

        // When
        IOException thrown = assertThrows(IOException.class, () -> bulkhead.withinCapacity(() -> {
            throw error;
        }));

        // Then
        assertSame(error, thrown);
        assertEquals(1, bulkhead.getAvailablePermits());
        assertDoesNotThrow(() -> bulkhead.withinCapacity(() -> "next"));
    }

    @Test
    void testUnboundedConfigs_NeverReject() throws Exception {
        // Given
        List<Bulkhead> bulkheads = List.of(
            createBulkhead(new BulkheadConfig()),
            createBulkhead(new BulkheadConfig(true, null, 0)),
            createBulkhead(BulkheadConfig.of(0, 0))
        );

        // When & Then
        for (Bulkhead bulkhead : bulkheads) {
            CountDownLatch inside = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                executor.submit(() -> bulkhead.withinCapacity(() -> {
                    inside.countDown();
                    return release.await(5, TimeUnit.SECONDS);
                }));
                assertTrue(inside.await(5, TimeUnit.SECONDS));
                assertEquals("free", bulkhead.withinCapacity(() -> "free"));
            } finally {
                release.countDown();
                executor.shutdownNow();
            }
        }
    }

    @Test
    void testAsync_ThirdCallerRejectedAndPermitsReturnedOnCompletion() {
        // Given
        Bulkhead bulkhead = createBulkhead(BulkheadConfig.of(2, 0));
        CompletableFuture<String> first = new CompletableFuture<>();
        CompletableFuture<String> second = new CompletableFuture<>();
        AtomicInteger thirdCalls = new AtomicInteger();

        // When
        CompletableFuture<String> r1 = bulkhead.withinCapacityAsync(() -> first);
        CompletableFuture<String> r2 = bulkhead.withinCapacityAsync(() -> second);
        CompletableFuture<String> r3 = bulkhead.withinCapacityAsync(() -> {
            thirdCalls.incrementAndGet();
            return CompletableFuture.completedFuture("third");
        });

        // Then
        CompletionException rejected = assertThrows(CompletionException.class, r3::join);
        assertInstanceOf(BulkheadRejectedException.class, rejected.getCause());
        assertEquals(0, thirdCalls.get());
        assertEquals(2, bulkhead.getCurrentConcurrency());

        first.complete("one");
        second.completeExceptionally(new IOException("two"));
        assertEquals("one", r1.join());
        assertThrows(CompletionException.class, r2::join);
        assertEquals(2, bulkhead.getAvailablePermits());
    }

    @Test
    void testAsync_CallerCancelsInFlightOperation_PermitReleased() {
        // Given
        Bulkhead bulkhead = createBulkhead(BulkheadConfig.of(1, 0));
        CompletableFuture<String> operation = new CompletableFuture<>();
        CompletableFuture<String> result = bulkhead.withinCapacityAsync(() -> operation);
        assertEquals(0, bulkhead.getAvailablePermits());

        // When
        result.cancel(true);

        // Then
        assertTrue(operation.isCancelled(), "Cancelled caller's operation must not keep running without a permit");
        assertEquals(1, bulkhead.getAvailablePermits(), "Cancelled caller must not leak its permit");
        assertEquals("next", bulkhead.withinCapacityAsync(() -> CompletableFuture.completedFuture("next")).join());
    }

    @Test
    void testAsync_WaitingCallerGetsPermitWhenReleased() {
        // Given
        Bulkhead bulkhead = createBulkhead(BulkheadConfig.of(1, 5_000));
        CompletableFuture<String> holder = new CompletableFuture<>();
        CompletableFuture<String> r1 = bulkhead.withinCapacityAsync(() -> holder);
        AtomicInteger waiterCalls = new AtomicInteger();

        // When
        CompletableFuture<String> r2 = bulkhead.withinCapacityAsync(() -> {
            waiterCalls.incrementAndGet();
            return CompletableFuture.completedFuture("waiter");
        });
        assertEquals(0, waiterCalls.get(), "Waiter must not run while the permit is held");
        holder.complete("holder");

        // Then
        assertEquals("holder", r1.join());
        assertEquals("waiter", r2.join());
        assertEquals(1, waiterCalls.get());
        assertEquals(1, bulkhead.getAvailablePermits());
    }

    @Test
    void testAsync_WaitingCallerCancelled_NoPermitLeaked() {
        // Given
        Bulkhead bulkhead = createBulkhead(BulkheadConfig.of(1, 5_000));
        CompletableFuture<String> holder = new CompletableFuture<>();
        bulkhead.withinCapacityAsync(() -> holder);
        AtomicInteger waiterCalls = new AtomicInteger();
        CompletableFuture<String> waiting = bulkhead.withinCapacityAsync(() -> {
            waiterCalls.incrementAndGet();
            return CompletableFuture.completedFuture("waiter");
        });

        // When
        waiting.cancel(true);
        holder.complete("holder");

        // Then
        assertEquals(0, waiterCalls.get(), "Cancelled waiter must never invoke the operation");
        assertEquals(1, bulkhead.getAvailablePermits());
        assertEquals(0, bulkhead.getCurrentConcurrency());
    }
}
