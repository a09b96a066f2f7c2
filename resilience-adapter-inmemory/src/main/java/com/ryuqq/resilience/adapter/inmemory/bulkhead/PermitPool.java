package com.ryuqq.resilience.adapter.inmemory.bulkhead;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Counting permit pool usable from blocking threads and from async callers.
 *
 * <p>Waiters queue in FIFO order as futures. {@link #release()} hands the permit directly to the
 * first waiter that is still pending; only when nobody is waiting does the free count grow.
 * A waiter that timed out or was withdrawn can never receive a permit, so no permit is lost.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
final class PermitPool {

    private final int limit;
    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private int available;

    PermitPool(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        this.limit = limit;
        this.available = limit;
    }

    synchronized boolean tryAcquire() {
        if (available > 0) {
            available--;
            return true;
        }
        return false;
    }

    /**
     * Blocks until a permit is granted or the timeout elapses.
     *
     * @param timeoutMs maximum wait, 0 for an immediate attempt
     * @return {@code true} if a permit is now held by the caller
     * @throws InterruptedException if interrupted while waiting; no permit is held in that case
     */
    boolean acquire(long timeoutMs) throws InterruptedException {
        if (timeoutMs <= 0) {
            return tryAcquire();
        }

        CompletableFuture<Void> waiter = grantOrEnqueue();
        try {
            waiter.get(timeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return !withdraw(waiter);
        } catch (InterruptedException e) {
            if (!withdraw(waiter)) {
                release();
            }
            throw e;
        } catch (ExecutionException e) {
            return false;
        }
    }

    /**
     * Returns a future completed once a permit is granted.
     *
     * <p>The future fails with {@link TimeoutException} when no permit arrives in time.</p>
     *
     * @param timeoutMs maximum wait in milliseconds, must be positive
     * @return pending or already completed grant
     */
    CompletableFuture<Void> acquireAsync(long timeoutMs) {
        CompletableFuture<Void> grant = grantOrEnqueue();
        if (grant.isDone()) {
            return grant;
        }
        return grant.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Withdraws a pending waiter.
     *
     * @param waiter waiter returned by this pool
     * @return {@code true} if the waiter was withdrawn, {@code false} if it was already granted a permit
     */
    boolean withdraw(CompletableFuture<Void> waiter) {
        boolean withdrawn = waiter.cancel(false);
        if (withdrawn) {
            remove(waiter);
            return true;
        }
        return waiter.isCompletedExceptionally();
    }

    void release() {
        while (true) {
            CompletableFuture<Void> next;
            synchronized (this) {
                next = waiters.pollFirst();
                if (next == null) {
                    if (available >= limit) {
                        throw new IllegalStateException(
                            "PermitPool invariant violated: release without acquire (limit: " + limit + ")"
                        );
                    }
                    available++;
                    return;
                }
            }
            if (next.complete(null)) {
                return;
            }
        }
    }

    synchronized int availablePermits() {
        return available;
    }

    int limit() {
        return limit;
    }

    private CompletableFuture<Void> grantOrEnqueue() {
        CompletableFuture<Void> waiter;
        synchronized (this) {
            if (available > 0) {
                available--;
                return CompletableFuture.completedFuture(null);
            }
            waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
        }
        waiter.whenComplete((ignored, error) -> {
            if (error != null) {
                remove(waiter);
            }
        });
        return waiter;
    }

    private synchronized void remove(CompletableFuture<Void> waiter) {
        waiters.remove(waiter);
    }
}
