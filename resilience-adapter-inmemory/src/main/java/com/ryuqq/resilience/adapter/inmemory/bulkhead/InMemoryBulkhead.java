package com.ryuqq.resilience.adapter.inmemory.bulkhead;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Futures;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.BulkheadRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Permit-based {@link Bulkhead}.
 *
 * <p>Blocking and async callers draw from the same {@link PermitPool}, so the concurrency limit
 * holds across both execution models on one instance.</p>
 *
 * <p><strong>Permit Lifecycle:</strong></p>
 * <ul>
 *   <li>Blocking: acquired before the invocation, released in {@code finally}</li>
 *   <li>Async: released when the returned future completes, whether normally, exceptionally or
 *       by cancellation from the caller. A cancelled caller's operation is cancelled before the
 *       permit is returned</li>
 *   <li>An async caller cancelled while still waiting withdraws from the queue and never invokes
 *       the operation</li>
 * </ul>
 *
 * <p>{@code maxWaitDurationMs = 0} rejects immediately when no permit is free. A disabled config or a
 * {@code maxConcurrentCalls} that is null or not positive means unbounded: calls go straight
 * through and introspection reports no usage.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class InMemoryBulkhead implements Bulkhead {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBulkhead.class);

    private final ResourceId resourceId;
    private final BulkheadConfig config;
    private final PermitPool permits;

    /**
     * @param resourceId protected resource
     * @param config bulkhead configuration
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryBulkhead(ResourceId resourceId, BulkheadConfig config) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.resourceId = resourceId;
        this.config = config;
        this.permits = config.isBounded() ? new PermitPool(config.maxConcurrentCalls()) : null;
    }

    @Override
    public <T> T withinCapacity(Invocation<T> invocation) throws Exception {
        if (invocation == null) {
            throw new IllegalArgumentException("invocation cannot be null");
        }
        if (permits == null) {
            return invocation.invoke();
        }

        if (!permits.acquire(config.maxWaitDurationMs())) {
            throw rejected();
        }
        try {
            return invocation.invoke();
        } finally {
            permits.release();
        }
    }

    @Override
    public <T> CompletableFuture<T> withinCapacityAsync(AsyncInvocation<T> invocation) {
        if (invocation == null) {
            throw new IllegalArgumentException("invocation cannot be null");
        }
        if (permits == null) {
            return Futures.invokeSafely(invocation);
        }

        CompletableFuture<T> promise = new CompletableFuture<>();
        if (config.maxWaitDurationMs() == 0) {
            if (!permits.tryAcquire()) {
                return Futures.failed(rejected());
            }
            runHoldingPermit(invocation, promise);
            return promise;
        }

        CompletableFuture<Void> grant = permits.acquireAsync(config.maxWaitDurationMs());
        promise.whenComplete((ignored, error) -> permits.withdraw(grant));
        grant.whenComplete((ignored, error) -> {
            if (error == null) {
                runHoldingPermit(invocation, promise);
            } else if (Futures.unwrap(error) instanceof TimeoutException) {
                promise.completeExceptionally(rejected());
            } else {
                promise.completeExceptionally(Futures.unwrap(error));
            }
        });
        return promise;
    }

    /**
     * Current number of held permits. Always 0 when unbounded.
     */
    @Override
    public int getCurrentConcurrency() {
        return permits == null ? 0 : permits.limit() - permits.availablePermits();
    }

    /**
     * Free permits, or {@link Integer#MAX_VALUE} when unbounded.
     */
    @Override
    public int getAvailablePermits() {
        return permits == null ? Integer.MAX_VALUE : permits.availablePermits();
    }

    @Override
    public ResourceId getResourceId() {
        return resourceId;
    }

    @Override
    public BulkheadConfig getConfig() {
        return config;
    }

    // the caller already holds one permit; it is returned exactly once when promise completes,
    // after a cancelled caller's operation has been cancelled
    private <T> void runHoldingPermit(AsyncInvocation<T> invocation, CompletableFuture<T> promise) {
        if (promise.isDone()) {
            permits.release();
            return;
        }
        CompletableFuture<T> operation = Futures.invokeSafely(invocation);
        promise.whenComplete((ignored, error) -> {
            if (promise.isCancelled()) {
                operation.cancel(false);
            }
            permits.release();
        });
        operation.whenComplete((result, error) -> {
            if (error != null) {
                promise.completeExceptionally(Futures.unwrap(error));
            } else {
                promise.complete(result);
            }
        });
    }

    private BulkheadRejectedException rejected() {
        log.warn("Bulkhead full for {}: {} concurrent calls, waited {}ms",
            resourceId, config.maxConcurrentCalls(), config.maxWaitDurationMs());
        return new BulkheadRejectedException(resourceId, config.maxConcurrentCalls(), config.maxWaitDurationMs());
    }
}
