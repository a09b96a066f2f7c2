package com.ryuqq.resilience.adapter.inmemory.circuitbreaker;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Futures;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.CircuitBreakerStats;
import com.ryuqq.resilience.core.protection.CircuitOpenException;
import com.ryuqq.resilience.core.protection.ProtectionRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory implementation of {@link CircuitBreaker}.
 *
 * <p>All counters and the state live in this instance and are mutated only inside
 * {@code synchronized} blocks. The protected operation itself always runs outside the lock,
 * so a slow call never blocks admission decisions of other callers.</p>
 *
 * <p><strong>State Machine:</strong></p>
 * <pre>
 * CLOSED    --(failureCount &gt;= failureThreshold)--&gt; OPEN
 * OPEN      --(next call after recoveryTimeout)----&gt; HALF_OPEN
 * HALF_OPEN --(successCount &gt;= successThreshold)--&gt; CLOSED
 * HALF_OPEN --(any failure)-----------------------&gt; OPEN
 * </pre>
 *
 * <p>The recovery window is measured from the most recent failure. {@link #forceOpen()} starts a
 * fresh window at the time it is called.</p>
 *
 * <p><strong>Outcome Recording:</strong></p>
 * <ul>
 *   <li>Returned results flagged by the {@link com.ryuqq.resilience.core.classify.FailureClassifier}
 *       are failures and are still returned to the caller</li>
 *   <li>Thrown errors are failures when the classifier says so, otherwise successes</li>
 *   <li>{@link ProtectionRejectedException} from inner protections and cancellations are not recorded</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class InMemoryCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreaker.class);

    private final ResourceId resourceId;
    private final CircuitBreakerConfig config;
    private final Clock clock;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;
    private long recoveryReferenceMs;
    private long totalCalls;
    private long totalFailures;
    private long totalSuccesses;
    private long totalRejected;

    /**
     * Creates a breaker reading time from the system UTC clock.
     *
     * @param resourceId protected resource
     * @param config breaker configuration
     */
    public InMemoryCircuitBreaker(ResourceId resourceId, CircuitBreakerConfig config) {
        this(resourceId, config, Clock.systemUTC());
    }

    /**
     * Creates a breaker with an explicit clock.
     *
     * @param resourceId protected resource
     * @param config breaker configuration
     * @param clock time source for recovery windows and timestamps
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryCircuitBreaker(ResourceId resourceId, CircuitBreakerConfig config, Clock clock) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.resourceId = resourceId;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public <T> T protect(Invocation<T> invocation) throws Exception {
        if (invocation == null) {
            throw new IllegalArgumentException("invocation cannot be null");
        }
        if (!config.enabled()) {
            return invocation.invoke();
        }

        CircuitOpenException rejection = admit();
        if (rejection != null) {
            throw rejection;
        }

        T result;
        try {
            result = invocation.invoke();
        } catch (Exception e) {
            onError(e);
            throw e;
        }
        onResult(result);
        return result;
    }

    @Override
    public <T> CompletableFuture<T> protectAsync(AsyncInvocation<T> invocation) {
        if (invocation == null) {
            throw new IllegalArgumentException("invocation cannot be null");
        }
        if (!config.enabled()) {
            return Futures.invokeSafely(invocation);
        }

        CircuitOpenException rejection = admit();
        if (rejection != null) {
            return Futures.failed(rejection);
        }

        CompletableFuture<T> operation = Futures.invokeSafely(invocation);
        CompletableFuture<T> outcome = operation.whenComplete((result, error) -> {
            if (error != null) {
                onError(Futures.unwrap(error));
            } else {
                onResult(result);
            }
        });
        return Futures.propagateCancellation(outcome, operation);
    }

    @Override
    public boolean tryAcquire() {
        return !config.enabled() || admit() == null;
    }

    @Override
    public synchronized void recordSuccess() {
        lastSuccessTime = clock.instant();
        totalSuccesses++;

        if (state == CircuitBreakerState.HALF_OPEN) {
            successCount++;
            if (successCount >= config.successThreshold()) {
                transitionTo(CircuitBreakerState.CLOSED);
            }
        } else if (state == CircuitBreakerState.CLOSED) {
            failureCount = 0;
        }
    }

    @Override
    public synchronized void recordFailure(Throwable cause) {
        lastFailureTime = clock.instant();
        recoveryReferenceMs = lastFailureTime.toEpochMilli();
        failureCount++;
        totalFailures++;

        if (state == CircuitBreakerState.HALF_OPEN) {
            log.debug("Trial call failed for {}: {}", resourceId, describe(cause));
            transitionTo(CircuitBreakerState.OPEN);
        } else if (state == CircuitBreakerState.CLOSED && failureCount >= config.failureThreshold()) {
            transitionTo(CircuitBreakerState.OPEN);
        }
    }

    @Override
    public synchronized CircuitBreakerState getState() {
        return state;
    }

    @Override
    public synchronized CircuitBreakerStats getStats() {
        return new CircuitBreakerStats(
            resourceId,
            state,
            failureCount,
            successCount,
            lastFailureTime,
            lastSuccessTime,
            totalCalls,
            totalFailures,
            totalSuccesses,
            totalRejected
        );
    }

    @Override
    public synchronized void reset() {
        transitionTo(CircuitBreakerState.CLOSED);
        log.info("Circuit breaker for {} manually reset to CLOSED", resourceId);
    }

    @Override
    public synchronized void forceOpen() {
        recoveryReferenceMs = clock.millis();
        transitionTo(CircuitBreakerState.OPEN);
        log.info("Circuit breaker for {} manually forced to OPEN", resourceId);
    }

    @Override
    public ResourceId getResourceId() {
        return resourceId;
    }

    @Override
    public CircuitBreakerConfig getConfig() {
        return config;
    }

    /**
     * Admission decision for one call.
     *
     * @return {@code null} when the call may proceed, otherwise the rejection to raise
     */
    private synchronized CircuitOpenException admit() {
        totalCalls++;

        if (state == CircuitBreakerState.OPEN) {
            long elapsed = clock.millis() - recoveryReferenceMs;
            if (elapsed < config.recoveryTimeoutMs()) {
                totalRejected++;
                long remainingMs = config.recoveryTimeoutMs() - elapsed;
                log.warn("Circuit breaker OPEN for {}, call rejected (retry after {}ms)", resourceId, remainingMs);
                return new CircuitOpenException(resourceId, lastFailureTime, remainingMs);
            }
            transitionTo(CircuitBreakerState.HALF_OPEN);
        }
        return null;
    }

    private void onResult(Object result) {
        if (config.failureClassifier().isFailureResult(result)) {
            recordFailure(null);
        } else {
            recordSuccess();
        }
    }

    private void onError(Throwable error) {
        if (error instanceof ProtectionRejectedException || Futures.isCancellation(error)) {
            log.debug("Outcome not recorded for {}: {}", resourceId, error.getClass().getSimpleName());
            return;
        }
        if (config.failureClassifier().isFailureError(error)) {
            recordFailure(error);
        } else {
            recordSuccess();
        }
    }

    // caller holds the monitor
    private void transitionTo(CircuitBreakerState target) {
        CircuitBreakerState previous = state;
        state = target;
        successCount = 0;
        if (target == CircuitBreakerState.CLOSED) {
            failureCount = 0;
        }

        if (previous == target) {
            return;
        }
        if (target == CircuitBreakerState.OPEN) {
            log.warn("Circuit breaker for {}: {} → OPEN (failures: {})", resourceId, previous, failureCount);
        } else {
            log.info("Circuit breaker for {}: {} → {}", resourceId, previous, target);
        }
    }

    private static String describe(Throwable cause) {
        return cause == null ? "failure result" : cause.toString();
    }
}
