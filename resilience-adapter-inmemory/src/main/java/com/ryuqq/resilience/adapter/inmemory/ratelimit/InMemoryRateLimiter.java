package com.ryuqq.resilience.adapter.inmemory.ratelimit;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Futures;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.time.Suspender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Burst-then-pace {@link RateLimiter} kept in memory.
 *
 * <p>Up to {@code maxBurstSize} calls pass back to back. Once the burst is used up, the next call
 * waits until {@code 1 / permitsPerSecond} has passed since the previous call. The burst counter
 * resets whenever a full interval elapses between two calls.</p>
 *
 * <p><strong>Algorithm (per call):</strong></p>
 * <pre>
 * start   = max(now, lastRequest)
 * elapsed = start - lastRequest
 * if elapsed &gt;= interval:        burstCount = 0
 * if burstCount &gt;= maxBurstSize:  start += interval - elapsed; burstCount = 0
 * burstCount++; lastRequest = start; wait = start - now
 * </pre>
 *
 * <p>The slot is reserved under the monitor before the caller waits, so concurrent callers line up
 * behind any slot that is still pending and the wait itself happens outside the lock. The pacing
 * reference {@code lastRequest} never moves backwards. A caller interrupted or
 * cancelled while waiting gives its slot back as long as no later caller reserved after it.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class InMemoryRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRateLimiter.class);

    private final ResourceId resourceId;
    private final RateLimiterConfig config;
    private final Clock clock;
    private final Suspender suspender;

    private boolean started;
    private long lastRequestMs;
    private int burstCount;
    private long reservationSequence;

    public InMemoryRateLimiter(ResourceId resourceId, RateLimiterConfig config) {
        this(resourceId, config, Clock.systemUTC(), Suspender.system());
    }

    /**
     * Creates a limiter with explicit time sources.
     *
     * @param resourceId protected resource
     * @param config limiter configuration
     * @param clock time source for pacing decisions
     * @param suspender performs the pacing wait
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryRateLimiter(ResourceId resourceId, RateLimiterConfig config, Clock clock, Suspender suspender) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (suspender == null) {
            throw new IllegalArgumentException("suspender cannot be null");
        }
        this.resourceId = resourceId;
        this.config = config;
        this.clock = clock;
        this.suspender = suspender;
    }

    @Override
    public <T> T throttle(Invocation<T> invocation) throws Exception {
        if (invocation == null) {
            throw new IllegalArgumentException("invocation cannot be null");
        }
        if (!config.isEnabled()) {
            return invocation.invoke();
        }

        Reservation reservation = reserve();
        if (reservation.waitMs() > 0) {
            try {
                suspender.sleep(reservation.waitMs());
            } catch (InterruptedException e) {
                release(reservation);
                throw e;
            }
        }
        return invocation.invoke();
    }

    @Override
    public <T> CompletableFuture<T> throttleAsync(AsyncInvocation<T> invocation) {
        if (invocation == null) {
            throw new IllegalArgumentException("invocation cannot be null");
        }
        if (!config.isEnabled()) {
            return Futures.invokeSafely(invocation);
        }

        Reservation reservation = reserve();
        if (reservation.waitMs() <= 0) {
            return Futures.invokeSafely(invocation);
        }

        CompletableFuture<T> promise = new CompletableFuture<>();
        CompletableFuture<Void> delay = suspender.delay(reservation.waitMs());
        promise.whenComplete((ignored, error) -> delay.cancel(false));
        delay.whenComplete((ignored, delayError) -> {
            if (delayError != null || promise.isDone()) {
                release(reservation);
                if (delayError != null) {
                    promise.completeExceptionally(Futures.unwrap(delayError));
                }
                return;
            }
            CompletableFuture<T> operation = Futures.invokeSafely(invocation);
            Futures.propagateCancellation(promise, operation);
            operation.whenComplete((result, error) -> {
                if (error != null) {
                    promise.completeExceptionally(Futures.unwrap(error));
                } else {
                    promise.complete(result);
                }
            });
        });
        return promise;
    }

    @Override
    public ResourceId getResourceId() {
        return resourceId;
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    private synchronized Reservation reserve() {
        long now = clock.millis();
        double intervalMs = config.intervalMs();
        Reservation.Snapshot previous = new Reservation.Snapshot(started, lastRequestMs, burstCount);

        // a slot reserved in the future is still pending; pace from it, never from an earlier time
        long effectiveNow = started ? Math.max(now, lastRequestMs) : now;
        long elapsed = started ? effectiveNow - lastRequestMs : Long.MAX_VALUE;
        if (elapsed >= intervalMs) {
            burstCount = 0;
        }

        long startAt = effectiveNow;
        if (burstCount >= config.maxBurstSize()) {
            double remaining = intervalMs - elapsed;
            if (remaining > 0) {
                startAt += (long) Math.ceil(remaining);
            }
            burstCount = 0;
        }

        burstCount++;
        lastRequestMs = startAt;
        started = true;
        reservationSequence++;

        long waitMs = startAt - now;
        if (waitMs > 0) {
            log.debug("Rate limit reached for {}, waiting {}ms", resourceId, waitMs);
        }
        return new Reservation(reservationSequence, waitMs, previous);
    }

    // Only the most recent reservation can be rolled back; later callers already paced against it.
    private synchronized void release(Reservation reservation) {
        if (reservation.sequence() != reservationSequence) {
            return;
        }
        Reservation.Snapshot previous = reservation.previous();
        started = previous.started();
        lastRequestMs = previous.lastRequestMs();
        burstCount = previous.burstCount();
        reservationSequence++;
        log.debug("Rate limit reservation for {} released before use", resourceId);
    }

    private record Reservation(long sequence, long waitMs, Snapshot previous) {

        private record Snapshot(boolean started, long lastRequestMs, int burstCount) {
        }
    }
}
