package com.ryuqq.resilience.adapter.inmemory.retry;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Futures;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.RetryPolicy;
import com.ryuqq.resilience.core.time.Suspender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * {@link RetryPolicy} with exponential backoff.
 *
 * <p>Runs at most {@code maxRetries + 1} attempts. After every attempt a single decision step
 * classifies the outcome and either stops or schedules the next attempt after
 * {@link BackoffCalculator#calculate(int)} milliseconds. The blocking and the async paths share
 * that decision step and differ only in how they wait ({@link Suspender#sleep(long)} versus
 * {@link Suspender#delay(long)}).</p>
 *
 * <p><strong>Outcome Rules:</strong></p>
 * <ul>
 *   <li>Result not retryable → returned</li>
 *   <li>Result retryable, attempts left → retried; attempts exhausted → last result returned</li>
 *   <li>Error retryable, attempts left → retried; otherwise the error is propagated unchanged</li>
 *   <li>Cancellation → never retried</li>
 * </ul>
 *
 * <p>The policy keeps no state between calls, so one instance may be shared freely.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class BackoffRetryPolicy implements RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(BackoffRetryPolicy.class);

    private final ResourceId resourceId;
    private final RetryConfig config;
    private final BackoffCalculator backoffCalculator;
    private final Suspender suspender;

    public BackoffRetryPolicy(ResourceId resourceId, RetryConfig config) {
        this(resourceId, config, Suspender.system());
    }

    public BackoffRetryPolicy(ResourceId resourceId, RetryConfig config, Suspender suspender) {
        this(resourceId, config, new BackoffCalculator(config), suspender);
    }

    BackoffRetryPolicy(ResourceId resourceId, RetryConfig config,
                       BackoffCalculator backoffCalculator, Suspender suspender) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (suspender == null) {
            throw new IllegalArgumentException("suspender cannot be null");
        }
        this.resourceId = resourceId;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
        this.suspender = suspender;
    }

    /**
     * {@inheritDoc}
     *
     * <p>An {@link InterruptedException} raised while waiting between attempts is propagated and no
     * further attempt is made.</p>
     */
    @Override
    public <T> T withRetry(Invocation<T> invocation) throws Exception {
        if (invocation == null) {
            throw new IllegalArgumentException("invocation cannot be null");
        }

        for (int attempt = 0; ; attempt++) {
            T result;
            try {
                result = invocation.invoke();
            } catch (Exception e) {
                RetryDecision decision = decideOnError(attempt, e);
                if (!decision.retry()) {
                    throw e;
                }
                suspender.sleep(decision.delayMs());
                continue;
            }

            RetryDecision decision = decideOnResult(attempt, result);
            if (!decision.retry()) {
                return result;
            }
            suspender.sleep(decision.delayMs());
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Cancelling the returned future stops the retry loop: the attempt in flight and a pending
     * backoff delay are cancelled and no further attempt is started.</p>
     */
    @Override
    public <T> CompletableFuture<T> withRetryAsync(AsyncInvocation<T> invocation) {
        if (invocation == null) {
            throw new IllegalArgumentException("invocation cannot be null");
        }
        CompletableFuture<T> promise = new CompletableFuture<>();
        attemptAsync(invocation, 0, promise);
        return promise;
    }

    @Override
    public ResourceId getResourceId() {
        return resourceId;
    }

    @Override
    public RetryConfig getConfig() {
        return config;
    }

    private <T> void attemptAsync(AsyncInvocation<T> invocation, int attempt, CompletableFuture<T> promise) {
        if (promise.isDone()) {
            return;
        }

        CompletableFuture<T> current = Futures.invokeSafely(invocation);
        Futures.propagateCancellation(promise, current);
        current.whenComplete((result, error) -> {
            Throwable cause = error == null ? null : Futures.unwrap(error);
            RetryDecision decision = cause != null ? decideOnError(attempt, cause) : decideOnResult(attempt, result);

            if (!decision.retry()) {
                if (cause != null) {
                    promise.completeExceptionally(cause);
                } else {
                    promise.complete(result);
                }
                return;
            }

            CompletableFuture<Void> delay = suspender.delay(decision.delayMs());
            promise.whenComplete((ignored, promiseError) -> delay.cancel(false));
            delay.whenComplete((ignored, delayError) -> {
                if (delayError != null) {
                    promise.completeExceptionally(Futures.unwrap(delayError));
                    return;
                }
                attemptAsync(invocation, attempt + 1, promise);
            });
        });
    }

    private RetryDecision decideOnError(int attempt, Throwable error) {
        if (Futures.isCancellation(error)) {
            return RetryDecision.STOP;
        }
        if (!config.isRetryableError(error)) {
            log.debug("Non-retryable error for {} on attempt {}: {}", resourceId, attempt + 1, error.toString());
            return RetryDecision.STOP;
        }
        if (attempt >= config.maxRetries()) {
            log.error("Retry exhausted for {} after {} attempts: {}", resourceId, attempt + 1, error.toString());
            return RetryDecision.STOP;
        }

        long delayMs = backoffCalculator.calculate(attempt);
        log.warn("Attempt {}/{} failed for {}: {}. Retrying in {}ms",
            attempt + 1, config.maxRetries() + 1, resourceId, error.toString(), delayMs);
        return RetryDecision.after(delayMs);
    }

    private RetryDecision decideOnResult(int attempt, Object result) {
        if (!config.isRetryableResult(result)) {
            return RetryDecision.STOP;
        }
        if (attempt >= config.maxRetries()) {
            log.error("Retry exhausted for {} after {} attempts, returning last result", resourceId, attempt + 1);
            return RetryDecision.STOP;
        }

        long delayMs = backoffCalculator.calculate(attempt);
        log.warn("Attempt {}/{} returned retryable result for {}: {}. Retrying in {}ms",
            attempt + 1, config.maxRetries() + 1, resourceId, result, delayMs);
        return RetryDecision.after(delayMs);
    }

    private record RetryDecision(boolean retry, long delayMs) {

        static final RetryDecision STOP = new RetryDecision(false, 0);

        static RetryDecision after(long delayMs) {
            return new RetryDecision(true, delayMs);
        }
    }
}
