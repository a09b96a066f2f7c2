package com.ryuqq.resilience.adapter.inmemory;

import com.ryuqq.resilience.adapter.inmemory.bulkhead.InMemoryBulkhead;
import com.ryuqq.resilience.adapter.inmemory.circuitbreaker.InMemoryCircuitBreaker;
import com.ryuqq.resilience.adapter.inmemory.ratelimit.InMemoryRateLimiter;
import com.ryuqq.resilience.adapter.inmemory.retry.BackoffRetryPolicy;
import com.ryuqq.resilience.application.invoker.ResilienceChain;
import com.ryuqq.resilience.application.settings.ResilienceSettings;
import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.RetryPolicy;
import com.ryuqq.resilience.core.protection.noop.NoOpBulkhead;
import com.ryuqq.resilience.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.resilience.core.protection.noop.NoOpRateLimiter;
import com.ryuqq.resilience.core.protection.noop.NoOpRetryPolicy;
import com.ryuqq.resilience.core.time.Suspender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Builds in-memory protections from configuration.
 *
 * <p>Every part whose configuration turns it off is replaced by the matching NoOp
 * implementation, so the resulting chain has no overhead for unused protections.</p>
 *
 * <ul>
 *   <li>Circuit breaker: {@code enabled = false} → {@link NoOpCircuitBreaker}</li>
 *   <li>Retry: {@code maxRetries = 0} → {@link NoOpRetryPolicy}</li>
 *   <li>Rate limiter: {@code permitsPerSecond = null} → {@link NoOpRateLimiter}</li>
 *   <li>Bulkhead: not bounded → {@link NoOpBulkhead}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryProtectionFactory factory = new InMemoryProtectionFactory();
 * ResilienceSettings settings = ResilienceSettings.defaults()
 *     .withCircuitBreaker(new CircuitBreakerConfig().withEnabled(true))
 *     .withBulkhead(BulkheadConfig.of(10, 500));
 *
 * ResilienceChain chain = factory.createChain(ResourceId.of("payment-api"), settings);
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class InMemoryProtectionFactory {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProtectionFactory.class);

    private final Clock clock;
    private final Suspender suspender;

    public InMemoryProtectionFactory() {
        this(Clock.systemUTC(), Suspender.system());
    }

    /**
     * @param clock time source handed to stateful protections
     * @param suspender wait strategy handed to retry and rate limiting
     */
    public InMemoryProtectionFactory(Clock clock, Suspender suspender) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (suspender == null) {
            throw new IllegalArgumentException("suspender cannot be null");
        }
        this.clock = clock;
        this.suspender = suspender;
    }

    public CircuitBreaker createCircuitBreaker(ResourceId resourceId, CircuitBreakerConfig config) {
        requireArguments(resourceId, config);
        if (!config.enabled()) {
            return new NoOpCircuitBreaker(resourceId);
        }
        return new InMemoryCircuitBreaker(resourceId, config, clock);
    }

    public RetryPolicy createRetryPolicy(ResourceId resourceId, RetryConfig config) {
        requireArguments(resourceId, config);
        if (config.maxRetries() == 0) {
            return new NoOpRetryPolicy(resourceId);
        }
        return new BackoffRetryPolicy(resourceId, config, suspender);
    }

    public RateLimiter createRateLimiter(ResourceId resourceId, RateLimiterConfig config) {
        requireArguments(resourceId, config);
        if (!config.isEnabled()) {
            return new NoOpRateLimiter(resourceId);
        }
        return new InMemoryRateLimiter(resourceId, config, clock, suspender);
    }

    public Bulkhead createBulkhead(ResourceId resourceId, BulkheadConfig config) {
        requireArguments(resourceId, config);
        if (!config.isBounded()) {
            return new NoOpBulkhead(resourceId);
        }
        return new InMemoryBulkhead(resourceId, config);
    }

    /**
     * Creates the full protection chain for one resource.
     *
     * @param resourceId protected resource
     * @param settings configuration of all four protections
     * @return chain ordered CircuitBreaker → Retry → RateLimiter → Bulkhead
     * @throws IllegalArgumentException if any argument is null
     */
    public ResilienceChain createChain(ResourceId resourceId, ResilienceSettings settings) {
        requireArguments(resourceId, settings);

        ResilienceChain chain = ResilienceChain.builder(resourceId)
            .circuitBreaker(createCircuitBreaker(resourceId, settings.circuitBreaker()))
            .retryPolicy(createRetryPolicy(resourceId, settings.retry()))
            .rateLimiter(createRateLimiter(resourceId, settings.rateLimiter()))
            .bulkhead(createBulkhead(resourceId, settings.bulkhead()))
            .build();

        log.info("Protection chain created for {} (circuitBreaker: {}, maxRetries: {}, rateLimit: {}/s, maxConcurrent: {})",
            resourceId,
            settings.circuitBreaker().enabled() ? "enabled" : "disabled",
            settings.retry().maxRetries(),
            settings.rateLimiter().permitsPerSecond(),
            settings.bulkhead().isBounded() ? settings.bulkhead().maxConcurrentCalls() : "unbounded");
        return chain;
    }

    private static void requireArguments(ResourceId resourceId, Object config) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
    }
}
