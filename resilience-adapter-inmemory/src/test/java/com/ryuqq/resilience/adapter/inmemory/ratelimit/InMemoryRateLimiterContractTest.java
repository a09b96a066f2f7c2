package com.ryuqq.resilience.adapter.inmemory.ratelimit;

import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.testkit.contract.RateLimiterContract;

/**
 * Runs the {@link RateLimiterContract} against {@link InMemoryRateLimiter}.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class InMemoryRateLimiterContractTest extends RateLimiterContract {

    @Override
    protected RateLimiter createRateLimiter(RateLimiterConfig config) {
        return new InMemoryRateLimiter(resourceId, config, clock, suspender);
    }
}
