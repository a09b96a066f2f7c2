package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Futures;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>Rate Limit을 적용하지 않습니다. 대기 없이 작업을 호출합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>throttle(): 작업을 그대로 호출</li>
 *   <li>getConfig(): 비활성(permitsPerSecond=null) 설정 반환</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimiterConfig UNLIMITED_CONFIG = RateLimiterConfig.unlimited();

    private final ResourceId resourceId;

    public NoOpRateLimiter(ResourceId resourceId) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        this.resourceId = resourceId;
    }

    @Override
    public <T> T throttle(Invocation<T> invocation) throws Exception {
        return invocation.invoke();
    }

    @Override
    public <T> CompletableFuture<T> throttleAsync(AsyncInvocation<T> invocation) {
        return Futures.invokeSafely(invocation);
    }

    @Override
    public ResourceId getResourceId() {
        return resourceId;
    }

    @Override
    public RateLimiterConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}
