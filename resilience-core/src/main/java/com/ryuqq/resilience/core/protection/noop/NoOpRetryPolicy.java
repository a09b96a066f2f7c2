package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Futures;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.RetryPolicy;

import java.util.concurrent.CompletableFuture;

/**
 * Retry Policy NoOp 구현.
 *
 * <p>재시도 없이 작업을 정확히 한 번 호출합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>withRetry(): 작업 1회 호출, 결과/예외 그대로 반환</li>
 *   <li>getConfig(): maxRetries=0 설정 반환</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpRetryPolicy implements RetryPolicy {

    private static final RetryConfig NO_RETRY_CONFIG = new RetryConfig().withMaxRetries(0);

    private final ResourceId resourceId;

    public NoOpRetryPolicy(ResourceId resourceId) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        this.resourceId = resourceId;
    }

    @Override
    public <T> T withRetry(Invocation<T> invocation) throws Exception {
        return invocation.invoke();
    }

    @Override
    public <T> CompletableFuture<T> withRetryAsync(AsyncInvocation<T> invocation) {
        return Futures.invokeSafely(invocation);
    }

    @Override
    public ResourceId getResourceId() {
        return resourceId;
    }

    @Override
    public RetryConfig getConfig() {
        return NO_RETRY_CONFIG;
    }
}
