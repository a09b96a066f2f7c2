package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Futures;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.CircuitBreakerStats;

import java.util.concurrent.CompletableFuture;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * 설정에서 Circuit Breaker가 비활성화된 경우 사용됩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>protect(): 작업을 그대로 호출</li>
 *   <li>tryAcquire(): 항상 true 반환</li>
 *   <li>recordSuccess() / recordFailure(): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>reset() / forceOpen(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private static final CircuitBreakerConfig DISABLED_CONFIG = new CircuitBreakerConfig();

    private final ResourceId resourceId;

    public NoOpCircuitBreaker(ResourceId resourceId) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        this.resourceId = resourceId;
    }

    @Override
    public <T> T protect(Invocation<T> invocation) throws Exception {
        return invocation.invoke();
    }

    @Override
    public <T> CompletableFuture<T> protectAsync(AsyncInvocation<T> invocation) {
        return Futures.invokeSafely(invocation);
    }

    @Override
    public boolean tryAcquire() {
        return true;
    }

    @Override
    public void recordSuccess() {
        // NoOp
    }

    @Override
    public void recordFailure(Throwable cause) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitBreakerStats getStats() {
        return new CircuitBreakerStats(resourceId, CircuitBreakerState.CLOSED, 0, 0, null, null, 0, 0, 0, 0);
    }

    @Override
    public void reset() {
        // NoOp
    }

    @Override
    public void forceOpen() {
        // NoOp
    }

    @Override
    public ResourceId getResourceId() {
        return resourceId;
    }

    @Override
    public CircuitBreakerConfig getConfig() {
        return DISABLED_CONFIG;
    }
}
