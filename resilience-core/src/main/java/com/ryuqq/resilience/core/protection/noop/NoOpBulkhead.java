package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Futures;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Bulkhead NoOp 구현.
 *
 * <p>동시 실행 수 제한을 적용하지 않습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>withinCapacity(): 작업을 그대로 호출</li>
 *   <li>getCurrentConcurrency(): 항상 0 반환</li>
 *   <li>getAvailablePermits(): 항상 Integer.MAX_VALUE 반환</li>
 *   <li>getConfig(): 무제한 설정 반환</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpBulkhead implements Bulkhead {

    private static final BulkheadConfig UNLIMITED_CONFIG = new BulkheadConfig();

    private final ResourceId resourceId;

    public NoOpBulkhead(ResourceId resourceId) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        this.resourceId = resourceId;
    }

    @Override
    public <T> T withinCapacity(Invocation<T> invocation) throws Exception {
        return invocation.invoke();
    }

    @Override
    public <T> CompletableFuture<T> withinCapacityAsync(AsyncInvocation<T> invocation) {
        return Futures.invokeSafely(invocation);
    }

    @Override
    public int getCurrentConcurrency() {
        return 0;
    }

    @Override
    public int getAvailablePermits() {
        return Integer.MAX_VALUE;
    }

    @Override
    public ResourceId getResourceId() {
        return resourceId;
    }

    @Override
    public BulkheadConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}
