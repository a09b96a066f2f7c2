package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.ResourceId;

/**
 * Bulkhead가 대기 시간 내에 Permit을 확보하지 못해 호출을 거부했을 때 발생하는 예외.
 *
 * <p>작업은 호출되지 않았습니다. 부하 차단(Load Shedding) 신호로 처리해야 합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class BulkheadRejectedException extends ProtectionRejectedException {

    private final int maxConcurrentCalls;
    private final long maxWaitDurationMs;

    /**
     * 생성자.
     *
     * @param resourceId 리소스 식별자
     * @param maxConcurrentCalls 최대 동시 실행 수
     * @param maxWaitDurationMs 대기한 최대 시간 (밀리초)
     */
    public BulkheadRejectedException(ResourceId resourceId, int maxConcurrentCalls, long maxWaitDurationMs) {
        super(resourceId, "Bulkhead capacity reached for " + resourceId.getValue()
            + " (maxConcurrentCalls: " + maxConcurrentCalls + ", waited: " + maxWaitDurationMs + "ms)");
        this.maxConcurrentCalls = maxConcurrentCalls;
        this.maxWaitDurationMs = maxWaitDurationMs;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public long getMaxWaitDurationMs() {
        return maxWaitDurationMs;
    }
}
