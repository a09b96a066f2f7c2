package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.ResourceId;

import java.time.Instant;

/**
 * Circuit Breaker가 OPEN 상태라서 호출을 거부했을 때 발생하는 예외.
 *
 * <p>작업은 호출되지 않았으며, 재시도 대상이 아닙니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CircuitOpenException extends ProtectionRejectedException {

    private final Instant lastFailureTime;
    private final long remainingMs;

    /**
     * 생성자.
     *
     * @param resourceId 리소스 식별자
     * @param lastFailureTime 마지막 실패 시각 (없으면 null)
     * @param remainingMs HALF_OPEN 시도 가능까지 남은 시간 (밀리초)
     */
    public CircuitOpenException(ResourceId resourceId, Instant lastFailureTime, long remainingMs) {
        super(resourceId, "Circuit breaker is OPEN for " + resourceId.getValue()
            + ". Last failure: " + lastFailureTime + ", retry after " + remainingMs + "ms");
        this.lastFailureTime = lastFailureTime;
        this.remainingMs = remainingMs;
    }

    public Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public long getRemainingMs() {
        return remainingMs;
    }
}
