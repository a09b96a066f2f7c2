package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.ResourceId;

import java.time.Instant;

/**
 * Circuit Breaker 통계 스냅샷 (읽기 전용).
 *
 * <p>{@link CircuitBreaker#getStats()} 호출 시점의 상태와 카운터를 일관된 하나의 시점으로 담습니다.
 * totalCalls에는 거부된 호출도 포함됩니다.</p>
 *
 * @param resourceId 보호 대상 리소스
 * @param state 현재 상태
 * @param failureCount 현재 누적 실패 수 (CLOSED에서 성공 시 0으로 초기화)
 * @param successCount HALF_OPEN 연속 성공 수
 * @param lastFailureTime 마지막 실패 시각 (없으면 null)
 * @param lastSuccessTime 마지막 성공 시각 (없으면 null)
 * @param totalCalls 전체 호출 수 (거부 포함)
 * @param totalFailures 전체 실패 수
 * @param totalSuccesses 전체 성공 수
 * @param totalRejected 전체 거부 수
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerStats(
    ResourceId resourceId,
    CircuitBreakerState state,
    int failureCount,
    int successCount,
    Instant lastFailureTime,
    Instant lastSuccessTime,
    long totalCalls,
    long totalFailures,
    long totalSuccesses,
    long totalRejected
) {

    /**
     * 실패율 (totalFailures / max(totalCalls, 1)).
     *
     * @return 0.0 ~ 1.0
     */
    public double failureRate() {
        return (double) totalFailures / Math.max(totalCalls, 1);
    }

    /**
     * 성공률 (totalSuccesses / max(totalCalls, 1)).
     *
     * @return 0.0 ~ 1.0
     */
    public double successRate() {
        return (double) totalSuccesses / Math.max(totalCalls, 1);
    }
}
