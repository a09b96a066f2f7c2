package com.ryuqq.resilience.core.protection;

/**
 * Bulkhead 설정.
 *
 * <p>Bulkhead의 동작을 제어하는 설정 정보입니다.</p>
 *
 * <p><strong>무제한 처리:</strong> maxConcurrentCalls가 null이거나 0 이하이면
 * 제한 없음으로 명시적으로 취급합니다 (영원히 대기하는 Bulkhead를 만들지 않음).</p>
 *
 * <p><strong>대기 시간:</strong> maxWaitDurationMs가 0이면 대기하지 않고 즉시 판정합니다.</p>
 *
 * @param enabled 활성화 여부
 * @param maxConcurrentCalls 최대 동시 실행 수 (예: 10, null 가능)
 * @param maxWaitDurationMs 최대 대기 시간 (밀리초)
 * @author Resilience Team
 * @since 1.0.0
 */
public record BulkheadConfig(boolean enabled, Integer maxConcurrentCalls, long maxWaitDurationMs) {

    /**
     * 기본 설정 생성자 (비활성).
     */
    public BulkheadConfig() {
        this(false, null, 0);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxWaitDurationMs is negative
     */
    public BulkheadConfig {
        if (maxWaitDurationMs < 0) {
            throw new IllegalArgumentException("maxWaitDurationMs cannot be negative (current: " + maxWaitDurationMs + ")");
        }
    }

    /**
     * 활성화된 제한 설정 생성.
     *
     * @param maxConcurrentCalls 최대 동시 실행 수
     * @param maxWaitDurationMs 최대 대기 시간 (밀리초)
     * @return 설정
     */
    public static BulkheadConfig of(int maxConcurrentCalls, long maxWaitDurationMs) {
        return new BulkheadConfig(true, maxConcurrentCalls, maxWaitDurationMs);
    }

    /**
     * 동시 실행 제한이 실제로 적용되는지 여부.
     *
     * @return enabled이고 maxConcurrentCalls가 양수인 경우 true
     */
    public boolean isBounded() {
        return enabled && maxConcurrentCalls != null && maxConcurrentCalls > 0;
    }
}
