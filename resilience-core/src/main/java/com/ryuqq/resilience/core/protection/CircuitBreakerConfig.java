package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.classify.FailureClassifier;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: 활성화 여부 (기본 false, 비활성 시 작업을 그대로 호출)</li>
 *   <li>failureThreshold: OPEN 전이까지 누적 실패 수 (기본 5)</li>
 *   <li>recoveryTimeoutMs: OPEN 유지 후 HALF_OPEN 시도까지 대기 시간 (기본 60000ms)</li>
 *   <li>successThreshold: HALF_OPEN에서 CLOSED 전이까지 연속 성공 수 (기본 2)</li>
 *   <li>failureClassifier: 결과/예외 실패 판정 (기본: 예외만 실패)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param enabled 활성화 여부
 * @param failureThreshold 실패 임계값 (1 이상)
 * @param recoveryTimeoutMs 복구 대기 시간 (밀리초, 0 이상)
 * @param successThreshold 성공 임계값 (1 이상)
 * @param failureClassifier 실패 분류기 (null 불가)
 */
public record CircuitBreakerConfig(
    boolean enabled,
    int failureThreshold,
    long recoveryTimeoutMs,
    int successThreshold,
    FailureClassifier failureClassifier
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: enabled=false, failureThreshold=5, recoveryTimeoutMs=60000ms,
     * successThreshold=2, failureClassifier=예외만 실패</p>
     */
    public CircuitBreakerConfig() {
        this(false, 5, 60000, 2, FailureClassifier.defaults());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (recoveryTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "recoveryTimeoutMs cannot be negative (current: " + recoveryTimeoutMs + ")"
            );
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException(
                "successThreshold must be positive (current: " + successThreshold + ")"
            );
        }
        if (failureClassifier == null) {
            throw new IllegalArgumentException("failureClassifier cannot be null");
        }
    }

    public CircuitBreakerConfig withEnabled(boolean enabled) {
        return new CircuitBreakerConfig(enabled, failureThreshold, recoveryTimeoutMs, successThreshold, failureClassifier);
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(enabled, failureThreshold, recoveryTimeoutMs, successThreshold, failureClassifier);
    }

    public CircuitBreakerConfig withRecoveryTimeoutMs(long recoveryTimeoutMs) {
        return new CircuitBreakerConfig(enabled, failureThreshold, recoveryTimeoutMs, successThreshold, failureClassifier);
    }

    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(enabled, failureThreshold, recoveryTimeoutMs, successThreshold, failureClassifier);
    }

    public CircuitBreakerConfig withFailureClassifier(FailureClassifier failureClassifier) {
        return new CircuitBreakerConfig(enabled, failureThreshold, recoveryTimeoutMs, successThreshold, failureClassifier);
    }
}
