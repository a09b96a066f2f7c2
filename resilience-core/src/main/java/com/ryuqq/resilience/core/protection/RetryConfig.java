package com.ryuqq.resilience.core.protection;

import java.util.function.Predicate;

/**
 * Retry 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: 첫 시도 외 추가 시도 수 (기본 3, 총 시도 = maxRetries + 1)</li>
 *   <li>baseDelayMs: 첫 재시도 전 대기 시간 (기본 1000ms)</li>
 *   <li>backoffFactor: 지수 백오프 배수 (기본 2.0, 1.0 이상)</li>
 *   <li>maxDelayMs: 최대 대기 시간 (기본 60000ms)</li>
 *   <li>jitter: 최대 25% 무작위 Jitter 적용 여부 (기본 false)</li>
 *   <li>retryableResult: 재시도 대상 결과 판정 (null이면 결과로는 재시도하지 않음)</li>
 *   <li>retryableError: 재시도 대상 예외 판정 (null이면 기본 정책)</li>
 * </ul>
 *
 * <p><strong>기본 예외 정책 (retryableError == null):</strong>
 * {@link CircuitOpenException}을 제외한 모든 예외를 재시도합니다.
 * Circuit Breaker 거부는 즉시 실패해야 하므로 재시도하지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param maxRetries 추가 시도 수 (0 이상)
 * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
 * @param backoffFactor 백오프 배수 (1.0 이상)
 * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
 * @param jitter Jitter 적용 여부
 * @param retryableResult 재시도 대상 결과 판정 (null 가능)
 * @param retryableError 재시도 대상 예외 판정 (null 가능)
 */
public record RetryConfig(
    int maxRetries,
    long baseDelayMs,
    double backoffFactor,
    long maxDelayMs,
    boolean jitter,
    Predicate<Object> retryableResult,
    Predicate<Throwable> retryableError
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRetries=3, baseDelayMs=1000ms, backoffFactor=2.0,
     * maxDelayMs=60000ms, jitter=false, 판정 조건 없음</p>
     */
    public RetryConfig() {
        this(3, 1000, 2.0, 60000, false, null, null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries cannot be negative (current: " + maxRetries + ")"
            );
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs cannot be negative (current: " + baseDelayMs + ")"
            );
        }
        if (Double.isNaN(backoffFactor) || backoffFactor < 1.0) {
            throw new IllegalArgumentException(
                "backoffFactor must be >= 1.0 (current: " + backoffFactor + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
    }

    /**
     * 결과가 재시도 대상인지 판정.
     *
     * @param result 작업 결과
     * @return retryableResult가 설정되어 있고 결과가 조건을 만족하면 true
     */
    public boolean isRetryableResult(Object result) {
        return retryableResult != null && retryableResult.test(result);
    }

    /**
     * 예외가 재시도 대상인지 판정.
     *
     * @param error 작업 예외
     * @return 재시도 대상 여부
     */
    public boolean isRetryableError(Throwable error) {
        if (retryableError == null) {
            return !(error instanceof CircuitOpenException);
        }
        return retryableError.test(error);
    }

    public RetryConfig withMaxRetries(int maxRetries) {
        return new RetryConfig(maxRetries, baseDelayMs, backoffFactor, maxDelayMs, jitter, retryableResult, retryableError);
    }

    public RetryConfig withBaseDelayMs(long baseDelayMs) {
        return new RetryConfig(maxRetries, baseDelayMs, backoffFactor, maxDelayMs, jitter, retryableResult, retryableError);
    }

    public RetryConfig withBackoffFactor(double backoffFactor) {
        return new RetryConfig(maxRetries, baseDelayMs, backoffFactor, maxDelayMs, jitter, retryableResult, retryableError);
    }

    public RetryConfig withMaxDelayMs(long maxDelayMs) {
        return new RetryConfig(maxRetries, baseDelayMs, backoffFactor, maxDelayMs, jitter, retryableResult, retryableError);
    }

    public RetryConfig withJitter(boolean jitter) {
        return new RetryConfig(maxRetries, baseDelayMs, backoffFactor, maxDelayMs, jitter, retryableResult, retryableError);
    }

    public RetryConfig withRetryableResult(Predicate<Object> retryableResult) {
        return new RetryConfig(maxRetries, baseDelayMs, backoffFactor, maxDelayMs, jitter, retryableResult, retryableError);
    }

    public RetryConfig withRetryableError(Predicate<Throwable> retryableError) {
        return new RetryConfig(maxRetries, baseDelayMs, backoffFactor, maxDelayMs, jitter, retryableResult, retryableError);
    }
}
