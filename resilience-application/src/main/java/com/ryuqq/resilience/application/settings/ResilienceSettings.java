package com.ryuqq.resilience.application.settings;

import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.protection.RetryConfig;

/**
 * 리소스 단위 보호 설정 묶음.
 *
 * <p>하나의 리소스에 적용할 네 가지 보호 장치 설정을 묶은 불변 객체입니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>circuitBreaker: 비활성화 (threshold 5, recovery 60s, successThreshold 2)</li>
 *   <li>retry: 최대 3회 재시도, base 1s, factor 2.0, max 60s, jitter 없음</li>
 *   <li>rateLimiter: 비활성화</li>
 *   <li>bulkhead: 비활성화</li>
 * </ul>
 *
 * @param circuitBreaker Circuit Breaker 설정
 * @param retry 재시도 설정 ({@code maxRetries = 0}이면 재시도 없음)
 * @param rateLimiter Rate Limiter 설정
 * @param bulkhead Bulkhead 설정
 * @author Resilience Team
 * @since 1.0.0
 */
public record ResilienceSettings(
    CircuitBreakerConfig circuitBreaker,
    RetryConfig retry,
    RateLimiterConfig rateLimiter,
    BulkheadConfig bulkhead
) {

    public ResilienceSettings() {
        this(new CircuitBreakerConfig(), new RetryConfig(), RateLimiterConfig.unlimited(), new BulkheadConfig());
    }

    public ResilienceSettings {
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (bulkhead == null) {
            throw new IllegalArgumentException("bulkhead cannot be null");
        }
    }

    public static ResilienceSettings defaults() {
        return new ResilienceSettings();
    }

    public ResilienceSettings withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new ResilienceSettings(circuitBreaker, retry, rateLimiter, bulkhead);
    }

    public ResilienceSettings withRetry(RetryConfig retry) {
        return new ResilienceSettings(circuitBreaker, retry, rateLimiter, bulkhead);
    }

    public ResilienceSettings withRateLimiter(RateLimiterConfig rateLimiter) {
        return new ResilienceSettings(circuitBreaker, retry, rateLimiter, bulkhead);
    }

    public ResilienceSettings withBulkhead(BulkheadConfig bulkhead) {
        return new ResilienceSettings(circuitBreaker, retry, rateLimiter, bulkhead);
    }

    public boolean isRetryEnabled() {
        return retry.maxRetries() > 0;
    }
}
