package com.ryuqq.resilience.core.protection;

/**
 * Rate Limiter 설정.
 *
 * <p>Rate Limiter의 동작을 제어하는 설정 정보입니다.
 * permitsPerSecond가 null이면 Rate Limiter는 대기 없이 통과시킵니다.</p>
 *
 * @param permitsPerSecond 초당 허용 요청 수 (예: 2.0, null이면 비활성)
 * @param maxBurstSize 버스트 허용량 (간격 제한 없이 연속 허용되는 호출 수, 1 이상)
 * @author Resilience Team
 * @since 1.0.0
 */
public record RateLimiterConfig(Double permitsPerSecond, int maxBurstSize) {

    /**
     * 기본 설정 생성자 (비활성, 버스트 1).
     */
    public RateLimiterConfig() {
        this(null, 1);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if permitsPerSecond is not positive
     * @throws IllegalArgumentException if maxBurstSize is not positive
     */
    public RateLimiterConfig {
        if (permitsPerSecond != null && (permitsPerSecond.isNaN() || permitsPerSecond.isInfinite() || permitsPerSecond <= 0)) {
            throw new IllegalArgumentException("permitsPerSecond must be positive (current: " + permitsPerSecond + ")");
        }
        if (maxBurstSize <= 0) {
            throw new IllegalArgumentException("maxBurstSize must be positive (current: " + maxBurstSize + ")");
        }
    }

    /**
     * 비활성 설정.
     *
     * @return permitsPerSecond가 null인 설정
     */
    public static RateLimiterConfig unlimited() {
        return new RateLimiterConfig();
    }

    /**
     * 활성화 여부.
     *
     * @return permitsPerSecond가 설정된 경우 true
     */
    public boolean isEnabled() {
        return permitsPerSecond != null;
    }

    /**
     * 최소 호출 간격 (1 / permitsPerSecond).
     *
     * @return 간격 (밀리초), 비활성이면 0
     */
    public double intervalMs() {
        return isEnabled() ? 1000.0 / permitsPerSecond : 0.0;
    }
}
