package com.ryuqq.resilience.adapter.inmemory.retry;

import com.ryuqq.resilience.core.protection.RetryConfig;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 {@code backoffFactor} 배수로 증가시키고, 선택적으로 최대 25%의
 * 무작위 Jitter를 더해 동시에 실패한 호출들이 한꺼번에 재시도하지 않도록 분산합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay  = min(baseDelay * backoffFactor^attempt, maxDelay)
 * jitter = random(0, min(delay * 0.25, maxDelay - delay))
 * </pre>
 *
 * <p><strong>예시 (baseDelay=100ms, backoffFactor=2.0, maxDelay=300ms):</strong></p>
 * <ul>
 *   <li>attempt=0: 100ms (+ jitter 0-25ms)</li>
 *   <li>attempt=1: 200ms (+ jitter 0-50ms)</li>
 *   <li>attempt=2: 300ms (상한 도달, jitter 없음)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    static final double JITTER_RATIO = 0.25;

    private final long baseDelayMs;
    private final double backoffFactor;
    private final long maxDelayMs;
    private final boolean jitter;
    private final DoubleSupplier random;

    /**
     * RetryConfig 기반으로 생성.
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public BackoffCalculator(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 지정하여 생성.
     *
     * @param config 재시도 설정
     * @param random [0.0, 1.0) 범위의 난수 공급자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    BackoffCalculator(RetryConfig config, DoubleSupplier random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = config.baseDelayMs();
        this.backoffFactor = config.backoffFactor();
        this.maxDelayMs = config.maxDelayMs();
        this.jitter = config.jitter();
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 직전 시도 번호 (0부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 음수인 경우
     */
    public long calculate(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException(
                "attempt cannot be negative (current: " + attempt + ")"
            );
        }

        // 1. 지수적 백오프 (Math.pow 결과가 무한대여도 min으로 상한 적용)
        double exponential = Math.min(baseDelayMs * Math.pow(backoffFactor, attempt), maxDelayMs);
        long delay = Math.round(exponential);
        if (!jitter) {
            return delay;
        }

        // 2. Jitter 추가 (최대 25%, maxDelay 초과 불가)
        double bound = Math.min(delay * JITTER_RATIO, maxDelayMs - delay);
        long widened = delay + (long) (bound * random.getAsDouble());

        // 3. 최대값 제한
        return Math.min(widened, maxDelayMs);
    }
}
