package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;

import java.util.concurrent.CompletableFuture;

/**
 * Rate Limiter SPI.
 *
 * <p>초당 요청 수를 제한하여 외부 API 과부하를 방지합니다.
 * 요청을 거부하지 않고, 필요한 만큼 호출자를 대기시킨 뒤 작업을 호출합니다.</p>
 *
 * <p><strong>Burst + Pacing 알고리즘:</strong></p>
 * <pre>
 * interval = 1 / permitsPerSecond
 * 1. now - lastRequestTime ≥ interval 이면 burstCount = 0
 * 2. burstCount ≥ maxBurstSize 이면
 *      wait = interval - (now - lastRequestTime) 만큼 대기 (양수인 경우), burstCount = 0
 * 3. burstCount++, lastRequestTime = now, 작업 호출
 * </pre>
 *
 * <p>정밀한 Token Bucket이 아니라, maxBurstSize까지의 짧은 버스트 후
 * 엄격한 간격을 강제하는 단순한 방식입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateLimiter limiter = ...;
 * Response response = limiter.throttle(() -> externalApi.call());
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * Rate Limit 적용 호출 (동기, 필요 시 블로킹 대기).
     *
     * @param invocation 보호 대상 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws InterruptedException 대기 중 인터럽트 발생 (작업은 호출되지 않음)
     * @throws Exception 작업의 원본 예외
     */
    <T> T throttle(Invocation<T> invocation) throws Exception;

    /**
     * Rate Limit 적용 호출 (비동기, 스레드 점유 없이 대기).
     *
     * @param invocation 보호 대상 비동기 작업
     * @param <T> 결과 타입
     * @return 작업 결과 Future
     */
    <T> CompletableFuture<T> throttleAsync(AsyncInvocation<T> invocation);

    default <T> Invocation<T> decorate(Invocation<T> invocation) {
        return () -> throttle(invocation);
    }

    default <T> AsyncInvocation<T> decorateAsync(AsyncInvocation<T> invocation) {
        return () -> throttleAsync(invocation);
    }

    /**
     * 보호 대상 리소스 조회.
     *
     * @return 리소스 식별자
     */
    ResourceId getResourceId();

    /**
     * Rate Limiter 설정 정보 조회.
     *
     * @return Rate Limiter 설정 (QPS 등)
     */
    RateLimiterConfig getConfig();
}
