package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;

import java.util.concurrent.CompletableFuture;

/**
 * Retry Policy SPI.
 *
 * <p>작업 실패 시 지수 백오프로 대기한 뒤 최대 maxRetries회 추가 시도합니다.
 * 정책은 설정 외의 상태를 갖지 않으며, 서로 다른 호출 간에 공유해도 안전합니다.</p>
 *
 * <p><strong>백오프 공식:</strong></p>
 * <pre>
 * delay(attempt) = min(baseDelay * backoffFactor^attempt, maxDelay)
 * jitter 활성화 시: delay + random(0, min(delay * 0.25, maxDelay - delay))
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RetryPolicy retry = ...;
 * Response response = retry.withRetry(() -> externalApi.call());
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface RetryPolicy {

    /**
     * 재시도 적용 호출 (동기).
     *
     * <p>재시도 대상 결과가 마지막 시도에서도 반환되면 예외 없이 그 결과를 반환합니다.
     * 재시도 대상이 아니거나 시도가 소진된 예외는 원본 그대로 전파됩니다.</p>
     *
     * @param invocation 보호 대상 작업
     * @param <T> 결과 타입
     * @return 마지막 시도의 결과
     * @throws Exception 마지막 시도의 원본 예외
     */
    <T> T withRetry(Invocation<T> invocation) throws Exception;

    /**
     * 재시도 적용 호출 (비동기).
     *
     * <p>재시도 사이 대기는 스레드를 점유하지 않습니다.
     * 반환된 Future가 취소되면 이후 시도는 시작되지 않습니다.</p>
     *
     * @param invocation 보호 대상 비동기 작업
     * @param <T> 결과 타입
     * @return 마지막 시도의 결과 Future
     */
    <T> CompletableFuture<T> withRetryAsync(AsyncInvocation<T> invocation);

    default <T> Invocation<T> decorate(Invocation<T> invocation) {
        return () -> withRetry(invocation);
    }

    default <T> AsyncInvocation<T> decorateAsync(AsyncInvocation<T> invocation) {
        return () -> withRetryAsync(invocation);
    }

    /**
     * 보호 대상 리소스 조회.
     *
     * @return 리소스 식별자
     */
    ResourceId getResourceId();

    /**
     * Retry 설정 조회.
     *
     * @return 설정
     */
    RetryConfig getConfig();
}
