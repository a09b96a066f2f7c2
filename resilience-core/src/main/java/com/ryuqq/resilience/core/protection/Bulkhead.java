package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;

import java.util.concurrent.CompletableFuture;

/**
 * Bulkhead SPI.
 *
 * <p>동시 실행 수를 제한하여 특정 작업이 전체 시스템 리소스를 독점하지 못하도록 격리합니다.
 * Permit은 성공, 실패, 취소 등 모든 종료 경로에서 반드시 반환됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Bulkhead bulkhead = ...;
 *
 * try {
 *     Result result = bulkhead.withinCapacity(() -> externalApi.call());
 * } catch (BulkheadRejectedException e) {
 *     // 대기 시간 내에 Permit 확보 실패, 작업은 호출되지 않음
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface Bulkhead {

    /**
     * 동시 실행 제한 내에서 호출 (동기).
     *
     * @param invocation 보호 대상 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws BulkheadRejectedException 대기 시간 내에 Permit을 확보하지 못한 경우
     * @throws InterruptedException Permit 대기 중 인터럽트 발생
     * @throws Exception 작업의 원본 예외
     */
    <T> T withinCapacity(Invocation<T> invocation) throws Exception;

    /**
     * 동시 실행 제한 내에서 호출 (비동기).
     *
     * <p>Permit 대기는 스레드를 점유하지 않습니다. 반환된 Future가 대기 중 취소되면
     * 작업은 호출되지 않고 Permit도 점유되지 않습니다.</p>
     *
     * @param invocation 보호 대상 비동기 작업
     * @param <T> 결과 타입
     * @return 작업 결과 Future
     */
    <T> CompletableFuture<T> withinCapacityAsync(AsyncInvocation<T> invocation);

    default <T> Invocation<T> decorate(Invocation<T> invocation) {
        return () -> withinCapacity(invocation);
    }

    default <T> AsyncInvocation<T> decorateAsync(AsyncInvocation<T> invocation) {
        return () -> withinCapacityAsync(invocation);
    }

    /**
     * 현재 동시 실행 수 조회.
     *
     * @return 현재 진입 중인 작업 수
     */
    int getCurrentConcurrency();

    /**
     * 현재 사용 가능한 Permit 수 조회.
     *
     * @return 사용 가능한 Permit 수 (무제한이면 Integer.MAX_VALUE)
     */
    int getAvailablePermits();

    /**
     * 보호 대상 리소스 조회.
     *
     * @return 리소스 식별자
     */
    ResourceId getResourceId();

    /**
     * Bulkhead 설정 정보 조회.
     *
     * @return Bulkhead 설정 (최대 동시 실행 수 등)
     */
    BulkheadConfig getConfig();
}
