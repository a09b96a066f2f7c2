package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;

import java.util.concurrent.CompletableFuture;

/**
 * Circuit Breaker SPI.
 *
 * <p>보호 대상 작업의 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 장애가 전체 시스템으로 전파되는 것을 방지합니다.
 * 인스턴스 하나가 하나의 리소스를 담당하며, 모든 동시 호출자가 공유합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 실패 수 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패 ({@link CircuitOpenException})</li>
 *   <li>HALF_OPEN: 요청 통과로 복구 확인</li>
 * </ul>
 *
 * <p><strong>사용 예시 (보호 호출):</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = ...;
 *
 * try {
 *     Response response = cb.protect(() -> externalApi.call());
 * } catch (CircuitOpenException e) {
 *     // 작업이 호출되지 않음 (빠른 실패)
 * }
 * }</pre>
 *
 * <p><strong>사용 예시 (수동 기록):</strong></p>
 * <pre>{@code
 * if (!cb.tryAcquire()) {
 *     return fallback();
 * }
 * try {
 *     Response response = externalApi.call();
 *     cb.recordSuccess();
 *     return response;
 * } catch (Exception e) {
 *     cb.recordFailure(e);
 *     throw e;
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 보호 호출 (동기).
     *
     * <p>OPEN 상태에서 recoveryTimeout이 경과하지 않았으면 작업을 호출하지 않고
     * {@link CircuitOpenException}을 던집니다. 작업 실패는 집계 후 원본 예외 그대로 전파됩니다.</p>
     *
     * @param invocation 보호 대상 작업
     * @param <T> 결과 타입
     * @return 작업 결과 (실패로 분류된 결과도 그대로 반환)
     * @throws CircuitOpenException Circuit이 OPEN인 경우
     * @throws Exception 작업의 원본 예외
     */
    <T> T protect(Invocation<T> invocation) throws Exception;

    /**
     * 보호 호출 (비동기).
     *
     * <p>동기 호출과 동일한 의미를 가지며, 거부는 {@link CircuitOpenException}으로
     * 예외 완료된 Future로 표현됩니다.</p>
     *
     * @param invocation 보호 대상 비동기 작업
     * @param <T> 결과 타입
     * @return 작업 결과 Future
     */
    <T> CompletableFuture<T> protectAsync(AsyncInvocation<T> invocation);

    /**
     * 작업을 보호 호출로 감싼 새 작업 생성.
     *
     * @param invocation 원본 작업
     * @param <T> 결과 타입
     * @return 호출 시 {@link #protect(Invocation)}를 거치는 작업
     */
    default <T> Invocation<T> decorate(Invocation<T> invocation) {
        return () -> protect(invocation);
    }

    /**
     * 비동기 작업을 보호 호출로 감싼 새 작업 생성.
     *
     * @param invocation 원본 비동기 작업
     * @param <T> 결과 타입
     * @return 호출 시 {@link #protectAsync(AsyncInvocation)}를 거치는 작업
     */
    default <T> AsyncInvocation<T> decorateAsync(AsyncInvocation<T> invocation) {
        return () -> protectAsync(invocation);
    }

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED / HALF_OPEN: true 반환</li>
     *   <li>OPEN + recoveryTimeout 미경과: 거부 수 증가 후 false 반환</li>
     *   <li>OPEN + recoveryTimeout 경과: HALF_OPEN 전이 후 true 반환</li>
     * </ul>
     *
     * @return true: 요청 통과 허용, false: 요청 차단
     */
    boolean tryAcquire();

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 실패 카운터 초기화</li>
     *   <li>HALF_OPEN: 연속 성공 임계값 도달 시 CLOSED로 전이</li>
     * </ul>
     */
    void recordSuccess();

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 실패 임계값 도달 시 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN으로 전이</li>
     * </ul>
     *
     * @param cause 실패 원인 (실패로 분류된 결과인 경우 null)
     */
    void recordFailure(Throwable cause);

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    default boolean isOpen() {
        return getState() == CircuitBreakerState.OPEN;
    }

    default boolean isClosed() {
        return getState() == CircuitBreakerState.CLOSED;
    }

    default boolean isHalfOpen() {
        return getState() == CircuitBreakerState.HALF_OPEN;
    }

    /**
     * 통계 스냅샷 조회.
     *
     * @return 상태와 카운터의 읽기 전용 스냅샷
     */
    CircuitBreakerStats getStats();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>실패/성공 카운터를 0으로 초기화합니다.
     * 진행 중인 호출과 관계없이 언제든 호출할 수 있습니다.</p>
     */
    void reset();

    /**
     * Circuit Breaker를 OPEN 상태로 강제 전이.
     *
     * <p>강제 전이 시각을 기준으로 recoveryTimeout이 적용됩니다.</p>
     */
    void forceOpen();

    /**
     * 보호 대상 리소스 조회.
     *
     * @return 리소스 식별자
     */
    ResourceId getResourceId();

    /**
     * Circuit Breaker 설정 조회.
     *
     * @return 설정
     */
    CircuitBreakerConfig getConfig();
}
