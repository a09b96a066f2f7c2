package com.ryuqq.resilience.core.invocation;

/**
 * 보호 대상 동기 작업.
 *
 * <p>인자가 없는 호출 가능 객체로, 결과를 반환하거나 예외를 던집니다.
 * 보호 컴포넌트는 이 작업을 감싸서 동일한 시그니처의 새 Invocation을 만들 수 있습니다.</p>
 *
 * @param <T> 작업 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Invocation<T> {

    /**
     * 작업 실행.
     *
     * @return 작업 결과
     * @throws Exception 작업 자체가 실패한 경우 (원본 예외 그대로 전파)
     */
    T invoke() throws Exception;
}
