package com.ryuqq.resilience.core.invocation;

import java.util.concurrent.CompletionStage;

/**
 * 보호 대상 비동기 작업.
 *
 * <p>호출 시점에 작업을 시작하고 {@link CompletionStage}를 반환합니다.
 * 작업 실패는 예외적으로 완료된 Stage로 표현하는 것이 원칙이지만,
 * 호출 자체가 동기적으로 예외를 던지는 경우도 보호 컴포넌트가 동일하게 처리합니다.</p>
 *
 * <p><strong>Cold 작업 요구사항:</strong> 거부(Rejection) 시 작업이 시작되지 않아야 하므로,
 * {@link #invoke()} 호출 전에는 어떤 작업도 시작되어서는 안 됩니다.</p>
 *
 * @param <T> 작업 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AsyncInvocation<T> {

    /**
     * 비동기 작업 시작.
     *
     * @return 작업 완료 시 결과를 담는 Stage
     */
    CompletionStage<T> invoke();
}
