package com.ryuqq.resilience.core.classify;

import java.util.function.Predicate;

/**
 * 작업 결과 또는 예외를 실패로 볼지 판정하는 분류기.
 *
 * <p>Circuit Breaker는 이 분류기로 정상 반환된 결과도 실패로 집계할 수 있습니다
 * (예: 503 응답).</p>
 *
 * <p><strong>기본 분류기 ({@link #defaults()}):</strong></p>
 * <ul>
 *   <li>예외: 항상 실패</li>
 *   <li>정상 결과: 항상 성공</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface FailureClassifier {

    /**
     * 정상 반환된 결과가 실패인지 판정.
     *
     * @param result 작업 결과 (null 가능)
     * @return true: 실패로 집계
     */
    boolean isFailureResult(Object result);

    /**
     * 작업이 던진 예외가 실패인지 판정.
     *
     * @param error 작업 예외
     * @return true: 실패로 집계
     */
    boolean isFailureError(Throwable error);

    /**
     * 기본 분류기 (모든 예외는 실패, 모든 결과는 성공).
     *
     * @return 기본 분류기
     */
    static FailureClassifier defaults() {
        return of(result -> false, error -> true);
    }

    /**
     * 결과/예외 판정 조건으로 분류기 생성.
     *
     * @param failureResult 결과 실패 판정 조건
     * @param failureError 예외 실패 판정 조건
     * @return 분류기
     * @throws IllegalArgumentException 조건이 null인 경우
     */
    static FailureClassifier of(Predicate<Object> failureResult, Predicate<Throwable> failureError) {
        if (failureResult == null) {
            throw new IllegalArgumentException("failureResult cannot be null");
        }
        if (failureError == null) {
            throw new IllegalArgumentException("failureError cannot be null");
        }
        return new FailureClassifier() {
            @Override
            public boolean isFailureResult(Object result) {
                return failureResult.test(result);
            }

            @Override
            public boolean isFailureError(Throwable error) {
                return failureError.test(error);
            }
        };
    }
}
