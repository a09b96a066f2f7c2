package com.ryuqq.resilience.core.classify;

/**
 * 상태 코드를 노출하는 작업 결과.
 *
 * <p>HTTP 응답처럼 상태 코드로 성공/실패를 판정할 수 있는 결과 타입이 구현합니다.
 * {@link Classifiers#statusCodeIn(int...)} 판정 조건이 이 인터페이스를 사용합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface StatusCoded {

    /**
     * 상태 코드 조회.
     *
     * @return 상태 코드 (예: 200, 503)
     */
    int statusCode();
}
