/**
 * 결과 분류 패키지.
 *
 * <p>보호 계층은 작업 결과의 의미를 알지 못합니다. 대신 외부 협력자(HTTP 전송 계층 등)가
 * 제공하는 판정 조건으로 결과를 "성공" 또는 "실패/재시도 대상"으로 분류합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.classify;
