/**
 * 시간 추상화 패키지.
 *
 * <p>현재 시각은 {@link java.time.Clock}으로, 대기는
 * {@link com.ryuqq.resilience.core.time.Suspender}로 주입받아
 * 시간 의존 로직을 결정적으로 테스트할 수 있게 합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.time;
