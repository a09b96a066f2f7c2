/**
 * 보호된 호출 진입점과 보호 장치 합성.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.application.invoker.ProtectedInvoker}: 호출 진입점 인터페이스</li>
 *   <li>{@link com.ryuqq.resilience.application.invoker.ResilienceChain}: 고정 순서 합성 구현</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.invoker;
