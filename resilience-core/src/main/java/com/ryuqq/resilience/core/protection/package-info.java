/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>보호 계층의 확장점을 제공합니다. 외부 API 호출처럼 실패하거나 느려질 수 있는 작업을
 * 감싸는 Circuit Breaker, Retry Policy, Rate Limiter, Bulkhead 인터페이스와
 * 각각의 불변 설정, 거부 예외를 정의합니다.</p>
 *
 * <h2>Protection 체인 순서</h2>
 *
 * <p>네 가지 보호가 모두 활성화된 경우 다음 순서(바깥 → 안쪽)로 적용됩니다:</p>
 * <pre>
 * 1. CircuitBreaker  → OPEN 상태 시 즉시 실패, 최종 결과 1회만 집계
 * 2. RetryPolicy     → 실패 시 백오프 후 재시도
 * 3. RateLimiter     → 시도마다 호출 간격 제어
 * 4. Bulkhead        → 시도마다 동시 실행 수 제한
 * 5. Invocation      → 실제 작업 실행
 * </pre>
 *
 * <h3>체인 순서 선정 이유</h3>
 * <ul>
 *   <li><strong>Circuit Breaker 바깥:</strong> 재시도로 회복된 일시적 실패가 Circuit을 열지 않도록,
 *       재시도가 끝난 뒤의 최종 결과만 집계</li>
 *   <li><strong>Retry:</strong> 재시도 루프는 Breaker에게 보이지 않음</li>
 *   <li><strong>Rate Limiter / Bulkhead 안쪽:</strong> 재시도를 포함한 모든 물리적 시도가
 *       호출 간격과 동시 실행 제한을 지킴</li>
 * </ul>
 *
 * <h2>오류 분류</h2>
 * <ul>
 *   <li><strong>작업 실패:</strong> 작업의 원본 예외 또는 실패로 분류된 결과 (정책 처리 후 전파)</li>
 *   <li><strong>거부:</strong> {@link com.ryuqq.resilience.core.protection.CircuitOpenException},
 *       {@link com.ryuqq.resilience.core.protection.BulkheadRejectedException} (작업 미호출)</li>
 * </ul>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>모든 Protection SPI는 {@code noop} 하위 패키지에 작업을 그대로 호출하는 기본 구현을 제공합니다.
 * 설정에서 비활성화된 보호는 NoOp 구현으로 대체됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @see com.ryuqq.resilience.core.protection.CircuitBreaker
 * @see com.ryuqq.resilience.core.protection.RetryPolicy
 * @see com.ryuqq.resilience.core.protection.RateLimiter
 * @see com.ryuqq.resilience.core.protection.Bulkhead
 * @see com.ryuqq.resilience.core.protection.noop
 */
package com.ryuqq.resilience.core.protection;
