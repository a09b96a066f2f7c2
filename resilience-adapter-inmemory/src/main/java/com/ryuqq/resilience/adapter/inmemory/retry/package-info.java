/**
 * 지수 백오프 재시도 구현.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.adapter.inmemory.retry.BackoffRetryPolicy}: 재시도 루프 (동기/비동기)</li>
 *   <li>{@link com.ryuqq.resilience.adapter.inmemory.retry.BackoffCalculator}: 시도별 대기 시간 계산</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.retry;
