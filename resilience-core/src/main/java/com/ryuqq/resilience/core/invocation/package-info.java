/**
 * 보호 대상 작업 계약 패키지.
 *
 * <p>모든 보호 컴포넌트는 동일한 호출 계약을 따릅니다:
 * 인자 없는 작업을 받아 결과를 반환하거나, 컴포넌트 고유의 거부 예외를 던지거나,
 * 작업의 원본 예외를 그대로 전파합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.invocation.Invocation} - 동기 작업 (스레드 모델)</li>
 *   <li>{@link com.ryuqq.resilience.core.invocation.AsyncInvocation} - 비동기 작업 (CompletableFuture 모델)</li>
 *   <li>{@link com.ryuqq.resilience.core.invocation.Futures} - 비동기 경로 공통 유틸리티</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.invocation;
