package com.ryuqq.resilience.application.invoker;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.CircuitBreaker;

import java.util.concurrent.CompletableFuture;

/**
 * 보호된 호출 진입점.
 *
 * <p>하나의 리소스에 대해 구성된 보호 장치(Circuit Breaker, Retry, Rate Limiter, Bulkhead)를
 * 통과시켜 작업을 실행합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ProtectedInvoker invoker = factory.createChain(ResourceId.of("payment-api"), settings);
 *
 * PaymentResponse response = invoker.invoke(() -&gt; paymentClient.charge(request));
 *
 * CompletableFuture&lt;PaymentResponse&gt; future =
 *     invoker.invokeAsync(() -&gt; paymentClient.chargeAsync(request));
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface ProtectedInvoker {

    /**
     * 작업을 동기 실행.
     *
     * @param invocation 보호할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws com.ryuqq.resilience.core.protection.CircuitOpenException Circuit이 OPEN인 경우
     * @throws com.ryuqq.resilience.core.protection.BulkheadRejectedException 동시 실행 한도 초과 시
     * @throws Exception 작업이 던진 원본 예외
     */
    <T> T invoke(Invocation<T> invocation) throws Exception;

    /**
     * 작업을 비동기 실행.
     *
     * <p>실패는 예외 완료된 Future로 전달되며, 원인은 감싸지 않은 원본 예외입니다.</p>
     *
     * @param invocation 보호할 비동기 작업
     * @param <T> 결과 타입
     * @return 작업 결과 Future
     */
    <T> CompletableFuture<T> invokeAsync(AsyncInvocation<T> invocation);

    ResourceId getResourceId();

    /**
     * 관리/조회용 Circuit Breaker.
     *
     * @return 체인의 Circuit Breaker (비활성화 시 NoOp)
     */
    CircuitBreaker getCircuitBreaker();

    Bulkhead getBulkhead();
}
