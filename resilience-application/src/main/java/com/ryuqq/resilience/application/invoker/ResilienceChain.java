package com.ryuqq.resilience.application.invoker;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RetryPolicy;
import com.ryuqq.resilience.core.protection.noop.NoOpBulkhead;
import com.ryuqq.resilience.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.resilience.core.protection.noop.NoOpRateLimiter;
import com.ryuqq.resilience.core.protection.noop.NoOpRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * 보호 장치 합성 체인.
 *
 * <p>네 가지 보호 장치를 고정된 순서로 감쌉니다 (바깥 → 안쪽):</p>
 * <pre>
 * CircuitBreaker → RetryPolicy → RateLimiter → Bulkhead → 작업
 * </pre>
 *
 * <p><strong>합성 규칙:</strong></p>
 * <ul>
 *   <li>Circuit Breaker는 재시도가 모두 끝난 최종 결과 하나만 기록합니다</li>
 *   <li>Rate Limiter와 Bulkhead는 물리적 시도마다 적용됩니다</li>
 *   <li>설정하지 않은 보호 장치는 NoOp 구현으로 대체됩니다</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ResilienceChain implements ProtectedInvoker {

    private static final Logger log = LoggerFactory.getLogger(ResilienceChain.class);

    private final ResourceId resourceId;
    private final CircuitBreaker circuitBreaker;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final Bulkhead bulkhead;

    private ResilienceChain(Builder builder) {
        this.resourceId = builder.resourceId;
        this.circuitBreaker = builder.circuitBreaker != null
            ? builder.circuitBreaker : new NoOpCircuitBreaker(resourceId);
        this.retryPolicy = builder.retryPolicy != null
            ? builder.retryPolicy : new NoOpRetryPolicy(resourceId);
        this.rateLimiter = builder.rateLimiter != null
            ? builder.rateLimiter : new NoOpRateLimiter(resourceId);
        this.bulkhead = builder.bulkhead != null
            ? builder.bulkhead : new NoOpBulkhead(resourceId);
    }

    /**
     * Builder 생성.
     *
     * @param resourceId 보호 대상 리소스
     * @return 새 Builder
     * @throws IllegalArgumentException resourceId가 null인 경우
     */
    public static Builder builder(ResourceId resourceId) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        return new Builder(resourceId);
    }

    @Override
    public <T> T invoke(Invocation<T> invocation) throws Exception {
        if (invocation == null) {
            throw new IllegalArgumentException("invocation cannot be null");
        }
        return circuitBreaker.protect(
            () -> retryPolicy.withRetry(
                () -> rateLimiter.throttle(
                    () -> bulkhead.withinCapacity(invocation))));
    }

    @Override
    public <T> CompletableFuture<T> invokeAsync(AsyncInvocation<T> invocation) {
        if (invocation == null) {
            throw new IllegalArgumentException("invocation cannot be null");
        }
        return circuitBreaker.protectAsync(
            () -> retryPolicy.withRetryAsync(
                () -> rateLimiter.throttleAsync(
                    () -> bulkhead.withinCapacityAsync(invocation))));
    }

    /**
     * 작업을 체인으로 감싼 새 Invocation 반환.
     *
     * @param invocation 감쌀 작업
     * @param <T> 결과 타입
     * @return 호출 시 체인을 통과하는 Invocation
     */
    public <T> Invocation<T> decorate(Invocation<T> invocation) {
        return () -> invoke(invocation);
    }

    public <T> AsyncInvocation<T> decorateAsync(AsyncInvocation<T> invocation) {
        return () -> invokeAsync(invocation);
    }

    @Override
    public ResourceId getResourceId() {
        return resourceId;
    }

    @Override
    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    @Override
    public Bulkhead getBulkhead() {
        return bulkhead;
    }

    /**
     * ResilienceChain Builder.
     *
     * <p>지정하지 않은 보호 장치는 NoOp으로 채워집니다.</p>
     */
    public static final class Builder {

        private final ResourceId resourceId;
        private CircuitBreaker circuitBreaker;
        private RetryPolicy retryPolicy;
        private RateLimiter rateLimiter;
        private Bulkhead bulkhead;

        private Builder(ResourceId resourceId) {
            this.resourceId = resourceId;
        }

        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder bulkhead(Bulkhead bulkhead) {
            this.bulkhead = bulkhead;
            return this;
        }

        public ResilienceChain build() {
            ResilienceChain chain = new ResilienceChain(this);
            log.debug("ResilienceChain built for {}: circuitBreaker={}, retryPolicy={}, rateLimiter={}, bulkhead={}",
                resourceId,
                chain.circuitBreaker.getClass().getSimpleName(),
                chain.retryPolicy.getClass().getSimpleName(),
                chain.rateLimiter.getClass().getSimpleName(),
                chain.bulkhead.getClass().getSimpleName());
            return chain;
        }
    }
}
