package com.ryuqq.resilience.adapter.inmemory;

import com.ryuqq.resilience.adapter.inmemory.bulkhead.InMemoryBulkhead;
import com.ryuqq.resilience.adapter.inmemory.circuitbreaker.InMemoryCircuitBreaker;
import com.ryuqq.resilience.adapter.inmemory.ratelimit.InMemoryRateLimiter;
import com.ryuqq.resilience.adapter.inmemory.retry.BackoffRetryPolicy;
import com.ryuqq.resilience.application.invoker.ResilienceChain;
import com.ryuqq.resilience.application.settings.ResilienceSettings;
import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.noop.NoOpBulkhead;
import com.ryuqq.resilience.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.resilience.core.protection.noop.NoOpRateLimiter;
import com.ryuqq.resilience.core.protection.noop.NoOpRetryPolicy;
import com.ryuqq.resilience.testkit.fixture.MutableClock;
import com.ryuqq.resilience.testkit.fixture.RecordingSuspender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryProtectionFactory 단위 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("InMemoryProtectionFactory 테스트")
class InMemoryProtectionFactoryTest {

    private static final ResourceId RESOURCE = ResourceId.of("order-api");

    private InMemoryProtectionFactory factory;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.create();
        factory = new InMemoryProtectionFactory(clock, RecordingSuspender.advancing(clock));
    }

    @Test
    @DisplayName("기본 설정은 재시도만 활성화된 체인을 만든다")
    void createChain_기본_설정() {
        // when
        ResilienceChain chain = factory.createChain(RESOURCE, ResilienceSettings.defaults());

        // then
        assertThat(chain.getResourceId()).isEqualTo(RESOURCE);
        assertThat(chain.getCircuitBreaker()).isInstanceOf(NoOpCircuitBreaker.class);
        assertThat(chain.getRetryPolicy()).isInstanceOf(BackoffRetryPolicy.class);
        assertThat(chain.getRateLimiter()).isInstanceOf(NoOpRateLimiter.class);
        assertThat(chain.getBulkhead()).isInstanceOf(NoOpBulkhead.class);
    }

    @Test
    @DisplayName("모든 보호 장치를 켜면 InMemory 구현으로 체인을 만든다")
    void createChain_전체_활성화() {
        // given
        ResilienceSettings settings = ResilienceSettings.defaults()
            .withCircuitBreaker(new CircuitBreakerConfig().withEnabled(true))
            .withRateLimiter(new RateLimiterConfig(5.0, 2))
            .withBulkhead(BulkheadConfig.of(4, 100));

        // when
        ResilienceChain chain = factory.createChain(RESOURCE, settings);

        // then
        assertThat(chain.getCircuitBreaker()).isInstanceOf(InMemoryCircuitBreaker.class);
        assertThat(chain.getRetryPolicy()).isInstanceOf(BackoffRetryPolicy.class);
        assertThat(chain.getRateLimiter()).isInstanceOf(InMemoryRateLimiter.class);
        assertThat(chain.getBulkhead()).isInstanceOf(InMemoryBulkhead.class);
        assertThat(chain.getBulkhead().getAvailablePermits()).isEqualTo(4);
    }

    @Test
    @DisplayName("재시도 횟수가 0이면 NoOpRetryPolicy 를 만든다")
    void createRetryPolicy_재시도_없음() {
        assertThat(factory.createRetryPolicy(RESOURCE, new RetryConfig().withMaxRetries(0)))
            .isInstanceOf(NoOpRetryPolicy.class);
    }

    @Test
    @DisplayName("maxConcurrentCalls 가 0 이하인 Bulkhead 는 제한 없음으로 취급한다")
    void createBulkhead_제한_없음() {
        assertThat(factory.createBulkhead(RESOURCE, BulkheadConfig.of(0, 0))).isInstanceOf(NoOpBulkhead.class);
        assertThat(factory.createBulkhead(RESOURCE, new BulkheadConfig(true, null, 0))).isInstanceOf(NoOpBulkhead.class);
    }

    @Test
    @DisplayName("같은 설정으로 만든 체인은 상태를 공유하지 않는다")
    void createChain_인스턴스_독립() throws Exception {
        // given
        ResilienceSettings settings = ResilienceSettings.defaults()
            .withCircuitBreaker(new CircuitBreakerConfig().withEnabled(true).withFailureThreshold(1))
            .withRetry(new RetryConfig().withMaxRetries(0));
        ResilienceChain first = factory.createChain(RESOURCE, settings);
        ResilienceChain second = factory.createChain(RESOURCE, settings);

        // when
        assertThatThrownBy(() -> first.invoke(() -> {
            throw new IllegalStateException("down");
        })).isInstanceOf(IllegalStateException.class);

        // then
        assertThat(first.getCircuitBreaker().isOpen()).isTrue();
        assertThat(second.getCircuitBreaker().isClosed()).isTrue();
        assertThat(second.invoke(() -> "ok")).isEqualTo("ok");
    }

    @Test
    @DisplayName("null 인자는 예외가 발생한다")
    void null_인자() {
        assertThatThrownBy(() -> new InMemoryProtectionFactory(null, RecordingSuspender.create()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("clock cannot be null");
        assertThatThrownBy(() -> factory.createChain(RESOURCE, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
        assertThatThrownBy(() -> factory.createCircuitBreaker(null, new CircuitBreakerConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("resourceId cannot be null");
    }
}
