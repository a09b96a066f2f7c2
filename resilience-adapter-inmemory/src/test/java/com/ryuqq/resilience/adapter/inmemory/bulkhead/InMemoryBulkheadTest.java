package com.ryuqq.resilience.adapter.inmemory.bulkhead;

import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.BulkheadRejectedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryBulkhead 단위 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("InMemoryBulkhead 테스트")
class InMemoryBulkheadTest {

    private static final ResourceId RESOURCE = ResourceId.of("payment-api");

    @Test
    @DisplayName("동기 호출과 비동기 호출은 같은 permit 을 나눠 쓴다")
    void 동기_비동기_permit_공유() throws Exception {
        // given
        InMemoryBulkhead bulkhead = new InMemoryBulkhead(RESOURCE, BulkheadConfig.of(1, 0));
        CompletableFuture<String> operation = new CompletableFuture<>();
        CompletableFuture<String> asyncCall = bulkhead.withinCapacityAsync(() -> operation);

        // when & then
        assertThat(bulkhead.getCurrentConcurrency()).isEqualTo(1);
        assertThatThrownBy(() -> bulkhead.withinCapacity(() -> "sync"))
            .isInstanceOf(BulkheadRejectedException.class);

        operation.complete("async");
        assertThat(asyncCall.join()).isEqualTo("async");
        assertThat(bulkhead.withinCapacity(() -> "sync")).isEqualTo("sync");
        assertThat(bulkhead.getAvailablePermits()).isEqualTo(1);
    }

    @Test
    @DisplayName("실행 중 취소된 호출의 작업은 취소된 뒤에야 다음 호출이 permit 을 받는다")
    void withinCapacityAsync_실행_중_취소() {
        // given
        InMemoryBulkhead bulkhead = new InMemoryBulkhead(RESOURCE, BulkheadConfig.of(1, 0));
        CompletableFuture<String> operationA = new CompletableFuture<>();
        CompletableFuture<String> callerA = bulkhead.withinCapacityAsync(() -> operationA);

        // when
        callerA.cancel(true);
        CompletableFuture<String> operationB = new CompletableFuture<>();
        CompletableFuture<String> callerB = bulkhead.withinCapacityAsync(() -> operationB);
        CompletableFuture<String> callerC = bulkhead.withinCapacityAsync(() -> CompletableFuture.completedFuture("c"));

        // then: A 의 작업이 끝났으므로 실제 동시 실행은 한 건
        assertThat(operationA).isCancelled();
        assertThat(callerB).isNotDone();
        assertThatThrownBy(callerC::join).hasCauseInstanceOf(BulkheadRejectedException.class);
        assertThat(bulkhead.getCurrentConcurrency()).isEqualTo(1);

        operationB.complete("b");
        assertThat(callerB.join()).isEqualTo("b");
        assertThat(bulkhead.getAvailablePermits()).isEqualTo(1);
    }

    @Test
    @DisplayName("비동기 대기가 시간을 넘기면 BulkheadRejectedException 으로 완료된다")
    void withinCapacityAsync_대기_타임아웃() {
        // given
        InMemoryBulkhead bulkhead = new InMemoryBulkhead(RESOURCE, BulkheadConfig.of(1, 30));
        CompletableFuture<String> holder = new CompletableFuture<>();
        bulkhead.withinCapacityAsync(() -> holder);

        // when
        CompletableFuture<String> waiting = bulkhead.withinCapacityAsync(() -> CompletableFuture.completedFuture("late"));

        // then
        assertThatThrownBy(() -> waiting.get(5, TimeUnit.SECONDS))
            .hasCauseInstanceOf(BulkheadRejectedException.class);
        holder.complete("done");
        assertThat(bulkhead.getAvailablePermits()).isEqualTo(1);
    }

    @Test
    @DisplayName("거부 예외는 리소스와 설정 값을 담는다")
    void withinCapacity_거부_예외_정보() {
        // given
        InMemoryBulkhead bulkhead = new InMemoryBulkhead(RESOURCE, BulkheadConfig.of(1, 0));
        CompletableFuture<String> holder = new CompletableFuture<>();
        bulkhead.withinCapacityAsync(() -> holder);

        // when & then
        assertThatThrownBy(() -> bulkhead.withinCapacity(() -> "rejected"))
            .isInstanceOfSatisfying(BulkheadRejectedException.class, e -> {
                assertThat(e.getResourceId()).isEqualTo(RESOURCE);
                assertThat(e.getMaxConcurrentCalls()).isEqualTo(1);
                assertThat(e.getMaxWaitDurationMs()).isZero();
            });
        holder.complete("done");
    }

    @Test
    @DisplayName("동기 대기자는 permit 이 반납되면 이어서 실행된다")
    void withinCapacity_대기_후_실행() throws Exception {
        // given
        InMemoryBulkhead bulkhead = new InMemoryBulkhead(RESOURCE, BulkheadConfig.of(1, 5_000));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<String> first = executor.submit(() -> bulkhead.withinCapacity(() -> {
                entered.countDown();
                release.await();
                return "first";
            }));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            Future<String> second = executor.submit(() -> bulkhead.withinCapacity(() -> "second"));

            // when
            Thread.sleep(50);
            assertThat(second.isDone()).isFalse();
            release.countDown();

            // then
            assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("first");
            assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("second");
            assertThat(bulkhead.getCurrentConcurrency()).isZero();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("비활성화 또는 제한 없음 설정은 introspection 에서 사용량을 보고하지 않는다")
    void 제한_없음_introspection() throws Exception {
        // given
        InMemoryBulkhead disabled = new InMemoryBulkhead(RESOURCE, new BulkheadConfig());
        InMemoryBulkhead zeroLimit = new InMemoryBulkhead(RESOURCE, BulkheadConfig.of(0, 0));

        // when
        String result = zeroLimit.withinCapacity(() -> "ok");

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(disabled.getCurrentConcurrency()).isZero();
        assertThat(disabled.getAvailablePermits()).isEqualTo(Integer.MAX_VALUE);
        assertThat(zeroLimit.getAvailablePermits()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    @DisplayName("null 인자는 예외가 발생한다")
    void null_인자() {
        InMemoryBulkhead bulkhead = new InMemoryBulkhead(RESOURCE, BulkheadConfig.of(1, 0));

        assertThatThrownBy(() -> new InMemoryBulkhead(null, new BulkheadConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("resourceId cannot be null");
        assertThatThrownBy(() -> bulkhead.withinCapacity(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("invocation cannot be null");
    }
}
