package com.ryuqq.resilience.adapter.inmemory.retry;

import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.time.Suspender;
import com.ryuqq.resilience.testkit.fixture.RecordingSuspender;
import com.ryuqq.resilience.testkit.fixture.ScriptedInvocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * BackoffRetryPolicy 단위 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("BackoffRetryPolicy 테스트")
class BackoffRetryPolicyTest {

    private static final ResourceId RESOURCE = ResourceId.of("payment-api");

    @Mock
    private Suspender suspender;

    @Test
    @DisplayName("두 번 실패 후 성공하면 실제로 0.3초 이상 대기한다")
    void withRetry_실제_대기_시간() throws Exception {
        // given
        BackoffRetryPolicy policy = new BackoffRetryPolicy(RESOURCE,
            new RetryConfig(2, 100, 2.0, 1_000, false, null, null));
        ScriptedInvocation<String> invocation = ScriptedInvocation.<String>create()
            .thenThrow(new IOException("first"))
            .thenThrow(new IOException("second"))
            .thenReturn("ok");
        long start = System.nanoTime();

        // when
        String result = policy.withRetry(invocation);

        // then
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertThat(result).isEqualTo("ok");
        assertThat(invocation.getCallCount()).isEqualTo(3);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(300);
    }

    @Test
    @DisplayName("시도 사이마다 계산된 지연만큼 순서대로 대기한다")
    void withRetry_대기_순서() throws Exception {
        // given
        BackoffRetryPolicy policy = new BackoffRetryPolicy(RESOURCE,
            new RetryConfig(3, 50, 3.0, 1_000, false, null, null), suspender);
        ScriptedInvocation<String> invocation = ScriptedInvocation.alwaysFailing(new IOException("down"));

        // when
        assertThatThrownBy(() -> policy.withRetry(invocation)).isInstanceOf(IOException.class);

        // then
        InOrder order = inOrder(suspender);
        order.verify(suspender).sleep(50);
        order.verify(suspender).sleep(150);
        order.verify(suspender).sleep(450);
        order.verifyNoMoreInteractions();
    }

    @Test
    @DisplayName("대기 중 인터럽트되면 추가 시도 없이 InterruptedException 을 전파한다")
    void withRetry_인터럽트_전파() throws Exception {
        // given
        BackoffRetryPolicy policy = new BackoffRetryPolicy(RESOURCE,
            new RetryConfig(3, 100, 2.0, 1_000, false, null, null), suspender);
        doThrow(new InterruptedException("stop")).when(suspender).sleep(anyLong());
        ScriptedInvocation<String> invocation = ScriptedInvocation.alwaysFailing(new IOException("down"));

        // when & then
        assertThatThrownBy(() -> policy.withRetry(invocation)).isInstanceOf(InterruptedException.class);
        assertThat(invocation.getCallCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("성공하면 대기하지 않는다")
    void withRetry_성공_대기_없음() throws Exception {
        // given
        BackoffRetryPolicy policy = new BackoffRetryPolicy(RESOURCE, new RetryConfig(), suspender);

        // when
        String result = policy.withRetry(() -> "ok");

        // then
        assertThat(result).isEqualTo("ok");
        verify(suspender, never()).sleep(anyLong());
    }

    @Test
    @DisplayName("비동기 재시도 대기 중 취소하면 더 이상 시도하지 않는다")
    void withRetryAsync_대기_중_취소() {
        // given
        RecordingSuspender holding = RecordingSuspender.holding(null);
        BackoffRetryPolicy policy = new BackoffRetryPolicy(RESOURCE,
            new RetryConfig(3, 100, 2.0, 1_000, false, null, null), holding);
        ScriptedInvocation<String> invocation = ScriptedInvocation.alwaysFailing(new IOException("down"));

        // when
        CompletableFuture<String> future = policy.withRetryAsync(invocation.asAsync());
        assertThat(holding.pendingCount()).isEqualTo(1);
        future.cancel(true);
        holding.releasePending();

        // then
        assertThat(future).isCancelled();
        assertThat(invocation.getCallCount()).isEqualTo(1);
        assertThat(holding.pendingCount()).isZero();
    }

    @Test
    @DisplayName("비동기 시도 진행 중 취소하면 진행 중인 시도 Future 도 취소된다")
    void withRetryAsync_시도_중_취소() {
        // given
        RecordingSuspender recording = RecordingSuspender.create();
        BackoffRetryPolicy policy = new BackoffRetryPolicy(RESOURCE,
            new RetryConfig(3, 100, 2.0, 1_000, false, null, null), recording);
        CompletableFuture<String> attempt = new CompletableFuture<>();
        AtomicInteger calls = new AtomicInteger();

        // when
        CompletableFuture<String> future = policy.withRetryAsync(() -> {
            calls.incrementAndGet();
            return attempt;
        });
        future.cancel(true);

        // then
        assertThat(attempt).isCancelled();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(recording.getSuspensions()).isEmpty();
    }

    @Test
    @DisplayName("null 인자는 예외가 발생한다")
    void 생성자_null_인자() {
        // when & then
        assertThatThrownBy(() -> new BackoffRetryPolicy(null, new RetryConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("resourceId cannot be null");
        assertThatThrownBy(() -> new BackoffRetryPolicy(RESOURCE, new RetryConfig(), (Suspender) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("suspender cannot be null");
    }
}
