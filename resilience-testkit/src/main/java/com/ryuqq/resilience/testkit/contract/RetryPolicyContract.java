package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.classify.Classifiers;
import com.ryuqq.resilience.core.protection.CircuitOpenException;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.RetryPolicy;
import com.ryuqq.resilience.testkit.fixture.ScriptedInvocation;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract every {@link RetryPolicy} implementation must satisfy.
 *
 * <p>Implementations must suspend through {@link #suspender} so that backoff delays are recorded
 * instead of slept.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class RetryPolicyContract extends AbstractContractTest {

    protected abstract RetryPolicy createRetryPolicy(RetryConfig config);

    protected RetryConfig fastConfig(int maxRetries) {
        return new RetryConfig(maxRetries, 100, 2.0, 10_000, false, null, null);
    }

    @Test
    void testFailTwiceThenSucceed_CalledThreeTimesWithExponentialDelays() throws Exception {
        // Given
        RetryPolicy policy = createRetryPolicy(fastConfig(2));
        ScriptedInvocation<String> invocation = ScriptedInvocation.<String>create()
            .thenThrow(new IOException("first"))
            .thenThrow(new IOException("second"))
            .thenReturn("ok");

        // When
        String result = policy.withRetry(invocation);

        // Then
        assertEquals("ok", result);
        assertEquals(3, invocation.getCallCount());
        assertEquals(List.of(100L, 200L), suspender.getSuspensions());
        assertTrue(suspender.totalSuspendedMillis() >= 300);
    }

    @Test
    void testAlwaysFailing_CalledMaxRetriesPlusOne_LastErrorPropagated() {
        // Given
        RetryPolicy policy = createRetryPolicy(fastConfig(2));
        IOException first = new IOException("first");
        IOException last = new IOException("last");
        ScriptedInvocation<String> invocation = ScriptedInvocation.<String>create()
            .thenThrow(first)
            .thenThrow(new IOException("middle"))
            .thenThrow(last);

        // When
        IOException thrown = assertThrows(IOException.class, () -> policy.withRetry(invocation));

        // Then
        assertSame(last, thrown, "Final error must be the operation's last raised error");
        assertEquals(3, invocation.getCallCount());
    }

    @Test
    void testRetryableResultExhausted_LastResultReturned() throws Exception {
        // Given
        RetryPolicy policy = createRetryPolicy(fastConfig(2).withRetryableResult("retry"::equals));
        ScriptedInvocation<String> invocation = ScriptedInvocation.<String>create().thenReturn("retry");

        // When
        String result = policy.withRetry(invocation);

        // Then
        assertEquals("retry", result, "Exhausted retryable result is returned, not raised");
        assertEquals(3, invocation.getCallCount());
    }

    @Test
    void testRetryableResult_RetriedUntilAcceptable() throws Exception {
        // Given
        RetryPolicy policy = createRetryPolicy(fastConfig(3).withRetryableResult("retry"::equals));
        ScriptedInvocation<String> invocation = ScriptedInvocation.<String>create()
            .thenReturn("retry")
            .thenReturn("done");

        // When
        String result = policy.withRetry(invocation);

        // Then
        assertEquals("done", result);
        assertEquals(2, invocation.getCallCount());
        assertEquals(List.of(100L), suspender.getSuspensions());
    }

    @Test
    void testNonRetryableError_PropagatedWithoutRetry() {
        // Given
        RetryPolicy policy = createRetryPolicy(
            fastConfig(3).withRetryableError(Classifiers.errorTypes(IOException.class)));
        IllegalStateException error = new IllegalStateException("bad");
        ScriptedInvocation<String> invocation = ScriptedInvocation.alwaysFailing(error);

        // When
        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> policy.withRetry(invocation));

        // Then
        assertSame(error, thrown);
        assertEquals(1, invocation.getCallCount());
        assertTrue(suspender.getSuspensions().isEmpty());
    }

    @Test
    void testCircuitOpen_NeverRetriedByDefault() {
        // Given
        RetryPolicy policy = createRetryPolicy(fastConfig(3));
        ScriptedInvocation<String> invocation = ScriptedInvocation.alwaysFailing(
            new CircuitOpenException(resourceId, Instant.EPOCH, 1_000));

        // When & Then
        assertThrows(CircuitOpenException.class, () -> policy.withRetry(invocation));
        assertEquals(1, invocation.getCallCount());
    }

    @Test
    void testZeroRetries_SingleAttempt() {
        // Given
        RetryPolicy policy = createRetryPolicy(fastConfig(0));
        ScriptedInvocation<String> invocation = ScriptedInvocation.alwaysFailing(new IOException());

        // When & Then
        assertThrows(IOException.class, () -> policy.withRetry(invocation));
        assertEquals(1, invocation.getCallCount());
    }

    @Test
    void testBackoff_CappedAtMaxDelay() {
        // Given
        RetryPolicy policy = createRetryPolicy(new RetryConfig(3, 100, 10.0, 500, false, null, null));
        ScriptedInvocation<String> invocation = ScriptedInvocation.alwaysFailing(new IOException());

        // When
        assertThrows(IOException.class, () -> policy.withRetry(invocation));

        // Then
        assertEquals(List.of(100L, 500L, 500L), suspender.getSuspensions());
    }

    @Test
    void testJitter_NeverExceedsMaxDelayOrQuarterWidening() {
        // Given
        RetryPolicy policy = createRetryPolicy(new RetryConfig(3, 100, 2.0, 300, true, null, null));
        ScriptedInvocation<String> invocation = ScriptedInvocation.alwaysFailing(new IOException());

        // When
        assertThrows(IOException.class, () -> policy.withRetry(invocation));

        // Then
        List<Long> delays = suspender.getSuspensions();
        assertEquals(3, delays.size());
        assertTrue(delays.get(0) >= 100 && delays.get(0) <= 125, "first delay: " + delays.get(0));
        assertTrue(delays.get(1) >= 200 && delays.get(1) <= 250, "second delay: " + delays.get(1));
        assertEquals(300L, delays.get(2), "jitter must not push a capped delay above maxDelay");
    }

    @Test
    void testAsync_FailTwiceThenSucceed() {
        // Given
        RetryPolicy policy = createRetryPolicy(fastConfig(2));
        ScriptedInvocation<String> invocation = ScriptedInvocation.<String>create()
            .thenThrow(new IOException("first"))
            .thenThrow(new IOException("second"))
            .thenReturn("ok");

        // When
        String result = policy.withRetryAsync(invocation.asAsync()).join();

        // Then
        assertEquals("ok", result);
        assertEquals(3, invocation.getCallCount());
        assertEquals(List.of(100L, 200L), suspender.getSuspensions());
    }

    @Test
    void testAsync_AlwaysFailing_LastErrorUnwrapped() {
        // Given
        RetryPolicy policy = createRetryPolicy(fastConfig(2));
        IOException last = new IOException("last");
        ScriptedInvocation<String> invocation = ScriptedInvocation.<String>create()
            .thenThrow(new IOException("first"))
            .thenThrow(new IOException("second"))
            .thenThrow(last);

        // When
        CompletableFuture<String> future = policy.withRetryAsync(invocation.asAsync());

        // Then
        CompletionException thrown = assertThrows(CompletionException.class, future::join);
        assertSame(last, thrown.getCause());
        assertEquals(3, invocation.getCallCount());
    }

    @Test
    void testAsync_SynchronousThrowTreatedAsFailure() {
        // Given
        RetryPolicy policy = createRetryPolicy(fastConfig(1));
        IllegalStateException error = new IllegalStateException("sync");

        // When
        CompletableFuture<String> future = policy.withRetryAsync(() -> {
            throw error;
        });

        // Then
        CompletionException thrown = assertThrows(CompletionException.class, future::join);
        assertSame(error, thrown.getCause());
        assertEquals(List.of(100L), suspender.getSuspensions());
    }
}
