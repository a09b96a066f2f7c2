package com.ryuqq.resilience.testkit.fixture;

import com.ryuqq.resilience.core.invocation.AsyncInvocation;
import com.ryuqq.resilience.core.invocation.Futures;
import com.ryuqq.resilience.core.invocation.Invocation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Invocation that plays back a fixed script of results and failures.
 *
 * <p>Each call consumes the next step. Once the script is exhausted the last step repeats.</p>
 *
 * <pre>
 * ScriptedInvocation&lt;String&gt; invocation = ScriptedInvocation.&lt;String&gt;create()
 *     .thenThrow(new IOException("reset"))
 *     .thenReturn("ok");
 * </pre>
 *
 * @param <T> result type
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ScriptedInvocation<T> implements Invocation<T> {

    private final List<Step<T>> steps = new ArrayList<>();
    private final AtomicInteger callCount = new AtomicInteger();

    private ScriptedInvocation() {
    }

    public static <T> ScriptedInvocation<T> create() {
        return new ScriptedInvocation<>();
    }

    /**
     * Creates an invocation that always fails with the given error.
     *
     * @param error error to throw on every call
     * @param <T> result type
     * @return scripted invocation
     */
    public static <T> ScriptedInvocation<T> alwaysFailing(Exception error) {
        return ScriptedInvocation.<T>create().thenThrow(error);
    }

    public ScriptedInvocation<T> thenReturn(T result) {
        steps.add(new Step<>(result, null));
        return this;
    }

    public ScriptedInvocation<T> thenThrow(Exception error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        steps.add(new Step<>(null, error));
        return this;
    }

    @Override
    public T invoke() throws Exception {
        Step<T> step = next();
        if (step.error() != null) {
            throw step.error();
        }
        return step.result();
    }

    /**
     * Returns an async view consuming the same script.
     *
     * <p>Failures complete the returned stage exceptionally.</p>
     *
     * @return async invocation
     */
    public AsyncInvocation<T> asAsync() {
        return () -> {
            Step<T> step = next();
            if (step.error() != null) {
                return Futures.failed(step.error());
            }
            return CompletableFuture.completedFuture(step.result());
        };
    }

    public int getCallCount() {
        return callCount.get();
    }

    private synchronized Step<T> next() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("ScriptedInvocation has no steps");
        }
        int index = callCount.getAndIncrement();
        return steps.get(Math.min(index, steps.size() - 1));
    }

    private record Step<T>(T result, Exception error) {
    }
}
