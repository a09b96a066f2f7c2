package com.ryuqq.resilience.testkit.fixture;

import com.ryuqq.resilience.core.invocation.Invocation;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks how many wrapped invocations run at the same time.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ConcurrencyTracker {

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();
    private final AtomicInteger invocations = new AtomicInteger();

    /**
     * Wraps an invocation so that its execution is counted.
     *
     * @param invocation invocation to observe
     * @param <T> result type
     * @return observed invocation
     */
    public <T> Invocation<T> track(Invocation<T> invocation) {
        return () -> {
            enter();
            try {
                return invocation.invoke();
            } finally {
                exit();
            }
        };
    }

    public void enter() {
        invocations.incrementAndGet();
        int current = active.incrementAndGet();
        peak.accumulateAndGet(current, Math::max);
    }

    public void exit() {
        active.decrementAndGet();
    }

    public int getActive() {
        return active.get();
    }

    public int getPeak() {
        return peak.get();
    }

    public int getInvocations() {
        return invocations.get();
    }
}
