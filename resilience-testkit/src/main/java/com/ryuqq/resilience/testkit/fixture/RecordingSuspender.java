package com.ryuqq.resilience.testkit.fixture;

import com.ryuqq.resilience.core.time.Suspender;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link Suspender} that records requested suspensions instead of waiting.
 *
 * <p>When bound to a {@link MutableClock}, every recorded suspension advances the clock by the
 * requested amount, so components observe the time they would have spent waiting.</p>
 *
 * <p>In holding mode {@link #delay(long)} returns futures that stay pending until
 * {@link #releasePending()} is called, which lets tests cancel a caller while it is suspended.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RecordingSuspender implements Suspender {

    private final MutableClock clock;
    private final boolean holding;
    private final List<Long> suspensions = new CopyOnWriteArrayList<>();
    private final List<PendingDelay> pending = new CopyOnWriteArrayList<>();

    private RecordingSuspender(MutableClock clock, boolean holding) {
        this.clock = clock;
        this.holding = holding;
    }

    /**
     * Creates a suspender that only records.
     *
     * @return a new suspender
     */
    public static RecordingSuspender create() {
        return new RecordingSuspender(null, false);
    }

    /**
     * Creates a suspender that advances the given clock on every suspension.
     *
     * @param clock clock to advance
     * @return a new suspender
     */
    public static RecordingSuspender advancing(MutableClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return new RecordingSuspender(clock, false);
    }

    /**
     * Creates a suspender whose async delays stay pending until released.
     *
     * @param clock clock to advance when pending delays are released, may be null
     * @return a new suspender
     */
    public static RecordingSuspender holding(MutableClock clock) {
        return new RecordingSuspender(clock, true);
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("interrupted before sleeping " + millis + "ms");
        }
        record(millis);
    }

    @Override
    public CompletableFuture<Void> delay(long millis) {
        if (holding) {
            CompletableFuture<Void> future = new CompletableFuture<>();
            pending.add(new PendingDelay(millis, future));
            return future;
        }
        record(millis);
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Completes every pending delay in request order, advancing the clock for each.
     *
     * @return number of delays completed
     */
    public int releasePending() {
        List<PendingDelay> snapshot = new ArrayList<>(pending);
        pending.removeAll(snapshot);
        int released = 0;
        for (PendingDelay delay : snapshot) {
            if (delay.future().isDone()) {
                continue;
            }
            record(delay.millis());
            if (delay.future().complete(null)) {
                released++;
            }
        }
        return released;
    }

    public int pendingCount() {
        return (int) pending.stream().filter(delay -> !delay.future().isDone()).count();
    }

    /**
     * Returns the recorded suspensions in order.
     *
     * @return copy of the recorded durations in milliseconds
     */
    public List<Long> getSuspensions() {
        return List.copyOf(suspensions);
    }

    public long totalSuspendedMillis() {
        return suspensions.stream().mapToLong(Long::longValue).sum();
    }

    public void clear() {
        suspensions.clear();
        pending.clear();
    }

    private void record(long millis) {
        if (millis <= 0) {
            return;
        }
        suspensions.add(millis);
        if (clock != null) {
            clock.advanceMillis(millis);
        }
    }

    private record PendingDelay(long millis, CompletableFuture<Void> future) {
    }
}
