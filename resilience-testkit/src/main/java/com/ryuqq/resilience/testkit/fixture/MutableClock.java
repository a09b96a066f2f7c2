package com.ryuqq.resilience.testkit.fixture;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Manually advanced {@link Clock} for deterministic time-based tests.
 *
 * <p>The clock never moves on its own. Tests call {@link #advance(Duration)} (or let a
 * {@link RecordingSuspender} do it) to simulate elapsed time. Reads and writes are thread-safe.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private static final Instant DEFAULT_START = Instant.parse("2024-01-01T00:00:00Z");

    private final AtomicLong epochMillis;
    private final ZoneId zone;

    private MutableClock(AtomicLong epochMillis, ZoneId zone) {
        this.epochMillis = epochMillis;
        this.zone = zone;
    }

    /**
     * Creates a clock fixed at 2024-01-01T00:00:00Z.
     *
     * @return a new clock
     */
    public static MutableClock create() {
        return startingAt(DEFAULT_START);
    }

    /**
     * Creates a clock fixed at the given instant.
     *
     * @param start initial instant
     * @return a new clock
     */
    public static MutableClock startingAt(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        return new MutableClock(new AtomicLong(start.toEpochMilli()), ZoneOffset.UTC);
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount of time to add, must not be negative
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be null or negative (current: " + duration + ")");
        }
        epochMillis.addAndGet(duration.toMillis());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Returns a view sharing this clock's time with another zone.
     */
    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(epochMillis, zone);
    }

    @Override
    public long millis() {
        return epochMillis.get();
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(epochMillis.get());
    }
}
