package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.invocation.Invocation;
import com.ryuqq.resilience.core.model.ResourceId;
import com.ryuqq.resilience.testkit.fixture.MutableClock;
import com.ryuqq.resilience.testkit.fixture.RecordingSuspender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Abstract base class for protection contract tests.
 *
 * <p>Provides a fresh deterministic time source for every test:</p>
 * <ul>
 *   <li>{@link MutableClock}: time only moves when a test or the suspender advances it</li>
 *   <li>{@link RecordingSuspender}: records waits and advances the clock instead of sleeping</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class InMemoryCircuitBreakerContractTest extends CircuitBreakerContract {
 *     {@literal @}Override
 *     protected CircuitBreaker createCircuitBreaker(CircuitBreakerConfig config) {
 *         return new InMemoryCircuitBreaker(resourceId, config, clock);
 *     }
 * }
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected ResourceId resourceId;
    protected MutableClock clock;
    protected RecordingSuspender suspender;

    /**
     * Creates fresh fixtures before each test.
     */
    @BeforeEach
    void setUpFixtures() {
        resourceId = ResourceId.of("contract", getClass().getSimpleName());
        clock = MutableClock.create();
        suspender = RecordingSuspender.advancing(clock);
    }

    /**
     * Clears recorded suspensions so no state leaks between tests.
     */
    @AfterEach
    void tearDownFixtures() {
        if (suspender != null) {
            suspender.clear();
        }
    }

    /**
     * Creates an invocation that counts its calls and returns the given value.
     *
     * @param counter call counter
     * @param result value to return
     * @param <T> result type
     * @return counting invocation
     */
    protected <T> Invocation<T> counting(AtomicInteger counter, T result) {
        return () -> {
            counter.incrementAndGet();
            return result;
        };
    }

    /**
     * Creates an invocation that counts its calls and throws the given error.
     *
     * @param counter call counter
     * @param error error to throw
     * @param <T> result type
     * @return failing invocation
     */
    protected <T> Invocation<T> failing(AtomicInteger counter, Exception error) {
        return () -> {
            counter.incrementAndGet();
            throw error;
        };
    }

    /**
     * Sleeps for real time. Used only where a test needs genuine thread interleaving.
     *
     * @param millis milliseconds to sleep
     */
    protected void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Sleep interrupted", e);
        }
    }
}
