package com.ryuqq.resilience.core.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 시스템 Suspender 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("Suspender.system() 테스트")
class SuspenderTest {

    @Test
    @DisplayName("0 이하의 지연은 즉시 완료된다")
    void delay_0_즉시_완료() {
        // when
        CompletableFuture<Void> delay = Suspender.system().delay(0);

        // then
        assertThat(delay).isDone();
    }

    @Test
    @DisplayName("양수 지연은 지정 시간 이후 완료된다")
    void delay_양수_지연() throws Exception {
        // given
        long start = System.nanoTime();

        // when
        Suspender.system().delay(50).get(2, TimeUnit.SECONDS);

        // then
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(45);
    }

    @Test
    @DisplayName("sleep() 은 현재 스레드를 지정 시간만큼 멈춘다")
    void sleep_지정_시간() throws Exception {
        // given
        long start = System.nanoTime();

        // when
        Suspender.system().sleep(30);

        // then
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(25);
    }
}
