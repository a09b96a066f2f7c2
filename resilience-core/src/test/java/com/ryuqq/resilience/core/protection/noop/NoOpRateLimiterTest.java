package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.model.ResourceId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpRateLimiter 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("NoOpRateLimiter 테스트")
class NoOpRateLimiterTest {

    private final NoOpRateLimiter rateLimiter = new NoOpRateLimiter(ResourceId.of("orders"));

    @Test
    @DisplayName("throttle() 은 대기 없이 연속 호출을 허용한다")
    void throttle_대기_없음() throws Exception {
        // given
        long start = System.nanoTime();

        // when
        for (int i = 0; i < 100; i++) {
            int value = i;
            Integer result = rateLimiter.throttle(() -> value);
            assertEquals(value, result);
        }

        // then
        assertTrue(System.nanoTime() - start < 1_000_000_000L);
    }

    @Test
    @DisplayName("throttleAsync() 는 결과를 그대로 전달한다")
    void throttleAsync_결과_전달() {
        // when
        CompletableFuture<String> future = rateLimiter.throttleAsync(() -> CompletableFuture.completedFuture("ok"));

        // then
        assertEquals("ok", future.join());
    }

    @Test
    @DisplayName("getConfig() 는 비활성화된 설정을 반환한다")
    void getConfig_비활성화() {
        // when & then
        assertFalse(rateLimiter.getConfig().isEnabled());
        assertEquals(ResourceId.of("orders"), rateLimiter.getResourceId());
    }
}
