package com.ryuqq.resilience.core.time;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 실행 일시 중단 전략.
 *
 * <p>재시도 백오프와 Rate Limit 대기는 이 전략을 통해서만 중단됩니다.
 * 동기 경로는 {@link #sleep(long)}으로 스레드를 블로킹하고,
 * 비동기 경로는 {@link #delay(long)}로 스레드를 점유하지 않고 대기합니다.</p>
 *
 * <p>테스트에서는 실제로 대기하지 않고 요청된 지연 시간만 기록하는 구현으로 교체합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface Suspender {

    /**
     * 현재 스레드 블로킹 대기.
     *
     * @param millis 대기 시간 (밀리초, 0 이하이면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    void sleep(long millis) throws InterruptedException;

    /**
     * 비블로킹 대기.
     *
     * @param millis 대기 시간 (밀리초, 0 이하이면 완료된 Future 반환)
     * @return 대기 완료 시 완료되는 Future
     */
    CompletableFuture<Void> delay(long millis);

    /**
     * 실제 시간을 사용하는 기본 전략.
     *
     * @return Thread.sleep / delayedExecutor 기반 전략
     */
    static Suspender system() {
        return SystemSuspender.INSTANCE;
    }

    /**
     * 시스템 시간 기반 구현.
     */
    final class SystemSuspender implements Suspender {

        private static final SystemSuspender INSTANCE = new SystemSuspender();

        private SystemSuspender() {
        }

        @Override
        public void sleep(long millis) throws InterruptedException {
            if (millis > 0) {
                Thread.sleep(millis);
            }
        }

        @Override
        public CompletableFuture<Void> delay(long millis) {
            if (millis <= 0) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.runAsync(
                () -> { },
                CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS)
            );
        }
    }
}
