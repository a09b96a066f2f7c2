package com.ryuqq.resilience.core.invocation;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * 비동기 보호 경로에서 공통으로 사용하는 CompletableFuture 유틸리티.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class Futures {

    private Futures() {
    }

    /**
     * 예외로 완료된 Future 생성.
     *
     * @param error 실패 원인
     * @param <T> 결과 타입
     * @return 예외로 완료된 Future
     */
    public static <T> CompletableFuture<T> failed(Throwable error) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(error);
        return future;
    }

    /**
     * 비동기 작업을 안전하게 시작.
     *
     * <p>작업이 Stage를 반환하지 않고 동기적으로 예외를 던지거나 null을 반환해도
     * 예외로 완료된 Future로 변환합니다.</p>
     *
     * @param invocation 비동기 작업
     * @param <T> 결과 타입
     * @return 작업 결과 Future
     */
    public static <T> CompletableFuture<T> invokeSafely(AsyncInvocation<T> invocation) {
        CompletionStage<T> stage;
        try {
            stage = invocation.invoke();
        } catch (Throwable t) {
            return failed(t);
        }
        if (stage == null) {
            return failed(new NullPointerException("AsyncInvocation returned null stage"));
        }
        return stage.toCompletableFuture();
    }

    /**
     * CompletionStage 파이프라인에서 감싸진 원본 예외 추출.
     *
     * @param error whenComplete/handle 등에서 전달된 예외
     * @return CompletionException/ExecutionException을 벗겨낸 원본 예외
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * 취소로 인한 완료인지 확인.
     *
     * @param error 완료 예외
     * @return 취소 여부
     */
    public static boolean isCancellation(Throwable error) {
        return unwrap(error) instanceof CancellationException;
    }

    /**
     * 반환한 Future의 취소를 안쪽 Future로 전달.
     *
     * <p>호출자가 {@code returned}를 취소하면 {@code inner}도 취소됩니다. 정상/예외 완료는 전달하지 않습니다.</p>
     *
     * @param returned 호출자에게 반환한 Future
     * @param inner 진행 중인 안쪽 작업
     * @param <T> 결과 타입
     * @return {@code returned}
     */
    public static <T> CompletableFuture<T> propagateCancellation(CompletableFuture<T> returned, Future<?> inner) {
        returned.whenComplete((ignored, error) -> {
            if (returned.isCancelled()) {
                inner.cancel(false);
            }
        });
        return returned;
    }
}
