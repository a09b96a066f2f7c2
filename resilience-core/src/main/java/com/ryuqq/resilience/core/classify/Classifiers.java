package com.ryuqq.resilience.core.classify;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 상태 코드/예외 타입 기반 판정 조건 모음.
 *
 * <p><strong>기본 상태 코드:</strong></p>
 * <ul>
 *   <li>재시도 대상: 429, 500, 502, 503, 504</li>
 *   <li>Circuit Breaker 실패 집계 대상: 500, 502, 503, 504</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * FailureClassifier classifier = FailureClassifier.of(
 *     Classifiers.statusCodeIn(Classifiers.DEFAULT_FAILURE_STATUS_CODES),
 *     Classifiers.errorTypes(IOException.class, TimeoutException.class)
 * );
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class Classifiers {

    /**
     * 재시도 대상 기본 상태 코드.
     */
    public static final Set<Integer> DEFAULT_RETRYABLE_STATUS_CODES = Set.of(429, 500, 502, 503, 504);

    /**
     * Circuit Breaker 실패 집계 기본 상태 코드.
     */
    public static final Set<Integer> DEFAULT_FAILURE_STATUS_CODES = Set.of(500, 502, 503, 504);

    private Classifiers() {
    }

    /**
     * 결과의 상태 코드가 지정 목록에 포함되는지 판정.
     *
     * <p>{@link StatusCoded}를 구현하지 않은 결과(null 포함)는 항상 false입니다.</p>
     *
     * @param statusCodes 상태 코드 목록
     * @return 결과 판정 조건
     */
    public static Predicate<Object> statusCodeIn(int... statusCodes) {
        Set<Integer> codes = Arrays.stream(statusCodes).boxed().collect(Collectors.toUnmodifiableSet());
        return statusCodeIn(codes);
    }

    /**
     * 결과의 상태 코드가 지정 집합에 포함되는지 판정.
     *
     * @param statusCodes 상태 코드 집합
     * @return 결과 판정 조건
     * @throws IllegalArgumentException statusCodes가 null인 경우
     */
    public static Predicate<Object> statusCodeIn(Set<Integer> statusCodes) {
        if (statusCodes == null) {
            throw new IllegalArgumentException("statusCodes cannot be null");
        }
        Set<Integer> codes = Set.copyOf(statusCodes);
        return result -> result instanceof StatusCoded
            && codes.contains(((StatusCoded) result).statusCode());
    }

    /**
     * 예외가 지정 타입(하위 타입 포함) 중 하나인지 판정.
     *
     * @param errorTypes 예외 타입 목록
     * @return 예외 판정 조건
     */
    @SafeVarargs
    public static Predicate<Throwable> errorTypes(Class<? extends Throwable>... errorTypes) {
        List<Class<? extends Throwable>> types = List.of(errorTypes);
        return error -> error != null && types.stream().anyMatch(type -> type.isInstance(error));
    }
}
