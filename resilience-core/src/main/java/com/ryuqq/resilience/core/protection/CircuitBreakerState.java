package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 보호 대상 작업의 실패를 누적 집계하고,
 * 임계값 도달 시 요청을 차단하여 장애 전파를 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (failureCount ≥ failureThreshold)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeout 경과 후 다음 호출)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► successThreshold 연속 성공 → CLOSED
 *   └─► 1회 실패 → OPEN
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 정상적으로 처리되며, 실패 수를 추적합니다.
     * 성공 시 실패 카운터가 0으로 초기화됩니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>작업을 호출하지 않고 즉시 거부합니다.
     * 마지막 실패 이후 recoveryTimeout이 경과하면 다음 호출이 HALF_OPEN으로 전이시킵니다.
     * 백그라운드 타이머는 사용하지 않습니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (복구 확인 중).
     *
     * <p>요청을 통과시켜 보호 대상의 복구 여부를 확인합니다.
     * successThreshold만큼 연속 성공하면 CLOSED, 한 번이라도 실패하면 OPEN으로 전이합니다.</p>
     */
    HALF_OPEN
}
