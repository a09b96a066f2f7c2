/**
 * Protection SPI의 NoOp 구현 패키지.
 *
 * <p>모든 구현은 작업을 그대로 한 번 호출하며 상태를 추적하지 않습니다.
 * 비활성화된 보호를 체인에서 제거하지 않고 대체할 때 사용합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.protection.noop;
