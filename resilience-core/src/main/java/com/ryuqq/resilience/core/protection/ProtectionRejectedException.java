package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.ResourceId;

/**
 * 보호 계층이 작업 호출 자체를 거부했음을 나타내는 예외의 공통 상위 타입.
 *
 * <p>이 예외가 관찰되면 보호 대상 작업은 호출되지 않았습니다.
 * 작업 실패와 타입으로 구분되며, Circuit Breaker의 실패 집계에 포함되지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class ProtectionRejectedException extends RuntimeException {

    private final ResourceId resourceId;

    protected ProtectionRejectedException(ResourceId resourceId, String message) {
        super(message);
        this.resourceId = resourceId;
    }

    protected ProtectionRejectedException(ResourceId resourceId, String message, Throwable cause) {
        super(message, cause);
        this.resourceId = resourceId;
    }

    /**
     * 거부한 보호 컴포넌트의 리소스 조회.
     *
     * @return 리소스 식별자
     */
    public ResourceId getResourceId() {
        return resourceId;
    }
}
