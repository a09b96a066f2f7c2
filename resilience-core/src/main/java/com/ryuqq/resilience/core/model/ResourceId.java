package com.ryuqq.resilience.core.model;

/**
 * 보호 컴포넌트가 지키는 대상의 이름.
 *
 * <p>단일 이름({@code payment-api}) 또는 {@code 서비스:오퍼레이션} 형태
 * ({@code payment-api:refund})를 가진다. 후자는 같은 외부 서비스의 오퍼레이션마다
 * 별도의 서킷/리미터를 둘 때 쓰며, 로그와 거부 예외 메시지에 그대로 찍힌다.</p>
 *
 * <p>각 부분은 영숫자와 {@code - _ .} 로만 구성되고 전체 길이는 255자 이하.</p>
 *
 * @param value 정규화된 식별자 문자열
 * @author Resilience Team
 * @since 1.0.0
 */
public record ResourceId(String value) {

    private static final char SEPARATOR = ':';
    private static final String SEGMENT_PATTERN = "[a-zA-Z0-9\\-_.]+";
    private static final int MAX_LENGTH = 255;

    public ResourceId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ResourceId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("ResourceId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches(SEGMENT_PATTERN + "(" + SEPARATOR + SEGMENT_PATTERN + ")?")) {
            throw new IllegalArgumentException("Invalid ResourceId '" + value
                + "': expected 'name' or 'service:operation' of alphanumeric, hyphen, underscore and dot");
        }
    }

    /**
     * @throws IllegalArgumentException 형식에 맞지 않는 경우
     */
    public static ResourceId of(String value) {
        return new ResourceId(value);
    }

    /**
     * 서비스의 특정 오퍼레이션을 가리키는 식별자.
     *
     * @throws IllegalArgumentException 어느 한쪽이 비었거나 구분자를 포함한 경우
     */
    public static ResourceId of(String service, String operation) {
        if (service == null || operation == null) {
            throw new IllegalArgumentException("service and operation cannot be null");
        }
        return new ResourceId(service + SEPARATOR + operation);
    }

    /**
     * 같은 서비스 아래 다른 오퍼레이션의 식별자. 단일 이름이면 그 이름이 서비스가 된다.
     */
    public ResourceId withOperation(String operation) {
        return of(service(), operation);
    }

    public String service() {
        int idx = value.indexOf(SEPARATOR);
        return idx < 0 ? value : value.substring(0, idx);
    }

    /**
     * @return 오퍼레이션 이름, 단일 이름이면 {@code null}
     */
    public String operation() {
        int idx = value.indexOf(SEPARATOR);
        return idx < 0 ? null : value.substring(idx + 1);
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "ResourceId{" + value + '}';
    }
}
