package com.ryuqq.gateway.core.schema;

/**
 * 인자 검증 실패.
 *
 * <p>선언 순서상 첫 번째로 위반한 필드와 사람이 읽을 수 있는 원인을 담습니다.
 * 메시지는 {@code "<field> <cause>"} 형태입니다 (예: {@code "userId is required"}).</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public class ValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final String reason;

    /**
     * 생성자.
     *
     * @param field 위반한 필드 이름
     * @param reason 원인 (예: "is required", "must be an integer")
     */
    public ValidationException(String field, String reason) {
        super(field + " " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
