package com.ryuqq.gateway.core.spi;

/**
 * 디렉터리가 요청한 필터 연산자를 지원하지 않음.
 *
 * <p>검색 전략 선택기는 이 실패를 받으면 다음 tier로 강등하며,
 * 호출자에게 실패로 노출하지 않습니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class CapabilityUnsupportedException extends DirectoryException {

    private static final long serialVersionUID = 1L;

    private final String operator;

    /**
     * 생성자.
     *
     * @param operator 지원되지 않는 연산자 토큰 (예: "ew")
     * @param message 디렉터리가 보고한 메시지
     */
    public CapabilityUnsupportedException(String operator, String message) {
        super(message);
        this.operator = operator;
    }

    /**
     * 지원되지 않는 연산자.
     *
     * @return 연산자 토큰 (알 수 없으면 null)
     */
    public String getOperator() {
        return operator;
    }
}
