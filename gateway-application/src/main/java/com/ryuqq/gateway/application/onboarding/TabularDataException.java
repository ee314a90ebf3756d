package com.ryuqq.gateway.application.onboarding;

/**
 * 표 형식 입력을 해석할 수 없음.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public class TabularDataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TabularDataException(String message) {
        super(message);
    }

    public TabularDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
