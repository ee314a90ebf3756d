package com.ryuqq.gateway.core.schema;

/**
 * 필드 단위 검증이 끝난 뒤 적용하는 필드 간 규칙.
 *
 * <p>예: 연산자가 present가 아니면 비교 값이 필요함.
 * 위반 시 {@link ValidationException}을 던집니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ArgumentRule {

    /**
     * 규칙 검사.
     *
     * @param arguments 필드 검증과 기본값 적용이 끝난 인자
     * @throws ValidationException 규칙을 위반한 경우
     */
    void check(ValidatedArguments arguments);
}
