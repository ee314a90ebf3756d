package com.ryuqq.gateway.application.command;

import com.ryuqq.gateway.core.contract.InvocationResult;
import com.ryuqq.gateway.core.schema.ValidatedArguments;

/**
 * Command 처리기.
 *
 * <p>검증이 끝난 인자만 받습니다. 처리 중 발생한 실패(디렉터리 호출 실패 포함)는
 * 던져도 되며, Dispatcher가 단일 지점에서 오류 결과로 변환합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * Command 실행.
     *
     * @param arguments 검증과 기본값 적용이 끝난 인자
     * @return 실행 결과 (null 반환은 오류로 취급됨)
     */
    InvocationResult handle(ValidatedArguments arguments);
}
