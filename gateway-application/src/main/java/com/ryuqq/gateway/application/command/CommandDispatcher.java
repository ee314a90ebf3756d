package com.ryuqq.gateway.application.command;

import com.ryuqq.gateway.core.contract.InvocationRequest;
import com.ryuqq.gateway.core.contract.InvocationResult;

import java.util.List;

/**
 * 경계 프로토콜의 두 가지 요청(목록 조회, 호출)을 처리하는 진입점.
 *
 * <p><strong>핵심 계약:</strong> {@link #dispatch(InvocationRequest)}는 어떤 경우에도 예외를 던지지 않으며
 * 항상 올바른 형태의 {@link InvocationResult}를 반환합니다.</p>
 *
 * <p><strong>오류 메시지:</strong></p>
 * <ul>
 *   <li>등록되지 않은 이름: {@code Unknown command: <name>}</li>
 *   <li>인자 검증 실패: {@code Invalid arguments for <name>: <field> <cause>} (처리기는 호출되지 않음)</li>
 *   <li>처리기 실패: {@code Error executing <name>: <message>}</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public interface CommandDispatcher {

    /**
     * 광고 가능한 Command 목록.
     *
     * @return 등록 순서의 CommandDescriptor 목록
     */
    List<CommandDescriptor> listCommands();

    /**
     * Command 호출.
     *
     * @param request 호출 요청 (null이면 오류 결과)
     * @return 실행 결과 (null 아님)
     */
    InvocationResult dispatch(InvocationRequest request);
}
