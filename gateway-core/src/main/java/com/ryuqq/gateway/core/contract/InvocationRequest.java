package com.ryuqq.gateway.core.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command 호출 요청.
 *
 * <p>경계 프로토콜이 전달한 명령 이름과 타입이 없는 인자 맵을 담습니다.
 * 요청 하나당 한 번 생성되고 한 번 소비됩니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>commandName:</strong> 호출할 Command 이름 (예: get_user)</li>
 *   <li><strong>rawArguments:</strong> 검증 전 인자 (null이면 빈 맵으로 취급)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * InvocationRequest request = InvocationRequest.of(
 *     "get_user",
 *     Map.of("userId", "00u1abcd")
 * );
 * </pre>
 *
 * @param commandName 호출할 Command 이름
 * @param rawArguments 검증 전 인자 (null 값 포함 가능)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record InvocationRequest(
    String commandName,
    Map<String, Object> rawArguments
) {

    /**
     * Compact Constructor.
     *
     * <p>commandName은 null을 허용합니다. 알 수 없는 이름과 마찬가지로
     * Dispatcher가 오류 결과로 변환합니다.</p>
     */
    public InvocationRequest {
        // LinkedHashMap: Map.copyOf는 null 값을 허용하지 않음
        rawArguments = rawArguments == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(rawArguments));
    }

    /**
     * InvocationRequest 생성.
     *
     * @param commandName Command 이름
     * @param rawArguments 검증 전 인자 (null 가능)
     * @return InvocationRequest 인스턴스
     */
    public static InvocationRequest of(String commandName, Map<String, Object> rawArguments) {
        return new InvocationRequest(commandName, rawArguments);
    }

    /**
     * 인자 없는 InvocationRequest 생성.
     *
     * @param commandName Command 이름
     * @return InvocationRequest 인스턴스
     */
    public static InvocationRequest of(String commandName) {
        return new InvocationRequest(commandName, Map.of());
    }
}
