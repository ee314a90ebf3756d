package com.ryuqq.gateway.application.command;

import com.ryuqq.gateway.core.schema.InputShape;

import java.util.Map;

/**
 * 경계 프로토콜에 광고되는 Command 정보 (처리기 제외).
 *
 * @param name Command 이름
 * @param description 설명
 * @param inputShape 입력 형태
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record CommandDescriptor(
    String name,
    String description,
    InputShape inputShape
) {

    /**
     * JSON Schema 형태의 입력 스키마.
     *
     * @return {@link InputShape#toJsonSchema()}
     */
    public Map<String, Object> inputSchema() {
        return inputShape.toJsonSchema();
    }
}
