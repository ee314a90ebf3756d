package com.ryuqq.gateway.testkit.scripted;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 기록된 디렉터리 호출 1건.
 *
 * @param operation 호출 종류
 * @param arguments 호출 인자 (선언 순서, null 포함 가능)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record DirectoryCall(DirectoryOperation operation, List<Object> arguments) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operation이 null인 경우
     */
    public DirectoryCall {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        arguments = arguments == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    /**
     * 인자 중 하나가 주어진 값과 같은지 확인.
     *
     * @param argument 비교할 값
     * @return 같은 인자가 있으면 true
     */
    public boolean involves(Object argument) {
        return arguments.stream().anyMatch(value -> Objects.equals(value, argument));
    }

    /**
     * 위치 인자 조회.
     *
     * @param index 인자 위치
     * @return 인자 값
     */
    public Object argument(int index) {
        return arguments.get(index);
    }
}
