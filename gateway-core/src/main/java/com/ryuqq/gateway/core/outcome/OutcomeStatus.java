package com.ryuqq.gateway.core.outcome;

/**
 * 단일 엔티티(또는 하위 작업)의 처리 결과 상태.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum OutcomeStatus {

    SUCCESS,

    FAILURE;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
