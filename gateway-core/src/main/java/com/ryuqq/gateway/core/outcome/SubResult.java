package com.ryuqq.gateway.core.outcome;

/**
 * 엔티티 하나에 대한 하위 작업 결과 (예: 애플리케이션 하나의 권한 부여).
 *
 * @param targetId 하위 작업 대상 id (예: 애플리케이션 id)
 * @param status 결과 상태
 * @param reason 실패 원인 (성공이면 null)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record SubResult(
    String targetId,
    OutcomeStatus status,
    String reason
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException targetId 또는 status가 없는 경우
     */
    public SubResult {
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("targetId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status.isSuccess()) {
            reason = null;
        }
    }

    public static SubResult success(String targetId) {
        return new SubResult(targetId, OutcomeStatus.SUCCESS, null);
    }

    public static SubResult failure(String targetId, String reason) {
        return new SubResult(targetId, OutcomeStatus.FAILURE, reason);
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }
}
