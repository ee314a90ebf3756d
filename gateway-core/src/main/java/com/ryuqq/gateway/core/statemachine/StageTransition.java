package com.ryuqq.gateway.core.statemachine;

/**
 * 온보딩 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IMPORT → GROUP_ASSIGNMENT</li>
 *   <li>GROUP_ASSIGNMENT → PROVISIONING</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>PROVISIONING에서는 어떤 단계로도 전이 불가</li>
 *   <li>단계 건너뛰기 불가 (건너뛴 단계도 skipped로 보고된 뒤 다음 단계로 진행)</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class StageTransition {

    private StageTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(OnboardingStage from, OnboardingStage to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Stages cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isLast()) {
            throw new IllegalStateException(
                String.format("Cannot transition from final stage: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case IMPORT -> to == OnboardingStage.GROUP_ASSIGNMENT;
            case GROUP_ASSIGNMENT -> to == OnboardingStage.PROVISIONING;
            case PROVISIONING -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid stage transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static OnboardingStage transition(OnboardingStage current, OnboardingStage next) {
        validate(current, next);
        return next;
    }
}
