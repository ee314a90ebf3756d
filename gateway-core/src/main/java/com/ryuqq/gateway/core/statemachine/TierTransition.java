package com.ryuqq.gateway.core.statemachine;

/**
 * 검색 tier 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong> 더 낮은 tier로의 강등 (중간 tier 건너뛰기 포함).</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>같은 tier로의 전이 불가 (각 tier는 한 번만 시도)</li>
 *   <li>승격 불가 (예: CLIENT_SIDE_SCAN → NATIVE_FILTER)</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class TierTransition {

    private TierTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * tier 전이가 유효한지 검증.
     *
     * @param from 현재 tier
     * @param to 전이할 tier
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 강등이 아닌 경우
     */
    public static void validate(SearchTier from, SearchTier to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Tiers cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (to.ordinal() <= from.ordinal()) {
            throw new IllegalStateException(
                String.format("Invalid tier transition (demotion only): %s → %s", from, to)
            );
        }
    }

    /**
     * 강등 실행 (검증 후).
     *
     * @param current 현재 tier
     * @param next 강등할 tier
     * @return next
     * @throws IllegalStateException 강등이 아닌 경우
     */
    public static SearchTier demote(SearchTier current, SearchTier next) {
        validate(current, next);
        return next;
    }
}
