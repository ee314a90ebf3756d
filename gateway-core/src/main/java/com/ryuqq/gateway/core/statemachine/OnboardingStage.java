package com.ryuqq.gateway.core.statemachine;

/**
 * 온보딩 단계.
 *
 * <p><strong>전이 규칙:</strong></p>
 * <ul>
 *   <li>IMPORT → GROUP_ASSIGNMENT → PROVISIONING</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p>GROUP_ASSIGNMENT와 PROVISIONING은 둘 다 IMPORT의 성공 키만 입력으로 받으며,
 * 서로의 결과를 소비하지 않습니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum OnboardingStage {

    /**
     * 표 형식 행으로부터 엔티티 생성.
     */
    IMPORT("User Import"),

    /**
     * 속성 규칙 기반 그룹 할당.
     */
    GROUP_ASSIGNMENT("Group Assignment"),

    /**
     * 애플리케이션 권한 부여.
     */
    PROVISIONING("Application Provisioning");

    private final String displayName;

    OnboardingStage(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isFirst() {
        return this == IMPORT;
    }

    public boolean isLast() {
        return this == PROVISIONING;
    }
}
