package com.ryuqq.gateway.application.onboarding;

import java.util.List;

/**
 * Import 단계 옵션.
 *
 * @param activate 생성 직후 활성화 여부
 * @param sendEmail 활성화 알림 발송 여부 (activate=false면 무시)
 * @param defaultGroups 모든 엔티티를 할당할 그룹 id (순서대로)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record ImportOptions(
    boolean activate,
    boolean sendEmail,
    List<String> defaultGroups
) {

    public ImportOptions {
        defaultGroups = defaultGroups == null ? List.of() : List.copyOf(defaultGroups);
    }

    /**
     * 기본 옵션 (활성화 안 함, 알림 발송, 기본 그룹 없음).
     *
     * @return ImportOptions
     */
    public static ImportOptions defaults() {
        return new ImportOptions(false, true, List.of());
    }
}
