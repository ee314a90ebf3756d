package com.ryuqq.gateway.application.onboarding;

import java.util.List;

/**
 * 전체 온보딩 워크플로 요청.
 *
 * @param rows 표 형식 입력 행 (입력 순서)
 * @param importOptions Import 단계 옵션
 * @param groupMappings Group Assignment 매핑 (비어있으면 단계 생략)
 * @param applicationIds Provisioning 애플리케이션 id (비어있으면 단계 생략)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record OnboardingRequest(
    List<OnboardingRow> rows,
    ImportOptions importOptions,
    GroupMappingTable groupMappings,
    List<String> applicationIds
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException rows가 null인 경우
     */
    public OnboardingRequest {
        if (rows == null) {
            throw new IllegalArgumentException("rows cannot be null");
        }
        rows = List.copyOf(rows);
        importOptions = importOptions == null ? ImportOptions.defaults() : importOptions;
        groupMappings = groupMappings == null ? GroupMappingTable.empty() : groupMappings;
        applicationIds = applicationIds == null ? List.of() : List.copyOf(applicationIds);
    }
}
