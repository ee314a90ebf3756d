package com.ryuqq.gateway.application.onboarding;

import java.util.List;

/**
 * 3단계 온보딩 워크플로.
 *
 * <p>각 단계는 단독으로도 호출할 수 있으며, {@link #run(OnboardingRequest)}은
 * Import → Group Assignment → Provisioning 순서로 실행합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>Group Assignment와 Provisioning의 입력은 정확히 Import의 성공 키</li>
 *   <li>엔티티 하나의 실패는 다른 엔티티 처리에 영향을 주지 않음</li>
 *   <li>어떤 단계도 이전 단계를 되돌리지 않음</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public interface OnboardingWorkflow {

    /**
     * Stage 1: 행마다 엔티티 생성.
     *
     * @param rows 입력 행
     * @param options Import 옵션
     * @return Import 보고 (성공 detail = 부여된 상태)
     */
    StageReport importRows(List<OnboardingRow> rows, ImportOptions options);

    /**
     * Stage 2: 속성 규칙 기반 그룹 할당.
     *
     * @param entityKeys 대상 엔티티 키
     * @param mappings 매핑 테이블
     * @return Group Assignment 보고
     */
    StageReport assignGroups(List<String> entityKeys, GroupMappingTable mappings);

    /**
     * Stage 3: 애플리케이션 권한 부여.
     *
     * @param entityKeys 대상 엔티티 키
     * @param applicationIds 애플리케이션 id
     * @return Provisioning 보고 (엔티티별 subResults 포함)
     */
    StageReport provision(List<String> entityKeys, List<String> applicationIds);

    /**
     * 전체 워크플로 실행.
     *
     * @param request 워크플로 요청
     * @return 세 단계 보고와 집계
     */
    WorkflowReport run(OnboardingRequest request);
}
