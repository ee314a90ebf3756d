package com.ryuqq.gateway.application.onboarding;

/**
 * 전체 온보딩 워크플로 결과.
 *
 * <p>반환된 후에는 변경되지 않습니다.</p>
 *
 * @param importReport Import 보고
 * @param groupAssignmentReport Group Assignment 보고
 * @param provisioningReport Provisioning 보고
 * @param summary 집계
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record WorkflowReport(
    StageReport importReport,
    StageReport groupAssignmentReport,
    StageReport provisioningReport,
    WorkflowSummary summary
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 단계 보고가 하나라도 null인 경우
     */
    public WorkflowReport {
        if (importReport == null || groupAssignmentReport == null || provisioningReport == null) {
            throw new IllegalArgumentException("stage reports cannot be null");
        }
        if (summary == null) {
            summary = WorkflowSummary.of(importReport, groupAssignmentReport, provisioningReport);
        }
    }

    /**
     * 단계 보고로부터 집계를 계산해 생성.
     *
     * @param importReport Import 보고
     * @param groupAssignmentReport Group Assignment 보고
     * @param provisioningReport Provisioning 보고
     * @return WorkflowReport
     */
    public static WorkflowReport of(StageReport importReport, StageReport groupAssignmentReport, StageReport provisioningReport) {
        return new WorkflowReport(importReport, groupAssignmentReport, provisioningReport, null);
    }
}
