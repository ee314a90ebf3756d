package com.ryuqq.gateway.application.onboarding;

import com.ryuqq.gateway.core.outcome.StageOutcome;

/**
 * 워크플로 집계.
 *
 * @param totalRows 처리한 행 수
 * @param onboarded Import 성공 수
 * @param importFailures Import 실패 수
 * @param groupAssignmentFailures Group Assignment 실패 엔티티 수
 * @param provisioningFailures Provisioning 실패 엔티티 수
 * @param groupsAssigned 성공한 그룹 할당 수 (엔티티 × 그룹)
 * @param applicationsProvisioned 성공한 애플리케이션 권한 부여 수 (엔티티 × 애플리케이션)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record WorkflowSummary(
    int totalRows,
    int onboarded,
    int importFailures,
    int groupAssignmentFailures,
    int provisioningFailures,
    int groupsAssigned,
    int applicationsProvisioned
) {

    /**
     * 세 단계 보고로부터 집계.
     *
     * <p>실패한 엔티티라도 성공한 그룹 할당과 권한 부여는 개수에 포함됩니다.</p>
     *
     * @param importReport Import 보고
     * @param groupReport Group Assignment 보고
     * @param provisioningReport Provisioning 보고
     * @return WorkflowSummary
     */
    public static WorkflowSummary of(StageReport importReport, StageReport groupReport, StageReport provisioningReport) {
        int groupsAssigned = 0;
        for (StageOutcome outcome : groupReport.successes()) {
            groupsAssigned += outcome.groupIds().size();
        }
        for (StageOutcome outcome : groupReport.failures()) {
            groupsAssigned += outcome.groupIds().size();
        }

        long applicationsProvisioned = 0;
        for (StageOutcome outcome : provisioningReport.successes()) {
            applicationsProvisioned += outcome.successfulSubResults();
        }
        for (StageOutcome outcome : provisioningReport.failures()) {
            applicationsProvisioned += outcome.successfulSubResults();
        }

        return new WorkflowSummary(
            importReport.processed(),
            importReport.successes().size(),
            importReport.failures().size(),
            groupReport.failures().size(),
            provisioningReport.failures().size(),
            groupsAssigned,
            (int) applicationsProvisioned
        );
    }
}
