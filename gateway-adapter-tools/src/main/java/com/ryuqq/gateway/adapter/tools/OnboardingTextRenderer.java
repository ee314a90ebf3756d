package com.ryuqq.gateway.adapter.tools;

import com.ryuqq.gateway.adapter.runner.StagedOnboardingOrchestrator;
import com.ryuqq.gateway.application.onboarding.StageReport;
import com.ryuqq.gateway.application.onboarding.WorkflowReport;
import com.ryuqq.gateway.application.onboarding.WorkflowSummary;
import com.ryuqq.gateway.core.outcome.StageOutcome;
import com.ryuqq.gateway.core.outcome.SubResult;

import java.util.List;

/**
 * 온보딩 단계 보고서의 텍스트 표현.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
final class OnboardingTextRenderer {

    static final String NOTHING_CREATED = "No users were successfully created during the onboarding workflow.";

    private OnboardingTextRenderer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String importReport(StageReport report) {
        StringBuilder text = new StringBuilder()
            .append("Processed ").append(report.processed()).append(" users from CSV data:\n")
            .append("- Successfully created: ").append(report.successes().size()).append('\n')
            .append("- Failed: ").append(report.failures().size()).append('\n');

        if (!report.successes().isEmpty()) {
            text.append("\n• Successfully created users:\n");
            int index = 0;
            for (StageOutcome outcome : report.successes()) {
                text.append(++index).append(". ").append(outcome.displayName())
                    .append(" (ID: ").append(outcome.entityKey())
                    .append(", Status: ").append(outcome.detail()).append(")\n");
            }
        }
        appendImportFailures(text, report.failures());
        return text.toString().stripTrailing();
    }

    static String groupAssignmentReport(StageReport report) {
        StringBuilder text = new StringBuilder()
            .append("Processed group assignments for ").append(report.processed()).append(" users:\n")
            .append("- Successful assignments: ").append(report.successes().size()).append('\n')
            .append("- Failed assignments: ").append(report.failures().size()).append('\n');

        if (!report.successes().isEmpty()) {
            text.append("\n• Successfully assigned users:\n");
            int index = 0;
            for (StageOutcome outcome : report.successes()) {
                String groups = outcome.groupIds().isEmpty()
                    ? StagedOnboardingOrchestrator.NO_MAPPING_MATCHED
                    : "assigned to " + outcome.groupIds().size() + " groups";
                text.append(++index).append(". ").append(outcome.displayName())
                    .append(" (").append(groups).append(")\n");
            }
        }
        appendGroupFailures(text, report.failures());
        return text.toString().stripTrailing();
    }

    static String provisioningReport(StageReport report, int applicationCount) {
        StringBuilder text = new StringBuilder()
            .append("Processed application provisioning for ").append(report.processed())
            .append(" users across ").append(applicationCount).append(" applications:\n")
            .append("- Successful provisioning: ").append(report.successes().size()).append(" users\n")
            .append("- Failed provisioning: ").append(report.failures().size()).append(" users\n");

        if (!report.successes().isEmpty()) {
            text.append("\n• Successfully provisioned users:\n");
            int index = 0;
            for (StageOutcome outcome : report.successes()) {
                text.append(++index).append(". ").append(outcome.displayName())
                    .append(" (provisioned ").append(outcome.subResults().size()).append(" applications)\n");
            }
        }
        appendProvisioningFailures(text, report.failures());
        return text.toString().stripTrailing();
    }

    static String workflowReport(WorkflowReport report) {
        WorkflowSummary summary = report.summary();
        StringBuilder text = new StringBuilder();
        if (summary.onboarded() == 0) {
            text.append(NOTHING_CREATED).append("\n\n");
            return text.append(importReport(report.importReport())).toString();
        }

        text.append("Onboarding Workflow Complete:\n\n")
            .append("- User Import:\n")
            .append("  - Processed ").append(summary.totalRows()).append(" users\n")
            .append("  - Successfully created: ").append(summary.onboarded()).append('\n')
            .append("  - Failed: ").append(summary.importFailures()).append('\n');
        appendImportFailures(text, report.importReport().failures());

        StageReport groups = report.groupAssignmentReport();
        text.append('\n');
        if (groups.skipped()) {
            text.append("• Group Assignment: ").append(skipLabel(groups)).append('\n');
        } else {
            text.append("• Group Assignment:\n")
                .append("  - Users assigned to groups: ").append(groups.successes().size()).append('\n')
                .append("  - Failed group assignments: ").append(summary.groupAssignmentFailures()).append('\n')
                .append("  - Group memberships created: ").append(summary.groupsAssigned()).append('\n');
            appendGroupFailures(text, groups.failures());
        }

        StageReport provisioning = report.provisioningReport();
        text.append('\n');
        if (provisioning.skipped()) {
            text.append("• Application Provisioning: ").append(skipLabel(provisioning)).append('\n');
        } else {
            text.append("• Application Provisioning:\n")
                .append("  - Users provisioned with applications: ").append(provisioning.successes().size()).append('\n')
                .append("  - Failed application provisioning: ").append(summary.provisioningFailures()).append('\n')
                .append("  - Application grants: ").append(summary.applicationsProvisioned()).append('\n');
            appendProvisioningFailures(text, provisioning.failures());
        }

        text.append("\nOverall, successfully onboarded ").append(summary.onboarded())
            .append(" out of ").append(summary.totalRows()).append(" users with ")
            .append(groups.skipped() ? "default groups only" : "attribute-based group assignment")
            .append(" and ")
            .append(provisioning.skipped() ? "no application provisioning" : "application provisioning")
            .append('.');
        return text.toString();
    }

    private static void appendImportFailures(StringBuilder text, List<StageOutcome> failures) {
        if (failures.isEmpty()) {
            return;
        }
        text.append("\n• Failed users:\n");
        int index = 0;
        for (StageOutcome outcome : failures) {
            text.append(++index).append(". ").append(outcome.displayName())
                .append(" - ").append(outcome.detail()).append('\n');
        }
    }

    private static void appendGroupFailures(StringBuilder text, List<StageOutcome> failures) {
        if (failures.isEmpty()) {
            return;
        }
        text.append("\n• Failed assignments:\n");
        int index = 0;
        for (StageOutcome outcome : failures) {
            text.append(++index).append(". User ID: ").append(outcome.entityKey())
                .append(" - ").append(outcome.detail()).append('\n');
        }
    }

    private static void appendProvisioningFailures(StringBuilder text, List<StageOutcome> failures) {
        if (failures.isEmpty()) {
            return;
        }
        text.append("\n• Failed provisioning:\n");
        int index = 0;
        for (StageOutcome outcome : failures) {
            text.append(++index).append(". ").append(outcome.displayName())
                .append(" - ").append(outcome.detail()).append('\n');
            for (SubResult result : outcome.subResults()) {
                if (!result.isSuccess()) {
                    text.append("   - ").append(result.targetId()).append(": ").append(result.reason()).append('\n');
                }
            }
        }
    }

    private static String skipLabel(StageReport report) {
        return StageReport.NOT_CONFIGURED.equals(report.skipReason())
            ? "Not configured"
            : "Skipped (" + report.skipReason() + ")";
    }
}
