package com.ryuqq.gateway.adapter.tools;

import com.ryuqq.gateway.application.command.Command;
import com.ryuqq.gateway.application.command.CommandProvider;
import com.ryuqq.gateway.application.onboarding.GroupMappingTable;
import com.ryuqq.gateway.application.onboarding.ImportOptions;
import com.ryuqq.gateway.application.onboarding.OnboardingRequest;
import com.ryuqq.gateway.application.onboarding.OnboardingRow;
import com.ryuqq.gateway.application.onboarding.OnboardingWorkflow;
import com.ryuqq.gateway.application.onboarding.TabularDataException;
import com.ryuqq.gateway.application.onboarding.TabularRowParser;
import com.ryuqq.gateway.core.contract.InvocationResult;
import com.ryuqq.gateway.core.schema.FieldDescriptor;
import com.ryuqq.gateway.core.schema.FieldType;
import com.ryuqq.gateway.core.schema.InputShape;
import com.ryuqq.gateway.core.schema.ValidatedArguments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * 온보딩 Command 모음.
 *
 * <p>CSV 파싱은 {@link TabularRowParser}, 단계 실행은 {@link OnboardingWorkflow}에 위임하고
 * 결과 보고서를 텍스트로 변환합니다. 엔티티별 실패는 보고서에 담기며 Command 오류가 되지 않습니다.
 * 읽을 수 없거나 데이터 행이 없는 CSV는 오류 결과입니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class OnboardingCommands implements CommandProvider {

    private static final Logger log = LoggerFactory.getLogger(OnboardingCommands.class);

    static final String NO_VALID_ROWS = "No valid users found in CSV data.";

    private static final String MAPPING_DESCRIPTION =
        "Mapping of user attributes to group IDs (e.g., {\"department\": {\"Engineering\": \"group1Id\"}})";

    private final OnboardingWorkflow workflow;
    private final TabularRowParser parser;

    /**
     * 생성자.
     *
     * @param workflow 온보딩 워크플로우
     * @param parser CSV 행 파서
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public OnboardingCommands(OnboardingWorkflow workflow, TabularRowParser parser) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        if (parser == null) {
            throw new IllegalArgumentException("parser cannot be null");
        }
        this.workflow = workflow;
        this.parser = parser;
    }

    @Override
    public List<Command> commands() {
        return List.of(
            new Command("bulk_user_import", "Import multiple users from a CSV string",
                InputShape.of(
                    csvData("CSV string with user information (header row required)"),
                    FieldDescriptor.optional("activateUsers", FieldType.BOOLEAN,
                        "Whether to activate users immediately (default: false)").withDefault(false),
                    FieldDescriptor.optional("sendEmail", FieldType.BOOLEAN,
                        "Whether to send activation emails (default: true)").withDefault(true),
                    defaultGroups("Default group IDs to assign all imported users to")
                ), this::bulkUserImport),
            new Command("assign_users_to_groups", "Assign multiple users to groups based on attributes",
                InputShape.of(
                    FieldDescriptor.required("userIds", FieldType.STRING_LIST, "List of user IDs to assign"),
                    FieldDescriptor.required("attributeMapping", FieldType.NESTED_STRING_MAP, MAPPING_DESCRIPTION)
                ), this::assignUsersToGroups),
            new Command("provision_applications", "Provision application access for multiple users",
                InputShape.of(
                    FieldDescriptor.required("userIds", FieldType.STRING_LIST, "List of user IDs to provision access for"),
                    FieldDescriptor.required("applicationIds", FieldType.STRING_LIST, "Application IDs to provision")
                ), this::provisionApplications),
            new Command("run_onboarding_workflow", "Run a complete onboarding workflow for multiple users from CSV data",
                InputShape.of(
                    csvData("CSV string with user information"),
                    FieldDescriptor.optional("activateUsers", FieldType.BOOLEAN,
                        "Whether to activate users immediately (default: true)").withDefault(true),
                    defaultGroups("Default group IDs to assign all users to"),
                    FieldDescriptor.optional("groupMappings", FieldType.NESTED_STRING_MAP, MAPPING_DESCRIPTION)
                        .withDefault(Map.of()),
                    FieldDescriptor.optional("applicationIds", FieldType.STRING_LIST,
                        "Application IDs to provision for all users").withDefault(List.of()),
                    FieldDescriptor.optional("sendWelcomeEmail", FieldType.BOOLEAN,
                        "Whether to send welcome emails (default: true)").withDefault(true)
                ), this::runOnboardingWorkflow)
        );
    }

    private InvocationResult bulkUserImport(ValidatedArguments arguments) {
        List<OnboardingRow> rows;
        try {
            rows = parser.parse(arguments.string("csvData"));
        } catch (TabularDataException e) {
            log.warn("Rejected CSV data: {}", e.getMessage());
            return InvocationResult.error("Failed to import users: " + e.getMessage());
        }
        if (rows.isEmpty()) {
            return InvocationResult.error(NO_VALID_ROWS);
        }
        ImportOptions options = new ImportOptions(
            arguments.bool("activateUsers"),
            arguments.bool("sendEmail"),
            arguments.stringList("defaultGroups")
        );
        return InvocationResult.text(OnboardingTextRenderer.importReport(workflow.importRows(rows, options)));
    }

    private InvocationResult assignUsersToGroups(ValidatedArguments arguments) {
        GroupMappingTable mappings = GroupMappingTable.of(arguments.nestedStringMap("attributeMapping"));
        return InvocationResult.text(OnboardingTextRenderer.groupAssignmentReport(
            workflow.assignGroups(arguments.stringList("userIds"), mappings)));
    }

    private InvocationResult provisionApplications(ValidatedArguments arguments) {
        List<String> applicationIds = arguments.stringList("applicationIds");
        return InvocationResult.text(OnboardingTextRenderer.provisioningReport(
            workflow.provision(arguments.stringList("userIds"), applicationIds), applicationIds.size()));
    }

    private InvocationResult runOnboardingWorkflow(ValidatedArguments arguments) {
        List<OnboardingRow> rows;
        try {
            rows = parser.parse(arguments.string("csvData"));
        } catch (TabularDataException e) {
            log.warn("Rejected CSV data: {}", e.getMessage());
            return InvocationResult.error("Failed to complete onboarding workflow: " + e.getMessage());
        }
        if (rows.isEmpty()) {
            return InvocationResult.error(NO_VALID_ROWS);
        }
        OnboardingRequest request = new OnboardingRequest(
            rows,
            new ImportOptions(
                arguments.bool("activateUsers"),
                arguments.bool("sendWelcomeEmail"),
                arguments.stringList("defaultGroups")
            ),
            GroupMappingTable.of(arguments.nestedStringMap("groupMappings")),
            arguments.stringList("applicationIds")
        );
        return InvocationResult.text(OnboardingTextRenderer.workflowReport(workflow.run(request)));
    }

    private static FieldDescriptor csvData(String description) {
        return FieldDescriptor.required("csvData", FieldType.STRING, description).withMinLength(1);
    }

    private static FieldDescriptor defaultGroups(String description) {
        return FieldDescriptor.optional("defaultGroups", FieldType.STRING_LIST, description).withDefault(List.of());
    }
}
