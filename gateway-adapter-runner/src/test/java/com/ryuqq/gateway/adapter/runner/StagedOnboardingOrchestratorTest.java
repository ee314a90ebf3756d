package com.ryuqq.gateway.adapter.runner;

import com.ryuqq.gateway.adapter.inmemory.InMemoryDirectoryClient;
import com.ryuqq.gateway.application.onboarding.GroupMappingTable;
import com.ryuqq.gateway.application.onboarding.ImportOptions;
import com.ryuqq.gateway.application.onboarding.OnboardingRequest;
import com.ryuqq.gateway.application.onboarding.OnboardingRow;
import com.ryuqq.gateway.application.onboarding.StageReport;
import com.ryuqq.gateway.application.onboarding.WorkflowReport;
import com.ryuqq.gateway.core.model.EntityDraft;
import com.ryuqq.gateway.core.model.EntityKind;
import com.ryuqq.gateway.core.model.EntityStatus;
import com.ryuqq.gateway.core.outcome.OutcomeStatus;
import com.ryuqq.gateway.core.outcome.StageOutcome;
import com.ryuqq.gateway.core.outcome.SubResult;
import com.ryuqq.gateway.core.spi.DirectoryTransportException;
import com.ryuqq.gateway.core.statemachine.OnboardingStage;
import com.ryuqq.gateway.testkit.scripted.DirectoryCall;
import com.ryuqq.gateway.testkit.scripted.DirectoryOperation;
import com.ryuqq.gateway.testkit.scripted.ScriptedDirectoryClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * StagedOnboardingOrchestrator 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class StagedOnboardingOrchestratorTest {

    private InMemoryDirectoryClient backing;
    private ScriptedDirectoryClient directory;
    private StagedOnboardingOrchestrator orchestrator;

    private String engineeringGroup;
    private String salesGroup;

    @BeforeEach
    void setUp() {
        backing = new InMemoryDirectoryClient();
        engineeringGroup = backing.create(EntityDraft.group("Engineering", null)).id();
        salesGroup = backing.create(EntityDraft.group("Sales", null)).id();
        backing.registerApplication("0oa-wiki");
        backing.registerApplication("0oa-mail");
        directory = new ScriptedDirectoryClient(backing);
        orchestrator = new StagedOnboardingOrchestrator(directory);
    }

    @Test
    void 필수_컬럼이_빠진_행만_실패하고_나머지는_생성된다() {
        // given
        List<OnboardingRow> rows = List.of(
            row("ada@corp.io", "Ada", "Lovelace", "Engineering"),
            row("bob@corp.io", "Bob", "", "Sales"),
            row("cara@corp.io", "Cara", "Diaz", "Sales"));

        // when
        StageReport report = orchestrator.importRows(rows, ImportOptions.defaults());

        // then
        assertThat(report.stage()).isEqualTo(OnboardingStage.IMPORT);
        assertThat(report.successes()).extracting(StageOutcome::contact).containsExactly("ada@corp.io", "cara@corp.io");
        assertThat(report.successes()).extracting(StageOutcome::detail).containsOnly("STAGED");
        assertThat(report.failures()).hasSize(1);
        assertThat(report.failures().get(0).entityKey()).isEqualTo("bob@corp.io");
        assertThat(report.failures().get(0).detail()).isEqualTo(StagedOnboardingOrchestrator.MISSING_REQUIRED_FIELDS);
        assertThat(directory.callCount(DirectoryOperation.CREATE)).isEqualTo(2);
        assertThat(directory.callCount(DirectoryOperation.SET_ACTIVATION)).isZero();
    }

    @Test
    void 이메일이_없는_행은_행_번호로_식별된다() {
        // when
        StageReport report = orchestrator.importRows(
            List.of(row("ada@corp.io", "Ada", "Lovelace", null), row("", "No", "Mail", null)),
            ImportOptions.defaults());

        // then
        assertThat(report.failures()).extracting(StageOutcome::entityKey).containsExactly("row 2");
        assertThat(report.failures().get(0).contact()).isNull();
    }

    @Test
    void 활성화_옵션은_알림_여부와_함께_활성화를_요청한다() {
        // when
        StageReport report = orchestrator.importRows(
            List.of(row("ada@corp.io", "Ada", "Lovelace", null)),
            new ImportOptions(true, false, List.of(engineeringGroup)));

        // then
        String key = report.successKeys().get(0);
        assertThat(report.successes().get(0).detail()).isEqualTo("ACTIVE");
        assertThat(backing.get(EntityKind.USER, key).status()).isEqualTo(EntityStatus.ACTIVE);
        assertThat(directory.calls(DirectoryOperation.SET_ACTIVATION).get(0).arguments()).containsExactly(key, false);
        assertThat(backing.isMember(engineeringGroup, key)).isTrue();
    }

    @Test
    void 기본_그룹_할당에_실패하면_단계를_밝혀_실패로_기록한다() {
        // when
        StageReport report = orchestrator.importRows(
            List.of(row("ada@corp.io", "Ada", "Lovelace", null)),
            new ImportOptions(false, true, List.of("00g404")));

        // then
        assertThat(report.successes()).isEmpty();
        assertThat(report.failures().get(0).detail())
            .isEqualTo("default group assignment (00g404) failed: Group not found: 00g404");
    }

    @Test
    void 생성_실패는_해당_행만_실패로_기록한다() {
        // given
        directory.failOn(DirectoryOperation.CREATE, "bob@corp.io",
            new DirectoryTransportException(400, "login already exists", null));

        // when
        StageReport report = orchestrator.importRows(
            List.of(row("ada@corp.io", "Ada", "Lovelace", null), row("bob@corp.io", "Bob", "Builder", null)),
            ImportOptions.defaults());

        // then
        assertThat(report.successes()).hasSize(1);
        assertThat(report.failures().get(0).detail()).isEqualTo("creation failed: login already exists");
    }

    @Test
    void 같은_그룹으로_매핑되는_규칙은_한번만_할당한다() {
        // given
        String key = created("ada@corp.io", "Engineering", "Engineer");
        Map<String, Map<String, String>> rules = new LinkedHashMap<>();
        rules.put("department", Map.of("Engineering", engineeringGroup));
        rules.put("title", Map.of("Engineer", engineeringGroup));

        // when
        StageReport report = orchestrator.assignGroups(List.of(key), GroupMappingTable.of(rules));

        // then
        assertThat(report.successes()).hasSize(1);
        assertThat(report.successes().get(0).groupIds()).containsExactly(engineeringGroup);
        assertThat(report.successes().get(0).detail()).isEqualTo("assigned to 1 group(s)");
        assertThat(directory.callCount(DirectoryOperation.ASSIGN_TO_GROUP)).isEqualTo(1);
    }

    @Test
    void 일치하는_매핑이_없으면_성공으로_기록한다() {
        // given
        String key = created("ada@corp.io", "Legal", "Counsel");

        // when
        StageReport report = orchestrator.assignGroups(List.of(key),
            GroupMappingTable.of(Map.of("department", Map.of("Engineering", engineeringGroup))));

        // then
        assertThat(report.successes()).hasSize(1);
        assertThat(report.successes().get(0).detail()).isEqualTo(StagedOnboardingOrchestrator.NO_MAPPING_MATCHED);
        assertThat(report.successes().get(0).groupIds()).isEmpty();
    }

    @Test
    void 그룹_할당_실패시_기본_설정은_해당_엔티티의_나머지_할당을_중단한다() {
        // given
        String key = created("ada@corp.io", "Engineering", "Engineer");
        Map<String, Map<String, String>> rules = new LinkedHashMap<>();
        rules.put("department", Map.of("Engineering", "00g404"));
        rules.put("title", Map.of("Engineer", salesGroup));

        // when
        StageReport stopping = orchestrator.assignGroups(List.of(key), GroupMappingTable.of(rules));
        StageReport continuing = new StagedOnboardingOrchestrator(directory,
            new OnboardingConfig().withStopAtFirstGroupFailure(false))
            .assignGroups(List.of(key), GroupMappingTable.of(rules));

        // then
        assertThat(stopping.failures()).hasSize(1);
        assertThat(stopping.failures().get(0).detail())
            .isEqualTo("assignment to group 00g404 failed: Group not found: 00g404");
        assertThat(stopping.failures().get(0).groupIds()).isEmpty();
        assertThat(continuing.failures().get(0).groupIds()).containsExactly(salesGroup);
        assertThat(backing.isMember(salesGroup, key)).isTrue();
    }

    @Test
    void 애플리케이션별로_독립적으로_권한을_부여한다() {
        // given
        String key = created("ada@corp.io", "Engineering", "Engineer");

        // when
        StageReport report = orchestrator.provision(List.of(key), List.of("0oa-wiki", "0oa-missing"));

        // then
        StageOutcome outcome = report.failures().get(0);
        assertThat(outcome.detail()).isEqualTo("1 application(s) failed");
        assertThat(outcome.contact()).isEqualTo("ada@corp.io");
        assertThat(outcome.subResults()).extracting(SubResult::targetId).containsExactly("0oa-wiki", "0oa-missing");
        assertThat(outcome.subResults()).extracting(SubResult::status)
            .containsExactly(OutcomeStatus.SUCCESS, OutcomeStatus.FAILURE);
        assertThat(outcome.subResults().get(1).reason()).isEqualTo("Application not found: 0oa-missing");
        assertThat(backing.hasGrant("0oa-wiki", key)).isTrue();
    }

    @Test
    void 프로필_조회에_실패하면_권한_부여를_시도하지_않는다() {
        // when
        StageReport report = orchestrator.provision(List.of("00u404"), List.of("0oa-wiki"));

        // then
        assertThat(report.failures().get(0).detail()).isEqualTo("profile unavailable: User not found: 00u404");
        assertThat(directory.callCount(DirectoryOperation.GRANT_APPLICATION)).isZero();
    }

    @Test
    void 사전_조회를_끄면_바로_권한을_부여한다() {
        // given
        String key = created("ada@corp.io", "Engineering", "Engineer");
        StagedOnboardingOrchestrator direct = new StagedOnboardingOrchestrator(directory,
            new OnboardingConfig().withLookupBeforeProvisioning(false));

        // when
        StageReport report = direct.provision(List.of(key), List.of("0oa-wiki", "0oa-mail"));

        // then
        assertThat(report.successes().get(0).detail()).isEqualTo("provisioned 2 application(s)");
        assertThat(directory.callCount(DirectoryOperation.GET)).isZero();
    }

    @Test
    void 생성된_엔티티가_없으면_후속_단계를_생략한다() {
        // given
        OnboardingRequest request = new OnboardingRequest(
            List.of(row("ada@corp.io", "", "", null)),
            ImportOptions.defaults(),
            GroupMappingTable.of(Map.of("department", Map.of("Engineering", engineeringGroup))),
            List.of("0oa-wiki"));

        // when
        WorkflowReport report = orchestrator.run(request);

        // then
        assertThat(report.groupAssignmentReport().skipped()).isTrue();
        assertThat(report.groupAssignmentReport().skipReason()).isEqualTo(StageReport.NO_ENTITIES);
        assertThat(report.provisioningReport().skipReason()).isEqualTo(StageReport.NO_ENTITIES);
        assertThat(report.summary().onboarded()).isZero();
        assertThat(directory.callCount(DirectoryOperation.ASSIGN_TO_GROUP)).isZero();
        assertThat(directory.callCount(DirectoryOperation.GRANT_APPLICATION)).isZero();
    }

    @Test
    void 매핑과_애플리케이션이_없으면_미구성으로_생략한다() {
        // when
        WorkflowReport report = orchestrator.run(new OnboardingRequest(
            List.of(row("ada@corp.io", "Ada", "Lovelace", "Engineering")), null, null, null));

        // then
        assertThat(report.importReport().successes()).hasSize(1);
        assertThat(report.groupAssignmentReport().skipReason()).isEqualTo(StageReport.NOT_CONFIGURED);
        assertThat(report.provisioningReport().skipReason()).isEqualTo(StageReport.NOT_CONFIGURED);
    }

    @Test
    void 세_단계를_순서대로_실행하고_요약을_집계한다() {
        // given
        OnboardingRequest request = new OnboardingRequest(
            List.of(
                row("ada@corp.io", "Ada", "Lovelace", "Engineering"),
                row("bob@corp.io", "Bob", "", "Sales"),
                row("cara@corp.io", "Cara", "Diaz", "Sales")),
            new ImportOptions(true, false, List.of()),
            GroupMappingTable.of(Map.of("department", Map.of("Engineering", engineeringGroup, "Sales", salesGroup))),
            List.of("0oa-wiki", "0oa-mail"));

        // when
        WorkflowReport report = orchestrator.run(request);

        // then
        assertThat(report.summary().totalRows()).isEqualTo(3);
        assertThat(report.summary().onboarded()).isEqualTo(2);
        assertThat(report.summary().importFailures()).isEqualTo(1);
        assertThat(report.summary().groupsAssigned()).isEqualTo(2);
        assertThat(report.summary().applicationsProvisioned()).isEqualTo(4);
        assertThat(report.summary().groupAssignmentFailures()).isZero();
        assertThat(report.summary().provisioningFailures()).isZero();
        assertThat(directory.calls()).extracting(DirectoryCall::operation)
            .containsSubsequence(DirectoryOperation.CREATE, DirectoryOperation.ASSIGN_TO_GROUP,
                DirectoryOperation.GRANT_APPLICATION);
    }

    private String created(String email, String department, String title) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("login", email);
        attributes.put("email", email);
        attributes.put("department", department);
        attributes.put("title", title);
        return backing.create(EntityDraft.user(attributes, true)).id();
    }

    private static OnboardingRow row(String email, String firstName, String lastName, String department) {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put(OnboardingRow.EMAIL, email);
        columns.put(OnboardingRow.FIRST_NAME, firstName);
        columns.put(OnboardingRow.LAST_NAME, lastName);
        columns.put("department", department);
        return OnboardingRow.of(columns);
    }
}
