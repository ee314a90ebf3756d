package com.ryuqq.gateway.adapter.runner;

import com.ryuqq.gateway.application.onboarding.GroupMappingTable;
import com.ryuqq.gateway.application.onboarding.ImportOptions;
import com.ryuqq.gateway.application.onboarding.OnboardingRequest;
import com.ryuqq.gateway.application.onboarding.OnboardingRow;
import com.ryuqq.gateway.application.onboarding.OnboardingWorkflow;
import com.ryuqq.gateway.application.onboarding.StageReport;
import com.ryuqq.gateway.application.onboarding.WorkflowReport;
import com.ryuqq.gateway.core.model.EntityDraft;
import com.ryuqq.gateway.core.model.EntityKind;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.model.EntityStatus;
import com.ryuqq.gateway.core.outcome.StageOutcome;
import com.ryuqq.gateway.core.outcome.SubResult;
import com.ryuqq.gateway.core.spi.DirectoryClient;
import com.ryuqq.gateway.core.statemachine.OnboardingStage;
import com.ryuqq.gateway.core.statemachine.StageTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Import → Group Assignment → Provisioning 순서로 실행하는 온보딩 오케스트레이터.
 *
 * <p><strong>단계별 동작:</strong></p>
 * <ul>
 *   <li><strong>Import:</strong> 필수 컬럼이 빠진 행은 "missing required fields"로 실패 처리.
 *       나머지는 생성 → (선택) 활성화 → (선택) 기본 그룹 할당. 어느 단계에서 실패하든 그 행만 실패</li>
 *   <li><strong>Group Assignment:</strong> 프로필 조회 → 매핑 테이블로 그룹 집합 결정 → 순서대로 할당.
 *       일치하는 규칙이 없으면 빈 그룹 목록으로 성공</li>
 *   <li><strong>Provisioning:</strong> 애플리케이션마다 독립적으로 권한 부여.
 *       하나라도 실패하면 엔티티는 실패, 모든 하위 결과는 보존</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>Group Assignment와 Provisioning의 입력은 정확히 Import 성공 키</li>
 *   <li>엔티티 하나의 실패는 다른 엔티티 처리에 영향 없음</li>
 *   <li>이전 단계의 결과는 되돌리지 않음</li>
 * </ul>
 *
 * <p>모든 처리는 입력 순서대로 순차 실행됩니다. 보고 누적기는 호출마다 새로 만들어지므로
 * 인스턴스는 상태를 갖지 않습니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class StagedOnboardingOrchestrator implements OnboardingWorkflow {

    /**
     * 필수 컬럼 누락 시 실패 사유.
     */
    public static final String MISSING_REQUIRED_FIELDS = "missing required fields";

    /**
     * 일치하는 매핑 규칙이 없을 때의 성공 detail.
     */
    public static final String NO_MAPPING_MATCHED = "no group mappings matched entity attributes";

    private static final Logger log = LoggerFactory.getLogger(StagedOnboardingOrchestrator.class);

    private final DirectoryClient directory;
    private final OnboardingConfig config;

    /**
     * 생성자 (기본 설정).
     *
     * @param directory 디렉터리 클라이언트
     * @throws IllegalArgumentException directory가 null인 경우
     */
    public StagedOnboardingOrchestrator(DirectoryClient directory) {
        this(directory, new OnboardingConfig());
    }

    /**
     * 생성자.
     *
     * @param directory 디렉터리 클라이언트
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StagedOnboardingOrchestrator(DirectoryClient directory, OnboardingConfig config) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.directory = directory;
        this.config = config;
    }

    @Override
    public WorkflowReport run(OnboardingRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        log.info("Onboarding workflow started: {} row(s)", request.rows().size());

        OnboardingStage stage = OnboardingStage.IMPORT;
        StageReport importReport = importRows(request.rows(), request.importOptions());
        List<String> createdKeys = importReport.successKeys();

        stage = StageTransition.transition(stage, OnboardingStage.GROUP_ASSIGNMENT);
        StageReport groupReport;
        if (createdKeys.isEmpty()) {
            groupReport = StageReport.skipped(stage, StageReport.NO_ENTITIES);
        } else if (request.groupMappings().isEmpty()) {
            groupReport = StageReport.skipped(stage, StageReport.NOT_CONFIGURED);
        } else {
            groupReport = assignGroups(createdKeys, request.groupMappings());
        }

        stage = StageTransition.transition(stage, OnboardingStage.PROVISIONING);
        StageReport provisioningReport;
        if (createdKeys.isEmpty()) {
            provisioningReport = StageReport.skipped(stage, StageReport.NO_ENTITIES);
        } else if (request.applicationIds().isEmpty()) {
            provisioningReport = StageReport.skipped(stage, StageReport.NOT_CONFIGURED);
        } else {
            provisioningReport = provision(createdKeys, request.applicationIds());
        }

        WorkflowReport report = WorkflowReport.of(importReport, groupReport, provisioningReport);
        log.info("Onboarding workflow completed: {} of {} row(s) onboarded, {} group membership(s), {} application grant(s)",
            report.summary().onboarded(), report.summary().totalRows(),
            report.summary().groupsAssigned(), report.summary().applicationsProvisioned());
        return report;
    }

    @Override
    public StageReport importRows(List<OnboardingRow> rows, ImportOptions options) {
        if (rows == null) {
            throw new IllegalArgumentException("rows cannot be null");
        }
        ImportOptions effective = options == null ? ImportOptions.defaults() : options;
        log.info("Import started: {} row(s), activate={}", rows.size(), effective.activate());

        List<StageOutcome> outcomes = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            outcomes.add(importRow(rows.get(i), i, effective));
        }

        StageReport report = StageReport.completed(OnboardingStage.IMPORT, outcomes);
        log.info("Import completed: {} created, {} failed", report.successes().size(), report.failures().size());
        return report;
    }

    private StageOutcome importRow(OnboardingRow row, int index, ImportOptions options) {
        String contact = row.email().isEmpty() ? null : row.email();
        String rowKey = contact == null ? "row " + (index + 1) : contact;

        if (!row.isComplete()) {
            log.warn("Import skipped {}: missing {}", rowKey, row.missingRequired());
            return StageOutcome.failure(rowKey, contact, MISSING_REQUIRED_FIELDS);
        }

        String step = "creation";
        try {
            EntityRecord created = directory.create(EntityDraft.user(row.profileAttributes(), false));
            String entityKey = created.id();

            if (options.activate()) {
                step = "activation";
                directory.setActivation(entityKey, options.sendEmail());
            }
            for (String groupId : options.defaultGroups()) {
                step = "default group assignment (" + groupId + ")";
                directory.assignToGroup(groupId, entityKey);
            }

            EntityStatus status = options.activate() ? EntityStatus.ACTIVE : EntityStatus.STAGED;
            return StageOutcome.success(entityKey, contact, status.name());
        } catch (RuntimeException e) {
            log.warn("Import failed for {} at {}: {}", rowKey, step, e.getMessage());
            return StageOutcome.failure(rowKey, contact, step + " failed: " + describe(e));
        }
    }

    @Override
    public StageReport assignGroups(List<String> entityKeys, GroupMappingTable mappings) {
        if (entityKeys == null) {
            throw new IllegalArgumentException("entityKeys cannot be null");
        }
        GroupMappingTable table = mappings == null ? GroupMappingTable.empty() : mappings;
        log.info("Group assignment started: {} entit(ies), {} mapping attribute(s)", entityKeys.size(), table.rules().size());

        List<StageOutcome> outcomes = new ArrayList<>(entityKeys.size());
        for (String entityKey : entityKeys) {
            outcomes.add(assignGroupsFor(entityKey, table));
        }

        StageReport report = StageReport.completed(OnboardingStage.GROUP_ASSIGNMENT, outcomes);
        log.info("Group assignment completed: {} succeeded, {} failed", report.successes().size(), report.failures().size());
        return report;
    }

    private StageOutcome assignGroupsFor(String entityKey, GroupMappingTable table) {
        EntityRecord entity;
        try {
            entity = directory.get(EntityKind.USER, entityKey);
        } catch (RuntimeException e) {
            log.warn("Group assignment failed for {}: profile unavailable: {}", entityKey, e.getMessage());
            return StageOutcome.failure(entityKey, null, "profile unavailable: " + describe(e));
        }
        String contact = entity.attribute("email").orElse(null);

        List<String> targets = table.resolve(entity);
        if (targets.isEmpty()) {
            return StageOutcome.success(entityKey, contact, NO_MAPPING_MATCHED);
        }

        List<String> assigned = new ArrayList<>(targets.size());
        List<String> errors = new ArrayList<>();
        for (String groupId : targets) {
            try {
                directory.assignToGroup(groupId, entityKey);
                assigned.add(groupId);
            } catch (RuntimeException e) {
                log.warn("Assignment of {} to group {} failed: {}", entityKey, groupId, e.getMessage());
                errors.add("assignment to group " + groupId + " failed: " + describe(e));
                if (config.stopAtFirstGroupFailure()) {
                    break;
                }
            }
        }

        if (errors.isEmpty()) {
            return StageOutcome.success(entityKey, contact, "assigned to " + assigned.size() + " group(s)")
                .withGroupIds(assigned);
        }
        return StageOutcome.failure(entityKey, contact, String.join("; ", errors)).withGroupIds(assigned);
    }

    @Override
    public StageReport provision(List<String> entityKeys, List<String> applicationIds) {
        if (entityKeys == null) {
            throw new IllegalArgumentException("entityKeys cannot be null");
        }
        List<String> apps = applicationIds == null ? List.of() : applicationIds;
        log.info("Provisioning started: {} entit(ies) across {} application(s)", entityKeys.size(), apps.size());

        List<StageOutcome> outcomes = new ArrayList<>(entityKeys.size());
        for (String entityKey : entityKeys) {
            outcomes.add(provisionFor(entityKey, apps));
        }

        StageReport report = StageReport.completed(OnboardingStage.PROVISIONING, outcomes);
        log.info("Provisioning completed: {} succeeded, {} failed", report.successes().size(), report.failures().size());
        return report;
    }

    private StageOutcome provisionFor(String entityKey, List<String> applicationIds) {
        String contact = null;
        if (config.lookupBeforeProvisioning()) {
            try {
                contact = directory.get(EntityKind.USER, entityKey).attribute("email").orElse(null);
            } catch (RuntimeException e) {
                log.warn("Provisioning failed for {}: profile unavailable: {}", entityKey, e.getMessage());
                return StageOutcome.failure(entityKey, null, "profile unavailable: " + describe(e));
            }
        }

        List<SubResult> results = new ArrayList<>(applicationIds.size());
        int failed = 0;
        for (String appId : applicationIds) {
            try {
                directory.grantApplication(appId, entityKey);
                results.add(SubResult.success(appId));
            } catch (RuntimeException e) {
                failed++;
                log.warn("Grant of application {} to {} failed: {}", appId, entityKey, e.getMessage());
                results.add(SubResult.failure(appId, describe(e)));
            }
        }

        if (failed == 0) {
            return StageOutcome.success(entityKey, contact, "provisioned " + results.size() + " application(s)")
                .withSubResults(results);
        }
        return StageOutcome.failure(entityKey, contact, failed + " application(s) failed").withSubResults(results);
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
