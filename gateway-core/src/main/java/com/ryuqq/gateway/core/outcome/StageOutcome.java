package com.ryuqq.gateway.core.outcome;

import java.util.List;

/**
 * 한 단계(stage)에서 엔티티 하나를 처리한 결과.
 *
 * <p>단계별로 채워지는 필드가 다릅니다:</p>
 * <ul>
 *   <li><strong>Import:</strong> 성공 시 detail = 부여된 상태 (ACTIVE/STAGED), 실패 시 detail = 원인</li>
 *   <li><strong>Group Assignment:</strong> groupIds = 이 엔티티에 대해 성공한 그룹 할당</li>
 *   <li><strong>Provisioning:</strong> subResults = 애플리케이션별 권한 부여 결과</li>
 * </ul>
 *
 * <p>생성 후 변경되지 않습니다. with* 메서드는 새 인스턴스를 반환합니다.</p>
 *
 * @param entityKey 엔티티 키 (Import 실패 시에는 행의 식별자)
 * @param contact 연락처 식별자 (예: email, null 가능)
 * @param status 결과 상태
 * @param detail 결과 설명 (null 가능)
 * @param groupIds 할당된 그룹 id
 * @param subResults 하위 작업 결과
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record StageOutcome(
    String entityKey,
    String contact,
    OutcomeStatus status,
    String detail,
    List<String> groupIds,
    List<SubResult> subResults
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException entityKey 또는 status가 없는 경우
     */
    public StageOutcome {
        if (entityKey == null || entityKey.isBlank()) {
            throw new IllegalArgumentException("entityKey cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        groupIds = groupIds == null ? List.of() : List.copyOf(groupIds);
        subResults = subResults == null ? List.of() : List.copyOf(subResults);
    }

    public static StageOutcome success(String entityKey, String contact, String detail) {
        return new StageOutcome(entityKey, contact, OutcomeStatus.SUCCESS, detail, List.of(), List.of());
    }

    public static StageOutcome failure(String entityKey, String contact, String detail) {
        return new StageOutcome(entityKey, contact, OutcomeStatus.FAILURE, detail, List.of(), List.of());
    }

    public StageOutcome withGroupIds(List<String> assigned) {
        return new StageOutcome(entityKey, contact, status, detail, assigned, subResults);
    }

    public StageOutcome withSubResults(List<SubResult> results) {
        return new StageOutcome(entityKey, contact, status, detail, groupIds, results);
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }

    /**
     * 표시용 이름 (연락처가 있으면 연락처, 없으면 엔티티 키).
     *
     * @return 표시용 이름
     */
    public String displayName() {
        return contact == null || contact.isBlank() ? entityKey : contact;
    }

    /**
     * 성공한 하위 작업 수.
     *
     * @return 성공 SubResult 개수
     */
    public long successfulSubResults() {
        return subResults.stream().filter(SubResult::isSuccess).count();
    }

    /**
     * 실패한 하위 작업 수.
     *
     * @return 실패 SubResult 개수
     */
    public long failedSubResults() {
        return subResults.size() - successfulSubResults();
    }
}
