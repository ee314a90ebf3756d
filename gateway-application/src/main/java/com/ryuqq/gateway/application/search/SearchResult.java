package com.ryuqq.gateway.application.search;

import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.search.SearchCriterion;
import com.ryuqq.gateway.core.statemachine.SearchTier;

import java.util.List;

/**
 * 검색 결과.
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>matches:</strong> 검증을 통과한 엔티티 (후보 순서 유지, 최대 limit개)</li>
 *   <li><strong>servedBy:</strong> 결과를 제공한 tier</li>
 *   <li><strong>notes:</strong> 강등 사유 등 진행 설명 (발생 순서)</li>
 *   <li><strong>candidatesExamined:</strong> 검증한 후보 수</li>
 *   <li><strong>unverifiable:</strong> 전체 레코드 조회에 실패해 건너뛴 후보 수</li>
 *   <li><strong>scanCap:</strong> CLIENT_SIDE_SCAN이 사용한 상한 (다른 tier면 0)</li>
 *   <li><strong>echoedValue:</strong> 응답에 표시할 검색 값 (PII 속성이면 마스킹됨, PRESENT면 null)</li>
 * </ul>
 *
 * @param criterion 검색 조건
 * @param matches 검증된 엔티티
 * @param servedBy 결과를 제공한 tier
 * @param notes 진행 설명
 * @param candidatesExamined 검증한 후보 수
 * @param unverifiable 검증 불가 후보 수
 * @param scanCap 스캔 상한
 * @param echoedValue 표시용 검색 값
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record SearchResult(
    SearchCriterion criterion,
    List<EntityRecord> matches,
    SearchTier servedBy,
    List<String> notes,
    int candidatesExamined,
    int unverifiable,
    int scanCap,
    String echoedValue
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException criterion 또는 servedBy가 null인 경우
     */
    public SearchResult {
        if (criterion == null) {
            throw new IllegalArgumentException("criterion cannot be null");
        }
        if (servedBy == null) {
            throw new IllegalArgumentException("servedBy cannot be null");
        }
        matches = matches == null ? List.of() : List.copyOf(matches);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    /**
     * 스캔 상한 경고가 필요한지 확인.
     *
     * @return CLIENT_SIDE_SCAN이 결과를 제공했으면 true
     */
    public boolean scanCapped() {
        return servedBy == SearchTier.CLIENT_SIDE_SCAN;
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }
}
