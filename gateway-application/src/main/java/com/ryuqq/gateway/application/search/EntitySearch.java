package com.ryuqq.gateway.application.search;

import com.ryuqq.gateway.core.search.SearchCriterion;

/**
 * 속성 기반 엔티티 검색.
 *
 * <p>디렉터리의 필터 언어가 어떤 연산자를 지원하는지와 무관하게,
 * 조건을 정확히 만족하는 엔티티만 최대 {@code criterion.limit()}개 반환합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public interface EntitySearch {

    /**
     * 검색 실행.
     *
     * <p>tier 실패는 강등으로 흡수되며 호출자에게 전파되지 않습니다.
     * 마지막 tier의 목록 조회까지 실패한 경우에만 예외가 전파됩니다.</p>
     *
     * @param criterion 검색 조건
     * @return 검색 결과 (검증된 엔티티와 진행 설명)
     * @throws IllegalArgumentException criterion이 null인 경우
     */
    SearchResult search(SearchCriterion criterion);
}
