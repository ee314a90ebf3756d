package com.ryuqq.gateway.core.model;

/**
 * 디렉터리 목록 조회 조건.
 *
 * <p>filter, search, query는 서로 다른 디렉터리 기능에 대응합니다:</p>
 * <ul>
 *   <li><strong>filter:</strong> 제한된 필터 표현식</li>
 *   <li><strong>search:</strong> 속성/연산자 기반 검색 표현식 (예: profile.department eq "Sales")</li>
 *   <li><strong>query:</strong> 속성과 무관한 자유 텍스트 매칭</li>
 * </ul>
 *
 * @param limit 최대 건수 (1 이상)
 * @param filter 필터 표현식 (null 가능)
 * @param search 검색 표현식 (null 가능)
 * @param query 자유 텍스트 (null 가능)
 * @param after 페이지 커서 (null 가능)
 * @param sortBy 정렬 필드 (null 가능)
 * @param sortOrder 정렬 방향 (null이면 ASC)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record ListQuery(
    int limit,
    String filter,
    String search,
    String query,
    String after,
    String sortBy,
    SortOrder sortOrder
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException limit이 양수가 아닌 경우
     */
    public ListQuery {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        filter = blankToNull(filter);
        search = blankToNull(search);
        query = blankToNull(query);
        after = blankToNull(after);
        sortBy = blankToNull(sortBy);
        sortOrder = sortOrder == null ? SortOrder.ASC : sortOrder;
    }

    /**
     * 조건 없이 limit만 지정한 쿼리.
     *
     * @param limit 최대 건수
     * @return ListQuery 인스턴스
     */
    public static ListQuery limit(int limit) {
        return new ListQuery(limit, null, null, null, null, null, SortOrder.ASC);
    }

    /**
     * 검색 표현식 쿼리.
     *
     * @param expression 검색 표현식
     * @param limit 최대 건수
     * @return ListQuery 인스턴스
     */
    public static ListQuery search(String expression, int limit) {
        return new ListQuery(limit, null, expression, null, null, null, SortOrder.ASC);
    }

    /**
     * 자유 텍스트 쿼리.
     *
     * @param text 자유 텍스트
     * @param limit 최대 건수
     * @return ListQuery 인스턴스
     */
    public static ListQuery freeText(String text, int limit) {
        return new ListQuery(limit, null, null, text, null, null, SortOrder.ASC);
    }

    /**
     * after 커서만 변경한 새 인스턴스 생성.
     *
     * @param cursor 페이지 커서
     * @return 새 ListQuery 인스턴스
     */
    public ListQuery withAfter(String cursor) {
        return new ListQuery(limit, filter, search, query, cursor, sortBy, sortOrder);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
