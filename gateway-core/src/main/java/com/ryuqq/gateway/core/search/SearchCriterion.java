package com.ryuqq.gateway.core.search;

import com.ryuqq.gateway.core.schema.FieldFormat;

/**
 * 속성 검색 조건.
 *
 * <p><strong>제약 조건:</strong></p>
 * <ul>
 *   <li>attribute는 비어있을 수 없으며 영문자, 숫자, 밑줄로만 구성 ({@link FieldFormat#ATTRIBUTE_NAME})</li>
 *   <li>PRESENT가 아닌 연산자는 비교 값 필수 (PRESENT면 값은 무시되어 null로 저장)</li>
 *   <li>limit은 1 이상 {@value #MAX_LIMIT} 이하</li>
 * </ul>
 *
 * @param attribute 프로필 속성 이름 (예: department)
 * @param operator 연산자
 * @param value 비교 값
 * @param limit 최대 결과 수
 * @param includeInactive SUSPENDED/DEPROVISIONED 엔티티 포함 여부
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record SearchCriterion(
    String attribute,
    SearchOperator operator,
    String value,
    int limit,
    boolean includeInactive
) {

    /**
     * 최대 limit.
     */
    public static final int MAX_LIMIT = 200;

    /**
     * 기본 limit.
     */
    public static final int DEFAULT_LIMIT = 50;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 제약 조건을 위반한 경우
     */
    public SearchCriterion {
        if (attribute == null || attribute.isBlank()) {
            throw new IllegalArgumentException("attribute cannot be null or blank");
        }
        attribute = attribute.trim();
        if (!FieldFormat.ATTRIBUTE_NAME.accepts(attribute)) {
            throw new IllegalArgumentException("attribute " + FieldFormat.ATTRIBUTE_NAME.violation() + ": " + attribute);
        }
        if (operator == null) {
            throw new IllegalArgumentException("operator cannot be null");
        }
        if (operator.requiresValue() && (value == null || value.isEmpty())) {
            throw new IllegalArgumentException("value is required for operator " + operator.wireValue());
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException(
                "limit must be between 1 and " + MAX_LIMIT + " (current: " + limit + ")"
            );
        }
        value = operator.requiresValue() ? value : null;
    }

    /**
     * 기본 limit, 활성 엔티티만 대상으로 하는 조건 생성.
     *
     * @param attribute 속성 이름
     * @param operator 연산자
     * @param value 비교 값
     * @return SearchCriterion 인스턴스
     */
    public static SearchCriterion of(String attribute, SearchOperator operator, String value) {
        return new SearchCriterion(attribute, operator, value, DEFAULT_LIMIT, false);
    }

    public SearchCriterion withLimit(int newLimit) {
        return new SearchCriterion(attribute, operator, value, newLimit, includeInactive);
    }

    public SearchCriterion withIncludeInactive(boolean include) {
        return new SearchCriterion(attribute, operator, value, limit, include);
    }

    /**
     * 후보 속성 값이 조건을 만족하는지 검사.
     *
     * @param attributeValue 후보의 속성 값
     * @return 만족하면 true
     */
    public boolean matches(String attributeValue) {
        return operator.matches(attributeValue, value);
    }
}
