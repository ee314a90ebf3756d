package com.ryuqq.gateway.core.search;

import java.util.Locale;

/**
 * 속성 검색 연산자.
 *
 * <p>각 연산자는 두 가지 표현을 가집니다:</p>
 * <ul>
 *   <li><strong>wireValue:</strong> Command 인자로 받는 이름 (예: "starts-with")</li>
 *   <li><strong>filterToken:</strong> 디렉터리 검색 표현식의 연산자 토큰 (예: "sw")</li>
 * </ul>
 *
 * <p>{@link #matches(String, String)}는 서버 필터를 신뢰할 수 없을 때 사용하는
 * 클라이언트 측 검증 규칙이며, 대소문자를 구분하지 않습니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum SearchOperator {

    /**
     * 값 전체 일치.
     */
    EQUALS("equals", "eq"),

    /**
     * 접두 일치.
     */
    STARTS_WITH("starts-with", "sw"),

    /**
     * 접미 일치.
     */
    ENDS_WITH("ends-with", "ew"),

    /**
     * 부분 문자열 포함.
     */
    CONTAINS("contains", "co"),

    /**
     * 값이 존재하고 비어있지 않음 (비교 값 없음).
     */
    PRESENT("present", "pr");

    private final String wireValue;
    private final String filterToken;

    SearchOperator(String wireValue, String filterToken) {
        this.wireValue = wireValue;
        this.filterToken = filterToken;
    }

    public String wireValue() {
        return wireValue;
    }

    public String filterToken() {
        return filterToken;
    }

    /**
     * 비교 값이 필요한 연산자인지 확인.
     *
     * @return PRESENT가 아니면 true
     */
    public boolean requiresValue() {
        return this != PRESENT;
    }

    /**
     * 속성 값이 이 연산자의 조건을 만족하는지 검사 (대소문자 무시).
     *
     * @param attributeValue 엔티티의 속성 값 (null 가능)
     * @param expected 비교 값 (PRESENT면 무시)
     * @return 만족하면 true
     */
    public boolean matches(String attributeValue, String expected) {
        if (this == PRESENT) {
            return attributeValue != null && !attributeValue.isBlank();
        }
        if (attributeValue == null || expected == null) {
            return false;
        }
        String actual = attributeValue.toLowerCase(Locale.ROOT);
        String target = expected.toLowerCase(Locale.ROOT);
        return switch (this) {
            case EQUALS -> actual.equals(target);
            case STARTS_WITH -> actual.startsWith(target);
            case ENDS_WITH -> actual.endsWith(target);
            case CONTAINS -> actual.contains(target);
            case PRESENT -> true;
        };
    }

    /**
     * 이름으로 연산자 조회.
     *
     * <p>wireValue, filterToken, enum 이름을 모두 받으며 대소문자와 '-'/'_' 차이를 무시합니다
     * (예: "starts-with", "STARTS_WITH", "sw").</p>
     *
     * @param value 연산자 이름
     * @return SearchOperator
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static SearchOperator fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("operator cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (SearchOperator operator : values()) {
            if (operator.wireValue.equals(normalized) || operator.filterToken.equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown search operator: " + value);
    }

    /**
     * Command 입력 형태의 열거 값 목록.
     *
     * @return wireValue 배열 (선언 순서)
     */
    public static String[] wireValues() {
        SearchOperator[] operators = values();
        String[] names = new String[operators.length];
        for (int i = 0; i < operators.length; i++) {
            names[i] = operators[i].wireValue;
        }
        return names;
    }
}
