package com.ryuqq.gateway.core.schema;

import java.util.regex.Pattern;

/**
 * 문자열 필드의 형식 제약.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum FieldFormat {

    /**
     * 형식 제약 없음.
     */
    NONE(null, null, null),

    /**
     * 이메일 주소.
     */
    EMAIL("email", "^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$", "must be a valid email address"),

    /**
     * 프로필 속성 이름 (영문자, 숫자, 밑줄).
     *
     * <p>디렉터리 검색 표현식에 그대로 들어가므로 연산자나 공백을 포함할 수 없습니다.</p>
     */
    ATTRIBUTE_NAME(null, "^[A-Za-z0-9_]+$", "must contain only letters, digits and underscores");

    private final String jsonFormat;
    private final Pattern pattern;
    private final String violation;

    FieldFormat(String jsonFormat, String regex, String violation) {
        this.jsonFormat = jsonFormat;
        this.pattern = regex == null ? null : Pattern.compile(regex);
        this.violation = violation;
    }

    /**
     * JSON Schema의 format 키워드 값.
     *
     * @return format 이름 (없으면 null)
     */
    public String jsonFormat() {
        return jsonFormat;
    }

    /**
     * JSON Schema의 pattern 키워드 값.
     *
     * @return 정규식 (NONE이면 null)
     */
    public String regex() {
        return pattern == null ? null : pattern.pattern();
    }

    /**
     * 값이 형식을 만족하는지 확인.
     *
     * @param value 문자열 값
     * @return 만족하면 true (NONE은 항상 true)
     */
    public boolean accepts(String value) {
        return pattern == null || pattern.matcher(value).matches();
    }

    /**
     * 위반 시 {@link ValidationException}의 원인 문구.
     *
     * @return 원인 (NONE이면 null)
     */
    public String violation() {
        return violation;
    }
}
