package com.ryuqq.gateway.core.model;

import java.util.Locale;

/**
 * 목록 정렬 방향.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum SortOrder {

    ASC,
    DESC;

    /**
     * 문자열을 정렬 방향으로 변환.
     *
     * @param value "asc" 또는 "desc" (대소문자 무시)
     * @return 정렬 방향
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static SortOrder fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("sortOrder cannot be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * 디렉터리 쿼리 파라미터 값.
     *
     * @return "asc" 또는 "desc"
     */
    public String queryValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
