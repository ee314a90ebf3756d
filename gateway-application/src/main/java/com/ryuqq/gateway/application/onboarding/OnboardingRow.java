package com.ryuqq.gateway.application.onboarding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 표 형식 입력의 한 행.
 *
 * <p>필수 컬럼은 {@code email}(연락처 식별자, login으로도 사용), {@code firstName}, {@code lastName}이며
 * 나머지 컬럼은 선택 프로필 속성이 됩니다.</p>
 *
 * @param columns 컬럼 이름 → 값 (헤더 순서 유지)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record OnboardingRow(Map<String, String> columns) {

    public static final String EMAIL = "email";
    public static final String FIRST_NAME = "firstName";
    public static final String LAST_NAME = "lastName";

    /**
     * 필수 컬럼 (검사 순서).
     */
    public static final List<String> REQUIRED_COLUMNS = List.of(EMAIL, FIRST_NAME, LAST_NAME);

    /**
     * Compact Constructor.
     *
     * <p>값은 앞뒤 공백을 제거하며, null 값은 빈 문자열로 바꿉니다.</p>
     */
    public OnboardingRow {
        Map<String, String> copy = new LinkedHashMap<>();
        if (columns != null) {
            columns.forEach((key, value) -> {
                if (key != null) {
                    copy.put(key.trim(), value == null ? "" : value.trim());
                }
            });
        }
        columns = Collections.unmodifiableMap(copy);
    }

    public static OnboardingRow of(Map<String, String> columns) {
        return new OnboardingRow(columns);
    }

    public String email() {
        return columns.getOrDefault(EMAIL, "");
    }

    public String firstName() {
        return columns.getOrDefault(FIRST_NAME, "");
    }

    public String lastName() {
        return columns.getOrDefault(LAST_NAME, "");
    }

    /**
     * 비어있는 필수 컬럼 목록.
     *
     * @return 누락된 필수 컬럼 이름 (없으면 빈 목록)
     */
    public List<String> missingRequired() {
        List<String> missing = new ArrayList<>();
        for (String column : REQUIRED_COLUMNS) {
            if (columns.getOrDefault(column, "").isEmpty()) {
                missing.add(column);
            }
        }
        return missing;
    }

    public boolean isComplete() {
        return missingRequired().isEmpty();
    }

    /**
     * 엔티티 생성에 사용할 프로필 속성.
     *
     * <p>login = email, 그 다음 필수 컬럼, 그 다음 비어있지 않은 선택 컬럼 순서입니다.</p>
     *
     * @return 프로필 속성
     */
    public Map<String, String> profileAttributes() {
        Map<String, String> profile = new LinkedHashMap<>();
        profile.put("login", email());
        profile.put(EMAIL, email());
        profile.put(FIRST_NAME, firstName());
        profile.put(LAST_NAME, lastName());
        columns.forEach((column, value) -> {
            if (!REQUIRED_COLUMNS.contains(column) && !"login".equals(column) && !value.isEmpty()) {
                profile.put(column, value);
            }
        });
        return profile;
    }
}
