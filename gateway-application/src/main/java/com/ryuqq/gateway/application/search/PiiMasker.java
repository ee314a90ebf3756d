package com.ryuqq.gateway.application.search;

import java.util.Locale;
import java.util.Set;

/**
 * 개인 식별 속성 값 마스킹.
 *
 * <p><strong>마스킹 규칙:</strong></p>
 * <ul>
 *   <li>길이 3 이하: {@code ***}</li>
 *   <li>그 외: 첫 글자 + '*' × (길이 − 2) + 마지막 글자 (예: {@code alice → a***e})</li>
 * </ul>
 *
 * <p>속성 이름 비교는 대소문자를 구분하지 않습니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class PiiMasker {

    /**
     * 개인 식별 속성 (login, 이름, 연락처, 관리자 참조).
     */
    public static final Set<String> PII_ATTRIBUTES = Set.of(
        "login",
        "email",
        "secondemail",
        "firstname",
        "lastname",
        "displayname",
        "nickname",
        "mobilephone",
        "primaryphone",
        "manager",
        "managerid"
    );

    private static final String SHORT_MASK = "***";

    private PiiMasker() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 개인 식별 속성인지 확인.
     *
     * @param attribute 속성 이름
     * @return PII 속성이면 true
     */
    public static boolean isPii(String attribute) {
        return attribute != null && PII_ATTRIBUTES.contains(attribute.toLowerCase(Locale.ROOT));
    }

    /**
     * 값 마스킹.
     *
     * @param value 원본 값 (null이면 null)
     * @return 마스킹된 값
     */
    public static String mask(String value) {
        if (value == null) {
            return null;
        }
        int length = value.length();
        if (length <= 3) {
            return SHORT_MASK;
        }
        return value.charAt(0) + "*".repeat(length - 2) + value.charAt(length - 1);
    }

    /**
     * 속성이 PII면 마스킹, 아니면 그대로 반환.
     *
     * @param attribute 속성 이름
     * @param value 값
     * @return 표시용 값
     */
    public static String maskIfPii(String attribute, String value) {
        return isPii(attribute) ? mask(value) : value;
    }
}
