package com.ryuqq.gateway.core.model;

import java.util.Locale;

/**
 * 엔티티 생명주기 상태.
 *
 * <p><strong>비활성 상태:</strong> SUSPENDED, DEPROVISIONED.
 * 검색에서 includeInactive=false이면 비활성 엔티티는 결과에서 제외됩니다.</p>
 *
 * <p>디렉터리가 알 수 없는 값을 반환하면 {@link #UNKNOWN}으로 매핑합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum EntityStatus {

    STAGED,
    PROVISIONED,
    ACTIVE,
    RECOVERY,
    PASSWORD_EXPIRED,
    LOCKED_OUT,
    SUSPENDED,
    DEPROVISIONED,
    UNKNOWN;

    /**
     * 비활성 상태인지 확인.
     *
     * @return SUSPENDED 또는 DEPROVISIONED인 경우 true
     */
    public boolean isInactive() {
        return this == SUSPENDED || this == DEPROVISIONED;
    }

    /**
     * 디렉터리 응답 문자열을 상태로 변환.
     *
     * @param value 상태 문자열 (대소문자 무시, null 가능)
     * @return 대응하는 상태, 알 수 없으면 UNKNOWN
     */
    public static EntityStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
