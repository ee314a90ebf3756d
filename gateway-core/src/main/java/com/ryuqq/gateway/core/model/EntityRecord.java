package com.ryuqq.gateway.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 디렉터리 엔티티 레코드 (사용자 또는 그룹).
 *
 * <p>프로필은 고정 구조가 아닌 "속성 이름 → 문자열 값" 맵으로 표현합니다.
 * 검색 검증과 그룹 매핑은 리플렉션 없이 단순 키 조회로 속성 값을 읽습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> 디렉터리가 부여한 엔티티 키</li>
 *   <li><strong>kind:</strong> USER 또는 GROUP</li>
 *   <li><strong>status:</strong> 생명주기 상태 (그룹은 보통 UNKNOWN)</li>
 *   <li><strong>attributes:</strong> 프로필 속성 (예: login, email, department)</li>
 *   <li><strong>timestamps:</strong> 생명주기 시각 (예: created, lastLogin)</li>
 * </ul>
 *
 * @param id 엔티티 키
 * @param kind 엔티티 종류
 * @param status 생명주기 상태
 * @param attributes 프로필 속성
 * @param timestamps 생명주기 시각
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record EntityRecord(
    String id,
    EntityKind kind,
    EntityStatus status,
    Map<String, String> attributes,
    Map<String, Instant> timestamps
) {

    public static final String CREATED = "created";
    public static final String ACTIVATED = "activated";
    public static final String LAST_LOGIN = "lastLogin";
    public static final String LAST_UPDATED = "lastUpdated";
    public static final String STATUS_CHANGED = "statusChanged";
    public static final String PASSWORD_CHANGED = "passwordChanged";
    public static final String LAST_MEMBERSHIP_UPDATED = "lastMembershipUpdated";

    /**
     * Compact Constructor.
     *
     * <p>attributes에 null 값이 들어있으면 해당 키는 제외합니다.</p>
     *
     * @throws IllegalArgumentException id가 비어있거나 kind가 null인 경우
     */
    public EntityRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        status = status == null ? EntityStatus.UNKNOWN : status;
        attributes = copyWithoutNulls(attributes);
        timestamps = copyWithoutNulls(timestamps);
    }

    /**
     * 속성 값 조회.
     *
     * @param name 속성 이름
     * @return 속성 값 (없으면 empty)
     */
    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    /**
     * 속성 값 조회 (없으면 기본값).
     *
     * @param name 속성 이름
     * @param fallback 기본값
     * @return 속성 값 또는 기본값
     */
    public String attributeOr(String name, String fallback) {
        return attributes.getOrDefault(name, fallback);
    }

    /**
     * 생명주기 시각 조회.
     *
     * @param name 시각 이름 (예: {@link #CREATED})
     * @return 시각 (없으면 empty)
     */
    public Optional<Instant> timestamp(String name) {
        return Optional.ofNullable(timestamps.get(name));
    }

    /**
     * 상태만 변경한 새 인스턴스 생성.
     *
     * @param newStatus 새 상태
     * @return 새 EntityRecord 인스턴스
     */
    public EntityRecord withStatus(EntityStatus newStatus) {
        return new EntityRecord(id, kind, newStatus, attributes, timestamps);
    }

    private static <V> Map<String, V> copyWithoutNulls(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, V> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
