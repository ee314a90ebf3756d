package com.ryuqq.gateway.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 생성 요청용 엔티티 초안.
 *
 * <p>디렉터리에 아직 존재하지 않는 엔티티의 속성을 담습니다.
 * 생성에 성공하면 디렉터리가 id와 상태를 부여한 {@link EntityRecord}가 반환됩니다.</p>
 *
 * @param kind 엔티티 종류
 * @param attributes 프로필 속성 (빈 값은 제외)
 * @param activate 생성과 동시에 활성화할지 여부 (그룹은 무시)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record EntityDraft(
    EntityKind kind,
    Map<String, String> attributes,
    boolean activate
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 attributes가 비어있는 경우
     */
    public EntityDraft {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (attributes == null || attributes.isEmpty()) {
            throw new IllegalArgumentException("attributes cannot be null or empty");
        }
        Map<String, String> copy = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            if (key != null && value != null && !value.isBlank()) {
                copy.put(key, value);
            }
        });
        attributes = Collections.unmodifiableMap(copy);
    }

    /**
     * 사용자 초안 생성.
     *
     * @param attributes 프로필 속성
     * @param activate 즉시 활성화 여부
     * @return EntityDraft 인스턴스
     */
    public static EntityDraft user(Map<String, String> attributes, boolean activate) {
        return new EntityDraft(EntityKind.USER, attributes, activate);
    }

    /**
     * 그룹 초안 생성.
     *
     * @param name 그룹 이름
     * @param description 그룹 설명 (null 가능)
     * @return EntityDraft 인스턴스
     */
    public static EntityDraft group(String name, String description) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("name", name);
        attributes.put("description", description);
        return new EntityDraft(EntityKind.GROUP, attributes, false);
    }
}
