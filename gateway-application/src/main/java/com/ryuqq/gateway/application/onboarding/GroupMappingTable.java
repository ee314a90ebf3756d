package com.ryuqq.gateway.application.onboarding;

import com.ryuqq.gateway.core.model.EntityRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 속성 → 값 → 그룹 id 매핑 테이블.
 *
 * <p>예: {@code {"department": {"Engineering": "G1", "Sales": "G2"}}}</p>
 *
 * @param rules 매핑 규칙 (선언 순서 유지)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record GroupMappingTable(Map<String, Map<String, String>> rules) {

    private static final GroupMappingTable EMPTY = new GroupMappingTable(Map.of());

    public GroupMappingTable {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        if (rules != null) {
            rules.forEach((attribute, values) -> {
                if (attribute != null && values != null) {
                    copy.put(attribute, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
                }
            });
        }
        rules = Collections.unmodifiableMap(copy);
    }

    public static GroupMappingTable empty() {
        return EMPTY;
    }

    public static GroupMappingTable of(Map<String, Map<String, String>> rules) {
        return new GroupMappingTable(rules);
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /**
     * 엔티티에 적용되는 그룹 id 목록.
     *
     * <p>규칙 선언 순서대로, 엔티티의 현재 속성 값이 값 맵의 키와 정확히 일치하면 그룹 id를 추가합니다.
     * 같은 그룹 id는 한 번만 포함됩니다.</p>
     *
     * @param entity 대상 엔티티
     * @return 중복 없는 그룹 id 목록 (일치하는 규칙이 없으면 빈 목록)
     */
    public List<String> resolve(EntityRecord entity) {
        Set<String> groupIds = new LinkedHashSet<>();
        rules.forEach((attribute, values) -> entity.attribute(attribute)
            .map(values::get)
            .filter(groupId -> !groupId.isBlank())
            .ifPresent(groupIds::add));
        return new ArrayList<>(groupIds);
    }
}
