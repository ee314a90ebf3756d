package com.ryuqq.gateway.application.onboarding;

import com.ryuqq.gateway.core.model.EntityKind;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.model.EntityStatus;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * GroupMappingTable 유닛 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class GroupMappingTableTest {

    private static EntityRecord user(Map<String, String> attributes) {
        return new EntityRecord("00u1", EntityKind.USER, EntityStatus.ACTIVE, attributes, Map.of());
    }

    @Test
    void resolve_일치하는_규칙의_그룹_반환() {
        // given
        GroupMappingTable table = GroupMappingTable.of(Map.of("department", Map.of("Engineering", "G1")));

        // when & then
        assertThat(table.resolve(user(Map.of("department", "Engineering")))).containsExactly("G1");
    }

    @Test
    void resolve_두_속성이_같은_그룹이면_중복_제거() {
        // given
        Map<String, Map<String, String>> rules = new LinkedHashMap<>();
        rules.put("department", Map.of("Engineering", "G1"));
        rules.put("title", Map.of("Engineer", "G1"));
        GroupMappingTable table = GroupMappingTable.of(rules);

        // when & then
        assertThat(table.resolve(user(Map.of("department", "Engineering", "title", "Engineer"))))
            .containsExactly("G1");
    }

    @Test
    void resolve_규칙_선언_순서_유지() {
        // given
        Map<String, Map<String, String>> rules = new LinkedHashMap<>();
        rules.put("title", Map.of("Engineer", "G2"));
        rules.put("department", Map.of("Engineering", "G1"));

        // when & then
        assertThat(GroupMappingTable.of(rules).resolve(user(Map.of("department", "Engineering", "title", "Engineer"))))
            .containsExactly("G2", "G1");
    }

    @Test
    void resolve_일치하는_규칙이_없으면_빈_목록() {
        // given
        GroupMappingTable table = GroupMappingTable.of(Map.of("department", Map.of("Engineering", "G1")));

        // when & then
        assertThat(table.resolve(user(Map.of("department", "Sales")))).isEmpty();
        assertThat(table.resolve(user(Map.of()))).isEmpty();
    }

    @Test
    void resolve_값은_정확히_일치해야_함() {
        GroupMappingTable table = GroupMappingTable.of(Map.of("department", Map.of("Engineering", "G1")));

        assertThat(table.resolve(user(Map.of("department", "engineering")))).isEmpty();
    }
}
