package com.ryuqq.gateway.application.onboarding;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * OnboardingRow 유닛 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class OnboardingRowTest {

    @Test
    void missingRequired_빈_값과_누락된_컬럼_보고() {
        // given
        OnboardingRow row = OnboardingRow.of(Map.of("email", "jane@example.com", "firstName", " "));

        // when & then
        assertThat(row.missingRequired()).containsExactly("firstName", "lastName");
        assertThat(row.isComplete()).isFalse();
    }

    @Test
    void profileAttributes_login은_email_선택_컬럼은_비어있지_않을_때만() {
        // given
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("email", "jane@example.com");
        columns.put("firstName", "Jane");
        columns.put("lastName", "Doe");
        columns.put("department", "Engineering");
        columns.put("title", "");
        OnboardingRow row = OnboardingRow.of(columns);

        // when
        Map<String, String> profile = row.profileAttributes();

        // then
        assertThat(row.isComplete()).isTrue();
        assertThat(profile).containsEntry("login", "jane@example.com")
            .containsEntry("department", "Engineering")
            .doesNotContainKey("title");
        assertThat(profile.keySet()).startsWith("login", "email", "firstName", "lastName");
    }
}
