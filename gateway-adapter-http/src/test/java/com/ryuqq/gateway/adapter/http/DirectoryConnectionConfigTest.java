package com.ryuqq.gateway.adapter.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DirectoryConnectionConfig 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class DirectoryConnectionConfigTest {

    @Test
    void 환경_변수에서_설정을_읽고_URL을_정규화한다() {
        // given
        Map<String, String> environment = Map.of(
            DirectoryConnectionConfig.ORG_URL_VARIABLE, "acme.okta.com//",
            DirectoryConnectionConfig.API_TOKEN_VARIABLE, " token-123 "
        );

        // when
        DirectoryConnectionConfig config = DirectoryConnectionConfig.fromEnvironment(environment);

        // then
        assertThat(config.orgUrl()).isEqualTo("https://acme.okta.com");
        assertThat(config.apiBase()).isEqualTo("https://acme.okta.com/api/v1");
        assertThat(config.authorizationHeader()).isEqualTo("SSWS token-123");
        assertThat(config.requestTimeout()).isEqualTo(DirectoryConnectionConfig.DEFAULT_REQUEST_TIMEOUT);
    }

    @Test
    void 조직_URL이_없으면_시작을_중단한다() {
        // given
        Map<String, String> environment = Map.of(DirectoryConnectionConfig.API_TOKEN_VARIABLE, "token-123");

        // when & then
        assertThatThrownBy(() -> DirectoryConnectionConfig.fromEnvironment(environment))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageStartingWith("OKTA_ORG_URL environment variable is not set");
    }

    @Test
    void 토큰이_없으면_시작을_중단한다() {
        // given
        Map<String, String> environment = Map.of(DirectoryConnectionConfig.ORG_URL_VARIABLE, "https://acme.okta.com");

        // when & then
        assertThatThrownBy(() -> DirectoryConnectionConfig.fromEnvironment(environment))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageStartingWith("OKTA_API_TOKEN environment variable is not set");
    }

    @Test
    void toString은_토큰을_노출하지_않는다() {
        // given
        DirectoryConnectionConfig config = new DirectoryConnectionConfig("http://localhost:8080", "secret-token");

        // when
        String text = config.toString();

        // then
        assertThat(text).contains("http://localhost:8080").doesNotContain("secret-token");
    }

    @Test
    void 타임아웃은_양수여야_한다() {
        // given
        DirectoryConnectionConfig config = new DirectoryConnectionConfig("https://acme.okta.com", "token");

        // when & then
        assertThat(config.withRequestTimeout(Duration.ofSeconds(5)).requestTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThatThrownBy(() -> config.withRequestTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
