package com.ryuqq.remoteexec.adapter.rest;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RestGatewayConfig 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RestGatewayConfigTest {

    private static final String TOKEN = "dapi-0123456789";

    @Test
    void host_끝의_슬래시를_제거() {
        // when
        RestGatewayConfig config = RestGatewayConfig.of("https://example.cloud.databricks.com//", TOKEN);

        // then
        assertThat(config.host()).isEqualTo("https://example.cloud.databricks.com");
        assertThat(config.requestTimeoutMs()).isEqualTo(RestGatewayConfig.DEFAULT_REQUEST_TIMEOUT_MS);
        assertThat(config.connectTimeoutMs()).isEqualTo(RestGatewayConfig.DEFAULT_CONNECT_TIMEOUT_MS);
    }

    @Test
    void 스킴이_없는_host는_거부() {
        assertThatThrownBy(() -> RestGatewayConfig.of("example.cloud.databricks.com", TOKEN))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("http:// or https://");
    }

    @Test
    void 짧은_토큰은_거부() {
        assertThatThrownBy(() -> RestGatewayConfig.of("https://host", "short"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at least 10 characters");
    }

    @Test
    void 타임아웃은_양수여야_함() {
        assertThatThrownBy(() -> RestGatewayConfig.of("https://host", TOKEN).withRequestTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("requestTimeoutMs must be positive");
    }

    @Test
    void fromEnvironment_호스트와_토큰을_읽음() {
        // when
        RestGatewayConfig config = RestGatewayConfig.fromEnvironment(Map.of(
            RestGatewayConfig.HOST_ENV, "https://host/",
            RestGatewayConfig.TOKEN_ENV, TOKEN));

        // then
        assertThat(config.host()).isEqualTo("https://host");
        assertThat(config.token()).isEqualTo(TOKEN);
    }

    @Test
    void fromEnvironment_호스트가_없으면_예외() {
        assertThatThrownBy(() -> RestGatewayConfig.fromEnvironment(Map.of(RestGatewayConfig.TOKEN_ENV, TOKEN)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("DATABRICKS_HOST is not set");
    }

    @Test
    void toString은_토큰을_노출하지_않음() {
        assertThat(RestGatewayConfig.of("https://host", TOKEN).toString())
            .contains("https://host")
            .doesNotContain(TOKEN);
    }
}
