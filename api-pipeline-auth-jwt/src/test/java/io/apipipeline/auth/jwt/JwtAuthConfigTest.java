package io.apipipeline.auth.jwt;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtAuthConfigTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    @Test
    void parsesExpirationStrings() {
        assertThat(JwtAuthConfig.parseDuration("30s")).isEqualTo(Duration.ofSeconds(30));
        assertThat(JwtAuthConfig.parseDuration("15m")).isEqualTo(Duration.ofMinutes(15));
        assertThat(JwtAuthConfig.parseDuration("2h")).isEqualTo(Duration.ofHours(2));
        assertThat(JwtAuthConfig.parseDuration("1d")).isEqualTo(Duration.ofDays(1));
        assertThat(JwtAuthConfig.parseDuration("1y")).isEqualTo(Duration.ofDays(365));
        assertThat(JwtAuthConfig.parseDuration("3600")).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void rejectsUnknownFormats() {
        assertThatThrownBy(() -> JwtAuthConfig.parseDuration("1w")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JwtAuthConfig.parseDuration("-5s")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JwtAuthConfig.parseDuration("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaults() {
        JwtAuthConfig config = JwtAuthConfig.builder(SECRET).build();

        assertThat(config.issuer()).isEqualTo("api-framework");
        assertThat(config.audience()).isEqualTo("api-users");
        assertThat(config.tokenExpiration()).isEqualTo(Duration.ofDays(1));
        assertThat(config.refreshExpiration()).isEqualTo(Duration.ofDays(7));
        assertThat(new String(config.refreshSecret())).isEqualTo(SECRET + "-refresh");
    }

    @Test
    void shortSecretIsRejected() {
        assertThatThrownBy(() -> JwtAuthConfig.builder("too-short").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 32 bytes");
    }

    @Test
    void readsEnvironment() {
        JwtAuthConfig config = JwtAuthConfig.fromEnvironment(Map.of(
                "JWT_SECRET", SECRET,
                "JWT_ISSUER", "shop",
                "JWT_EXPIRATION", "15m",
                "JWT_REFRESH_EXPIRATION", "30d"));

        assertThat(config.issuer()).isEqualTo("shop");
        assertThat(config.audience()).isEqualTo("api-users");
        assertThat(config.tokenExpiration()).isEqualTo(Duration.ofMinutes(15));
        assertThat(config.refreshExpiration()).isEqualTo(Duration.ofDays(30));
    }

    @Test
    void environmentWithoutSecretFails() {
        assertThatThrownBy(() -> JwtAuthConfig.fromEnvironment(Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("JWT_SECRET is not set");
    }
}
