package io.apipipeline.auth.jwt;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Settings of {@link JwtAuthProvider}.
 *
 * <p>Defaults: issuer {@code api-framework}, audience {@code api-users}, access tokens valid for
 * one day, refresh tokens for seven days, refresh secret derived from the signing secret.
 * <pre>{@code
 * JwtAuthConfig config = JwtAuthConfig.builder(secret).tokenExpiration("15m").build();
 * JwtAuthConfig fromEnv = JwtAuthConfig.fromEnvironment(System.getenv());
 * }</pre>
 */
public final class JwtAuthConfig {

    public static final String DEFAULT_ISSUER = "api-framework";
    public static final String DEFAULT_AUDIENCE = "api-users";
    public static final Duration DEFAULT_TOKEN_EXPIRATION = Duration.ofDays(1);
    public static final Duration DEFAULT_REFRESH_EXPIRATION = Duration.ofDays(7);

    /** HS256 needs a key of at least 256 bits. */
    static final int MIN_SECRET_BYTES = 32;

    private static final Pattern DURATION = Pattern.compile("^(\\d+)([smhdy])$");

    private final byte[] secret;
    private final byte[] refreshSecret;
    private final String issuer;
    private final String audience;
    private final Duration tokenExpiration;
    private final Duration refreshExpiration;
    private final Clock clock;

    private JwtAuthConfig(Builder b) {
        this.secret = b.secret.getBytes(StandardCharsets.UTF_8);
        this.refreshSecret = (b.refreshSecret != null ? b.refreshSecret : b.secret + "-refresh").getBytes(StandardCharsets.UTF_8);
        this.issuer = b.issuer;
        this.audience = b.audience;
        this.tokenExpiration = b.tokenExpiration;
        this.refreshExpiration = b.refreshExpiration;
        this.clock = b.clock;
    }

    public static Builder builder(String secret) {
        return new Builder(secret);
    }

    /**
     * Reads {@code JWT_SECRET} (required), {@code REFRESH_SECRET}, {@code JWT_ISSUER},
     * {@code JWT_AUDIENCE}, {@code JWT_EXPIRATION} and {@code JWT_REFRESH_EXPIRATION}.
     *
     * @throws IllegalArgumentException if {@code JWT_SECRET} is missing or a value is invalid
     */
    public static JwtAuthConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        String secret = env.get("JWT_SECRET");
        if (secret == null || secret.isBlank()) throw new IllegalArgumentException("JWT_SECRET is not set");

        Builder builder = builder(secret);
        String refreshSecret = env.get("REFRESH_SECRET");
        if (refreshSecret != null && !refreshSecret.isBlank()) builder.refreshSecret(refreshSecret);
        builder.issuer(env.getOrDefault("JWT_ISSUER", DEFAULT_ISSUER));
        builder.audience(env.getOrDefault("JWT_AUDIENCE", DEFAULT_AUDIENCE));
        String expiration = env.get("JWT_EXPIRATION");
        if (expiration != null) builder.tokenExpiration(expiration);
        String refreshExpiration = env.get("JWT_REFRESH_EXPIRATION");
        if (refreshExpiration != null) builder.refreshExpiration(refreshExpiration);
        return builder.build();
    }

    /**
     * Parses {@code <n><unit>} with unit {@code s}, {@code m}, {@code h}, {@code d} or {@code y}
     * (365 days). A bare number is read as seconds.
     *
     * @throws IllegalArgumentException for any other format
     */
    public static Duration parseDuration(String value) {
        if (value == null) throw new IllegalArgumentException("duration must not be null");
        String v = value.trim();
        if (!v.isEmpty() && v.chars().allMatch(Character::isDigit)) return Duration.ofSeconds(Long.parseLong(v));

        Matcher m = DURATION.matcher(v);
        if (!m.matches()) throw new IllegalArgumentException("Invalid duration: " + value);
        long amount = Long.parseLong(m.group(1));
        return switch (m.group(2)) {
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            case "d" -> Duration.ofDays(amount);
            default -> Duration.ofDays(amount * 365);
        };
    }

    byte[] secret() {
        return secret.clone();
    }

    byte[] refreshSecret() {
        return refreshSecret.clone();
    }

    public String issuer() {
        return issuer;
    }

    public String audience() {
        return audience;
    }

    public Duration tokenExpiration() {
        return tokenExpiration;
    }

    public Duration refreshExpiration() {
        return refreshExpiration;
    }

    public Clock clock() {
        return clock;
    }

    public static final class Builder {
        private final String secret;
        private String refreshSecret;
        private String issuer = DEFAULT_ISSUER;
        private String audience = DEFAULT_AUDIENCE;
        private Duration tokenExpiration = DEFAULT_TOKEN_EXPIRATION;
        private Duration refreshExpiration = DEFAULT_REFRESH_EXPIRATION;
        private Clock clock = Clock.systemUTC();

        private Builder(String secret) {
            this.secret = secret;
        }

        /** Secret for refresh tokens. Default: the signing secret followed by {@code -refresh}. */
        public Builder refreshSecret(String refreshSecret) {
            this.refreshSecret = refreshSecret;
            return this;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder audience(String audience) {
            this.audience = audience;
            return this;
        }

        public Builder tokenExpiration(Duration tokenExpiration) {
            this.tokenExpiration = tokenExpiration;
            return this;
        }

        /** @see JwtAuthConfig#parseDuration(String) */
        public Builder tokenExpiration(String tokenExpiration) {
            return tokenExpiration(parseDuration(tokenExpiration));
        }

        public Builder refreshExpiration(Duration refreshExpiration) {
            this.refreshExpiration = refreshExpiration;
            return this;
        }

        /** @see JwtAuthConfig#parseDuration(String) */
        public Builder refreshExpiration(String refreshExpiration) {
            return refreshExpiration(parseDuration(refreshExpiration));
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public JwtAuthConfig build() {
            requireSecret("secret", secret);
            if (refreshSecret != null) requireSecret("refreshSecret", refreshSecret);
            if (issuer == null || issuer.isBlank()) throw new IllegalArgumentException("issuer must not be blank");
            if (audience == null || audience.isBlank()) throw new IllegalArgumentException("audience must not be blank");
            requirePositive("tokenExpiration", tokenExpiration);
            requirePositive("refreshExpiration", refreshExpiration);
            Objects.requireNonNull(clock, "clock");
            return new JwtAuthConfig(this);
        }

        private static void requireSecret(String name, String value) {
            if (value == null || value.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
                throw new IllegalArgumentException(name + " must be at least " + MIN_SECRET_BYTES + " bytes");
            }
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
