package io.apipipeline.server.core.pipeline;

import io.apipipeline.server.core.auth.AuthOptions;
import io.apipipeline.server.core.cache.CacheOptions;
import io.apipipeline.server.core.decorate.CorsOptions;
import io.apipipeline.server.core.decorate.LoggingOptions;
import io.apipipeline.server.core.decorate.MetricsOptions;
import io.apipipeline.server.core.health.HealthOptions;
import io.apipipeline.server.core.ratelimit.RateLimitOptions;
import io.apipipeline.server.core.validation.ValidationOptions;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative endpoint configuration. Every concern is disabled unless its options are set.
 * <pre>{@code
 * EndpointConfig config = EndpointConfig.builder((req, ctx) -> userService.find(ctx.param("id").orElseThrow()))
 *     .auth(AuthOptions.required().roles("admin").build())
 *     .rateLimit(RateLimitOptions.builder(100, 60).build())
 *     .cache(CacheOptions.builder().ttlSeconds(30).tags("users").build())
 *     .timeout(Duration.ofSeconds(5))
 *     .metrics(MetricsOptions.defaults())
 *     .build();
 * }</pre>
 */
public final class EndpointConfig {

    private final String name;
    private final ApiHandler handler;
    private final Duration timeout;
    private final HealthOptions health;
    private final CorsOptions cors;
    private final RateLimitOptions rateLimit;
    private final AuthOptions auth;
    private final ValidationOptions validation;
    private final CacheOptions cache;
    private final MetricsOptions metrics;
    private final LoggingOptions logging;

    private EndpointConfig(Builder b) {
        this.name = b.name;
        this.handler = b.handler;
        this.timeout = b.timeout;
        this.health = b.health;
        this.cors = b.cors;
        this.rateLimit = b.rateLimit;
        this.auth = b.auth;
        this.validation = b.validation;
        this.cache = b.cache;
        this.metrics = b.metrics;
        this.logging = b.logging;
    }

    public static Builder builder(ApiHandler handler) {
        return new Builder(handler);
    }

    public String name() {
        return name;
    }

    public ApiHandler handler() {
        return handler;
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<HealthOptions> health() {
        return Optional.ofNullable(health);
    }

    public Optional<CorsOptions> cors() {
        return Optional.ofNullable(cors);
    }

    public Optional<RateLimitOptions> rateLimit() {
        return Optional.ofNullable(rateLimit);
    }

    public Optional<AuthOptions> auth() {
        return Optional.ofNullable(auth);
    }

    public Optional<ValidationOptions> validation() {
        return Optional.ofNullable(validation);
    }

    public Optional<CacheOptions> cache() {
        return Optional.ofNullable(cache);
    }

    public Optional<MetricsOptions> metrics() {
        return Optional.ofNullable(metrics);
    }

    public Optional<LoggingOptions> logging() {
        return Optional.ofNullable(logging);
    }

    public static final class Builder {
        private final ApiHandler handler;
        private String name = "endpoint";
        private Duration timeout;
        private HealthOptions health;
        private CorsOptions cors;
        private RateLimitOptions rateLimit;
        private AuthOptions auth;
        private ValidationOptions validation;
        private CacheOptions cache;
        private MetricsOptions metrics;
        private LoggingOptions logging;

        private Builder(ApiHandler handler) {
            this.handler = Objects.requireNonNull(handler, "handler");
        }

        /** Label used in log messages. */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /** Handler deadline; without one the handler runs on the calling thread, unbounded. */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder health(HealthOptions health) {
            this.health = health;
            return this;
        }

        public Builder cors(CorsOptions cors) {
            this.cors = cors;
            return this;
        }

        public Builder rateLimit(RateLimitOptions rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder auth(AuthOptions auth) {
            this.auth = auth;
            return this;
        }

        public Builder validation(ValidationOptions validation) {
            this.validation = validation;
            return this;
        }

        public Builder cache(CacheOptions cache) {
            this.cache = cache;
            return this;
        }

        public Builder metrics(MetricsOptions metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder logging(LoggingOptions logging) {
            this.logging = logging;
            return this;
        }

        public EndpointConfig build() {
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            if (name == null || name.isBlank()) name = "endpoint";
            return new EndpointConfig(this);
        }
    }
}
