package io.apipipeline.server.core.health;

import io.apipipeline.core.HttpMethod;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Health endpoint configuration.
 *
 * <p>Defaults: {@code GET /health}, 30 second timeout per probe, checks from the shared
 * {@link HealthCheckRegistry}, version from {@code API_VERSION} (else {@code 1.0.0}) and
 * environment from {@code APP_ENV} (else {@code development}).
 */
public final class HealthOptions {

    public static final String DEFAULT_PATH = "/health";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpMethod method;
    private final String path;
    private final Duration timeout;
    private final List<HealthCheck> checks;
    private final String version;
    private final String environment;

    private HealthOptions(Builder b) {
        this.method = b.method;
        this.path = b.path;
        this.timeout = b.timeout;
        this.checks = b.checks == null ? null : List.copyOf(b.checks);
        this.version = b.version;
        this.environment = b.environment;
    }

    public static Builder builder() {
        return builder(System.getenv());
    }

    /**
     * @param env source of {@code API_VERSION} and {@code APP_ENV}
     */
    public static Builder builder(Map<String, String> env) {
        return new Builder(env);
    }

    public HttpMethod method() {
        return method;
    }

    public String path() {
        return path;
    }

    public Duration timeout() {
        return timeout;
    }

    /** Endpoint-specific checks overriding the registry, if configured. */
    public Optional<List<HealthCheck>> checks() {
        return Optional.ofNullable(checks);
    }

    public String version() {
        return version;
    }

    public String environment() {
        return environment;
    }

    /** Whether the request targets the health endpoint; a trailing slash is ignored. */
    public boolean matches(HttpMethod requestMethod, String requestPath) {
        if (requestMethod != method || requestPath == null) return false;
        String p = requestPath.length() > 1 && requestPath.endsWith("/")
                ? requestPath.substring(0, requestPath.length() - 1)
                : requestPath;
        return p.equals(path);
    }

    public static final class Builder {
        private HttpMethod method = HttpMethod.GET;
        private String path = DEFAULT_PATH;
        private Duration timeout = DEFAULT_TIMEOUT;
        private List<HealthCheck> checks;
        private String version;
        private String environment;

        private Builder(Map<String, String> env) {
            Objects.requireNonNull(env, "env");
            this.version = env.getOrDefault("API_VERSION", "1.0.0");
            this.environment = env.getOrDefault("APP_ENV", "development");
        }

        public Builder method(HttpMethod method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder checks(List<HealthCheck> checks) {
            this.checks = checks;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public HealthOptions build() {
            Objects.requireNonNull(method, "method");
            if (path == null || !path.startsWith("/")) throw new IllegalArgumentException("path must start with '/'");
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isZero() || timeout.isNegative()) throw new IllegalArgumentException("timeout must be positive");
            return new HealthOptions(this);
        }
    }
}
