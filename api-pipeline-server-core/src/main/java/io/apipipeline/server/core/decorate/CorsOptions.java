package io.apipipeline.server.core.decorate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Cross-origin settings.
 *
 * <p>Defaults: any origin, methods {@code GET,POST,PUT,DELETE,OPTIONS}, headers
 * {@code Content-Type, Authorization}, no credentials, preflight status 204.
 */
public final class CorsOptions {

    public static final String ANY_ORIGIN = "*";

    private final List<String> origins;
    private final List<String> methods;
    private final List<String> allowedHeaders;
    private final List<String> exposedHeaders;
    private final boolean credentials;
    private final Duration maxAge;
    private final int preflightStatus;

    private CorsOptions(Builder b) {
        this.origins = List.copyOf(b.origins);
        this.methods = List.copyOf(b.methods);
        this.allowedHeaders = List.copyOf(b.allowedHeaders);
        this.exposedHeaders = List.copyOf(b.exposedHeaders);
        this.credentials = b.credentials;
        this.maxAge = b.maxAge;
        this.preflightStatus = b.preflightStatus;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CorsOptions defaults() {
        return builder().build();
    }

    public List<String> origins() {
        return origins;
    }

    public boolean anyOrigin() {
        return origins.contains(ANY_ORIGIN);
    }

    public List<String> methods() {
        return methods;
    }

    public List<String> allowedHeaders() {
        return allowedHeaders;
    }

    public List<String> exposedHeaders() {
        return exposedHeaders;
    }

    public boolean credentials() {
        return credentials;
    }

    public Optional<Duration> maxAge() {
        return Optional.ofNullable(maxAge);
    }

    public int preflightStatus() {
        return preflightStatus;
    }

    public static final class Builder {
        private List<String> origins = List.of(ANY_ORIGIN);
        private List<String> methods = List.of("GET", "POST", "PUT", "DELETE", "OPTIONS");
        private List<String> allowedHeaders = List.of("Content-Type", "Authorization");
        private List<String> exposedHeaders = List.of();
        private boolean credentials;
        private Duration maxAge;
        private int preflightStatus = 204;

        private Builder() {}

        public Builder origins(String... origins) {
            this.origins = List.of(origins);
            return this;
        }

        public Builder methods(String... methods) {
            this.methods = List.of(methods);
            return this;
        }

        public Builder allowedHeaders(String... headers) {
            this.allowedHeaders = List.of(headers);
            return this;
        }

        public Builder exposedHeaders(String... headers) {
            this.exposedHeaders = List.of(headers);
            return this;
        }

        public Builder credentials(boolean credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder maxAge(Duration maxAge) {
            this.maxAge = maxAge;
            return this;
        }

        public Builder preflightStatus(int preflightStatus) {
            this.preflightStatus = preflightStatus;
            return this;
        }

        public CorsOptions build() {
            if (origins.isEmpty()) throw new IllegalArgumentException("at least one origin is required");
            if (methods.isEmpty()) throw new IllegalArgumentException("at least one method is required");
            if (preflightStatus < 200 || preflightStatus > 299) throw new IllegalArgumentException("preflightStatus must be 2xx");
            return new CorsOptions(this);
        }
    }
}
