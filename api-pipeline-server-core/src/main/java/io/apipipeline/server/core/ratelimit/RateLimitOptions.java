package io.apipipeline.server.core.ratelimit;

import io.apipipeline.server.core.ServerRequest;

import java.util.Optional;
import java.util.function.Function;

/**
 * Per-endpoint fixed-window limit.
 * <pre>{@code
 * RateLimitOptions.builder(100, 60).name("search").varyByRoute(true).build();
 * }</pre>
 */
public final class RateLimitOptions {

    public static final String DEFAULT_NAME = "default";
    public static final String DEFAULT_MESSAGE = "Rate limit exceeded";
    public static final int DEFAULT_STATUS = 429;

    private final int limit;
    private final long windowSeconds;
    private final String adapter;
    private final String name;
    private final Function<ServerRequest, String> keyGenerator;
    private final boolean varyByUser;
    private final boolean varyByRoute;
    private final boolean varyByMethod;
    private final String message;
    private final int statusCode;

    private RateLimitOptions(Builder b) {
        this.limit = b.limit;
        this.windowSeconds = b.windowSeconds;
        this.adapter = b.adapter;
        this.name = b.name;
        this.keyGenerator = b.keyGenerator;
        this.varyByUser = b.varyByUser;
        this.varyByRoute = b.varyByRoute;
        this.varyByMethod = b.varyByMethod;
        this.message = b.message;
        this.statusCode = b.statusCode;
    }

    /**
     * @param limit requests allowed per window
     * @param windowSeconds window length
     */
    public static Builder builder(int limit, long windowSeconds) {
        return new Builder(limit, windowSeconds);
    }

    public int limit() {
        return limit;
    }

    public long windowSeconds() {
        return windowSeconds;
    }

    public String adapter() {
        return adapter;
    }

    public String name() {
        return name;
    }

    public Optional<Function<ServerRequest, String>> keyGenerator() {
        return Optional.ofNullable(keyGenerator);
    }

    public boolean varyByUser() {
        return varyByUser;
    }

    public boolean varyByRoute() {
        return varyByRoute;
    }

    public boolean varyByMethod() {
        return varyByMethod;
    }

    public String message() {
        return message;
    }

    public int statusCode() {
        return statusCode;
    }

    public static final class Builder {
        private final int limit;
        private final long windowSeconds;
        private String adapter;
        private String name = DEFAULT_NAME;
        private Function<ServerRequest, String> keyGenerator;
        private boolean varyByUser;
        private boolean varyByRoute;
        private boolean varyByMethod;
        private String message = DEFAULT_MESSAGE;
        private int statusCode = DEFAULT_STATUS;

        private Builder(int limit, long windowSeconds) {
            this.limit = limit;
            this.windowSeconds = windowSeconds;
        }

        public Builder adapter(String adapter) {
            this.adapter = adapter;
            return this;
        }

        /** Key prefix. Default: {@code default}. */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /** Replaces the derived key entirely. */
        public Builder keyGenerator(Function<ServerRequest, String> keyGenerator) {
            this.keyGenerator = keyGenerator;
            return this;
        }

        public Builder varyByUser(boolean varyByUser) {
            this.varyByUser = varyByUser;
            return this;
        }

        public Builder varyByRoute(boolean varyByRoute) {
            this.varyByRoute = varyByRoute;
            return this;
        }

        public Builder varyByMethod(boolean varyByMethod) {
            this.varyByMethod = varyByMethod;
            return this;
        }

        /** Error message when limited. Default: {@code Rate limit exceeded}. */
        public Builder message(String message) {
            this.message = message;
            return this;
        }

        /** Status when limited. Default: 429. */
        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public RateLimitOptions build() {
            if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
            if (windowSeconds <= 0) throw new IllegalArgumentException("windowSeconds must be positive");
            if (statusCode < 400 || statusCode > 599) throw new IllegalArgumentException("statusCode must be 4xx or 5xx");
            if (name == null || name.isBlank()) name = DEFAULT_NAME;
            if (message == null || message.isBlank()) message = DEFAULT_MESSAGE;
            return new RateLimitOptions(this);
        }
    }
}
