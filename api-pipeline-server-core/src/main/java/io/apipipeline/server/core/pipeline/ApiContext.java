package io.apipipeline.server.core.pipeline;

import io.apipipeline.core.HttpMethod;
import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.spi.ApiUser;
import io.apipipeline.server.spi.RateLimitResult;

import java.net.URI;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-request values assembled by the pipeline before the handler runs.
 */
public final class ApiContext {

    private final ServerRequest request;
    private final Map<String, Object> params;
    private final Object query;
    private final Object body;
    private final Instant startTime;
    private final String requestId;
    private final String token;
    private final ApiUser user;
    private final RateLimitResult rateLimit;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    private ApiContext(Builder b) {
        this.request = b.request;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(b.params));
        this.query = b.query;
        this.body = b.body;
        this.startTime = b.startTime;
        this.requestId = b.requestId;
        this.token = b.token;
        this.user = b.user;
        this.rateLimit = b.rateLimit;
    }

    static Builder builder(ServerRequest request) {
        return new Builder(request);
    }

    public ServerRequest request() {
        return request;
    }

    /** Route parameters overlaid with validated parameters. */
    public Map<String, Object> params() {
        return params;
    }

    public Optional<String> param(String name) {
        Object v = params.get(name);
        return v == null ? Optional.empty() : Optional.of(String.valueOf(v));
    }

    /** Validated query, or the raw query map when no schema is configured. */
    public Object query() {
        return query;
    }

    /** Validated body, or {@code null} when no body schema applied. */
    public Object body() {
        return body;
    }

    public Map<String, List<String>> headers() {
        return request.headers();
    }

    public HttpMethod method() {
        return request.method();
    }

    public String path() {
        return request.path();
    }

    public URI url() {
        return request.uri();
    }

    public String clientAddress() {
        return request.clientAddress();
    }

    public Instant startTime() {
        return startTime;
    }

    public String requestId() {
        return requestId;
    }

    public Optional<String> token() {
        return Optional.ofNullable(token);
    }

    public Optional<ApiUser> user() {
        return Optional.ofNullable(user);
    }

    public Optional<RateLimitResult> rateLimit() {
        return Optional.ofNullable(rateLimit);
    }

    /** Free-form values shared between the handler and code it calls. */
    public Map<String, Object> attributes() {
        return attributes;
    }

    static final class Builder {
        private final ServerRequest request;
        private Map<String, Object> params = Map.of();
        private Object query;
        private Object body;
        private Instant startTime;
        private String requestId;
        private String token;
        private ApiUser user;
        private RateLimitResult rateLimit;

        private Builder(ServerRequest request) {
            this.request = Objects.requireNonNull(request, "request");
        }

        Builder params(Map<String, String> route, Object validated) {
            Map<String, Object> merged = new LinkedHashMap<>(route);
            if (validated instanceof Map<?, ?> m && validated != route) {
                m.forEach((k, v) -> merged.put(String.valueOf(k), v));
            }
            this.params = merged;
            return this;
        }

        Builder query(Object query) {
            this.query = query;
            return this;
        }

        Builder body(Object body) {
            this.body = body;
            return this;
        }

        Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        Builder token(String token) {
            this.token = token;
            return this;
        }

        Builder user(ApiUser user) {
            this.user = user;
            return this;
        }

        Builder rateLimit(RateLimitResult rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        ApiContext build() {
            return new ApiContext(this);
        }
    }
}
