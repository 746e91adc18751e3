package io.apipipeline.server.core.cache;

import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.spi.CacheAdapter;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Per-endpoint response caching configuration. Applies to GET requests only.
 */
public final class CacheOptions {

    private final long ttlSeconds;
    private final String key;
    private final Function<ServerRequest, String> keyFunction;
    private final String adapter;
    private final boolean includeQuery;
    private final List<String> headerNames;
    private final boolean varyByUser;
    private final Set<String> tags;

    private CacheOptions(Builder b) {
        this.ttlSeconds = b.ttlSeconds;
        this.key = b.key;
        this.keyFunction = b.keyFunction;
        this.adapter = b.adapter;
        this.includeQuery = b.includeQuery;
        this.headerNames = List.copyOf(b.headerNames);
        this.varyByUser = b.varyByUser;
        this.tags = Set.copyOf(b.tags);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CacheOptions defaults() {
        return builder().build();
    }

    public long ttlSeconds() {
        return ttlSeconds;
    }

    public Optional<String> key() {
        return Optional.ofNullable(key);
    }

    public Optional<Function<ServerRequest, String>> keyFunction() {
        return Optional.ofNullable(keyFunction);
    }

    /** Adapter name; {@code null} selects the registry default. */
    public String adapter() {
        return adapter;
    }

    public boolean includeQuery() {
        return includeQuery;
    }

    public List<String> headerNames() {
        return headerNames;
    }

    public boolean varyByUser() {
        return varyByUser;
    }

    public Set<String> tags() {
        return tags;
    }

    public static final class Builder {
        private long ttlSeconds = CacheAdapter.DEFAULT_TTL_SECONDS;
        private String key;
        private Function<ServerRequest, String> keyFunction;
        private String adapter;
        private boolean includeQuery;
        private List<String> headerNames = List.of();
        private boolean varyByUser;
        private Set<String> tags = Set.of();

        private Builder() {}

        /** Entry lifetime in seconds; {@code 0} never expires. Default: 300. */
        public Builder ttlSeconds(long ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
            return this;
        }

        /** Fixed cache key; takes precedence over every derived key. */
        public Builder key(String key) {
            this.key = key;
            return this;
        }

        /** Computes the key from the request; used when no fixed key is set. */
        public Builder keyFunction(Function<ServerRequest, String> keyFunction) {
            this.keyFunction = keyFunction;
            return this;
        }

        public Builder adapter(String adapter) {
            this.adapter = adapter;
            return this;
        }

        /** Adds the sorted query parameters to the derived key. */
        public Builder includeQuery(boolean includeQuery) {
            this.includeQuery = includeQuery;
            return this;
        }

        /** Adds the named request headers, when present, to the derived key. */
        public Builder includeHeaders(String... names) {
            this.headerNames = List.of(names);
            return this;
        }

        public Builder varyByUser(boolean varyByUser) {
            this.varyByUser = varyByUser;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags = Set.of(tags);
            return this;
        }

        public CacheOptions build() {
            if (ttlSeconds < 0) throw new IllegalArgumentException("ttlSeconds must be >= 0");
            if (key != null && key.isBlank()) throw new IllegalArgumentException("key must not be blank");
            headerNames.forEach(h -> Objects.requireNonNull(h, "header name"));
            return new CacheOptions(this);
        }
    }
}
