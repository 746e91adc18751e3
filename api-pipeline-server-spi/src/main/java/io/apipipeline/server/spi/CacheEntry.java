package io.apipipeline.server.spi;

import java.util.Set;

/**
 * Stored cache value.
 *
 * @param value the cached value (opaque)
 * @param expiresAt absolute expiry in epoch millis; {@code 0} means never
 * @param createdAt creation time in epoch millis
 * @param tags labels under which the entry is indexed
 */
public record CacheEntry(Object value, long expiresAt, long createdAt, Set<String> tags) {

    public CacheEntry {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static CacheEntry create(Object value, long ttlSeconds, Set<String> tags, long nowMillis) {
        if (ttlSeconds < 0) throw new IllegalArgumentException("ttlSeconds must be >= 0");
        long expiresAt = ttlSeconds == 0 ? 0 : nowMillis + ttlSeconds * 1000;
        return new CacheEntry(value, expiresAt, nowMillis, tags);
    }

    public boolean isExpired(long nowMillis) {
        return expiresAt != 0 && expiresAt <= nowMillis;
    }
}
