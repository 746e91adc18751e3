package io.apipipeline.server.spi;

import java.util.Optional;
import java.util.Set;

/**
 * Cache SPI used by the response cache.
 *
 * <p>Implementations must make {@code get}, {@code set} and {@code delete} linearizable per key
 * and keep the tag index consistent with the stored entries: an entry's tags are indexed while
 * the entry is live and pruned when it is removed for any reason.
 */
public interface CacheAdapter {

    /** TTL applied by {@link #set(String, Object)}. */
    long DEFAULT_TTL_SECONDS = 300;

    /**
     * Look up a live entry. An expired entry is treated as a miss and removed.
     */
    Optional<Object> get(String key);

    /**
     * Insert or replace an entry.
     *
     * @param ttlSeconds lifetime in seconds; {@code 0} means the entry never expires
     * @param tags labels for bulk invalidation (may be empty)
     */
    void set(String key, Object value, long ttlSeconds, Set<String> tags);

    default void set(String key, Object value) {
        set(key, value, DEFAULT_TTL_SECONDS, Set.of());
    }

    /**
     * @return true if an entry was removed
     */
    boolean delete(String key);

    /**
     * Remove every key containing a match of the given regular expression.
     */
    void invalidate(String pattern);

    /**
     * Remove every key indexed under {@code tag} and drop the tag from the index.
     */
    void invalidateByTag(String tag);

    void clear();
}
