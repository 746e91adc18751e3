package io.apipipeline.server.spi;

/**
 * Fixed-window rate limit SPI.
 *
 * <p>{@link #increment} must be a single atomic read-modify-write per key: two concurrent
 * increments on the same key never observe the same pre-increment count.
 */
public interface RateLimitAdapter {

    /**
     * Count one request against {@code key}.
     *
     * <p>Starts a new window (count 1, {@code resetAt = now + window}) if none exists or the
     * existing one has ended; otherwise increments the existing window.
     */
    RateLimitResult increment(String key, int limit, long windowSeconds);

    /**
     * Same computation as {@link #increment} without counting a request.
     */
    RateLimitResult get(String key, int limit, long windowSeconds);

    /**
     * Delete the window for {@code key}.
     */
    void reset(String key);
}
