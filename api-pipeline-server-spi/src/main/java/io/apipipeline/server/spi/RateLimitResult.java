package io.apipipeline.server.spi;

/**
 * Outcome of a rate limit check.
 *
 * @param limited whether the request exceeded the limit
 * @param remaining requests left in the current window
 * @param limit configured limit
 * @param reset seconds until the window ends
 * @param retryAfter seconds the client should wait; {@code 0} when not limited
 */
public record RateLimitResult(boolean limited, int remaining, int limit, long reset, long retryAfter) {

    /**
     * Result for a window holding {@code count} requests that ends at {@code resetAt}.
     *
     * <p>The boundary is {@code count > limit}: the Nth request of a limit of N still succeeds.
     */
    public static RateLimitResult of(RateWindow window, int limit, long nowMillis) {
        long count = window.count();
        boolean limited = count > limit;
        int remaining = (int) Math.max(0, limit - count);
        long reset = Math.max(0, ceilSeconds(window.resetAt() - nowMillis));
        return new RateLimitResult(limited, remaining, limit, reset, limited ? reset : 0);
    }

    /**
     * Result when no window exists for the key.
     */
    public static RateLimitResult untouched(int limit) {
        return new RateLimitResult(false, limit, limit, 0, 0);
    }

    private static long ceilSeconds(long millis) {
        return (millis + 999) / 1000;
    }
}
