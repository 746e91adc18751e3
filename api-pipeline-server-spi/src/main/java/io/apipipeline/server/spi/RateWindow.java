package io.apipipeline.server.spi;

/**
 * Immutable fixed-window counter.
 *
 * @param count requests seen since the window started
 * @param resetAt window end in epoch millis
 */
public record RateWindow(long count, long resetAt) {

    public static RateWindow open(long nowMillis, long windowSeconds) {
        if (windowSeconds <= 0) throw new IllegalArgumentException("windowSeconds must be > 0");
        return new RateWindow(1, nowMillis + windowSeconds * 1000);
    }

    public RateWindow incremented() {
        return new RateWindow(count + 1, resetAt);
    }

    /** A window no longer exists once {@code now > resetAt}. */
    public boolean hasEnded(long nowMillis) {
        return nowMillis > resetAt;
    }
}
