package io.apipipeline.server.core.ratelimit;

import io.apipipeline.server.core.BackgroundSweeper;
import io.apipipeline.server.spi.RateLimitAdapter;
import io.apipipeline.server.spi.RateLimitResult;
import io.apipipeline.server.spi.RateWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window {@link RateLimitAdapter}.
 *
 * <p>This is a reference implementation suitable for single-instance deployments.
 * For distributed systems, register a shared-store adapter instead.
 *
 * <p>Each key maps to an immutable {@link RateWindow} replaced through
 * {@link ConcurrentHashMap#compute}, so increments on one key are serialized.
 */
public final class MemoryRateLimitAdapter implements RateLimitAdapter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MemoryRateLimitAdapter.class);

    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);

    private final ConcurrentHashMap<String, RateWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final BackgroundSweeper sweeper;

    public MemoryRateLimitAdapter() {
        this(Clock.systemUTC(), DEFAULT_SWEEP_INTERVAL);
    }

    /**
     * @param sweepInterval interval of the background sweep; {@code null} disables it
     */
    public MemoryRateLimitAdapter(Clock clock, Duration sweepInterval) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sweeper = sweepInterval == null ? null : new BackgroundSweeper("rate-limit-sweep", sweepInterval, this::purgeExpired);
    }

    @Override
    public RateLimitResult increment(String key, int limit, long windowSeconds) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
        long now = clock.millis();
        RateWindow window = windows.compute(key, (k, current) ->
                current == null || current.hasEnded(now) ? RateWindow.open(now, windowSeconds) : current.incremented());
        return RateLimitResult.of(window, limit, now);
    }

    @Override
    public RateLimitResult get(String key, int limit, long windowSeconds) {
        long now = clock.millis();
        RateWindow window = windows.get(key);
        if (window == null || window.hasEnded(now)) return RateLimitResult.untouched(limit);
        return RateLimitResult.of(window, limit, now);
    }

    @Override
    public void reset(String key) {
        windows.remove(key);
    }

    /**
     * Removes every window past its reset time.
     *
     * @return number of windows removed
     */
    public int purgeExpired() {
        long now = clock.millis();
        List<String> candidates = new ArrayList<>();
        windows.forEach((key, window) -> {
            if (window.hasEnded(now)) candidates.add(key);
        });
        int removed = 0;
        for (String key : candidates) {
            boolean[] dropped = {false};
            windows.computeIfPresent(key, (k, w) -> {
                if (!w.hasEnded(now)) return w;
                dropped[0] = true;
                return null;
            });
            if (dropped[0]) removed++;
        }
        if (removed > 0) log.debug("Swept {} expired rate limit windows", removed);
        return removed;
    }

    public int size() {
        return windows.size();
    }

    @Override
    public void close() {
        if (sweeper != null) sweeper.close();
    }
}
