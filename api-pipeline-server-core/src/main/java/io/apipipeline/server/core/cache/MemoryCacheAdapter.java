package io.apipipeline.server.core.cache;

import io.apipipeline.server.core.BackgroundSweeper;
import io.apipipeline.server.spi.CacheAdapter;
import io.apipipeline.server.spi.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * In-process {@link CacheAdapter} with TTL and tag-based invalidation.
 *
 * <p>This is a reference implementation suitable for single-instance deployments. Entries live
 * in a {@link ConcurrentHashMap}; every change to the entry map also updates the tag index under
 * one lock, so a tag never points at a removed key. Expired entries are removed lazily on
 * {@link #get} and by a periodic sweep.
 */
public final class MemoryCacheAdapter implements CacheAdapter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MemoryCacheAdapter.class);

    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> tagIndex = new HashMap<>(); // guarded by lock
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final BackgroundSweeper sweeper;

    /**
     * Creates an adapter on the system clock sweeping every 60 seconds.
     */
    public MemoryCacheAdapter() {
        this(Clock.systemUTC(), DEFAULT_SWEEP_INTERVAL);
    }

    /**
     * @param sweepInterval interval of the background sweep; {@code null} disables it
     */
    public MemoryCacheAdapter(Clock clock, Duration sweepInterval) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sweeper = sweepInterval == null ? null : new BackgroundSweeper("cache-sweep", sweepInterval, this::purgeExpired);
    }

    @Override
    public Optional<Object> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) return Optional.empty();
        if (entry.isExpired(clock.millis())) {
            lock.lock();
            try {
                if (entries.remove(key, entry)) unindex(key, entry);
            } finally {
                lock.unlock();
            }
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, Object value, long ttlSeconds, Set<String> tags) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        CacheEntry entry = CacheEntry.create(value, ttlSeconds, tags, clock.millis());
        lock.lock();
        try {
            CacheEntry previous = entries.put(key, entry);
            if (previous != null) unindex(key, previous);
            for (String tag : entry.tags()) {
                tagIndex.computeIfAbsent(tag, t -> new HashSet<>()).add(key);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        lock.lock();
        try {
            return removeLocked(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidate(String pattern) {
        Pattern regex = Pattern.compile(pattern);
        List<String> matching = new ArrayList<>();
        for (String key : entries.keySet()) {
            if (regex.matcher(key).find()) matching.add(key);
        }
        lock.lock();
        try {
            matching.forEach(this::removeLocked);
        } finally {
            lock.unlock();
        }
        log.debug("Invalidated {} cache entries matching {}", matching.size(), pattern);
    }

    @Override
    public void invalidateByTag(String tag) {
        lock.lock();
        try {
            Set<String> keys = tagIndex.remove(tag);
            if (keys == null) return;
            for (String key : keys) removeLocked(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            tagIndex.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        long now = clock.millis();
        List<String> expired = new ArrayList<>();
        entries.forEach((key, entry) -> {
            if (entry.isExpired(now)) expired.add(key);
        });
        int removed = 0;
        lock.lock();
        try {
            for (String key : expired) {
                CacheEntry entry = entries.get(key);
                if (entry != null && entry.isExpired(now) && entries.remove(key, entry)) {
                    unindex(key, entry);
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) log.debug("Swept {} expired cache entries", removed);
        return removed;
    }

    public int size() {
        return entries.size();
    }

    /** Keys currently indexed under {@code tag}. */
    public Set<String> keysForTag(String tag) {
        lock.lock();
        try {
            Set<String> keys = tagIndex.get(tag);
            return keys == null ? Set.of() : Set.copyOf(keys);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> tags() {
        lock.lock();
        try {
            return Set.copyOf(tagIndex.keySet());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        if (sweeper != null) sweeper.close();
    }

    private boolean removeLocked(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed == null) return false;
        unindex(key, removed);
        return true;
    }

    private void unindex(String key, CacheEntry entry) {
        for (String tag : entry.tags()) {
            Set<String> keys = tagIndex.get(tag);
            if (keys == null) continue;
            keys.remove(key);
            if (keys.isEmpty()) tagIndex.remove(tag);
        }
    }
}
