package io.apipipeline.server.core.cache;

import io.apipipeline.server.spi.AdapterRegistry;
import io.apipipeline.server.spi.CacheAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

/**
 * Read-through cache in front of a computation.
 *
 * <p>Concurrent misses on the same key are collapsed: one caller computes, the others wait for
 * its outcome (value or failure). Only values accepted by the {@code storable} predicate are
 * written to the adapter.
 */
public final class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final AdapterRegistry<CacheAdapter> adapters;
    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    public ResponseCache(AdapterRegistry<CacheAdapter> adapters) {
        this.adapters = Objects.requireNonNull(adapters, "adapters");
    }

    public <T> T getOrCompute(String key, CacheOptions options, Class<T> type,
                              Callable<T> compute, Predicate<? super T> storable) throws Exception {
        CacheAdapter adapter = adapters.resolve(options.adapter());

        Optional<Object> cached = adapter.get(key);
        if (cached.isPresent() && type.isInstance(cached.get())) {
            log.debug("Cache hit {}", key);
            return type.cast(cached.get());
        }

        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> leader = inFlight.putIfAbsent(key, mine);
        if (leader != null) {
            log.debug("Joining in-flight computation for {}", key);
            return type.cast(await(leader));
        }

        try {
            T value = compute.call();
            if (value != null && storable.test(value)) {
                adapter.set(key, value, options.ttlSeconds(), options.tags());
            }
            mine.complete(value);
            return value;
        } catch (Throwable t) {
            mine.completeExceptionally(t);
            throw t;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /** Number of keys currently being computed. */
    public int inFlight() {
        return inFlight.size();
    }

    private static Object await(CompletableFuture<Object> leader) throws Exception {
        try {
            return leader.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }
}
