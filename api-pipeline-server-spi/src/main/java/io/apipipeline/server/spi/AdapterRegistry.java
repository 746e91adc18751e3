package io.apipipeline.server.spi;

import io.apipipeline.core.ApiException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Named registry with one default entry.
 *
 * <p>Backs cache adapters, rate limit adapters and auth providers alike:
 * <pre>{@code
 * AdapterRegistry<CacheAdapter> caches = AdapterRegistry.of("Cache adapter", "memory", new MemoryCacheAdapter());
 * caches.register("redis", redisAdapter);
 * caches.resolve(null);      // memory
 * caches.resolve("redis");   // redis
 * }</pre>
 *
 * <p>Registration is expected during setup; lookups are safe from any thread.
 *
 * @param <A> the capability interface
 */
public final class AdapterRegistry<A> implements AutoCloseable {

    private final String kind;
    private final Map<String, A> adapters = new LinkedHashMap<>();
    private String defaultName;

    /**
     * @param kind label used in error messages, e.g. {@code "Cache adapter"}
     */
    public AdapterRegistry(String kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Creates a registry with one adapter registered as the default.
     */
    public static <A> AdapterRegistry<A> of(String kind, String name, A adapter) {
        AdapterRegistry<A> registry = new AdapterRegistry<>(kind);
        registry.register(name, adapter);
        return registry;
    }

    /**
     * Registers (or replaces) an adapter. The first registered adapter becomes the default.
     *
     * @return this registry
     */
    public synchronized AdapterRegistry<A> register(String name, A adapter) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        Objects.requireNonNull(adapter, "adapter");
        adapters.put(name, adapter);
        if (defaultName == null) defaultName = name;
        return this;
    }

    /**
     * @throws ApiException.AdapterMisconfigured if no adapter is registered under {@code name}
     */
    public synchronized void setDefault(String name) {
        if (!adapters.containsKey(name)) {
            throw new ApiException.AdapterMisconfigured(kind + " '" + name + "' not registered");
        }
        defaultName = name;
    }

    /**
     * Resolves the named adapter, or the default when {@code name} is null or blank.
     *
     * @throws ApiException.AdapterMisconfigured if the requested (or default) adapter is missing
     */
    public synchronized A resolve(String name) {
        String target = name == null || name.isBlank() ? defaultName : name;
        if (target == null) {
            throw new ApiException.AdapterMisconfigured("No default " + kind.toLowerCase(Locale.ROOT) + " configured");
        }
        A adapter = adapters.get(target);
        if (adapter == null) {
            throw new ApiException.AdapterMisconfigured(kind + " '" + target + "' not registered");
        }
        return adapter;
    }

    public synchronized Optional<String> defaultName() {
        return Optional.ofNullable(defaultName);
    }

    public synchronized Set<String> names() {
        return Set.copyOf(adapters.keySet());
    }

    /**
     * Closes every registered adapter that is {@link AutoCloseable}, stopping background work.
     */
    @Override
    public void close() throws Exception {
        List<A> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(adapters.values());
        }
        Exception failure = null;
        for (A adapter : snapshot) {
            if (adapter instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    if (failure == null) failure = e;
                    else failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) throw failure;
    }
}
