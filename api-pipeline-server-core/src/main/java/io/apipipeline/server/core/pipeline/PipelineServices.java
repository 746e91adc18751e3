package io.apipipeline.server.core.pipeline;

import io.apipipeline.json.spi.JsonCodec;
import io.apipipeline.server.core.HandlerThreads;
import io.apipipeline.server.core.JsonCodecs;
import io.apipipeline.server.core.auth.Authenticator;
import io.apipipeline.server.core.cache.MemoryCacheAdapter;
import io.apipipeline.server.core.decorate.RequestMetrics;
import io.apipipeline.server.core.cache.ResponseCache;
import io.apipipeline.server.core.health.HealthCheckRegistry;
import io.apipipeline.server.core.health.HealthCheckRunner;
import io.apipipeline.server.core.ratelimit.MemoryRateLimitAdapter;
import io.apipipeline.server.core.ratelimit.RateLimiter;
import io.apipipeline.server.core.validation.RequestValidator;
import io.apipipeline.server.spi.*;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Shared collaborators of all endpoint pipelines: adapter registries, JSON codec, meter registry,
 * executor and clock.
 *
 * <p>Without explicit adapters the builder registers {@code memory} cache and rate limit adapters
 * as defaults. Closing the services stops adapter sweeps and, when it was created here, the executor.
 * <pre>{@code
 * PipelineServices services = PipelineServices.builder()
 *     .authProvider("jwt", new JwtAuthProvider(JwtAuthConfig.fromEnvironment(System.getenv())))
 *     .build();
 * }</pre>
 */
public final class PipelineServices implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineServices.class);

    public static final String MEMORY = "memory";

    private final AdapterRegistry<CacheAdapter> cacheAdapters;
    private final AdapterRegistry<RateLimitAdapter> rateLimitAdapters;
    private final AdapterRegistry<AuthProvider> authProviders;
    private final HealthCheckRegistry healthChecks;
    private final JsonCodec jsonCodec;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Clock clock;

    private final ResponseCache responseCache;
    private final RateLimiter rateLimiter;
    private final Authenticator authenticator;
    private final RequestValidator validator;
    private final HealthCheckRunner healthRunner;
    private final RequestMetrics requestMetrics;

    private PipelineServices(Builder b) {
        this.clock = b.clock;
        this.cacheAdapters = b.cacheAdapters;
        this.rateLimitAdapters = b.rateLimitAdapters;
        this.authProviders = b.authProviders;
        if (cacheAdapters.names().isEmpty()) {
            cacheAdapters.register(MEMORY, new MemoryCacheAdapter(clock, b.sweepInterval));
        }
        if (rateLimitAdapters.names().isEmpty()) {
            rateLimitAdapters.register(MEMORY, new MemoryRateLimitAdapter(clock, b.sweepInterval));
        }
        this.healthChecks = b.healthChecks != null ? b.healthChecks : HealthCheckRegistry.withSystemCheck();
        this.jsonCodec = b.jsonCodec != null ? b.jsonCodec : JsonCodecs.discover();
        this.ownsExecutor = b.executor == null;
        this.executor = b.executor != null ? b.executor : HandlerThreads.newExecutor("api-handler");

        this.responseCache = new ResponseCache(cacheAdapters);
        this.rateLimiter = new RateLimiter(rateLimitAdapters);
        this.authenticator = new Authenticator(authProviders);
        this.validator = new RequestValidator(jsonCodec);
        this.healthRunner = new HealthCheckRunner(executor, clock);
        this.requestMetrics = new RequestMetrics(b.meterRegistry != null ? b.meterRegistry : new SimpleMeterRegistry());
    }

    public static Builder builder() {
        return new Builder();
    }

    public AdapterRegistry<CacheAdapter> cacheAdapters() {
        return cacheAdapters;
    }

    public AdapterRegistry<RateLimitAdapter> rateLimitAdapters() {
        return rateLimitAdapters;
    }

    public AdapterRegistry<AuthProvider> authProviders() {
        return authProviders;
    }

    public HealthCheckRegistry healthChecks() {
        return healthChecks;
    }

    public JsonCodec jsonCodec() {
        return jsonCodec;
    }

    public ExecutorService executor() {
        return executor;
    }

    public Clock clock() {
        return clock;
    }

    /** Registry holding the request counters and timers; callers may register their own gauges here. */
    public MeterRegistry meterRegistry() {
        return requestMetrics.registry();
    }

    public Authenticator authenticator() {
        return authenticator;
    }

    public HealthCheckRunner healthRunner() {
        return healthRunner;
    }

    ResponseCache responseCache() {
        return responseCache;
    }

    RateLimiter rateLimiter() {
        return rateLimiter;
    }

    RequestValidator validator() {
        return validator;
    }

    RequestMetrics requestMetrics() {
        return requestMetrics;
    }

    /** Removes cached entries whose key contains a match of {@code pattern} in the named (or default) adapter. */
    public void invalidateCache(String pattern, String adapter) {
        cacheAdapters.resolve(adapter).invalidate(pattern);
    }

    public void invalidateCache(String pattern) {
        invalidateCache(pattern, null);
    }

    public void invalidateCacheByTag(String tag, String adapter) {
        cacheAdapters.resolve(adapter).invalidateByTag(tag);
    }

    public void invalidateCacheByTag(String tag) {
        invalidateCacheByTag(tag, null);
    }

    public void clearCache(String adapter) {
        cacheAdapters.resolve(adapter).clear();
    }

    public void resetRateLimit(String key, String adapter) {
        rateLimitAdapters.resolve(adapter).reset(key);
    }

    public void resetRateLimit(String key) {
        resetRateLimit(key, null);
    }

    /** Current window of {@code key} without counting a request. */
    public RateLimitResult rateLimitStatus(String key, int limit, long windowSeconds, String adapter) {
        return rateLimitAdapters.resolve(adapter).get(key, limit, windowSeconds);
    }

    @Override
    public void close() throws Exception {
        if (ownsExecutor) executor.shutdownNow();
        Exception failure = null;
        for (AdapterRegistry<?> registry : new AdapterRegistry<?>[] {cacheAdapters, rateLimitAdapters, authProviders}) {
            try {
                registry.close();
            } catch (Exception e) {
                if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        if (failure != null) throw failure;
        log.debug("Pipeline services closed");
    }

    public static final class Builder {
        private final AdapterRegistry<CacheAdapter> cacheAdapters = new AdapterRegistry<>("Cache adapter");
        private final AdapterRegistry<RateLimitAdapter> rateLimitAdapters = new AdapterRegistry<>("Rate limit adapter");
        private final AdapterRegistry<AuthProvider> authProviders = new AdapterRegistry<>("Authentication provider");
        private HealthCheckRegistry healthChecks;
        private JsonCodec jsonCodec;
        private ExecutorService executor;
        private MeterRegistry meterRegistry;
        private Clock clock = Clock.systemUTC();
        private Duration sweepInterval = MemoryCacheAdapter.DEFAULT_SWEEP_INTERVAL;

        private Builder() {}

        /** Registers a cache adapter; the first one registered is the default. */
        public Builder cacheAdapter(String name, CacheAdapter adapter) {
            cacheAdapters.register(name, adapter);
            return this;
        }

        /** Registers a rate limit adapter; the first one registered is the default. */
        public Builder rateLimitAdapter(String name, RateLimitAdapter adapter) {
            rateLimitAdapters.register(name, adapter);
            return this;
        }

        /** Registers an auth provider; the first one registered is the default. */
        public Builder authProvider(String name, AuthProvider provider) {
            authProviders.register(name, provider);
            return this;
        }

        /** Default: a registry holding the {@code system} heap check. */
        public Builder healthChecks(HealthCheckRegistry healthChecks) {
            this.healthChecks = healthChecks;
            return this;
        }

        /** Default: discovered through {@link JsonCodecs#discover()}. */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /** Executor for timeout-bounded handlers and health probes. Not shut down by {@link #close()}. */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /** Default: a {@link SimpleMeterRegistry}. */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** Sweep interval of the default memory adapters; {@code null} disables sweeping. Default: 60 seconds. */
        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        public PipelineServices build() {
            return new PipelineServices(this);
        }
    }
}
