package io.apipipeline.server.core.ratelimit;

import io.apipipeline.core.ApiException;
import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.spi.AdapterRegistry;
import io.apipipeline.server.spi.RateLimitAdapter;
import io.apipipeline.server.spi.RateLimitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Rate limiting stage: counts the request against its key and rejects it once the window is full.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final AdapterRegistry<RateLimitAdapter> adapters;

    public RateLimiter(AdapterRegistry<RateLimitAdapter> adapters) {
        this.adapters = Objects.requireNonNull(adapters, "adapters");
    }

    /**
     * @return the counted result when the request is allowed
     * @throws ApiException.RateLimited when the window is exceeded
     */
    public RateLimitResult check(ServerRequest request, RateLimitOptions options) {
        RateLimitAdapter adapter = adapters.resolve(options.adapter());
        String key = key(request, options);
        RateLimitResult result = adapter.increment(key, options.limit(), options.windowSeconds());
        if (result.limited()) {
            log.debug("Rate limit exceeded for {} (retry after {}s)", key, result.retryAfter());
            throw new ApiException.RateLimited(options.message(), options.statusCode(),
                    options.limit(), result.reset(), result.retryAfter());
        }
        return result;
    }

    /**
     * Derives the counter key: the key generator when configured, otherwise
     * {@code name|ip:<client>} plus optional {@code user:}, {@code route:} and {@code method:} parts.
     */
    public static String key(ServerRequest request, RateLimitOptions options) {
        if (options.keyGenerator().isPresent()) return options.keyGenerator().get().apply(request);

        StringJoiner key = new StringJoiner("|");
        key.add(options.name());
        key.add("ip:" + request.clientAddress());
        if (options.varyByUser()) {
            request.user().ifPresent(u -> key.add("user:" + u.id()));
        }
        if (options.varyByRoute()) key.add("route:" + request.path());
        if (options.varyByMethod()) key.add("method:" + request.method().name());
        return key.toString();
    }
}
