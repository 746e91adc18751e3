package io.apipipeline.server.core.pipeline;

import io.apipipeline.core.ApiException;
import io.apipipeline.core.Headers;
import io.apipipeline.core.HttpMethod;
import io.apipipeline.json.spi.JsonException;
import io.apipipeline.server.core.HandlerThreads;
import io.apipipeline.server.core.ResponseBody;
import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.core.ServerResponse;
import io.apipipeline.server.core.auth.Authenticator;
import io.apipipeline.server.core.cache.CacheKeys;
import io.apipipeline.server.core.cache.CacheOptions;
import io.apipipeline.server.core.decorate.CorsOptions;
import io.apipipeline.server.core.decorate.CorsPolicy;
import io.apipipeline.server.core.decorate.MetricsOptions;
import io.apipipeline.server.core.decorate.RequestLogger;
import io.apipipeline.server.core.decorate.ResponseMetrics;
import io.apipipeline.server.core.health.HealthCheck;
import io.apipipeline.server.core.health.HealthOptions;
import io.apipipeline.server.core.health.HealthReport;
import io.apipipeline.server.core.ratelimit.RateLimitOptions;
import io.apipipeline.server.core.router.Endpoint;
import io.apipipeline.server.core.validation.RequestValidator;
import io.apipipeline.server.spi.ApiUser;
import io.apipipeline.server.spi.RateLimitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Framework-neutral endpoint running the configured concerns in a fixed order:
 * <ol>
 *   <li>health short-circuit (no decoration)</li>
 *   <li>CORS preflight for {@code OPTIONS}</li>
 *   <li>rate limit, authentication, validation</li>
 *   <li>handler, bounded by the timeout and wrapped by the response cache for GET</li>
 *   <li>CORS, metrics and logging decoration, on success and failure alike; with
 *       {@link MetricsOptions#record()} the request is also counted and timed</li>
 * </ol>
 *
 * <p>Every failure is caught here once and rendered as the failure envelope.
 * <pre>{@code
 * router.get("/users/:id", new EndpointPipeline(config, services));
 * }</pre>
 */
public final class EndpointPipeline implements Endpoint {

    private static final Logger log = LoggerFactory.getLogger(EndpointPipeline.class);

    private static final byte[] FALLBACK_ERROR =
            "{\"success\":false,\"error\":\"Internal server error\"}".getBytes(StandardCharsets.UTF_8);

    private final EndpointConfig config;
    private final PipelineServices services;

    public EndpointPipeline(EndpointConfig config, PipelineServices services) {
        this.config = Objects.requireNonNull(config, "config");
        this.services = Objects.requireNonNull(services, "services");
    }

    public EndpointConfig config() {
        return config;
    }

    @Override
    public ServerResponse handle(ServerRequest request, Map<String, String> params) {
        long startNanos = System.nanoTime();
        Instant startTime = services.clock().instant();
        String requestId = request.requestId().orElseGet(() -> {
            String id = UUID.randomUUID().toString();
            request.assignRequestId(id);
            return id;
        });
        Map<String, String> routeParams = params == null ? Map.of() : params;

        Optional<HealthOptions> health = config.health();
        if (health.isPresent() && health.get().matches(request.method(), request.path())) {
            return health(health.get());
        }

        if (recordsMetrics()) services.requestMetrics().started();

        Optional<CorsOptions> cors = config.cors();
        if (cors.isPresent() && request.method() == HttpMethod.OPTIONS) {
            ServerResponse preflight = CorsPolicy.preflight(request, cors.get());
            finish(request, preflight, requestId, startNanos);
            return preflight;
        }

        ApiResponse result;
        try {
            result = execute(request, routeParams, requestId, startTime);
        } catch (ApiException e) {
            if (e.status() >= 500) {
                log.error("{} {} {} failed with {}", config.name(), request.method(), request.path(), e.status(), e);
            } else {
                log.debug("{} {} {} rejected with {}: {}", config.name(), request.method(), request.path(), e.status(), e.getMessage());
            }
            result = ApiResponse.failure(e);
        } catch (Exception e) {
            log.error("Unhandled error in {} {} {} [{}]", config.name(), request.method(), request.path(), requestId, e);
            result = ApiResponse.failure(new ApiException.Internal("Internal server error", e));
        }

        ServerResponse response = render(result);
        cors.ifPresent(c -> CorsPolicy.apply(request, response, c));
        finish(request, response, requestId, startNanos);
        return response;
    }

    private ApiResponse execute(ServerRequest request, Map<String, String> params, String requestId,
                                Instant startTime) throws Exception {
        Optional<ApiUser> user = Optional.empty();
        ApiException authFailure = null;
        boolean authBeforeRateLimit = config.auth().isPresent()
                && config.rateLimit().map(RateLimitOptions::varyByUser).orElse(false);
        if (authBeforeRateLimit) {
            // user must be attached before the rate limit key is built; a rejection surfaces after the limit check
            try {
                user = services.authenticator().authenticate(request, config.auth().get());
            } catch (ApiException e) {
                authFailure = e;
            }
        }

        RateLimitResult rate = null;
        if (config.rateLimit().isPresent()) {
            rate = services.rateLimiter().check(request, config.rateLimit().get());
        }

        if (authFailure != null) throw authFailure;
        if (config.auth().isPresent() && !authBeforeRateLimit) {
            user = services.authenticator().authenticate(request, config.auth().get());
        }

        RequestValidator.Validated validated = config.validation().isPresent()
                ? services.validator().validate(request, params, config.validation().get())
                : new RequestValidator.Validated(request.query(), null, params);

        ApiContext context = ApiContext.builder(request)
                .params(params, validated.params())
                .query(validated.query())
                .body(validated.body())
                .startTime(startTime)
                .requestId(requestId)
                .token(user.isPresent() ? Authenticator.extractToken(request).orElse(null) : null)
                .user(user.orElse(null))
                .rateLimit(rate)
                .build();

        Callable<ApiResponse> timed = () -> invoke(request, context);
        Optional<CacheOptions> cache = config.cache();
        if (cache.isPresent() && request.method() == HttpMethod.GET) {
            String key = CacheKeys.key(request, cache.get());
            return services.responseCache().getOrCompute(key, cache.get(), ApiResponse.class, timed, r -> r.status() < 400);
        }
        return timed.call();
    }

    private ApiResponse invoke(ServerRequest request, ApiContext context) throws Exception {
        ApiHandler handler = config.handler();
        Optional<Duration> timeout = config.timeout();
        if (timeout.isEmpty()) return toApiResponse(handler.handle(request, context));

        Future<Object> future = services.executor().submit(HandlerThreads.labelled(
                config.name() + " " + context.requestId(), () -> handler.handle(request, context)));
        try {
            return toApiResponse(future.get(timeout.get().toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} {} {} timed out after {}ms [{}]", config.name(), request.method(), request.path(),
                    timeout.get().toMillis(), context.requestId());
            throw new ApiException.RequestTimeout();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private static ApiResponse toApiResponse(Object result) {
        return result instanceof ApiResponse response ? response : ApiResponse.success(result);
    }

    private ServerResponse health(HealthOptions options) {
        List<HealthCheck> checks = options.checks().orElseGet(() -> services.healthChecks().checks());
        HealthReport report = services.healthRunner().run(checks, options);
        return render(ApiResponse.json(report.httpStatus(), report.body()));
    }

    private ServerResponse render(ApiResponse result) {
        try {
            return result.toServerResponse(services.jsonCodec());
        } catch (JsonException e) {
            log.error("Failed to encode response body for {}", config.name(), e);
            return new ServerResponse(500, new ResponseBody.Bytes(FALLBACK_ERROR))
                    .header(Headers.CONTENT_TYPE, Headers.CT_JSON);
        }
    }

    private void finish(ServerRequest request, ServerResponse response, String requestId, long startNanos) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        config.metrics().ifPresent(m -> ResponseMetrics.apply(response, requestId, elapsed, m));
        config.logging().ifPresent(l -> RequestLogger.log(request, response.status(), elapsed, l));
        if (recordsMetrics()) {
            services.requestMetrics().completed(config.name(), request.method(), response.status(), elapsed);
        }
    }

    private boolean recordsMetrics() {
        return config.metrics().map(MetricsOptions::record).orElse(false);
    }
}
