package io.apipipeline.server.core.decorate;

import io.apipipeline.core.HttpMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Request counters, response time timer and in-flight gauge of the endpoint pipelines.
 *
 * <pre>
 * api.requests          Counter  (endpoint, method, status, outcome)
 * api.response.time     Timer    (endpoint, method, outcome), p50/p95/p99
 * api.requests.active   Gauge    requests between start and decoration
 * </pre>
 *
 * Tags stay low-cardinality: no URL or request id.
 */
public final class RequestMetrics {

    private static final Logger log = LoggerFactory.getLogger(RequestMetrics.class);

    public static final String REQUESTS = "api.requests";
    public static final String RESPONSE_TIME = "api.response.time";
    public static final String ACTIVE = "api.requests.active";

    private final MeterRegistry registry;
    private final AtomicInteger active = new AtomicInteger();

    public RequestMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        Gauge.builder(ACTIVE, active, AtomicInteger::get)
                .description("Requests currently inside an endpoint pipeline")
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void started() {
        active.incrementAndGet();
    }

    /**
     * Records one finished request; pairs with a preceding {@link #started()}.
     */
    public void completed(String endpoint, HttpMethod method, int status, Duration elapsed) {
        active.decrementAndGet();
        String outcome = outcome(status);
        Counter.builder(REQUESTS)
                .description("Requests handled by endpoint pipelines")
                .tag("endpoint", endpoint)
                .tag("method", method.name())
                .tag("status", String.valueOf(status))
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder(RESPONSE_TIME)
                .description("Time from pipeline entry to decorated response")
                .tag("endpoint", endpoint)
                .tag("method", method.name())
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(elapsed);
        log.trace("Recorded {} {} -> {} in {}ms", endpoint, method, status, elapsed.toMillis());
    }

    /** Current number of in-flight requests. */
    public int active() {
        return active.get();
    }

    static String outcome(int status) {
        if (status < 200) return "INFORMATIONAL";
        if (status < 300) return "SUCCESS";
        if (status < 400) return "REDIRECTION";
        if (status < 500) return "CLIENT_ERROR";
        return "SERVER_ERROR";
    }
}
