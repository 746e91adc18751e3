package io.apipipeline.server.core.decorate;

/**
 * Which metric headers decorated responses carry, and whether the request is recorded in the
 * services' meter registry.
 *
 * @param responseTime add {@code X-Response-Time: <n>ms}
 * @param requestId add {@code X-Request-ID}
 * @param record count the request and time it through {@link RequestMetrics}
 */
public record MetricsOptions(boolean responseTime, boolean requestId, boolean record) {

    public static MetricsOptions defaults() {
        return new MetricsOptions(true, true, true);
    }

    public static MetricsOptions headersOnly() {
        return new MetricsOptions(true, true, false);
    }
}
