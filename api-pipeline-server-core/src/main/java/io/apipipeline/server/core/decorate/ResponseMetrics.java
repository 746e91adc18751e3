package io.apipipeline.server.core.decorate;

import io.apipipeline.core.Headers;
import io.apipipeline.server.core.ServerResponse;

import java.time.Duration;

/**
 * Adds timing and correlation headers.
 */
public final class ResponseMetrics {

    private ResponseMetrics() {}

    public static void apply(ServerResponse response, String requestId, Duration elapsed, MetricsOptions options) {
        if (options.responseTime()) response.setHeader(Headers.X_RESPONSE_TIME, elapsed.toMillis() + "ms");
        if (options.requestId() && requestId != null) response.setHeader(Headers.X_REQUEST_ID, requestId);
    }
}
