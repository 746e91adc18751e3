package io.apipipeline.server.core.decorate;

import io.apipipeline.server.core.ServerRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one structured record per completed request.
 *
 * <p>Fields are attached as SLF4J key-value pairs: {@code requestId}, {@code method},
 * {@code path}, {@code status}, {@code durationMs}, {@code clientAddress} and, when enabled,
 * {@code headers} and {@code query} with sensitive values masked.
 */
public final class RequestLogger {

    private static final Logger log = LoggerFactory.getLogger(RequestLogger.class);

    private RequestLogger() {}

    public static void log(ServerRequest request, int status, Duration elapsed, LoggingOptions options) {
        if (!log.isEnabledForLevel(options.level())) return;

        String requestId = request.requestId().orElse(null);
        LoggingEventBuilder event = log.atLevel(options.level())
                .addKeyValue("requestId", requestId)
                .addKeyValue("method", request.method().name())
                .addKeyValue("path", request.path())
                .addKeyValue("status", status)
                .addKeyValue("durationMs", elapsed.toMillis())
                .addKeyValue("clientAddress", request.clientAddress());
        if (options.logHeaders()) event = event.addKeyValue("headers", sanitizeHeaders(request.headers(), options));
        if (options.logQuery()) event = event.addKeyValue("query", sanitize(request.query(), options));
        event.log("{} {} {} {}ms", request.method(), request.path(), status, elapsed.toMillis());
    }

    static Map<String, String> sanitizeHeaders(Map<String, List<String>> headers, LoggingOptions options) {
        Map<String, String> out = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (name == null) return;
            out.put(name, options.isRedacted(name) ? LoggingOptions.REDACTED : values == null ? "" : String.join(", ", values));
        });
        return out;
    }

    static Map<String, String> sanitize(Map<String, String> values, LoggingOptions options) {
        Map<String, String> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k, options.isRedacted(k) ? LoggingOptions.REDACTED : v));
        return out;
    }
}
