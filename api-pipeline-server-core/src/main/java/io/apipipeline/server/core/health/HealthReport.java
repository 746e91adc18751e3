package io.apipipeline.server.core.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated probe results.
 *
 * @param status {@code healthy}, {@code degraded} or {@code critical}
 * @param checks per-check results in execution order
 * @param metadata timestamp, duration, version and environment
 */
public record HealthReport(String status, Map<String, CheckResult> checks, Map<String, Object> metadata) {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";
    public static final String DEGRADED = "degraded";
    public static final String CRITICAL = "critical";

    public HealthReport {
        checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * @param error failure description, {@code null} when the probe completed
     */
    public record CheckResult(String status, boolean critical, String error) {

        public boolean healthy() {
            return HEALTHY.equals(status);
        }
    }

    /** 200 when healthy, 207 when degraded, 503 when critical. */
    public int httpStatus() {
        return switch (status) {
            case HEALTHY -> 200;
            case DEGRADED -> 207;
            default -> 503;
        };
    }

    /** JSON-ready representation: {@code {status, checks, metadata}}. */
    public Map<String, Object> body() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("checks", checks);
        body.put("metadata", metadata);
        return body;
    }
}
