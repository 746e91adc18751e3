package io.apipipeline.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for every failure the pipeline turns into a response.
 *
 * <p>Carries the HTTP status, an optional machine-readable code, optional warnings and optional
 * metadata. Handlers may throw this class directly for statuses without a dedicated subtype.
 */
public class ApiException extends RuntimeException {

    private final int status;
    private final String code;
    private final List<String> warnings;
    private final Map<String, Object> metadata;

    public ApiException(String message, int status) {
        this(message, status, null, null, null, null);
    }

    public ApiException(String message, int status, String code) {
        this(message, status, code, null, null, null);
    }

    public ApiException(String message, int status, String code, List<String> warnings, Map<String, Object> metadata) {
        this(message, status, code, warnings, metadata, null);
    }

    public ApiException(String message, int status, String code, List<String> warnings,
                        Map<String, Object> metadata, Throwable cause) {
        super(message, cause);
        if (status < 100 || status > 599) throw new IllegalArgumentException("status out of range: " + status);
        this.status = status;
        this.code = code;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public int status() {
        return status;
    }

    /** Machine-readable error code, or {@code null}. */
    public String code() {
        return code;
    }

    public List<String> warnings() {
        return warnings;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * Malformed or unsupported request (400).
     */
    public static class BadRequest extends ApiException {
        public BadRequest(String message) {
            super(message, 400);
        }
    }

    /**
     * One or more schema violations across query, body and path parameters (400).
     */
    public static class ValidationFailed extends ApiException {
        public static final String CODE = "VALIDATION_ERROR";

        public ValidationFailed(Map<String, Object> details) {
            super("Validation error", 400, CODE, null, Map.of("details", details));
        }
    }

    /**
     * No valid credentials (401).
     */
    public static class AuthenticationRequired extends ApiException {
        public AuthenticationRequired() {
            this("Authentication required");
        }

        public AuthenticationRequired(String message) {
            super(message, 401);
        }

        public AuthenticationRequired(String message, Throwable cause) {
            super(message, 401, null, null, null, cause);
        }

        protected AuthenticationRequired(String message, String code) {
            super(message, 401, code);
        }
    }

    /**
     * Token could not be parsed, verified or lacks required claims (401).
     */
    public static class InvalidToken extends AuthenticationRequired {
        public InvalidToken(String message) {
            super(message, "INVALID_TOKEN");
        }
    }

    /**
     * Token verified but is past its expiry (401).
     */
    public static class TokenExpired extends AuthenticationRequired {
        public TokenExpired(String message) {
            super(message, "TOKEN_EXPIRED");
        }
    }

    /**
     * Authenticated user lacks the required roles or permissions (403).
     */
    public static class Forbidden extends ApiException {
        public Forbidden(String message) {
            super(message, 403);
        }
    }

    /**
     * No route or resource (404).
     */
    public static class NotFound extends ApiException {
        public NotFound(String message) {
            super(message, 404);
        }
    }

    /**
     * The handler did not complete before the configured deadline (408).
     */
    public static class RequestTimeout extends ApiException {
        public RequestTimeout() {
            super("Request timeout", 408);
        }
    }

    /**
     * Fixed-window limit exceeded (429 unless configured otherwise).
     */
    public static class RateLimited extends ApiException {
        private final long retryAfterSeconds;

        public RateLimited(String message, int status, int limit, long resetSeconds, long retryAfterSeconds) {
            super(message, status, "RATE_LIMITED", null, rateMetadata(limit, resetSeconds, retryAfterSeconds));
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public long retryAfterSeconds() {
            return retryAfterSeconds;
        }

        private static Map<String, Object> rateMetadata(int limit, long reset, long retryAfter) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("limit", limit);
            m.put("remaining", 0);
            m.put("reset", reset);
            m.put("retryAfter", retryAfter);
            return m;
        }
    }

    /**
     * Unexpected failure (500).
     */
    public static class Internal extends ApiException {
        public Internal(String message) {
            super(message, 500);
        }

        public Internal(String message, Throwable cause) {
            super(message, 500, null, null, null, cause);
        }
    }

    /**
     * An adapter or provider was requested by a name that is not registered (500).
     */
    public static class AdapterMisconfigured extends ApiException {
        public AdapterMisconfigured(String message) {
            super(message, 500, "ADAPTER_MISCONFIGURED");
        }
    }
}
