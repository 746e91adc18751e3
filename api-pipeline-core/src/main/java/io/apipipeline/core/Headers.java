package io.apipipeline.core;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal helpers for case-insensitive header lookup.
 */
public final class Headers {

    public static final String AUTHORIZATION = "Authorization";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String COOKIE = "Cookie";
    public static final String ORIGIN = "Origin";
    public static final String RETRY_AFTER = "Retry-After";
    public static final String VARY = "Vary";
    public static final String X_REQUEST_ID = "X-Request-ID";
    public static final String X_RESPONSE_TIME = "X-Response-Time";
    public static final String X_REFRESH_TOKEN = "X-Refresh-Token";

    public static final String CT_JSON = "application/json";
    public static final String CT_TEXT = "text/plain; charset=utf-8";

    private Headers() {}

    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        String target = name.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (e.getKey() == null) continue;
            if (e.getKey().toLowerCase(Locale.ROOT).equals(target)) {
                Iterable<String> vals = e.getValue();
                if (vals == null) return Optional.empty();
                for (String v : vals) {
                    if (v != null) return Optional.of(v);
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Reads a cookie value from the {@code Cookie} header.
     */
    public static Optional<String> cookie(Map<String, ? extends Iterable<String>> headers, String name) {
        if (name == null) return Optional.empty();
        Optional<String> raw = firstValue(headers, COOKIE);
        if (raw.isEmpty()) return Optional.empty();
        for (String part : raw.get().split(";")) {
            int eq = part.indexOf('=');
            if (eq < 0) continue;
            if (part.substring(0, eq).trim().equals(name)) {
                return Optional.of(part.substring(eq + 1).trim());
            }
        }
        return Optional.empty();
    }
}
