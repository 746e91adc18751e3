package io.apipipeline.server.core;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Minimal query string parser (framework-neutral).
 */
public final class QueryString {

    private QueryString() {}

    /**
     * Parses the raw query of {@code uri}, preserving first-seen key order.
     */
    public static Map<String, String> parse(URI uri) {
        String q = uri.getRawQuery();
        if (q == null || q.isEmpty()) return Map.of();
        Map<String, String> out = new LinkedHashMap<>();
        for (String part : q.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            if (eq < 0) {
                out.put(decode(part), "");
            } else {
                String k = decode(part.substring(0, eq));
                String v = decode(part.substring(eq + 1));
                out.put(k, v);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Renders parameters as {@code k=v&k=v} with keys in natural order.
     */
    public static String sorted(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        new TreeMap<>(params).forEach((k, v) -> joiner.add(k + "=" + v));
        return joiner.toString();
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
