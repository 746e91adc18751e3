package io.apipipeline.server.core.cache;

import io.apipipeline.server.core.QueryString;
import io.apipipeline.server.core.ServerRequest;

import java.util.Map;
import java.util.StringJoiner;

/**
 * Derives response cache keys.
 *
 * <p>Precedence: fixed key, then key function, then {@code METHOD|uri} followed by the optional
 * {@code query:}, {@code headers:} and {@code user:} parts, joined with {@code |}.
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String key(ServerRequest request, CacheOptions options) {
        if (options.key().isPresent()) return options.key().get();
        if (options.keyFunction().isPresent()) return options.keyFunction().get().apply(request);

        StringJoiner key = new StringJoiner("|");
        key.add(request.method().name());
        key.add(request.uri().toString());

        if (options.includeQuery()) {
            Map<String, String> query = request.query();
            if (!query.isEmpty()) key.add("query:" + QueryString.sorted(query));
        }

        if (!options.headerNames().isEmpty()) {
            StringJoiner headers = new StringJoiner("&");
            for (String name : options.headerNames()) {
                request.firstHeader(name).ifPresent(v -> headers.add(name + "=" + v));
            }
            if (headers.length() > 0) key.add("headers:" + headers);
        }

        if (options.varyByUser()) {
            request.user().ifPresent(u -> key.add("user:" + u.id()));
        }
        return key.toString();
    }
}
