package io.apipipeline.server.core;

import io.apipipeline.core.Headers;
import io.apipipeline.core.HttpMethod;
import io.apipipeline.server.spi.ApiUser;

import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Framework-neutral request abstraction.
 *
 * <p>Immutable except for the authenticated user and the request id, which the pipeline sets
 * exactly once per request.
 */
public final class ServerRequest {

    public static final String UNKNOWN_CLIENT = "unknown";

    private final HttpMethod method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final InputStream body; // may be null
    private final String clientAddress;
    private final AtomicReference<ApiUser> user = new AtomicReference<>();
    private final AtomicReference<String> requestId = new AtomicReference<>();

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body) {
        this(method, uri, headers, body, null);
    }

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body,
                         String clientAddress) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = body;
        this.clientAddress = clientAddress == null || clientAddress.isBlank() ? UNKNOWN_CLIENT : clientAddress;
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    /** Raw (still percent-encoded) path; {@code "/"} when the URI has none. */
    public String path() {
        String p = uri.getRawPath();
        return p == null || p.isEmpty() ? "/" : p;
    }

    /** Decoded query parameters; the last occurrence of a repeated key wins. */
    public Map<String, String> query() {
        return QueryString.parse(uri);
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public Optional<String> firstHeader(String name) {
        return Headers.firstValue(headers, name);
    }

    public Optional<String> cookie(String name) {
        return Headers.cookie(headers, name);
    }

    public InputStream body() {
        return body;
    }

    public String clientAddress() {
        return clientAddress;
    }

    public Optional<ApiUser> user() {
        return Optional.ofNullable(user.get());
    }

    /**
     * @throws IllegalStateException if a user is already attached
     */
    public void attachUser(ApiUser apiUser) {
        Objects.requireNonNull(apiUser, "user");
        if (!user.compareAndSet(null, apiUser)) throw new IllegalStateException("user already attached");
    }

    public Optional<String> requestId() {
        return Optional.ofNullable(requestId.get());
    }

    /**
     * @throws IllegalStateException if an id is already assigned
     */
    public void assignRequestId(String id) {
        Objects.requireNonNull(id, "requestId");
        if (!requestId.compareAndSet(null, id)) throw new IllegalStateException("request id already assigned");
    }
}
