package io.apipipeline.server.core.router;

import java.util.Objects;

/**
 * A registered route.
 *
 * @param method upper-case HTTP method, or {@link Router#ALL}
 */
public record Route(String method, RoutePattern pattern, Endpoint endpoint) {

    public Route {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(endpoint, "endpoint");
    }

    public boolean acceptsMethod(String requestMethod) {
        return Router.ALL.equals(method) || method.equals(requestMethod);
    }
}
