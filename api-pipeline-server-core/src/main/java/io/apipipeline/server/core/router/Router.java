package io.apipipeline.server.core.router;

import io.apipipeline.core.Headers;
import io.apipipeline.core.HttpMethod;
import io.apipipeline.server.core.ResponseBody;
import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.core.ServerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Maps method + path to a registered {@link Endpoint}.
 *
 * <p>Routes are tried in registration order and the first whose method and pattern both match
 * wins. Registration may happen at any time; dispatch never blocks.
 * <pre>{@code
 * Router router = new Router()
 *     .get("/users/:id", usersEndpoint)
 *     .all("/files/**", filesEndpoint);
 * ServerResponse resp = router.handle(request, Router::notFound);
 * }</pre>
 */
public final class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    /** Method wildcard matching every verb. */
    public static final String ALL = "ALL";

    private final List<Route> routes = new CopyOnWriteArrayList<>();

    /**
     * @param method an {@link HttpMethod} name or {@link #ALL}, case-insensitive
     * @throws IllegalArgumentException on an unknown method or an invalid template
     */
    public Router register(String method, String template, Endpoint endpoint) {
        String normalized = normalizeMethod(method);
        Route route = new Route(normalized, RoutePattern.compile(template), endpoint);
        routes.add(route);
        log.debug("Registered route {} {}", normalized, template);
        return this;
    }

    public Router get(String template, Endpoint endpoint) {
        return register("GET", template, endpoint);
    }

    public Router post(String template, Endpoint endpoint) {
        return register("POST", template, endpoint);
    }

    public Router put(String template, Endpoint endpoint) {
        return register("PUT", template, endpoint);
    }

    public Router delete(String template, Endpoint endpoint) {
        return register("DELETE", template, endpoint);
    }

    public Router patch(String template, Endpoint endpoint) {
        return register("PATCH", template, endpoint);
    }

    public Router options(String template, Endpoint endpoint) {
        return register("OPTIONS", template, endpoint);
    }

    public Router head(String template, Endpoint endpoint) {
        return register("HEAD", template, endpoint);
    }

    public Router all(String template, Endpoint endpoint) {
        return register(ALL, template, endpoint);
    }

    public Optional<RouteMatch> dispatch(HttpMethod method, String path) {
        return dispatch(method.name(), path);
    }

    public Optional<RouteMatch> dispatch(String method, String path) {
        String verb = method == null ? "" : method.toUpperCase(Locale.ROOT);
        for (Route route : routes) {
            if (!route.acceptsMethod(verb)) continue;
            Optional<Map<String, String>> params = route.pattern().match(path);
            if (params.isPresent()) return Optional.of(new RouteMatch(route, params.get()));
        }
        return Optional.empty();
    }

    /**
     * Dispatches the request and invokes the matched endpoint, or {@code notFound} when no route matches.
     */
    public ServerResponse handle(ServerRequest request, Function<ServerRequest, ServerResponse> notFound) {
        Objects.requireNonNull(notFound, "notFound");
        return dispatch(request.method(), request.path())
                .map(match -> match.invoke(request))
                .orElseGet(() -> notFound.apply(request));
    }

    public ServerResponse handle(ServerRequest request) {
        return handle(request, Router::notFound);
    }

    /** Plain 404 fallback. */
    public static ServerResponse notFound(ServerRequest request) {
        return new ServerResponse(404, new ResponseBody.Bytes("Not found".getBytes(StandardCharsets.UTF_8)))
                .header(Headers.CONTENT_TYPE, Headers.CT_TEXT);
    }

    /** Snapshot of the route table in registration order. */
    public List<Route> routes() {
        return List.copyOf(routes);
    }

    private static String normalizeMethod(String method) {
        if (method == null || method.isBlank()) throw new IllegalArgumentException("method must not be blank");
        String upper = method.trim().toUpperCase(Locale.ROOT);
        if (ALL.equals(upper)) return ALL;
        return HttpMethod.parse(upper).name();
    }
}
