package io.apipipeline.server.core.router;

import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.core.ServerResponse;

import java.util.Map;

/**
 * The route that won dispatch together with its captured parameters.
 */
public record RouteMatch(Route route, Map<String, String> params) {

    public ServerResponse invoke(ServerRequest request) {
        return route.endpoint().handle(request, params);
    }
}
