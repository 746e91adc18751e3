package io.apipipeline.server.core.router;

import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.core.ServerResponse;

import java.util.Map;

/**
 * Target bound to a route. Usually an {@link io.apipipeline.server.core.pipeline.EndpointPipeline}.
 */
@FunctionalInterface
public interface Endpoint {

    /**
     * @param params decoded path parameters captured by the route pattern
     */
    ServerResponse handle(ServerRequest request, Map<String, String> params);
}
