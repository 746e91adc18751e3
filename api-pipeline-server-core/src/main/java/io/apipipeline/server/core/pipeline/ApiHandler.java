package io.apipipeline.server.core.pipeline;

import io.apipipeline.server.core.ServerRequest;

/**
 * Business logic of an endpoint.
 *
 * <p>Return an {@link ApiResponse} for full control; any other value is wrapped in the success
 * envelope with status 200. Throw an {@link io.apipipeline.core.ApiException} to answer with its
 * status; other exceptions become 500. With a timeout configured the handler runs on another
 * thread and is interrupted once the deadline passes.
 */
@FunctionalInterface
public interface ApiHandler {

    Object handle(ServerRequest request, ApiContext context) throws Exception;
}
