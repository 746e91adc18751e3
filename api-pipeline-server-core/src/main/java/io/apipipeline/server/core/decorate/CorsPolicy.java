package io.apipipeline.server.core.decorate;

import io.apipipeline.core.Headers;
import io.apipipeline.server.core.ResponseBody;
import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.core.ServerResponse;

import java.util.Optional;

/**
 * Writes CORS response headers.
 *
 * <p>With the wildcard origin every response is decorated ({@code *}, or the echoed
 * {@code Origin} when credentials are allowed). With an explicit list only requests whose
 * {@code Origin} is listed are decorated, and the origin is echoed with {@code Vary: Origin}.
 */
public final class CorsPolicy {

    public static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    public static final String ALLOW_METHODS = "Access-Control-Allow-Methods";
    public static final String ALLOW_HEADERS = "Access-Control-Allow-Headers";
    public static final String ALLOW_CREDENTIALS = "Access-Control-Allow-Credentials";
    public static final String EXPOSE_HEADERS = "Access-Control-Expose-Headers";
    public static final String MAX_AGE = "Access-Control-Max-Age";

    private CorsPolicy() {}

    /** Empty preflight answer carrying the CORS headers. */
    public static ServerResponse preflight(ServerRequest request, CorsOptions options) {
        ServerResponse response = new ServerResponse(options.preflightStatus(), new ResponseBody.Empty());
        if (apply(request, response, options)) {
            options.maxAge().ifPresent(age -> response.setHeader(MAX_AGE, Long.toString(age.getSeconds())));
        }
        return response;
    }

    /**
     * @return whether the request origin was allowed and headers were written
     */
    public static boolean apply(ServerRequest request, ServerResponse response, CorsOptions options) {
        Optional<String> origin = allowedOrigin(request.firstHeader(Headers.ORIGIN), options);
        if (origin.isEmpty()) return false;

        response.setHeader(ALLOW_ORIGIN, origin.get());
        if (!CorsOptions.ANY_ORIGIN.equals(origin.get())) response.setHeader(Headers.VARY, Headers.ORIGIN);
        response.setHeader(ALLOW_METHODS, String.join(",", options.methods()));
        response.setHeader(ALLOW_HEADERS, String.join(", ", options.allowedHeaders()));
        if (options.credentials()) response.setHeader(ALLOW_CREDENTIALS, "true");
        if (!options.exposedHeaders().isEmpty()) {
            response.setHeader(EXPOSE_HEADERS, String.join(", ", options.exposedHeaders()));
        }
        return true;
    }

    static Optional<String> allowedOrigin(Optional<String> requestOrigin, CorsOptions options) {
        if (options.anyOrigin()) {
            if (options.credentials() && requestOrigin.isPresent()) return requestOrigin;
            return Optional.of(CorsOptions.ANY_ORIGIN);
        }
        return requestOrigin.filter(o -> options.origins().contains(o));
    }
}
