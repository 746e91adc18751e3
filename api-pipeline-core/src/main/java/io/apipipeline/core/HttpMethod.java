package io.apipipeline.core;

import java.util.Locale;

/**
 * HTTP methods understood by the router and the pipeline.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    PATCH,
    OPTIONS,
    HEAD;

    /**
     * Whether requests with this method conventionally carry a body that should be validated.
     */
    public boolean carriesBody() {
        return this == POST || this == PUT || this == PATCH;
    }

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException if the name is not a supported method
     */
    public static HttpMethod parse(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("method must not be blank");
        return HttpMethod.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
