package io.apipipeline.server.core.validation;

import io.apipipeline.core.ApiException;
import io.apipipeline.json.spi.JsonCodec;
import io.apipipeline.json.spi.JsonException;
import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.spi.ValidationResult;
import io.apipipeline.server.spi.ValidationSchema;
import io.apipipeline.server.spi.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Validation stage.
 *
 * <p>Runs every configured schema before deciding, so one response reports the violations of
 * query, body and params together. Nothing is returned unless all sections pass.
 */
public final class RequestValidator {

    private static final Logger log = LoggerFactory.getLogger(RequestValidator.class);

    private final JsonCodec codec;

    public RequestValidator(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Validated values. A section without a schema carries the raw input ({@code body} is then null).
     */
    public record Validated(Object query, Object body, Object params) {}

    /**
     * @throws ApiException.ValidationFailed when any section has violations
     */
    public Validated validate(ServerRequest request, Map<String, String> params, ValidationOptions options) {
        List<Map<String, Object>> errors = new ArrayList<>();

        Object query = request.query();
        if (options.query().isPresent()) {
            query = run("query", options.query().get(), query, errors);
        }

        Object body = null;
        if (options.body().isPresent() && request.method().carriesBody()) {
            body = run("body", options.body().get(), readBody(request), errors);
        }

        Object validatedParams = params;
        if (options.params().isPresent()) {
            validatedParams = run("params", options.params().get(), params, errors);
        }

        if (!errors.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("message", "Validation failed");
            details.put("errors", errors);
            throw new ApiException.ValidationFailed(details);
        }
        return new Validated(query, body, validatedParams);
    }

    private static Object run(String location, ValidationSchema<?> schema, Object input, List<Map<String, Object>> errors) {
        ValidationResult<?> result = schema.validate(input);
        for (Violation v : result.violations()) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("location", location);
            error.put("message", v.message());
            error.put("path", v.path());
            if (v.type() != null) error.put("type", v.type());
            errors.add(error);
        }
        return result.value();
    }

    private Object readBody(ServerRequest request) {
        InputStream in = request.body();
        if (in == null) return new LinkedHashMap<>();
        byte[] bytes;
        try {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            throw new ApiException.BadRequest("Unable to read request body: " + e.getMessage());
        }
        if (bytes.length == 0) return new LinkedHashMap<>();
        try {
            Object parsed = codec.readValue(bytes, Object.class);
            return parsed == null ? new LinkedHashMap<>() : parsed;
        } catch (JsonException e) {
            log.debug("Request body is not valid JSON, validating an empty object: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
