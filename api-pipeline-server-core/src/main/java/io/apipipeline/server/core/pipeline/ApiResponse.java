package io.apipipeline.server.core.pipeline;

import io.apipipeline.core.ApiException;
import io.apipipeline.core.ApiResult;
import io.apipipeline.core.Headers;
import io.apipipeline.json.spi.JsonCodec;
import io.apipipeline.json.spi.JsonException;
import io.apipipeline.server.core.ResponseBody;
import io.apipipeline.server.core.ServerResponse;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable handler outcome, rendered to a {@link ServerResponse} once per request.
 *
 * <p>Being codec-independent, instances can be stored in a response cache and rendered again
 * for every hit.
 */
public final class ApiResponse {

    private enum Kind { EMPTY, TEXT, JSON }

    private final int status;
    private final Map<String, String> headers;
    private final Kind kind;
    private final Object payload;

    private ApiResponse(int status, Map<String, String> headers, Kind kind, Object payload) {
        if (status < 100 || status > 599) throw new IllegalArgumentException("status out of range: " + status);
        this.status = status;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.kind = kind;
        this.payload = payload;
    }

    /** 200 with the success envelope around {@code data}. */
    public static ApiResponse success(Object data) {
        return success(200, data);
    }

    public static ApiResponse success(int status, Object data) {
        return json(status, ApiResult.success(data));
    }

    public static ApiResponse success(Object data, List<String> warnings, Map<String, Object> metadata) {
        return json(200, ApiResult.success(data, warnings, metadata));
    }

    /** Failure envelope with the exception's status; rate limit failures also carry {@code Retry-After}. */
    public static ApiResponse failure(ApiException e) {
        ApiResponse response = json(e.status(), ApiResult.failure(e));
        if (e instanceof ApiException.RateLimited limited) {
            response = response.withHeader(Headers.RETRY_AFTER, Long.toString(limited.retryAfterSeconds()));
        }
        return response;
    }

    /** Arbitrary JSON body, not wrapped in the envelope. */
    public static ApiResponse json(int status, Object body) {
        return new ApiResponse(status, Map.of(), Kind.JSON, Objects.requireNonNull(body, "body"));
    }

    public static ApiResponse text(int status, String text) {
        return new ApiResponse(status, Map.of(), Kind.TEXT, Objects.requireNonNull(text, "text"));
    }

    public static ApiResponse empty(int status) {
        return new ApiResponse(status, Map.of(), Kind.EMPTY, null);
    }

    public ApiResponse withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ApiResponse(status, copy, kind, payload);
    }

    public int status() {
        return status;
    }

    public Map<String, String> headers() {
        return headers;
    }

    /** Envelope, JSON body or text; {@code null} when empty. */
    public Object payload() {
        return payload;
    }

    public ServerResponse toServerResponse(JsonCodec codec) throws JsonException {
        ServerResponse response = switch (kind) {
            case EMPTY -> new ServerResponse(status, new ResponseBody.Empty());
            case TEXT -> new ServerResponse(status, new ResponseBody.Bytes(((String) payload).getBytes(StandardCharsets.UTF_8)))
                    .header(Headers.CONTENT_TYPE, Headers.CT_TEXT);
            case JSON -> new ServerResponse(status, new ResponseBody.Bytes(codec.writeBytes(payload)))
                    .header(Headers.CONTENT_TYPE, Headers.CT_JSON);
        };
        headers.forEach(response::setHeader);
        return response;
    }
}
