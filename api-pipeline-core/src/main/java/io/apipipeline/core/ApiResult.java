package io.apipipeline.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Standard response envelope.
 *
 * <p>Success: {@code {success: true, data, warnings?, metadata?}}.
 * Failure: {@code {success: false, error, code?, warnings?, metadata?}}.
 * Absent members are {@code null} so that codecs omitting nulls render the compact form.
 */
public record ApiResult(
        boolean success,
        Object data,
        String error,
        String code,
        List<String> warnings,
        Map<String, Object> metadata
) {

    public ApiResult {
        warnings = warnings == null || warnings.isEmpty() ? null : List.copyOf(warnings);
        metadata = metadata == null || metadata.isEmpty() ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ApiResult success(Object data) {
        return new ApiResult(true, data, null, null, null, null);
    }

    public static ApiResult success(Object data, List<String> warnings, Map<String, Object> metadata) {
        return new ApiResult(true, data, null, null, warnings, metadata);
    }

    public static ApiResult failure(ApiException e) {
        return new ApiResult(false, null, e.getMessage(), e.code(), e.warnings(), e.metadata());
    }

    public static ApiResult failure(String message) {
        return new ApiResult(false, null, message, null, null, null);
    }
}
