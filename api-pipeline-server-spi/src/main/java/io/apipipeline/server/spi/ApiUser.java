package io.apipipeline.server.spi;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Authenticated principal produced by an {@link AuthProvider}.
 */
public record ApiUser(
        String id,
        Set<String> roles,
        Set<String> permissions,
        String email,
        String name,
        Map<String, Object> metadata
) {

    public ApiUser {
        Objects.requireNonNull(id, "id");
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public ApiUser(String id, Set<String> roles, Set<String> permissions) {
        this(id, roles, permissions, null, null, null);
    }

    public static ApiUser of(String id) {
        return new ApiUser(id, Set.of(), Set.of());
    }
}
