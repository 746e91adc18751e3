package io.apipipeline.server.core.auth;

import io.apipipeline.core.ApiException;
import io.apipipeline.server.spi.ApiUser;

import java.util.Set;

/**
 * Role and permission checks evaluated on an authenticated {@link ApiUser}.
 */
public final class AccessRules {

    static final String INSUFFICIENT_PERMISSIONS = "Insufficient permissions";

    private AccessRules() {}

    /**
     * @param requireAll whether the user needs every entry of {@code required} rather than one
     * @return true when {@code required} is empty or satisfied
     */
    public static boolean satisfies(Set<String> granted, Set<String> required, boolean requireAll) {
        if (required.isEmpty()) return true;
        if (requireAll) return granted.containsAll(required);
        for (String r : required) {
            if (granted.contains(r)) return true;
        }
        return false;
    }

    /**
     * @throws ApiException.Forbidden if the user lacks the configured roles or permissions
     */
    public static void enforce(ApiUser user, AuthOptions options) {
        if (!satisfies(user.roles(), options.requiredRoles(), options.requireAllRoles())
                || !satisfies(user.permissions(), options.requiredPermissions(), options.requireAllPermissions())) {
            throw new ApiException.Forbidden(INSUFFICIENT_PERMISSIONS);
        }
    }
}
