package io.apipipeline.server.core.auth;

import java.util.Objects;
import java.util.Set;

/**
 * Per-endpoint authentication requirements.
 * <pre>{@code
 * AuthOptions.required().roles("admin", "editor").build();   // any of the roles
 * AuthOptions.optional().build();                             // attach the user when a valid token is sent
 * }</pre>
 */
public final class AuthOptions {

    public enum Mode { REQUIRED, OPTIONAL }

    private final Mode mode;
    private final String provider;
    private final Set<String> requiredRoles;
    private final boolean requireAllRoles;
    private final Set<String> requiredPermissions;
    private final boolean requireAllPermissions;

    private AuthOptions(Builder b) {
        this.mode = b.mode;
        this.provider = b.provider;
        this.requiredRoles = Set.copyOf(b.requiredRoles);
        this.requireAllRoles = b.requireAllRoles;
        this.requiredPermissions = Set.copyOf(b.requiredPermissions);
        this.requireAllPermissions = b.requireAllPermissions;
    }

    /** A missing or invalid token fails the request with 401. */
    public static Builder required() {
        return new Builder(Mode.REQUIRED);
    }

    /** A missing or invalid token leaves the request anonymous. */
    public static Builder optional() {
        return new Builder(Mode.OPTIONAL);
    }

    public Mode mode() {
        return mode;
    }

    public boolean isRequired() {
        return mode == Mode.REQUIRED;
    }

    /** Provider name; {@code null} selects the registry default. */
    public String provider() {
        return provider;
    }

    public Set<String> requiredRoles() {
        return requiredRoles;
    }

    public boolean requireAllRoles() {
        return requireAllRoles;
    }

    public Set<String> requiredPermissions() {
        return requiredPermissions;
    }

    public boolean requireAllPermissions() {
        return requireAllPermissions;
    }

    public static final class Builder {
        private final Mode mode;
        private String provider;
        private Set<String> requiredRoles = Set.of();
        private boolean requireAllRoles;
        private Set<String> requiredPermissions = Set.of();
        private boolean requireAllPermissions;

        private Builder(Mode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder roles(String... roles) {
            this.requiredRoles = Set.of(roles);
            return this;
        }

        /** Require every listed role instead of any one. */
        public Builder requireAllRoles(boolean requireAllRoles) {
            this.requireAllRoles = requireAllRoles;
            return this;
        }

        public Builder permissions(String... permissions) {
            this.requiredPermissions = Set.of(permissions);
            return this;
        }

        /** Require every listed permission instead of any one. */
        public Builder requireAllPermissions(boolean requireAllPermissions) {
            this.requireAllPermissions = requireAllPermissions;
            return this;
        }

        public AuthOptions build() {
            return new AuthOptions(this);
        }
    }
}
