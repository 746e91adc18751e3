package io.apipipeline.server.core.health;

import io.apipipeline.server.spi.HealthProbe;

import java.util.Objects;

/**
 * A named probe. A failing critical check makes the service {@code critical} (503); a failing
 * non-critical one only {@code degraded} (207).
 */
public record HealthCheck(String name, HealthProbe probe, boolean critical) {

    public HealthCheck {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        Objects.requireNonNull(probe, "probe");
    }

    public static HealthCheck of(String name, HealthProbe probe) {
        return new HealthCheck(name, probe, false);
    }

    public static HealthCheck critical(String name, HealthProbe probe) {
        return new HealthCheck(name, probe, true);
    }
}
