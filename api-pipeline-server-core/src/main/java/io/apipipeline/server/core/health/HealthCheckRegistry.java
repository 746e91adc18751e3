package io.apipipeline.server.core.health;

import io.apipipeline.server.spi.HealthProbe;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

/**
 * Probes run by the health endpoint when the endpoint does not list its own.
 */
public final class HealthCheckRegistry {

    public static final String SYSTEM_CHECK = "system";
    static final double HEAP_THRESHOLD_PERCENT = 90.0;

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    /**
     * Registry holding the non-critical {@code system} heap probe.
     */
    public static HealthCheckRegistry withSystemCheck() {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.add(SYSTEM_CHECK, systemProbe(), false);
        return registry;
    }

    /** Adds a check; an existing check with the same name is replaced. */
    public HealthCheckRegistry add(String name, HealthProbe probe, boolean critical) {
        HealthCheck check = new HealthCheck(name, probe, critical);
        checks.removeIf(c -> c.name().equals(name));
        checks.add(check);
        return this;
    }

    public boolean remove(String name) {
        return checks.removeIf(c -> c.name().equals(name));
    }

    public List<HealthCheck> checks() {
        return List.copyOf(checks);
    }

    /** Healthy while heap usage stays below 90% of the maximum heap. */
    public static HealthProbe systemProbe() {
        Runtime rt = Runtime.getRuntime();
        return heapUsageBelow(HEAP_THRESHOLD_PERCENT, () -> rt.totalMemory() - rt.freeMemory(), rt::maxMemory);
    }

    static HealthProbe heapUsageBelow(double percent, LongSupplier used, LongSupplier max) {
        return () -> {
            long limit = max.getAsLong();
            if (limit <= 0) return true;
            return used.getAsLong() * 100.0 / limit < percent;
        };
    }
}
