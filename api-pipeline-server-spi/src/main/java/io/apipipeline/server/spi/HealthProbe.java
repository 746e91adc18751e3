package io.apipipeline.server.spi;

/**
 * A single health probe.
 *
 * <p>Returns {@code true} when healthy. Throwing counts as unhealthy; the exception message is
 * reported.
 */
@FunctionalInterface
public interface HealthProbe {

    boolean check() throws Exception;
}
