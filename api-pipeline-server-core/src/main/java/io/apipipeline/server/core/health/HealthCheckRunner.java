package io.apipipeline.server.core.health;

import io.apipipeline.server.core.HandlerThreads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs health checks one after another, each bounded by the configured timeout.
 */
public final class HealthCheckRunner {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRunner.class);

    private final ExecutorService executor;
    private final Clock clock;

    public HealthCheckRunner(ExecutorService executor, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public HealthReport run(List<HealthCheck> checks, HealthOptions options) {
        long started = System.nanoTime();
        Map<String, HealthReport.CheckResult> results = new LinkedHashMap<>();
        boolean allHealthy = true;
        boolean criticalFailed = false;

        for (HealthCheck check : checks) {
            HealthReport.CheckResult result = runProbe(check, options.timeout());
            results.put(check.name(), result);
            if (!result.healthy()) {
                allHealthy = false;
                if (check.critical()) criticalFailed = true;
            }
        }

        String status = allHealthy ? HealthReport.HEALTHY : criticalFailed ? HealthReport.CRITICAL : HealthReport.DEGRADED;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", clock.instant().toString());
        metadata.put("duration", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) + "ms");
        metadata.put("version", options.version());
        metadata.put("environment", options.environment());
        return new HealthReport(status, results, metadata);
    }

    /**
     * Runs one probe. A probe that returns false, throws or outlives {@code timeout} is unhealthy;
     * an outlived probe is cancelled with interruption.
     */
    public HealthReport.CheckResult runProbe(HealthCheck check, Duration timeout) {
        Future<Boolean> future = executor.submit(
                HandlerThreads.labelled("health " + check.name(), () -> check.probe().check()));
        try {
            Boolean healthy = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return Boolean.TRUE.equals(healthy)
                    ? new HealthReport.CheckResult(HealthReport.HEALTHY, check.critical(), null)
                    : new HealthReport.CheckResult(HealthReport.UNHEALTHY, check.critical(), null);
        } catch (TimeoutException e) {
            future.cancel(true);
            String message = "Health check \"" + check.name() + "\" timed out after " + timeout.toMillis() + "ms";
            log.warn(message);
            return new HealthReport.CheckResult(HealthReport.UNHEALTHY, check.critical(), message);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Health check \"{}\" failed", check.name(), cause);
            String message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
            return new HealthReport.CheckResult(HealthReport.UNHEALTHY, check.critical(), message);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new HealthReport.CheckResult(HealthReport.UNHEALTHY, check.critical(), "Health check interrupted");
        }
    }
}
