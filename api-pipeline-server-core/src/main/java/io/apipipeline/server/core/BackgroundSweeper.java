package io.apipipeline.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs a maintenance task periodically on a single daemon thread until closed.
 *
 * <p>A failing run is logged and does not cancel later runs.
 */
public final class BackgroundSweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackgroundSweeper.class);

    private final String name;
    private final ScheduledExecutorService scheduler;

    public BackgroundSweeper(String name, Duration interval, Runnable task) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(task, "task");
        if (interval.isNegative() || interval.isZero()) throw new IllegalArgumentException("interval must be positive");

        this.scheduler = Executors.newSingleThreadScheduledExecutor(HandlerThreads.daemonThreads(name));
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(() -> runOnce(task), millis, millis, TimeUnit.MILLISECONDS);
    }

    private void runOnce(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.warn("Sweep {} failed", name, e);
        }
    }

    public boolean isRunning() {
        return !scheduler.isShutdown();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        log.debug("Sweep {} stopped", name);
    }
}
