package io.apipipeline.server.core;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Daemon worker threads for timeout-bounded handlers, health probes and sweeps.
 *
 * <p>While a task wrapped by {@link #labelled} runs, its worker is named
 * {@code <pool-name> [<label>]}, so thread dumps and log patterns using {@code %thread} show
 * which endpoint and request a busy or interrupted worker belongs to.
 */
public final class HandlerThreads {

    private HandlerThreads() {
    }

    /** Cached pool of daemon threads named {@code <namePrefix>-<n>}. */
    public static ExecutorService newExecutor(String namePrefix) {
        return Executors.newCachedThreadPool(daemonThreads(namePrefix));
    }

    public static ThreadFactory daemonThreads(String namePrefix) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Wraps {@code task} so the executing thread carries {@code label} for the duration of the call.
     * The pooled name is restored afterwards, also when the task fails or is interrupted.
     */
    public static <T> Callable<T> labelled(String label, Callable<T> task) {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(task, "task");
        return () -> {
            Thread thread = Thread.currentThread();
            String pooledName = thread.getName();
            thread.setName(pooledName + " [" + label + "]");
            try {
                return task.call();
            } finally {
                thread.setName(pooledName);
            }
        };
    }
}
