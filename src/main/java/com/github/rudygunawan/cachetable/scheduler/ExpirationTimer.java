package com.github.rudygunawan.cachetable.scheduler;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One-shot, cancellable timer used by a cache table to wake up its expiration scan.
 *
 * <p>The scheduler thread only measures the delay: when a timer fires, the task is handed to the
 * executor, so every firing runs as a new task and a slow scan never holds up the timers of
 * other tables.
 *
 * <p>Unless configured otherwise, all tables share one daemon scheduler thread named
 * {@value #THREAD_NAME} and run their scans on {@link ForkJoinPool#commonPool()}.
 */
public class ExpirationTimer {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.cachetable.CacheTable");

    static final String THREAD_NAME = "cache-table-expiration";

    private final ScheduledExecutorService scheduler;
    private final Executor executor;

    /**
     * Creates a timer on the shared default scheduler and the common fork-join pool.
     */
    public ExpirationTimer() {
        this(defaultScheduler(), ForkJoinPool.commonPool());
    }

    /**
     * Returns the daemon scheduler shared by all tables that were not given their own.
     */
    public static ScheduledExecutorService defaultScheduler() {
        return DefaultScheduler.INSTANCE;
    }

    /**
     * Creates a timer on the given scheduler and executor.
     *
     * @param scheduler measures the delays; must stay running for the lifetime of the table
     * @param executor runs the task when a timer fires
     */
    public ExpirationTimer(ScheduledExecutorService scheduler, Executor executor) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /**
     * Arms a timer that runs {@code task} on the executor once {@code delayNanos} have passed.
     *
     * @param delayNanos the delay, in nanoseconds
     * @param task the task to run when the timer fires
     * @return a handle to cancel the timer, or null if the scheduler rejected it
     */
    public ScheduledFuture<?> schedule(long delayNanos, Runnable task) {
        try {
            return scheduler.schedule(() -> executor.execute(task), delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.WARNING, "Expiration scheduler rejected a timer of " + delayNanos
                    + "ns; expiration stays idle until the next add", e);
            return null;
        }
    }

    /**
     * Cancels a pending timer. Does nothing if {@code timer} is null or has already fired; a task
     * already handed to the executor keeps running.
     */
    public static void cancel(ScheduledFuture<?> timer) {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    public Executor getExecutor() {
        return executor;
    }

    private static final class DefaultScheduler {
        static final ScheduledExecutorService INSTANCE = create();

        private static ScheduledExecutorService create() {
            ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
                Thread t = new Thread(r, THREAD_NAME);
                t.setDaemon(true);
                return t;
            });
            // Tables cancel and re-arm often; don't let cancelled timers pile up in the queue
            executor.setRemoveOnCancelPolicy(true);
            return executor;
        }
    }
}
