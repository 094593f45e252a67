package com.github.rudygunawan.cachetable.builder;

import com.github.rudygunawan.cachetable.api.CacheTable;
import com.github.rudygunawan.cachetable.api.DataLoader;
import com.github.rudygunawan.cachetable.impl.ConcurrentCacheTable;
import com.github.rudygunawan.cachetable.listener.AboutToDeleteListener;
import com.github.rudygunawan.cachetable.listener.AddedListener;
import com.github.rudygunawan.cachetable.scheduler.ExpirationTimer;
import com.github.rudygunawan.cachetable.time.Ticker;

import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;
import java.util.logging.Logger;

/**
 * A builder of {@link CacheTable} instances having any combination of the following features:
 *
 * <ul>
 *   <li>loading of missing entries through a {@link DataLoader}
 *   <li>notification of added and about-to-be-deleted entries
 *   <li>a per-table diagnostic logger
 *   <li>a custom time source, timer scheduler and scan executor
 * </ul>
 *
 * <p>Every option can also be changed later on the table itself, except the time source, the
 * scheduler, the executor and the initial capacity.
 *
 * <p>Usage example:
 * <pre>{@code
 * CacheTable<String, Graph> graphs = CacheTableBuilder.newBuilder()
 *     .dataLoader((key, args) -> LoadedValue.of(createExpensiveGraph(key), 10, TimeUnit.MINUTES))
 *     .aboutToDeleteListener(entry -> System.out.println("Deleting: " + entry.getKey()))
 *     .build("graphs");
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class CacheTableBuilder<K, V> {
    private static final int DEFAULT_INITIAL_CAPACITY = 16;

    private int initialCapacity = DEFAULT_INITIAL_CAPACITY;
    private Ticker ticker = Ticker.systemTicker();
    private ScheduledExecutorService scheduler;
    private Executor executor;
    private Logger logger;
    private DataLoader<? super K, ? extends V> dataLoader;
    private AddedListener<? extends K, ? extends V> addedListener;
    private AboutToDeleteListener<? extends K, ? extends V> aboutToDeleteListener;

    private CacheTableBuilder() {
    }

    /**
     * Constructs a new {@code CacheTableBuilder} instance with default settings.
     */
    public static CacheTableBuilder<Object, Object> newBuilder() {
        return new CacheTableBuilder<>();
    }

    /**
     * Sets the initial capacity of the entry map.
     *
     * <p>This option is not required; by default the initial capacity is 16.
     *
     * @param initialCapacity the initial capacity
     * @return this builder instance
     * @throws IllegalArgumentException if {@code initialCapacity} is negative
     */
    public CacheTableBuilder<K, V> initialCapacity(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initial capacity must not be negative");
        }
        this.initialCapacity = initialCapacity;
        return this;
    }

    /**
     * Specifies the time source for entry timestamps and idle-time checks.
     *
     * <p>By default {@link Ticker#systemTicker()} is used. Timers still wait in real time, so a
     * fake ticker is meant to be combined with {@link CacheTable#cleanUp()}.
     *
     * @param ticker the ticker
     * @return this builder instance
     */
    public CacheTableBuilder<K, V> ticker(Ticker ticker) {
        if (ticker == null) {
            throw new NullPointerException("ticker cannot be null");
        }
        this.ticker = ticker;
        return this;
    }

    /**
     * Specifies the scheduled executor that measures the delay until the next expiration scan.
     *
     * <p>By default all tables share a single daemon thread.
     *
     * <p><b>Warning:</b> the scheduler must remain running for the lifetime of the table. Once it
     * is shut down, new timers are rejected and expiration only happens on {@code cleanUp()} or
     * when an add triggers a scan.
     *
     * @param scheduler the scheduled executor
     * @return this builder instance
     */
    public CacheTableBuilder<K, V> scheduler(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new NullPointerException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
        return this;
    }

    /**
     * Specifies the executor that runs an expiration scan when its timer fires.
     *
     * <p>By default {@link java.util.concurrent.ForkJoinPool#commonPool()} is used. Exceptions
     * thrown by listeners during a timer-driven scan surface through this executor.
     *
     * @param executor the executor
     * @return this builder instance
     */
    public CacheTableBuilder<K, V> executor(Executor executor) {
        if (executor == null) {
            throw new NullPointerException("executor cannot be null");
        }
        this.executor = executor;
        return this;
    }

    /**
     * Specifies the logger receiving the table's diagnostic lines (adds, deletes, flushes and
     * expiration checks) at INFO. Without one the table logs nothing.
     *
     * @param logger the logger
     * @return this builder instance
     */
    public CacheTableBuilder<K, V> logger(Logger logger) {
        if (logger == null) {
            throw new NullPointerException("logger cannot be null");
        }
        this.logger = logger;
        return this;
    }

    /**
     * Specifies the loader asked for a value when a lookup misses.
     *
     * @param loader the data loader
     * @return this builder instance
     */
    public <K1 extends K, V1 extends V> CacheTableBuilder<K1, V1> dataLoader(
            DataLoader<? super K1, V1> loader) {
        if (loader == null) {
            throw new NullPointerException("data loader cannot be null");
        }
        @SuppressWarnings("unchecked")
        CacheTableBuilder<K1, V1> me = (CacheTableBuilder<K1, V1>) this;
        me.dataLoader = loader;
        return me;
    }

    /**
     * Specifies a listener notified every time an entry is added.
     *
     * @param listener the listener
     * @return this builder instance
     */
    public <K1 extends K, V1 extends V> CacheTableBuilder<K1, V1> addedListener(
            AddedListener<K1, V1> listener) {
        if (listener == null) {
            throw new NullPointerException("added listener cannot be null");
        }
        @SuppressWarnings("unchecked")
        CacheTableBuilder<K1, V1> me = (CacheTableBuilder<K1, V1>) this;
        me.addedListener = listener;
        return me;
    }

    /**
     * Specifies a listener notified right before an entry is deleted, explicitly or by
     * expiration.
     *
     * @param listener the listener
     * @return this builder instance
     */
    public <K1 extends K, V1 extends V> CacheTableBuilder<K1, V1> aboutToDeleteListener(
            AboutToDeleteListener<K1, V1> listener) {
        if (listener == null) {
            throw new NullPointerException("about-to-delete listener cannot be null");
        }
        @SuppressWarnings("unchecked")
        CacheTableBuilder<K1, V1> me = (CacheTableBuilder<K1, V1>) this;
        me.aboutToDeleteListener = listener;
        return me;
    }

    /**
     * Builds a table with the given name and the settings of this builder.
     *
     * @param name the table's name
     * @return a new table
     */
    public <K1 extends K, V1 extends V> CacheTable<K1, V1> build(String name) {
        return new ConcurrentCacheTable<K1, V1>(name, this);
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public Ticker getTicker() {
        return ticker;
    }

    /**
     * Returns the configured scheduler, or null for the shared default.
     */
    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    /**
     * Returns the configured executor, or null for the common fork-join pool.
     */
    public Executor getExecutor() {
        return executor;
    }

    public Logger getLogger() {
        return logger;
    }

    public DataLoader<? super K, ? extends V> getDataLoader() {
        return dataLoader;
    }

    public AddedListener<? extends K, ? extends V> getAddedListener() {
        return addedListener;
    }

    public AboutToDeleteListener<? extends K, ? extends V> getAboutToDeleteListener() {
        return aboutToDeleteListener;
    }

    /**
     * Returns the timer described by the scheduler and executor settings.
     */
    public ExpirationTimer buildExpirationTimer() {
        return new ExpirationTimer(
                scheduler != null ? scheduler : ExpirationTimer.defaultScheduler(),
                executor != null ? executor : ForkJoinPool.commonPool());
    }
}
