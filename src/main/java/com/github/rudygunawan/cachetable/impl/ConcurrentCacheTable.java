package com.github.rudygunawan.cachetable.impl;

import com.github.rudygunawan.cachetable.api.CacheTable;
import com.github.rudygunawan.cachetable.api.DataLoader;
import com.github.rudygunawan.cachetable.api.LoadedValue;
import com.github.rudygunawan.cachetable.builder.CacheTableBuilder;
import com.github.rudygunawan.cachetable.exception.KeyNotFoundException;
import com.github.rudygunawan.cachetable.exception.KeyNotFoundOrLoadableException;
import com.github.rudygunawan.cachetable.listener.AboutToDeleteListener;
import com.github.rudygunawan.cachetable.listener.AddedListener;
import com.github.rudygunawan.cachetable.metrics.CacheTableMetrics;
import com.github.rudygunawan.cachetable.model.CacheEntry;
import com.github.rudygunawan.cachetable.model.CacheStats;
import com.github.rudygunawan.cachetable.scheduler.ExpirationTimer;
import com.github.rudygunawan.cachetable.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Concurrent cache table with per-entry idle expiration driven by a self-adjusting timer.
 *
 * <p>Instead of polling on a fixed interval, each expiration scan removes the entries that have
 * been idle for their whole lifespan and then arms a single one-shot timer for the moment the
 * next remaining entry would expire. Adding an entry whose lifespan is shorter than the armed
 * interval runs a scan right away so the timer is pulled forward.
 *
 * <p>A table-wide read/write lock guards the entry map, the callbacks and the timer state. It is
 * never held while user callbacks run or while a scan walks the entries, so callbacks may call
 * back into the table.
 *
 * <p>Logging: library diagnostics go to the java.util.logging logger
 * {@code "com.github.rudygunawan.cachetable.CacheTable"} (FINE for scan races). The per-table
 * logger set through {@link #setLogger(Logger)} receives operational lines at INFO; a table
 * without one is silent.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class ConcurrentCacheTable<K, V> implements CacheTable<K, V>, CacheTableMetrics {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.cachetable.CacheTable");

    private final String name;
    private final Ticker ticker;
    private final ExpirationTimer expirationTimer;
    private final int initialCapacity;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // Guarded by lock
    private ConcurrentHashMap<K, CacheEntry<K, V>> items;
    private ScheduledFuture<?> cleanupTimer;
    private long cleanupIntervalNanos;
    private long flushGeneration;
    private DataLoader<? super K, V> loader;
    private AddedListener<K, V> addedListener;
    private AboutToDeleteListener<K, V> aboutToDeleteListener;
    private Logger logger;

    // Statistics
    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);
    private final AtomicLong loadSuccessCount = new AtomicLong(0);
    private final AtomicLong loadFailureCount = new AtomicLong(0);
    private final AtomicLong totalLoadTime = new AtomicLong(0);
    private final AtomicLong expirationCount = new AtomicLong(0);
    private final AtomicLong deleteCount = new AtomicLong(0);

    /**
     * Creates a table configured by {@code builder}.
     */
    @SuppressWarnings("unchecked")
    public ConcurrentCacheTable(String name, CacheTableBuilder<?, ?> builder) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.ticker = builder.getTicker();
        this.expirationTimer = builder.buildExpirationTimer();
        this.initialCapacity = builder.getInitialCapacity();
        this.items = new ConcurrentHashMap<>(initialCapacity);
        this.loader = (DataLoader<? super K, V>) builder.getDataLoader();
        this.addedListener = (AddedListener<K, V>) builder.getAddedListener();
        this.aboutToDeleteListener = (AboutToDeleteListener<K, V>) builder.getAboutToDeleteListener();
        this.logger = builder.getLogger();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int count() {
        lock.readLock().lock();
        try {
            return items.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void forEach(BiConsumer<? super K, ? super CacheEntry<K, V>> visitor) {
        Objects.requireNonNull(visitor, "visitor cannot be null");
        lock.readLock().lock();
        try {
            items.forEach(visitor);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void setDataLoader(DataLoader<? super K, V> loader) {
        lock.writeLock().lock();
        try {
            this.loader = loader;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void setAddedListener(AddedListener<K, V> listener) {
        lock.writeLock().lock();
        try {
            this.addedListener = listener;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void setAboutToDeleteListener(AboutToDeleteListener<K, V> listener) {
        lock.writeLock().lock();
        try {
            this.aboutToDeleteListener = listener;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void setLogger(Logger logger) {
        lock.writeLock().lock();
        try {
            this.logger = logger;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public CacheEntry<K, V> add(K key, long lifespan, TimeUnit unit, V value) {
        Objects.requireNonNull(unit, "unit cannot be null");
        CacheEntry<K, V> entry = new CacheEntry<>(key, unit.toNanos(lifespan), value, ticker);

        long interval;
        AddedListener<K, V> listener;
        lock.writeLock().lock();
        try {
            log("Adding item with key", key, "and lifespan of", Duration.ofNanos(entry.getLifespan()),
                    "to table", name);
            items.put(key, entry);
            interval = cleanupIntervalNanos;
            listener = addedListener;
        } finally {
            lock.writeLock().unlock();
        }

        afterAdd(entry, interval, listener);
        return entry;
    }

    @Override
    public boolean notFoundAdd(K key, long lifespan, TimeUnit unit, V value) {
        Objects.requireNonNull(unit, "unit cannot be null");
        CacheEntry<K, V> entry = new CacheEntry<>(key, unit.toNanos(lifespan), value, ticker);

        long interval;
        AddedListener<K, V> listener;
        lock.writeLock().lock();
        try {
            if (items.containsKey(key)) {
                return false;
            }
            log("Adding item with key", key, "and lifespan of", Duration.ofNanos(entry.getLifespan()),
                    "to table", name);
            items.put(key, entry);
            interval = cleanupIntervalNanos;
            listener = addedListener;
        } finally {
            lock.writeLock().unlock();
        }

        afterAdd(entry, interval, listener);
        return true;
    }

    /**
     * Runs the added listener, then scans right away if the new entry expires sooner than the
     * armed timer (or no timer is armed).
     */
    private void afterAdd(CacheEntry<K, V> entry, long interval, AddedListener<K, V> listener) {
        if (listener != null) {
            listener.onAdded(entry);
        }

        long lifespan = entry.getLifespan();
        if (lifespan > 0 && (interval == 0 || lifespan < interval)) {
            expirationCheck();
        }
    }

    @Override
    public CacheEntry<K, V> delete(K key) throws KeyNotFoundException {
        Objects.requireNonNull(key, "key cannot be null");
        return deleteInternal(key, null, false);
    }

    /**
     * Removes {@code key} after running the about-to-delete listener and the entry's expiry
     * callback, in that order.
     *
     * @param expected if non-null, only this exact entry may be removed
     * @param expired whether the removal is driven by the expiration scan
     */
    private CacheEntry<K, V> deleteInternal(K key, CacheEntry<K, V> expected, boolean expired)
            throws KeyNotFoundException {
        CacheEntry<K, V> entry;
        AboutToDeleteListener<K, V> listener;
        lock.readLock().lock();
        try {
            entry = items.get(key);
            listener = aboutToDeleteListener;
        } finally {
            lock.readLock().unlock();
        }

        if (entry == null || (expected != null && entry != expected)) {
            throw new KeyNotFoundException(key);
        }

        if (listener != null) {
            listener.onAboutToDelete(entry);
        }
        entry.fireExpiryCallback();

        lock.writeLock().lock();
        try {
            log("Deleting item with key", key, "created on", entry.getCreatedOn(), "and hit",
                    entry.getAccessCount(), "times from table", name);
            // A concurrent add may have replaced the entry while the callbacks ran
            if (items.remove(key, entry)) {
                deleteCount.incrementAndGet();
                if (expired) {
                    expirationCount.incrementAndGet();
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return entry;
    }

    @Override
    public boolean exists(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.readLock().lock();
        try {
            return items.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CacheEntry<K, V> value(K key, Object... loaderArgs)
            throws KeyNotFoundException, KeyNotFoundOrLoadableException {
        Objects.requireNonNull(key, "key cannot be null");

        CacheEntry<K, V> entry;
        DataLoader<? super K, V> dataLoader;
        lock.readLock().lock();
        try {
            entry = items.get(key);
            dataLoader = loader;
        } finally {
            lock.readLock().unlock();
        }

        if (entry != null) {
            entry.keepAlive();
            hitCount.incrementAndGet();
            return entry;
        }

        missCount.incrementAndGet();
        if (dataLoader == null) {
            throw new KeyNotFoundException(key);
        }

        long startTime = System.nanoTime();
        LoadedValue<V> loaded;
        try {
            loaded = dataLoader.load(key, loaderArgs == null ? new Object[0] : loaderArgs);
        } catch (RuntimeException e) {
            loadFailureCount.incrementAndGet();
            throw e;
        } finally {
            totalLoadTime.addAndGet(System.nanoTime() - startTime);
        }

        if (loaded == null) {
            loadFailureCount.incrementAndGet();
            throw new KeyNotFoundOrLoadableException(key);
        }
        loadSuccessCount.incrementAndGet();
        return add(key, loaded.getLifespanNanos(), TimeUnit.NANOSECONDS, loaded.getValue());
    }

    @Override
    public void flush() {
        lock.writeLock().lock();
        try {
            log("Flushing table", name);
            items = new ConcurrentHashMap<>(initialCapacity);
            cleanupIntervalNanos = 0;
            ExpirationTimer.cancel(cleanupTimer);
            cleanupTimer = null;
            flushGeneration++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<CacheEntry<K, V>> mostAccessed(long count) {
        if (count <= 0) {
            return Collections.emptyList();
        }

        List<AccessRank<K>> ranking;
        lock.readLock().lock();
        try {
            ranking = new ArrayList<>(items.size());
            for (Map.Entry<K, CacheEntry<K, V>> e : items.entrySet()) {
                ranking.add(new AccessRank<>(e.getKey(), e.getValue().getAccessCount()));
            }
        } finally {
            lock.readLock().unlock();
        }

        ranking.sort(Comparator.comparingLong((AccessRank<K> rank) -> rank.accessCount).reversed());

        List<K> rankedKeys = new ArrayList<>(ranking.size());
        for (AccessRank<K> rank : ranking) {
            rankedKeys.add(rank.key);
        }
        return lookUpRanked(rankedKeys, count);
    }

    /**
     * Looks up the first {@code count} of {@code rankedKeys} in the live table. Keys deleted since
     * the ranking was taken are skipped but still use up a slot.
     */
    List<CacheEntry<K, V>> lookUpRanked(List<K> rankedKeys, long count) {
        List<CacheEntry<K, V>> result = new ArrayList<>();
        long visited = 0;
        lock.readLock().lock();
        try {
            for (K key : rankedKeys) {
                if (visited >= count) {
                    break;
                }
                CacheEntry<K, V> entry = items.get(key);
                if (entry != null) {
                    result.add(entry);
                }
                visited++;
            }
        } finally {
            lock.readLock().unlock();
        }
        return result;
    }

    @Override
    public void cleanUp() {
        expirationCheck();
    }

    /**
     * Expiration scan. Cancels the pending timer, removes every entry that has been idle for its
     * whole lifespan and arms a new timer for the entry closest to expiring.
     *
     * <p>The table lock is held only to swap timer state, never while walking the entries or
     * running callbacks. Concurrent changes during the walk are picked up by the next scan.
     *
     * <p>A callback failure does not stop the walk. The failing entry is kept and retried one
     * lifespan later, the timer is re-armed, and the first failure is rethrown with any later
     * ones suppressed.
     */
    private void expirationCheck() {
        Map<K, CacheEntry<K, V>> snapshot;
        long generation;
        lock.writeLock().lock();
        try {
            ExpirationTimer.cancel(cleanupTimer);
            cleanupTimer = null;
            if (cleanupIntervalNanos > 0) {
                log("Expiration check triggered after", Duration.ofNanos(cleanupIntervalNanos),
                        "for table", name);
            } else {
                log("Expiration check installed for table", name);
            }
            snapshot = items;
            generation = flushGeneration;
        } finally {
            lock.writeLock().unlock();
        }

        long now = ticker.read();
        long smallestDuration = 0;
        RuntimeException failure = null;
        for (Map.Entry<K, CacheEntry<K, V>> e : snapshot.entrySet()) {
            CacheEntry<K, V> entry = e.getValue();
            long lifespan = entry.getLifespan();
            if (lifespan == 0) {
                continue;
            }

            long remaining;
            if (entry.isExpiredAt(now)) {
                try {
                    expire(e.getKey(), entry);
                    continue;
                } catch (RuntimeException ex) {
                    // Entry stays; retry it one lifespan from now
                    if (failure == null) {
                        failure = ex;
                    } else if (failure != ex) {
                        failure.addSuppressed(ex);
                    }
                    remaining = lifespan;
                }
            } else {
                remaining = lifespan - entry.getIdleNanos(now);
            }
            if (smallestDuration == 0 || remaining < smallestDuration) {
                smallestDuration = remaining;
            }
        }

        scheduleNextCheck(smallestDuration, generation);
        if (failure != null) {
            throw failure;
        }
    }

    private void expire(K key, CacheEntry<K, V> entry) {
        try {
            deleteInternal(key, entry, true);
        } catch (KeyNotFoundException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Expired entry was already removed or replaced: key=" + key + ", table=" + name);
            }
        }
    }

    /**
     * Arms the timer for the next scan. A scan that overlapped this one may already have armed a
     * timer; the earlier of the two wins so only one stays pending.
     */
    private void scheduleNextCheck(long delayNanos, long generation) {
        lock.writeLock().lock();
        try {
            if (generation != flushGeneration) {
                // Flushed while scanning; the scanned entries are gone
                return;
            }

            boolean pending = cleanupTimer != null && !cleanupTimer.isDone();
            if (delayNanos == 0) {
                if (!pending) {
                    cleanupIntervalNanos = 0;
                }
                return;
            }
            if (pending && cleanupTimer.getDelay(TimeUnit.NANOSECONDS) <= delayNanos) {
                return;
            }

            ExpirationTimer.cancel(cleanupTimer);
            cleanupTimer = expirationTimer.schedule(delayNanos, this::expirationCheck);
            cleanupIntervalNanos = cleanupTimer == null ? 0 : delayNanos;
            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.finest("Next expiration check for table " + name + " in " + delayNanos + "ns");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long getCleanupInterval(TimeUnit unit) {
        return unit.convert(cleanupIntervalNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(
                hitCount.get(),
                missCount.get(),
                loadSuccessCount.get(),
                loadFailureCount.get(),
                totalLoadTime.get(),
                expirationCount.get(),
                deleteCount.get()
        );
    }

    /**
     * Writes a diagnostic line to the table's logger. Must be called with the table lock held.
     */
    private void log(Object... parts) {
        if (logger == null || !logger.isLoggable(Level.INFO)) {
            return;
        }
        StringBuilder line = new StringBuilder();
        for (Object part : parts) {
            if (line.length() > 0) {
                line.append(' ');
            }
            line.append(part);
        }
        logger.info(line.toString());
    }

    // CacheTableMetrics interface implementation for Micrometer integration

    @Override
    public long size() {
        return count();
    }

    @Override
    public long hitCount() {
        return hitCount.get();
    }

    @Override
    public long missCount() {
        return missCount.get();
    }

    @Override
    public long loadSuccessCount() {
        return loadSuccessCount.get();
    }

    @Override
    public long loadFailureCount() {
        return loadFailureCount.get();
    }

    @Override
    public long totalLoadTimeNanos() {
        return totalLoadTime.get();
    }

    @Override
    public long expirationCount() {
        return expirationCount.get();
    }

    @Override
    public long deleteCount() {
        return deleteCount.get();
    }

    @Override
    public long cleanupIntervalNanos() {
        lock.readLock().lock();
        try {
            return cleanupIntervalNanos;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "ConcurrentCacheTable{name=" + name + ", count=" + count() + '}';
    }

    private static final class AccessRank<K> {
        final K key;
        final long accessCount;

        AccessRank(K key, long accessCount) {
            this.key = key;
            this.accessCount = accessCount;
        }
    }
}
