package com.github.rudygunawan.cachetable.api;

import com.github.rudygunawan.cachetable.exception.KeyNotFoundException;
import com.github.rudygunawan.cachetable.exception.KeyNotFoundOrLoadableException;
import com.github.rudygunawan.cachetable.listener.AboutToDeleteListener;
import com.github.rudygunawan.cachetable.listener.AddedListener;
import com.github.rudygunawan.cachetable.model.CacheEntry;
import com.github.rudygunawan.cachetable.model.CacheStats;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.logging.Logger;

/**
 * A named, in-process table of cache entries. Each entry carries its own lifespan: once an entry
 * has not been accessed for that long it is removed automatically by the table's expiration
 * scan. An entry added with a lifespan of 0 is never removed automatically.
 *
 * <p>Implementations of this interface are expected to be thread-safe, and can be safely accessed
 * by multiple concurrent threads. User callbacks (data loader, added and about-to-delete
 * listeners, per-entry expiry callbacks) run on the calling thread or on the expiration scan's
 * thread, never while the table lock is held.
 *
 * @param <K> the type of keys maintained by this table
 * @param <V> the type of cached values
 */
public interface CacheTable<K, V> {

    /**
     * Returns the name this table was created with.
     */
    String getName();

    /**
     * Returns the number of entries currently stored.
     */
    int count();

    /**
     * Invokes {@code visitor} for every entry currently stored, while holding the table's read
     * lock. The visitor must not add, delete or flush entries of this table.
     *
     * @param visitor receives each key and its entry
     */
    void forEach(BiConsumer<? super K, ? super CacheEntry<K, V>> visitor);

    /**
     * Configures the loader invoked by {@link #value(Object, Object...)} on a miss. {@code null}
     * removes the loader.
     */
    void setDataLoader(DataLoader<? super K, V> loader);

    /**
     * Configures the listener invoked every time an entry is added. {@code null} removes it.
     */
    void setAddedListener(AddedListener<K, V> listener);

    /**
     * Configures the listener invoked right before an entry is deleted. {@code null} removes it.
     */
    void setAboutToDeleteListener(AboutToDeleteListener<K, V> listener);

    /**
     * Sets the logger receiving this table's diagnostic lines. {@code null} silences the table.
     */
    void setLogger(Logger logger);

    /**
     * Adds an entry, replacing any entry already stored under {@code key}.
     *
     * <p>The added listener runs after the entry becomes visible. If the lifespan is positive and
     * shorter than the currently scheduled scan interval, or no scan is scheduled, an expiration
     * scan runs before this method returns.
     *
     * @param key the entry's key
     * @param lifespan how long the entry may stay idle, or 0 to never expire
     * @param unit the unit of {@code lifespan}
     * @param value the value to cache
     * @return the new entry
     */
    CacheEntry<K, V> add(K key, long lifespan, TimeUnit unit, V value);

    /**
     * Adds an entry with a {@link Duration} lifespan.
     *
     * @see #add(Object, long, TimeUnit, Object)
     */
    default CacheEntry<K, V> add(K key, Duration lifespan, V value) {
        return add(key, lifespan.toNanos(), TimeUnit.NANOSECONDS, value);
    }

    /**
     * Adds an entry that never expires.
     *
     * @see #add(Object, long, TimeUnit, Object)
     */
    default CacheEntry<K, V> add(K key, V value) {
        return add(key, 0, TimeUnit.NANOSECONDS, value);
    }

    /**
     * Adds an entry only if {@code key} is not present. The check and the insert happen in a
     * single critical section.
     *
     * @return true if the entry was added, false if {@code key} was already present
     */
    boolean notFoundAdd(K key, long lifespan, TimeUnit unit, V value);

    /**
     * Adds an entry with a {@link Duration} lifespan only if {@code key} is not present.
     *
     * @see #notFoundAdd(Object, long, TimeUnit, Object)
     */
    default boolean notFoundAdd(K key, Duration lifespan, V value) {
        return notFoundAdd(key, lifespan.toNanos(), TimeUnit.NANOSECONDS, value);
    }

    /**
     * Removes the entry stored under {@code key}.
     *
     * <p>The about-to-delete listener runs first, then the entry's own expiry callback, then the
     * entry is removed.
     *
     * @return the removed entry
     * @throws KeyNotFoundException if {@code key} is not present
     */
    CacheEntry<K, V> delete(K key) throws KeyNotFoundException;

    /**
     * Returns true if {@code key} is present. Does not keep the entry alive and never invokes the
     * data loader.
     */
    boolean exists(K key);

    /**
     * Returns the entry stored under {@code key} and keeps it alive. On a miss, the data loader
     * (if any) is asked for a value, which is then added to the table and returned.
     *
     * @param key the key to look up
     * @param loaderArgs extra arguments passed through to the data loader
     * @return the present or freshly loaded entry
     * @throws KeyNotFoundException if {@code key} is absent and no data loader is configured
     * @throws KeyNotFoundOrLoadableException if {@code key} is absent and the loader returned null
     */
    CacheEntry<K, V> value(K key, Object... loaderArgs)
            throws KeyNotFoundException, KeyNotFoundOrLoadableException;

    /**
     * Removes every entry and cancels any pending expiration scan. No listener or expiry
     * callback is invoked.
     */
    void flush();

    /**
     * Returns up to {@code count} entries, ordered by access count, most accessed first. Ties come
     * back in no particular order.
     *
     * <p>The ranking is taken from a snapshot of the access counts, then the top {@code count}
     * keys are looked up again. A key deleted in between is skipped but still uses up its slot, so
     * fewer than {@code count} entries may be returned even when the table holds more.
     *
     * @param count the maximum number of entries; {@code count <= 0} returns an empty list
     */
    List<CacheEntry<K, V>> mostAccessed(long count);

    /**
     * Runs an expiration scan on the calling thread: removes every idle entry and reschedules the
     * next scan.
     */
    void cleanUp();

    /**
     * Returns the delay until the next scheduled expiration scan, or 0 if none is scheduled.
     */
    long getCleanupInterval(TimeUnit unit);

    /**
     * Returns a current snapshot of this table's statistics.
     */
    CacheStats stats();
}
