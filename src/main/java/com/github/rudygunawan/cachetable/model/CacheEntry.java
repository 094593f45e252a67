package com.github.rudygunawan.cachetable.model;

import com.github.rudygunawan.cachetable.listener.ExpiryCallback;
import com.github.rudygunawan.cachetable.time.Ticker;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A cache entry that wraps a value with metadata for idle-time expiration and access tracking.
 *
 * <p>The key, value, lifespan and creation time are immutable and read without locking. The
 * access time, access count and expiry callback change after construction and are guarded by a
 * per-entry read/write lock, so a reader always sees an access time and count from the same
 * keep-alive.
 *
 * <p>An entry stays readable after it has been removed from its table; its fields simply stop
 * being updated.
 *
 * @param <K> the type of the key
 * @param <V> the type of the cached value
 */
public class CacheEntry<K, V> {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Ticker ticker;

    private final K key;
    private final V value;
    private final long lifespanNanos;
    private final long createdOn;

    // Guarded by lock
    private long accessedOn;
    private long accessCount;
    private ExpiryCallback<? super K> expiryCallback;

    /**
     * Creates a new cache entry.
     *
     * @param key the entry's key
     * @param lifespanNanos how long the entry may stay idle before it expires, in nanoseconds,
     *                      or 0 to never expire
     * @param value the value to cache
     * @param ticker the time source for the entry's timestamps
     * @throws IllegalArgumentException if {@code lifespanNanos} is negative
     */
    public CacheEntry(K key, long lifespanNanos, V value, Ticker ticker) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.value = Objects.requireNonNull(value, "value cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        if (lifespanNanos < 0) {
            throw new IllegalArgumentException("lifespan must not be negative: " + lifespanNanos);
        }
        this.lifespanNanos = lifespanNanos;
        this.createdOn = ticker.read();
        this.accessedOn = createdOn;
        this.accessCount = 0;
    }

    /**
     * Marks the entry as accessed: resets its idle clock and increments its access count.
     */
    public void keepAlive() {
        lock.writeLock().lock();
        try {
            accessedOn = ticker.read();
            accessCount++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public K getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    /**
     * Returns how long the entry may stay idle before it expires, in nanoseconds. 0 means the
     * entry never expires.
     */
    public long getLifespan() {
        return lifespanNanos;
    }

    /**
     * Returns the lifespan converted to {@code unit}.
     */
    public long getLifespan(TimeUnit unit) {
        return unit.convert(lifespanNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Returns the ticker time (in nanoseconds) when this entry was created.
     */
    public long getCreatedOn() {
        return createdOn;
    }

    /**
     * Returns the ticker time (in nanoseconds) when this entry was last kept alive.
     */
    public long getAccessedOn() {
        lock.readLock().lock();
        try {
            return accessedOn;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the number of times this entry has been kept alive.
     */
    public long getAccessCount() {
        lock.readLock().lock();
        try {
            return accessCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns how long the entry has been idle at {@code now}.
     */
    public long getIdleNanos(long now) {
        return now - getAccessedOn();
    }

    /**
     * Returns true if the entry has a lifespan and has been idle for at least that long at
     * {@code now}.
     */
    public boolean isExpiredAt(long now) {
        return lifespanNanos > 0 && getIdleNanos(now) >= lifespanNanos;
    }

    /**
     * Configures a callback invoked right before this entry is removed from its table. Replaces
     * any previous callback; {@code null} clears it.
     *
     * @param callback the callback, or null
     */
    public void setExpiryCallback(ExpiryCallback<? super K> callback) {
        lock.writeLock().lock();
        try {
            this.expiryCallback = callback;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Invokes the expiry callback, if one is set, while holding the entry's read lock.
     *
     * <p>Called by the owning table as part of removing this entry.
     */
    public void fireExpiryCallback() {
        lock.readLock().lock();
        try {
            if (expiryCallback != null) {
                expiryCallback.onAboutToExpire(key);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "CacheEntry{"
                + "key=" + key
                + ", lifespanNanos=" + lifespanNanos
                + ", createdOn=" + createdOn
                + ", accessedOn=" + getAccessedOn()
                + ", accessCount=" + getAccessCount()
                + '}';
    }
}
