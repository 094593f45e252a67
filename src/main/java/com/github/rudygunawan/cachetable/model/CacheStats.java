package com.github.rudygunawan.cachetable.model;

/**
 * Point-in-time snapshot of a table's lookup, load and removal counters, as returned by
 * {@code CacheTable.stats()}.
 *
 * <p>A lookup is one call to {@code value}. It is a hit when the key is present and a miss
 * otherwise; a miss on a table with a data loader also counts one load, successful when the loader
 * returned a value. Removals count entries taken out through the delete path, whether by an
 * explicit {@code delete} or by the expiration scan; {@code flush} counts nothing.
 */
public final class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final long loadSuccessCount;
    private final long loadFailureCount;
    private final long totalLoadTime;
    private final long expirationCount;
    private final long deleteCount;

    public CacheStats(long hitCount, long missCount, long loadSuccessCount, long loadFailureCount,
                      long totalLoadTime, long expirationCount, long deleteCount) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.loadSuccessCount = loadSuccessCount;
        this.loadFailureCount = loadFailureCount;
        this.totalLoadTime = totalLoadTime;
        this.expirationCount = expirationCount;
        this.deleteCount = deleteCount;
    }

    public long hitCount() {
        return hitCount;
    }

    public long missCount() {
        return missCount;
    }

    /**
     * Share of lookups that found their key. A table that was never read reports {@code 0.0},
     * the same value as the {@code cache.hit.ratio} gauge.
     */
    public double hitRate() {
        long lookups = hitCount + missCount;
        return lookups == 0 ? 0.0 : (double) hitCount / lookups;
    }

    public long loadSuccessCount() {
        return loadSuccessCount;
    }

    /**
     * Loads where the loader returned null or threw.
     */
    public long loadFailureCount() {
        return loadFailureCount;
    }

    /**
     * Nanoseconds spent inside the data loader, failed loads included.
     */
    public long totalLoadTime() {
        return totalLoadTime;
    }

    /**
     * Entries removed because they sat idle for their whole lifespan.
     */
    public long expirationCount() {
        return expirationCount;
    }

    /**
     * All entries removed through the delete path; {@link #expirationCount()} is a subset.
     */
    public long deleteCount() {
        return deleteCount;
    }

    /**
     * Entries removed by callers, i.e. {@code deleteCount - expirationCount}.
     */
    public long explicitDeleteCount() {
        return deleteCount - expirationCount;
    }

    @Override
    public String toString() {
        return "CacheStats{hits=" + hitCount + ", misses=" + missCount
                + ", loaded=" + loadSuccessCount + ", loadFailures=" + loadFailureCount
                + ", loadTimeNanos=" + totalLoadTime
                + ", expired=" + expirationCount + ", deleted=" + deleteCount + '}';
    }
}
