package com.github.rudygunawan.cachetable.metrics;

/**
 * Interface for cache table implementations to provide metrics data.
 * This is used by MicrometerCacheTableMetrics to collect and expose metrics.
 */
public interface CacheTableMetrics {

    /**
     * Returns the current number of entries in the table.
     */
    long size();

    /**
     * Returns the number of lookups that found an entry.
     */
    long hitCount();

    /**
     * Returns the number of lookups that found no entry.
     */
    long missCount();

    /**
     * Returns the number of data loader calls that produced a value.
     */
    long loadSuccessCount();

    /**
     * Returns the number of data loader calls that produced no value or threw.
     */
    long loadFailureCount();

    /**
     * Returns the total time spent in the data loader in nanoseconds.
     */
    long totalLoadTimeNanos();

    /**
     * Returns the number of entries removed by the expiration scan.
     */
    long expirationCount();

    /**
     * Returns the number of entries removed through the delete path, expirations included.
     */
    long deleteCount();

    /**
     * Returns the delay the next expiration scan was scheduled with, in nanoseconds, or 0 when
     * no scan is scheduled.
     */
    long cleanupIntervalNanos();
}
