package com.github.rudygunawan.cachetable.listener;

import com.github.rudygunawan.cachetable.model.CacheEntry;

/**
 * A listener notified every time an entry is added to a table, through {@code add},
 * {@code notFoundAdd} or a loader-triggered re-add.
 *
 * <p>The listener is invoked synchronously on the adding thread, after the entry is visible to
 * other readers and outside the table lock. It may call back into the table.
 *
 * <p>Usage example:
 * <pre>{@code
 * table.setAddedListener(entry ->
 *     System.out.println("Added: " + entry.getKey() + " " + entry.getValue()));
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@FunctionalInterface
public interface AddedListener<K, V> {

    /**
     * Called after {@code entry} has been stored in the table.
     *
     * <p>Exceptions thrown here are not caught by the table; they propagate to the caller of the
     * operation that added the entry.
     *
     * @param entry the entry that was added
     */
    void onAdded(CacheEntry<K, V> entry);
}
