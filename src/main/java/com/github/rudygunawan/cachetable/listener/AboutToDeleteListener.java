package com.github.rudygunawan.cachetable.listener;

import com.github.rudygunawan.cachetable.model.CacheEntry;

/**
 * A table-level listener notified right before an entry is removed, whether by an explicit
 * {@code delete} or by the expiration scan. It runs before the entry's own
 * {@link ExpiryCallback}.
 *
 * <p>Not invoked by {@code flush()}.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@FunctionalInterface
public interface AboutToDeleteListener<K, V> {

    /**
     * Called with the entry that is about to be removed. The entry is still in the table.
     *
     * @param entry the entry being removed
     */
    void onAboutToDelete(CacheEntry<K, V> entry);
}
