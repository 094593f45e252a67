package com.github.rudygunawan.cachetable.listener;

/**
 * A per-entry callback invoked once, right before that specific entry is removed from its table.
 *
 * <p>It runs after the table's {@link AboutToDeleteListener}, while the entry's read lock is held:
 * it must not keep the same entry alive or replace its callback.
 *
 * @param <K> the type of keys
 * @see com.github.rudygunawan.cachetable.model.CacheEntry#setExpiryCallback(ExpiryCallback)
 */
@FunctionalInterface
public interface ExpiryCallback<K> {

    /**
     * Called with the key of the entry about to be removed.
     *
     * @param key the entry's key
     */
    void onAboutToExpire(K key);
}
