package com.github.rudygunawan.cachetable.exception;

/**
 * Thrown when a key is not present in the table and no data loader is configured, or when
 * deleting a key that is not present.
 */
public class KeyNotFoundException extends CacheTableException {

    private static final long serialVersionUID = 1L;

    public KeyNotFoundException(Object key) {
        super("Key not found in cache: " + key, key);
    }
}
