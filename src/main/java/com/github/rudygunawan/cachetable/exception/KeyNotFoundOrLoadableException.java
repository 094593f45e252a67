package com.github.rudygunawan.cachetable.exception;

/**
 * Thrown when a key is not present in the table and the configured data loader did not produce
 * a value for it either.
 */
public class KeyNotFoundOrLoadableException extends CacheTableException {

    private static final long serialVersionUID = 1L;

    public KeyNotFoundOrLoadableException(Object key) {
        super("Key not found and could not be loaded into cache: " + key, key);
    }
}
