package com.github.rudygunawan.cachetable.exception;

/**
 * Base class of the failures a {@link com.github.rudygunawan.cachetable.api.CacheTable} reports
 * for a key it cannot produce.
 */
public abstract class CacheTableException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient Object key;

    protected CacheTableException(String message, Object key) {
        super(message);
        this.key = key;
    }

    /**
     * Returns the key the failed operation was called with.
     */
    public Object getKey() {
        return key;
    }
}
