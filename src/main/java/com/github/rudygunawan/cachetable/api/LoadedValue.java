package com.github.rudygunawan.cachetable.api;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * The result of a {@link DataLoader}: a value plus the lifespan it should be stored with.
 *
 * @param <V> the type of the value
 */
public final class LoadedValue<V> {

    private final V value;
    private final long lifespanNanos;

    private LoadedValue(V value, long lifespanNanos) {
        this.value = Objects.requireNonNull(value, "value cannot be null");
        if (lifespanNanos < 0) {
            throw new IllegalArgumentException("lifespan must not be negative: " + lifespanNanos);
        }
        this.lifespanNanos = lifespanNanos;
    }

    /**
     * Returns a loaded value that expires after being idle for {@code lifespan}.
     */
    public static <V> LoadedValue<V> of(V value, long lifespan, TimeUnit unit) {
        return new LoadedValue<>(value, unit.toNanos(lifespan));
    }

    /**
     * Returns a loaded value that expires after being idle for {@code lifespan}.
     */
    public static <V> LoadedValue<V> of(V value, Duration lifespan) {
        return new LoadedValue<>(value, lifespan.toNanos());
    }

    /**
     * Returns a loaded value that never expires.
     */
    public static <V> LoadedValue<V> immortal(V value) {
        return new LoadedValue<>(value, 0);
    }

    public V getValue() {
        return value;
    }

    public long getLifespanNanos() {
        return lifespanNanos;
    }

    @Override
    public String toString() {
        return "LoadedValue{value=" + value + ", lifespanNanos=" + lifespanNanos + '}';
    }
}
