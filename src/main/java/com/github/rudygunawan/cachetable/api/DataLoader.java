package com.github.rudygunawan.cachetable.api;

/**
 * Computes a value for a key that is not present in a table. Invoked by
 * {@link CacheTable#value(Object, Object...)} on a miss, outside the table lock.
 *
 * <p>Usage example:
 * <pre>{@code
 * table.setDataLoader((key, args) -> {
 *     User user = userRepository.find(key);
 *     return user == null ? null : LoadedValue.of(user, 10, TimeUnit.MINUTES);
 * });
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@FunctionalInterface
public interface DataLoader<K, V> {

    /**
     * Loads the value for {@code key}.
     *
     * <p>Exceptions thrown by the loader are not caught; they propagate to the caller of
     * {@code value}.
     *
     * @param key the key that was not found
     * @param args the extra arguments passed to {@code value}, possibly empty
     * @return the loaded value and its lifespan, or {@code null} if the key cannot be loaded
     */
    LoadedValue<V> load(K key, Object... args);
}
