package com.github.rudygunawan.cachetable.registry;

import com.github.rudygunawan.cachetable.api.CacheTable;
import com.github.rudygunawan.cachetable.builder.CacheTableBuilder;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Named cache tables, created on first access.
 *
 * <p>The application constructs one registry and passes it to everything that needs shared
 * tables. Concurrent first calls to {@link #getOrCreate(String)} for the same name create exactly
 * one table.
 *
 * <p>Usage example:
 * <pre>{@code
 * CacheTableRegistry<String, Session> sessions = new CacheTableRegistry<>();
 * sessions.getOrCreate("web").add(sessionId, 30, TimeUnit.MINUTES, session);
 * }</pre>
 *
 * @param <K> the type of keys of the registered tables
 * @param <V> the type of values of the registered tables
 */
public class CacheTableRegistry<K, V> {

    private final ConcurrentHashMap<String, CacheTable<K, V>> tables = new ConcurrentHashMap<>();
    private final Function<String, CacheTable<K, V>> factory;

    /**
     * Creates a registry whose tables use the default builder settings.
     */
    public CacheTableRegistry() {
        this(name -> CacheTableBuilder.newBuilder().<K, V>build(name));
    }

    /**
     * Creates a registry that creates missing tables with {@code factory}.
     *
     * @param factory builds the table for a name; called at most once per name
     */
    public CacheTableRegistry(Function<String, CacheTable<K, V>> factory) {
        this.factory = Objects.requireNonNull(factory, "factory cannot be null");
    }

    /**
     * Returns the table registered under {@code name}, creating it if necessary.
     */
    public CacheTable<K, V> getOrCreate(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        return tables.computeIfAbsent(name, factory);
    }

    /**
     * Returns the table registered under {@code name}, if any.
     */
    public Optional<CacheTable<K, V>> find(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        return Optional.ofNullable(tables.get(name));
    }

    /**
     * Flushes the table registered under {@code name} and removes it from the registry.
     *
     * @return true if a table was removed
     */
    public boolean remove(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        CacheTable<K, V> removed = tables.remove(name);
        if (removed == null) {
            return false;
        }
        removed.flush();
        return true;
    }

    /**
     * Returns the names of all registered tables, sorted.
     */
    public Set<String> tableNames() {
        return Collections.unmodifiableSet(new TreeSet<>(tables.keySet()));
    }
}
