package com.example.kvdriver.driver;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Memoizes one table handle per table name for the lifetime of a connection.
 *
 * @param <T> the backend's table handle
 */
public class TableRegistry<T> {

    private final ConcurrentMap<String, T> handles = new ConcurrentHashMap<>();

    /**
     * Returns the handle registered for {@code table}, creating it with {@code factory}
     * on first use. Concurrent first calls for the same name create one handle.
     */
    public T resolve(String table, Function<String, T> factory) {
        return handles.computeIfAbsent(table, factory);
    }

    public boolean contains(String table) {
        return handles.containsKey(table);
    }

    public Set<String> tables() {
        return new TreeSet<>(handles.keySet());
    }

    /** Drops every handle; they belong to a connection that no longer exists. */
    public void invalidate() {
        handles.clear();
    }
}
