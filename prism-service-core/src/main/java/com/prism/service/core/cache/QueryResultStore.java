package com.prism.service.core.cache;

/**
 * Keyed store for finished query results. Entries expire on their own; {@link #sweep(String)} drops them
 * early when the underlying data is known to have changed.
 */
public interface QueryResultStore {

    /** Cached value for {@code key} if present and of {@code type}, otherwise {@code null}. */
    <T> T get(String key, Class<T> type);

    void put(String key, Object value);

    /** Removes every entry whose key starts with {@code prefix}; returns how many were dropped. */
    int sweep(String prefix);
}
