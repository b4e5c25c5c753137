package com.prism.service.core.query;

import java.util.Objects;

/** Validated ordering on one requested dimension or metric key. */
public record RowSort(String key, SortDirection direction) {

    public RowSort {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(direction, "direction");
    }

    public static RowSort asc(String key) {
        return new RowSort(key, SortDirection.ASC);
    }

    public static RowSort desc(String key) {
        return new RowSort(key, SortDirection.DESC);
    }
}
