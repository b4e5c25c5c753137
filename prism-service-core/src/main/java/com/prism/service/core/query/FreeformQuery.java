package com.prism.service.core.query;

import java.util.Objects;

/**
 * Validated freeform query. {@code window} is a table query cut at {@code offset + pageSize} rows, so a page is
 * the tail of the window and comes out of the same ordering as a plain table query.
 */
public record FreeformQuery(TableQuery window, int offset, int pageSize) {

    public FreeformQuery {
        Objects.requireNonNull(window, "window");
        if (offset < 0 || pageSize < 1 || window.limit() != offset + pageSize) {
            throw new IllegalArgumentException("window must end at offset + pageSize");
        }
    }
}
