package com.prism.service.core.query;

import java.time.Instant;
import java.util.Objects;

/** Concrete UTC window, inclusive on both ends. */
public record ResolvedRange(Instant from, Instant to) {

    public ResolvedRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(from) && !instant.isAfter(to);
    }
}
