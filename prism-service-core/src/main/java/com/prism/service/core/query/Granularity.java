package com.prism.service.core.query;

import com.prism.service.core.catalog.Dimension;
import java.util.Locale;

/** Time bucket width of a series; each maps onto the matching time dimension. */
public enum Granularity {
    DAY(Dimension.DAY),
    HOUR(Dimension.HOUR);

    private final Dimension dimension;

    Granularity(Dimension dimension) {
        this.dimension = dimension;
    }

    public Dimension dimension() {
        return dimension;
    }

    public static Granularity fromWire(String value) {
        if (value == null) return null;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "day" -> DAY;
            case "hour" -> HOUR;
            default -> null;
        };
    }
}
