package com.prism.service.core.catalog;

import java.util.Locale;

public enum SegmentOperator {
    EQ,
    NEQ,
    CONTAINS,
    GT,
    GTE,
    LT,
    LTE,
    IN;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isRange() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }

    /** Lenient lookup used at the request boundary; {@code null} when the operator is unknown. */
    public static SegmentOperator fromWire(String value) {
        if (value == null) return null;
        for (SegmentOperator op : values()) {
            if (op.wireValue().equalsIgnoreCase(value.trim())) return op;
        }
        return null;
    }
}
