package com.prism.service.core.segment;

import java.util.Locale;

public enum SegmentLogic {
    AND,
    OR;

    public static SegmentLogic fromWire(String value) {
        if (value == null) return null;
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "AND" -> AND;
            case "OR" -> OR;
            default -> null;
        };
    }
}
