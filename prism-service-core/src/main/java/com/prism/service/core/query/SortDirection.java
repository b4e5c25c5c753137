package com.prism.service.core.query;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    public static SortDirection fromWire(String value) {
        if (value == null) return null;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "asc" -> ASC;
            case "desc" -> DESC;
            default -> null;
        };
    }

    public String sql() {
        return name();
    }
}
