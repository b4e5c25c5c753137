package com.prism.service.core.query;

/** Named rolling windows of whole UTC days ending today. */
public enum DatePreset {
    TODAY("today", 1),
    LAST_7_DAYS("last_7_days", 7),
    LAST_30_DAYS("last_30_days", 30),
    LAST_90_DAYS("last_90_days", 90);

    private final String wireValue;
    private final int days;

    DatePreset(String wireValue, int days) {
        this.wireValue = wireValue;
        this.days = days;
    }

    public String wireValue() {
        return wireValue;
    }

    public int days() {
        return days;
    }

    public static DatePreset fromWire(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        if (trimmed.startsWith("date:")) {
            trimmed = trimmed.substring("date:".length());
        }
        for (DatePreset preset : values()) {
            if (preset.wireValue.equalsIgnoreCase(trimmed)) return preset;
        }
        return null;
    }
}
