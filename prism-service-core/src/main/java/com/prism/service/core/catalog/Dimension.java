package com.prism.service.core.catalog;

import com.prism.core.model.Event;
import com.prism.core.support.ScalarValues;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Closed set of grouping axes. Each constant knows where its value comes from so that the in-process scan
 * and the SQL compiler read the same source.
 */
public enum Dimension {
    CHANNEL("channel", "Channel", Source.PROPERTY, "channel"),
    BRAND("brand", "Brand", Source.PROPERTY, "brand"),
    PRODUCT("product", "Product", Source.PROPERTY, "product"),
    CAMPAIGN("campaign", "Campaign", Source.PROPERTY, "campaign"),
    EVENT_NAME("eventName", "Event Name", Source.EVENT_NAME, null),
    DAY("day", "Day", Source.DAY, null),
    HOUR("hour", "Hour", Source.HOUR, null);

    /** Value reported when the source property is absent. */
    public static final String NONE = "(none)";

    private static final DateTimeFormatter DAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter HOUR_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH':00:00Z'").withZone(ZoneOffset.UTC);

    public enum Source {
        PROPERTY,
        EVENT_NAME,
        DAY,
        HOUR
    }

    private final String key;
    private final String label;
    private final Source source;
    private final String property;

    Dimension(String key, String label, Source source, String property) {
        this.key = key;
        this.label = label;
        this.source = source;
        this.property = property;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public Source source() {
        return source;
    }

    /** Backing property name for {@link Source#PROPERTY} dimensions, otherwise {@code null}. */
    public String property() {
        return property;
    }

    public boolean isTimeBucket() {
        return source == Source.DAY || source == Source.HOUR;
    }

    /** Total: never throws, falls back to {@link #NONE}. */
    public String derive(Event event) {
        return switch (source) {
            case PROPERTY -> {
                String text = ScalarValues.asText(event.property(property));
                yield text == null ? NONE : text;
            }
            case EVENT_NAME -> event.eventName() == null ? NONE : event.eventName();
            case DAY -> DAY_FORMAT.format(event.timestamp());
            case HOUR -> HOUR_FORMAT.format(event.timestamp().truncatedTo(ChronoUnit.HOURS));
        };
    }

    public static Dimension fromKey(String key) {
        if (key == null) return null;
        for (Dimension d : values()) {
            if (d.key.equals(key)) return d;
        }
        return null;
    }
}
