package com.prism.service.core.catalog;

import com.prism.core.model.Event;
import com.prism.core.support.ScalarValues;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A field a segment rule can test. Catalog fields carry a fixed type; raw {@code properties.<name>} paths
 * are read as text.
 */
public final class SegmentField {

    public static final String RAW_PROPERTY_PREFIX = "properties.";

    public enum Source {
        PROPERTY,
        EVENT_NAME,
        USER_ID,
        DAY
    }

    private static final Map<String, SegmentField> CATALOG = new LinkedHashMap<>();

    static {
        register(new SegmentField("channel", FieldType.TEXT, Source.PROPERTY, "channel", false));
        register(new SegmentField("brand", FieldType.TEXT, Source.PROPERTY, "brand", false));
        register(new SegmentField("product", FieldType.TEXT, Source.PROPERTY, "product", false));
        register(new SegmentField("campaign", FieldType.TEXT, Source.PROPERTY, "campaign", false));
        register(new SegmentField("eventName", FieldType.TEXT, Source.EVENT_NAME, null, false));
        register(new SegmentField("userId", FieldType.TEXT, Source.USER_ID, null, false));
        register(new SegmentField("day", FieldType.DATE, Source.DAY, null, false));
        register(new SegmentField(
                Metric.REVENUE.key(), FieldType.NUMBER, Source.PROPERTY, Metric.REVENUE.property(), false));
        register(new SegmentField(
                Metric.NET_DEMAND.key(), FieldType.NUMBER, Source.PROPERTY, Metric.NET_DEMAND.property(), false));
    }

    private final String key;
    private final FieldType type;
    private final Source source;
    private final String property;
    private final boolean raw;

    private SegmentField(String key, FieldType type, Source source, String property, boolean raw) {
        this.key = key;
        this.type = type;
        this.source = source;
        this.property = property;
        this.raw = raw;
    }

    private static void register(SegmentField field) {
        CATALOG.put(field.key, field);
    }

    /**
     * Catalog field for {@code key}, a raw text property for {@code properties.<name>}, or {@code null} when
     * the key names neither.
     */
    public static SegmentField resolve(String key) {
        if (key == null) return null;
        SegmentField known = CATALOG.get(key);
        if (known != null) return known;
        if (key.startsWith(RAW_PROPERTY_PREFIX) && key.length() > RAW_PROPERTY_PREFIX.length()) {
            String name = key.substring(RAW_PROPERTY_PREFIX.length());
            return new SegmentField(key, FieldType.TEXT, Source.PROPERTY, name, true);
        }
        return null;
    }

    public static Map<String, SegmentField> catalog() {
        return java.util.Collections.unmodifiableMap(CATALOG);
    }

    public String key() {
        return key;
    }

    public FieldType type() {
        return type;
    }

    public Source source() {
        return source;
    }

    public String property() {
        return property;
    }

    /** True for request-supplied property names that are not part of the closed catalog. */
    public boolean raw() {
        return raw;
    }

    /**
     * Typed reading of this field on an event: {@link String} (empty when absent) for text,
     * {@link java.math.BigDecimal} for numbers, UTC {@link LocalDate} for dates.
     */
    public Object read(Event event) {
        return switch (type) {
            case TEXT -> readText(event);
            case NUMBER -> ScalarValues.toNumber(event.property(property));
            case DATE -> LocalDate.ofInstant(event.timestamp(), ZoneOffset.UTC);
        };
    }

    private String readText(Event event) {
        String value = switch (source) {
            case EVENT_NAME -> event.eventName();
            case USER_ID -> event.userId();
            case PROPERTY -> ScalarValues.asText(event.property(property));
            case DAY -> LocalDate.ofInstant(event.timestamp(), ZoneOffset.UTC).toString();
        };
        return value == null ? "" : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SegmentField other)) return false;
        return key.equals(other.key) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, type);
    }

    @Override
    public String toString() {
        return key + ":" + type.wireValue();
    }
}
