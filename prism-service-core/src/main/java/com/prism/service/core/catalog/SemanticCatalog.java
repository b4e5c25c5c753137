package com.prism.service.core.catalog;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** Lookup facade over the closed dimension, metric and segment-field vocabularies. */
public final class SemanticCatalog {

    private SemanticCatalog() {}

    public static Dimension dimension(String key) {
        return Dimension.fromKey(key);
    }

    public static Metric metric(String key) {
        return Metric.fromKey(key);
    }

    public static SegmentField segmentField(String key) {
        return SegmentField.resolve(key);
    }

    /** Field type for segment typing, {@code null} for unknown keys. */
    public static FieldType fieldType(String key) {
        SegmentField field = SegmentField.resolve(key);
        return field == null ? null : field.type();
    }

    public static List<String> dimensionKeys() {
        return Arrays.stream(Dimension.values()).map(Dimension::key).toList();
    }

    public static List<String> metricKeys() {
        return Arrays.stream(Metric.values()).map(Metric::key).toList();
    }

    /** Catalog listing served to query-builder clients. */
    public static Description describe() {
        List<Entry> dimensions = new ArrayList<>();
        for (Dimension d : Dimension.values()) {
            FieldType type = d.isTimeBucket() ? FieldType.DATE : FieldType.TEXT;
            dimensions.add(new Entry(d.key(), d.label(), type.wireValue(), null, null));
        }
        List<Entry> metrics = new ArrayList<>();
        for (Metric m : Metric.values()) {
            String aggregation = m.aggregation().name().toLowerCase(Locale.ROOT);
            metrics.add(new Entry(m.key(), m.label(), FieldType.NUMBER.wireValue(), aggregation, null));
        }
        List<Entry> fields = new ArrayList<>();
        for (SegmentField f : SegmentField.catalog().values()) {
            List<String> operators = f.type().allowedOperators().stream()
                    .map(SegmentOperator::wireValue)
                    .toList();
            fields.add(new Entry(f.key(), f.key(), f.type().wireValue(), null, operators));
        }
        return new Description(dimensions, metrics, fields);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(String key, String label, String type, String aggregation, List<String> operators) {}

    public record Description(List<Entry> dimensions, List<Entry> metrics, List<Entry> segmentFields) {}
}
