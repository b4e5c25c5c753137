package com.prism.service.core.query;

import java.util.Map;

/**
 * Maps key names used by earlier query-builder releases onto the current catalog. Consulted once, when a
 * request is turned into a query; nothing past {@link QueryFactory} sees a legacy key.
 */
public final class LegacyKeyTranslator {

    public static final String VERSION = "v1";

    private static final Map<String, String> DIMENSIONS = Map.ofEntries(
            Map.entry("dimension:eventName", "eventName"),
            Map.entry("dimension:channel", "channel"),
            Map.entry("dimension:brand", "brand"),
            Map.entry("dimension:product", "product"),
            Map.entry("dimension:campaign", "campaign"),
            Map.entry("dimension:day", "day"),
            Map.entry("dimension:hour", "hour"),
            Map.entry("properties.channel", "channel"),
            Map.entry("properties.brand", "brand"),
            Map.entry("properties.product", "product"),
            Map.entry("properties.campaign", "campaign"));

    private static final Map<String, String> METRICS = Map.of(
            "metric:event_count", "events",
            "metric:unique_users", "users",
            "metric:revenue_sum", "revenue",
            "metric:net_demand_sum", "netDemand");

    private static final Map<String, String> SEGMENT_FIELDS = Map.of(
            "properties.channel", "channel",
            "properties.brand", "brand",
            "properties.product", "product",
            "properties.campaign", "campaign",
            "properties.revenue", "revenue",
            "properties.netDemand", "netDemand",
            "dimension:eventName", "eventName");

    private LegacyKeyTranslator() {}

    public static String dimension(String key) {
        if (key == null) return null;
        return DIMENSIONS.getOrDefault(key, key);
    }

    public static String metric(String key) {
        if (key == null) return null;
        return METRICS.getOrDefault(key, key);
    }

    public static String segmentField(String key) {
        if (key == null) return null;
        return SEGMENT_FIELDS.getOrDefault(key, key);
    }

    /** Sort keys name either a dimension or a metric. */
    public static String sortKey(String key) {
        if (key == null) return null;
        String metric = metric(key);
        return metric.equals(key) ? dimension(key) : metric;
    }
}
