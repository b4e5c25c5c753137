package com.prism.service.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.prism.service.core.catalog.Dimension;
import com.prism.service.core.catalog.Metric;
import com.prism.service.core.query.DateRange;
import com.prism.service.core.query.ResolvedRange;
import com.prism.service.core.query.TableQuery;
import com.prism.service.core.query.TimeseriesQuery;
import com.prism.service.core.segment.SegmentGroup;
import com.prism.service.core.segment.SegmentNode;
import com.prism.service.core.segment.SegmentRule;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cache keys of the form {@code namespace:tenantId:sha256}, where the hash covers the canonical JSON of the
 * validated query. Two requests that differ only in key order, legacy aliases or equivalent number spellings
 * share an entry. A preset range also carries the window it resolves to on {@code clock}, so a rolling window
 * never outlives the UTC day it was computed for.
 */
public final class QueryCacheKeys {

    public static final String TABLE = "table";
    public static final String TIMESERIES = "timeseries";

    private static final ObjectMapper CANONICAL_JSON =
            new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private QueryCacheKeys() {}

    public static String table(TableQuery query, Clock clock) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("dateRange", dateRange(query.dateRange(), clock));
        payload.put("dimensions", query.dimensions().stream().map(Dimension::key).toList());
        payload.put("metrics", query.metrics().stream().map(Metric::key).toList());
        payload.put("segment", segment(query.segment()));
        payload.put("sort", query.sort().key() + ":" + query.sort().direction().name());
        payload.put("limit", query.limit());
        return build(TABLE, query.tenantId(), payload);
    }

    public static String timeseries(TimeseriesQuery query, Clock clock) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("dateRange", dateRange(query.dateRange(), clock));
        payload.put("metric", query.metric().key());
        payload.put("dimension", query.dimension() == null ? null : query.dimension().key());
        payload.put("granularity", query.granularity().name());
        payload.put("segment", segment(query.segment()));
        return build(TIMESERIES, query.tenantId(), payload);
    }

    public static String build(String namespace, String tenantId, Object payload) {
        String canonical;
        try {
            canonical = CANONICAL_JSON.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonically encode cache key payload", e);
        }
        return namespace + ":" + tenantId + ":" + sha256(canonical);
    }

    /** Prefixes covering every cached result of {@code tenantId}. */
    public static List<String> tenantPrefixes(String tenantId) {
        return List.of(TABLE + ":" + tenantId + ":", TIMESERIES + ":" + tenantId + ":");
    }

    private static Object dateRange(DateRange range, Clock clock) {
        if (range.preset() == null) {
            return Map.of("from", range.from().toString(), "to", range.to().toString());
        }
        ResolvedRange resolved = range.resolve(clock);
        return Map.of(
                "preset", range.preset().wireValue(),
                "from", resolved.from().toString(),
                "to", resolved.to().toString());
    }

    private static Object segment(SegmentNode node) {
        if (node == null) {
            return null;
        }
        Map<String, Object> out = new LinkedHashMap<>();
        if (node instanceof SegmentRule rule) {
            List<String> values = new ArrayList<>(rule.operands().size());
            for (Object operand : rule.operands()) {
                values.add(operand instanceof BigDecimal number
                        ? number.stripTrailingZeros().toPlainString()
                        : operand.toString());
            }
            out.put("field", rule.field().key());
            out.put("operator", rule.operator().wireValue());
            out.put("values", values);
            return out;
        }
        SegmentGroup group = (SegmentGroup) node;
        List<Object> children = new ArrayList<>(group.children().size());
        for (SegmentNode child : group.children()) {
            children.add(segment(child));
        }
        out.put("op", group.logic().name());
        out.put("rules", children);
        return out;
    }

    private static String sha256(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hashBytes.length * 2);
            for (byte b : hashBytes) {
                sb.append(Character.forDigit((b >> 4) & 0xf, 16)).append(Character.forDigit(b & 0xf, 16));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
