package com.prism.service.core.engine;

import com.prism.service.core.catalog.Dimension;
import com.prism.service.core.catalog.Metric;
import com.prism.service.core.query.ResolvedRange;
import com.prism.service.core.query.RowSort;
import com.prism.service.core.segment.SegmentNode;
import java.util.List;
import java.util.Objects;

/**
 * Strategy-neutral description of one aggregation: which tenant and window, how to group, what to compute,
 * how to order and where to cut. {@code limit} is {@code null} for an unbounded result; {@code totals} says
 * whether the caller wants the whole-population aggregate as well.
 */
public record AggregationPlan(
        String tenantId,
        ResolvedRange range,
        List<Dimension> dimensions,
        List<Metric> metrics,
        SegmentNode segment,
        List<RowSort> ordering,
        Integer limit,
        boolean totals) {

    public AggregationPlan {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(range, "range");
        dimensions = List.copyOf(dimensions);
        metrics = List.copyOf(metrics);
        ordering = ordering == null ? List.of() : List.copyOf(ordering);
        if (metrics.isEmpty()) {
            throw new IllegalArgumentException("plan needs at least one metric");
        }
        for (RowSort sort : ordering) {
            if (dimensionIndex(dimensions, sort.key()) < 0 && metricIndex(metrics, sort.key()) < 0) {
                throw new IllegalArgumentException("sort key '" + sort.key() + "' is not part of the plan");
            }
        }
    }

    /** Position of {@code key} among the dimensions, or -1. */
    public int dimensionIndex(String key) {
        return dimensionIndex(dimensions, key);
    }

    /** Position of {@code key} among the metrics, or -1. */
    public int metricIndex(String key) {
        return metricIndex(metrics, key);
    }

    private static int dimensionIndex(List<Dimension> dimensions, String key) {
        for (int i = 0; i < dimensions.size(); i++) {
            if (dimensions.get(i).key().equals(key)) return i;
        }
        return -1;
    }

    private static int metricIndex(List<Metric> metrics, String key) {
        for (int i = 0; i < metrics.size(); i++) {
            if (metrics.get(i).key().equals(key)) return i;
        }
        return -1;
    }
}
