package com.prism.service.core.query;

import com.prism.service.core.catalog.Dimension;
import com.prism.service.core.catalog.Metric;
import com.prism.service.core.segment.SegmentNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Validated, tenant-scoped table query. Built only by {@link QueryFactory}. */
public record TableQuery(
        String tenantId,
        DateRange dateRange,
        List<Dimension> dimensions,
        List<Metric> metrics,
        SegmentNode segment,
        RowSort sort,
        int limit) {

    public TableQuery {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(dateRange, "dateRange");
        dimensions = List.copyOf(dimensions);
        metrics = List.copyOf(metrics);
        if (metrics.isEmpty()) {
            throw new IllegalArgumentException("At least one metric is required");
        }
        Objects.requireNonNull(sort, "sort");
    }

    /** Output column order: dimension keys followed by metric keys. */
    public List<String> columns() {
        List<String> columns = new ArrayList<>(dimensions.size() + metrics.size());
        dimensions.forEach(d -> columns.add(d.key()));
        metrics.forEach(m -> columns.add(m.key()));
        return columns;
    }
}
