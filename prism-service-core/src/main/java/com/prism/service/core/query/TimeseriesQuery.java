package com.prism.service.core.query;

import com.prism.service.core.catalog.Dimension;
import com.prism.service.core.catalog.Metric;
import com.prism.service.core.segment.SegmentNode;
import java.util.Objects;

/** Validated series query; {@code dimension} is optional and splits each bucket into one point per value. */
public record TimeseriesQuery(
        String tenantId,
        Metric metric,
        Dimension dimension,
        Granularity granularity,
        DateRange dateRange,
        SegmentNode segment) {

    public TimeseriesQuery {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(granularity, "granularity");
        Objects.requireNonNull(dateRange, "dateRange");
    }
}
