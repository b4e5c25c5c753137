package com.prism.service.core.engine;

import java.util.List;

/** One bucket: dimension values and metric values, index-aligned with the plan. */
public record GroupRow(List<String> dimensionValues, List<Number> metricValues) {

    public GroupRow {
        dimensionValues = List.copyOf(dimensionValues);
        metricValues = List.copyOf(metricValues);
    }
}
