package com.prism.service.core.engine;

import com.prism.core.model.Event;
import com.prism.service.core.catalog.Dimension;
import com.prism.service.core.catalog.Metric;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process grouping. Buckets are keyed by the tuple of derived dimension values and kept in the order they
 * were first seen; a totals bucket receives every accepted event. Without dimensions there is exactly one
 * bucket, present even when no event matches.
 */
final class BucketAggregator {

    private final List<Dimension> dimensions;
    private final List<Metric> metrics;
    private final Map<List<String>, List<Metric.Accumulator>> buckets = new LinkedHashMap<>();
    private final List<Metric.Accumulator> totals;

    BucketAggregator(List<Dimension> dimensions, List<Metric> metrics) {
        this.dimensions = dimensions;
        this.metrics = metrics;
        this.totals = newAccumulators();
        if (dimensions.isEmpty()) {
            buckets.put(List.of(), newAccumulators());
        }
    }

    void accept(Event event) {
        List<String> key = new ArrayList<>(dimensions.size());
        for (Dimension dimension : dimensions) {
            key.add(dimension.derive(event));
        }
        List<Metric.Accumulator> bucket = buckets.computeIfAbsent(key, k -> newAccumulators());
        for (int i = 0; i < metrics.size(); i++) {
            bucket.get(i).accept(event);
            totals.get(i).accept(event);
        }
    }

    List<GroupRow> rows() {
        List<GroupRow> rows = new ArrayList<>(buckets.size());
        buckets.forEach((key, accumulators) -> rows.add(new GroupRow(key, values(accumulators))));
        return rows;
    }

    List<Number> totals() {
        return values(totals);
    }

    private List<Metric.Accumulator> newAccumulators() {
        List<Metric.Accumulator> accumulators = new ArrayList<>(metrics.size());
        for (Metric metric : metrics) {
            accumulators.add(metric.newAccumulator());
        }
        return accumulators;
    }

    private static List<Number> values(List<Metric.Accumulator> accumulators) {
        List<Number> values = new ArrayList<>(accumulators.size());
        for (Metric.Accumulator accumulator : accumulators) {
            values.add(accumulator.value());
        }
        return values;
    }
}
