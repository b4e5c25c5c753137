package com.prism.service.core.engine;

import com.prism.core.support.ScalarValues;
import com.prism.service.core.query.RowSort;
import com.prism.service.core.query.SortDirection;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Ordering shared by both strategies. Metrics compare numerically, dimensions by their unsigned UTF-8 bytes,
 * which is what {@code COLLATE "C"} does in a UTF-8 database. The sort is stable, so rows that tie keep the
 * order the strategy produced them in.
 */
final class RowOrdering {

    /** UTF-16 {@link String#compareTo} disagrees with byte order once supplementary characters appear. */
    static final Comparator<String> BYTE_ORDER = (a, b) ->
            Arrays.compareUnsigned(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

    private RowOrdering() {}

    static Comparator<GroupRow> comparator(AggregationPlan plan) {
        Comparator<GroupRow> comparator = (a, b) -> 0;
        for (RowSort sort : plan.ordering()) {
            Comparator<GroupRow> next = keyComparator(plan, sort.key());
            comparator = comparator.thenComparing(sort.direction() == SortDirection.DESC ? next.reversed() : next);
        }
        return comparator;
    }

    /** Sorts {@code rows} in place, then cuts them at the plan's limit. */
    static List<GroupRow> apply(AggregationPlan plan, List<GroupRow> rows) {
        if (!plan.ordering().isEmpty()) {
            rows.sort(comparator(plan));
        }
        if (plan.limit() != null && rows.size() > plan.limit()) {
            return rows.subList(0, plan.limit());
        }
        return rows;
    }

    private static Comparator<GroupRow> keyComparator(AggregationPlan plan, String key) {
        int dimension = plan.dimensionIndex(key);
        if (dimension >= 0) {
            return Comparator.comparing(row -> row.dimensionValues().get(dimension), BYTE_ORDER);
        }
        int metric = plan.metricIndex(key);
        return Comparator.comparing(row -> ScalarValues.toNumber(row.metricValues().get(metric)));
    }
}
