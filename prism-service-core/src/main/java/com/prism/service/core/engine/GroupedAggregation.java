package com.prism.service.core.engine;

import java.util.List;

/** Rows of a plan plus its totals; {@code totals} is empty when the plan did not ask for them. */
public record GroupedAggregation(List<GroupRow> rows, List<Number> totals) {

    public GroupedAggregation {
        rows = List.copyOf(rows);
        totals = totals == null ? List.of() : List.copyOf(totals);
    }
}
