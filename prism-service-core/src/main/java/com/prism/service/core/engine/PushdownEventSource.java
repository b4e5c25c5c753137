package com.prism.service.core.engine;

/**
 * Source that evaluates filtering, grouping, metrics and totals in the backing store. Rows come back already
 * ordered by {@link AggregationPlan#ordering()} and cut at {@link AggregationPlan#limit()}.
 */
public interface PushdownEventSource extends EventSource {

    GroupedAggregation compileAndExecute(AggregationPlan plan);
}
