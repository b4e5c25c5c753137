package com.prism.service.core.engine;

import com.prism.core.model.Event;
import com.prism.service.core.catalog.Dimension;
import com.prism.service.core.catalog.Metric;
import com.prism.service.core.query.RowSort;
import com.prism.service.core.query.TableQuery;
import com.prism.service.core.query.TableQueryResult;
import com.prism.service.core.query.TimeseriesQuery;
import com.prism.service.core.query.TimeseriesQueryResult;
import com.prism.service.core.segment.SegmentEvaluator;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes validated queries against whichever {@link EventSource} is configured. A pushdown source answers the
 * plan itself; for a candidate source the engine filters and buckets in process. Ordering and truncation are
 * applied here in both cases so the two strategies cannot drift apart.
 */
@Service
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final EventSource source;
    private final Clock clock;

    public AggregationEngine(EventSource source, Clock clock) {
        this.source = source;
        this.clock = clock;
    }

    public TableQueryResult table(TableQuery query) {
        AggregationPlan plan = new AggregationPlan(
                query.tenantId(),
                query.dateRange().resolve(clock),
                query.dimensions(),
                query.metrics(),
                query.segment(),
                List.of(query.sort()),
                query.limit(),
                true);
        GroupedAggregation result = execute(plan);

        List<Map<String, Object>> rows = new ArrayList<>(result.rows().size());
        for (GroupRow row : result.rows()) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (int i = 0; i < plan.dimensions().size(); i++) {
                out.put(plan.dimensions().get(i).key(), row.dimensionValues().get(i));
            }
            for (int i = 0; i < plan.metrics().size(); i++) {
                out.put(plan.metrics().get(i).key(), row.metricValues().get(i));
            }
            rows.add(out);
        }
        Map<String, Number> totals = new LinkedHashMap<>();
        for (int i = 0; i < plan.metrics().size(); i++) {
            totals.put(plan.metrics().get(i).key(), result.totals().get(i));
        }
        return new TableQueryResult(query.columns(), rows, totals);
    }

    public TimeseriesQueryResult timeseries(TimeseriesQuery query) {
        Dimension bucket = query.granularity().dimension();
        List<Dimension> dimensions = new ArrayList<>();
        List<RowSort> ordering = new ArrayList<>();
        dimensions.add(bucket);
        ordering.add(RowSort.asc(bucket.key()));
        if (query.dimension() != null) {
            dimensions.add(query.dimension());
            ordering.add(RowSort.asc(query.dimension().key()));
        }
        AggregationPlan plan = new AggregationPlan(
                query.tenantId(),
                query.dateRange().resolve(clock),
                dimensions,
                List.of(query.metric()),
                query.segment(),
                ordering,
                null,
                false);
        GroupedAggregation result = execute(plan);

        List<TimeseriesQueryResult.Point> series = new ArrayList<>(result.rows().size());
        for (GroupRow row : result.rows()) {
            String split = query.dimension() == null ? null : row.dimensionValues().get(1);
            series.add(new TimeseriesQueryResult.Point(
                    row.dimensionValues().get(0), split, row.metricValues().get(0)));
        }
        return new TimeseriesQueryResult(series);
    }

    GroupedAggregation execute(AggregationPlan plan) {
        long started = System.nanoTime();
        GroupedAggregation raw;
        if (source instanceof PushdownEventSource pushdown) {
            raw = pushdown.compileAndExecute(plan);
        } else if (source instanceof CandidateEventSource candidates) {
            raw = scan(candidates, plan);
        } else {
            throw new IllegalStateException("Unsupported event source: " + source.getClass().getName());
        }
        List<GroupRow> rows = RowOrdering.apply(plan, new ArrayList<>(raw.rows()));
        if (log.isDebugEnabled()) {
            log.debug(
                    "Aggregated tenant={} dims={} metrics={} via {} -> {} rows in {} ms",
                    plan.tenantId(),
                    plan.dimensions().stream().map(Dimension::key).toList(),
                    plan.metrics().stream().map(Metric::key).toList(),
                    source.name(),
                    rows.size(),
                    (System.nanoTime() - started) / 1_000_000);
        }
        return new GroupedAggregation(rows, raw.totals());
    }

    private static GroupedAggregation scan(CandidateEventSource candidates, AggregationPlan plan) {
        List<Event> events = candidates.fetchCandidates(
                plan.tenantId(), plan.range().from(), plan.range().to());
        BucketAggregator aggregator = new BucketAggregator(plan.dimensions(), plan.metrics());
        for (Event event : events) {
            if (SegmentEvaluator.matches(event, plan.segment())) {
                aggregator.accept(event);
            }
        }
        return new GroupedAggregation(aggregator.rows(), plan.totals() ? aggregator.totals() : List.of());
    }
}
