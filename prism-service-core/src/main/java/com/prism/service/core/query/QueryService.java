package com.prism.service.core.query;

import com.prism.service.core.cache.QueryCacheKeys;
import com.prism.service.core.cache.QueryResultStore;
import com.prism.service.core.config.QueryProperties;
import com.prism.service.core.engine.AggregationEngine;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for query execution: validates the request, then answers from the result cache or the engine.
 * Only successful results are stored.
 */
@Service
@Slf4j
public class QueryService {

    private final QueryFactory factory;
    private final AggregationEngine engine;
    private final QueryResultStore cache;
    private final QueryProperties properties;
    private final Clock clock;

    public QueryService(
            QueryFactory factory,
            AggregationEngine engine,
            QueryResultStore cache,
            QueryProperties properties,
            Clock clock) {
        this.factory = factory;
        this.engine = engine;
        this.cache = cache;
        this.properties = properties;
        this.clock = clock;
    }

    public TableQueryResult table(TableQueryRequest request) {
        TableQuery query = factory.table(request);
        return cachedTable(query);
    }

    public TimeseriesQueryResult timeseries(TimeseriesQueryRequest request) {
        TimeseriesQuery query = factory.timeseries(request);
        return cached(
                QueryCacheKeys.timeseries(query, clock), TimeseriesQueryResult.class, () -> engine.timeseries(query));
    }

    /** One page of a freeform query. The window up to the page end is cached like any table query. */
    public FreeformQueryResult freeform(FreeformQueryRequest request) {
        FreeformQuery query = factory.freeform(request);
        long started = System.nanoTime();
        TableQueryResult window = cachedTable(query.window());
        List<Map<String, Object>> rows = window.rows();
        List<Map<String, Object>> page = query.offset() >= rows.size()
                ? List.of()
                : List.copyOf(rows.subList(query.offset(), Math.min(rows.size(), query.offset() + query.pageSize())));
        long queryMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        return new FreeformQueryResult(window.columns(), page, window.totals(), queryMs);
    }

    /** Drops every cached result of {@code tenantId}. */
    public int invalidateTenant(String tenantId) {
        int removed = 0;
        for (String prefix : QueryCacheKeys.tenantPrefixes(tenantId)) {
            removed += cache.sweep(prefix);
        }
        log.info("Invalidated {} cached query results for tenant {}", removed, tenantId);
        return removed;
    }

    private TableQueryResult cachedTable(TableQuery query) {
        return cached(QueryCacheKeys.table(query, clock), TableQueryResult.class, () -> engine.table(query));
    }

    private <T> T cached(String key, Class<T> type, Supplier<T> compute) {
        if (!properties.getCache().isEnabled()) {
            return compute.get();
        }
        T hit = cache.get(key, type);
        if (hit != null) {
            log.debug("Query cache hit {}", key);
            return hit;
        }
        T result = compute.get();
        cache.put(key, result);
        return result;
    }
}
