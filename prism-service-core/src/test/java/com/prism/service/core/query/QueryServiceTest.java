package com.prism.service.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.prism.service.core.TestEvents;
import com.prism.service.core.cache.CaffeineQueryResultStore;
import com.prism.service.core.config.QueryProperties;
import com.prism.service.core.engine.AggregationEngine;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class QueryServiceTest {

    private static final DateRangeSpec FEB = DateRangeSpec.between("2026-02-01", "2026-02-07");

    @Mock
    private AggregationEngine engine;

    private QueryProperties properties;
    private MovableClock clock;
    private QueryService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        properties = new QueryProperties();
        clock = new MovableClock(Instant.parse("2026-02-10T23:59:59.500Z"));
        service = new QueryService(
                new QueryFactory(properties, TestEvents.VALIDATOR),
                engine,
                new CaffeineQueryResultStore(properties),
                properties,
                clock);
    }

    @Test
    void repeatedQueryIsServedFromCache() {
        TableQueryResult computed = tableResult(4L);
        when(engine.table(any())).thenReturn(computed);

        TableQueryResult first = service.table(request("acme", List.of("channel")));
        TableQueryResult second = service.table(request("acme", List.of("channel")));

        assertSame(computed, first);
        assertSame(computed, second);
        verify(engine, times(1)).table(any());
    }

    @Test
    void legacySpellingSharesTheCacheEntry() {
        when(engine.table(any())).thenReturn(tableResult(4L));

        service.table(request("acme", List.of("channel")));
        service.table(request("acme", List.of("dimension:channel")));

        verify(engine, times(1)).table(any());
    }

    @Test
    void tenantsDoNotShareEntries() {
        when(engine.table(any())).thenReturn(tableResult(4L));

        service.table(request("acme", List.of("channel")));
        service.table(request("globex", List.of("channel")));

        verify(engine, times(2)).table(any());
    }

    @Test
    void failuresAreNotCached() {
        when(engine.table(any())).thenThrow(new IllegalStateException("boom")).thenReturn(tableResult(1L));

        assertThrows(IllegalStateException.class, () -> service.table(request("acme", List.of("channel"))));
        TableQueryResult retried = service.table(request("acme", List.of("channel")));

        assertEquals(1L, retried.totals().get("events"));
        verify(engine, times(2)).table(any());
    }

    @Test
    void invalidRequestNeverReachesTheEngine() {
        assertThrows(QueryValidationException.class, () -> service.table(request("acme", List.of("country"))));

        verify(engine, never()).table(any());
    }

    @Test
    void invalidateTenantDropsOnlyThatTenant() {
        when(engine.table(any())).thenReturn(tableResult(4L));
        when(engine.timeseries(any())).thenReturn(new TimeseriesQueryResult(List.of()));
        service.table(request("acme", List.of("channel")));
        service.timeseries(new TimeseriesQueryRequest("acme", "events", null, "day", FEB, null));
        service.table(request("globex", List.of("channel")));

        assertEquals(2, service.invalidateTenant("acme"));

        service.table(request("acme", List.of("channel")));
        service.table(request("globex", List.of("channel")));
        verify(engine, times(3)).table(any());
    }

    @Test
    void disabledCacheAlwaysComputes() {
        properties.getCache().setEnabled(false);
        when(engine.table(any())).thenReturn(tableResult(4L));

        service.table(request("acme", List.of("channel")));
        service.table(request("acme", List.of("channel")));

        verify(engine, times(2)).table(any());
    }

    @Test
    void timeseriesIsCachedSeparatelyFromTables() {
        when(engine.timeseries(any())).thenReturn(new TimeseriesQueryResult(
                List.of(new TimeseriesQueryResult.Point("2026-02-01", null, 3L))));

        TimeseriesQueryResult first = service.timeseries(
                new TimeseriesQueryRequest("acme", "events", null, "day", FEB, null));
        TimeseriesQueryResult second = service.timeseries(
                new TimeseriesQueryRequest("acme", "metric:event_count", null, "DAY", FEB, null));

        assertThat(second.series()).isEqualTo(first.series());
        verify(engine, times(1)).timeseries(any());
    }

    @Test
    void presetResultsAreNotServedAcrossUtcMidnight() {
        when(engine.table(any())).thenReturn(tableResult(4L));
        TableQueryRequest today = new TableQueryRequest(
                "acme", DateRangeSpec.preset("today"), List.of("channel"), List.of("events"), null, null, null);

        service.table(today);
        service.table(today);
        clock.now = Instant.parse("2026-02-11T00:00:00.500Z");
        service.table(today);

        verify(engine, times(2)).table(any());
    }

    @Test
    void freeformPageIsCutFromTheOrderedWindow() {
        when(engine.table(any())).thenReturn(channelRows("A", "B", "C", "D"));

        FreeformQueryResult page = service.freeform(freeform(2, 2));

        ArgumentCaptor<TableQuery> window = ArgumentCaptor.forClass(TableQuery.class);
        verify(engine).table(window.capture());
        assertEquals(4, window.getValue().limit());
        assertThat(page.rows()).extracting(r -> r.get("channel")).containsExactly("C", "D");
        assertThat(page.columns()).containsExactly("channel", "events");
        assertEquals(40L, page.totals().get("events"));
        assertThat(page.queryMs()).isNotNegative();
    }

    @Test
    void freeformOffsetPastTheLastRowGivesAnEmptyPage() {
        when(engine.table(any())).thenReturn(channelRows("A", "B"));

        FreeformQueryResult page = service.freeform(freeform(10, 5));

        assertThat(page.rows()).isEmpty();
        assertEquals(40L, page.totals().get("events"));
    }

    @Test
    void freeformWindowIsCachedLikeATableQuery() {
        when(engine.table(any())).thenReturn(channelRows("A", "B", "C", "D"));

        service.freeform(freeform(2, 2));
        FreeformQueryResult again = service.freeform(freeform(2, 2));
        service.table(new TableQueryRequest("acme", FEB, List.of("channel"), List.of("events"), null, null, 4));

        assertThat(again.rows()).extracting(r -> r.get("channel")).containsExactly("C", "D");
        verify(engine, times(1)).table(any());
    }

    private static FreeformQueryRequest freeform(int limit, int offset) {
        return new FreeformQueryRequest(
                "acme", List.of("channel"), List.of("events"), null, FEB, limit, offset, null);
    }

    private static TableQueryResult channelRows(String... channels) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String channel : channels) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("channel", channel);
            row.put("events", 10L);
            rows.add(row);
        }
        return new TableQueryResult(List.of("channel", "events"), rows, Map.of("events", 40L));
    }

    private static TableQueryRequest request(String tenantId, List<String> dimensions) {
        return new TableQueryRequest(tenantId, FEB, dimensions, List.of("events"), null, null, null);
    }

    private static TableQueryResult tableResult(long events) {
        return new TableQueryResult(
                List.of("channel", "events"),
                List.of(Map.of("channel", "Email", "events", events)),
                Map.of("events", events));
    }

    private static final class MovableClock extends Clock {

        private Instant now;

        MovableClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
