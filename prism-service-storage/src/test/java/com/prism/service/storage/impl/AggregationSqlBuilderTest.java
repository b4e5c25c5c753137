package com.prism.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.prism.core.support.ScalarValues;
import com.prism.service.core.catalog.Dimension;
import com.prism.service.core.catalog.Metric;
import com.prism.service.core.catalog.SegmentField;
import com.prism.service.core.catalog.SegmentOperator;
import com.prism.service.core.engine.AggregationPlan;
import com.prism.service.core.query.ResolvedRange;
import com.prism.service.core.query.RowSort;
import com.prism.service.core.segment.SegmentGroup;
import com.prism.service.core.segment.SegmentNode;
import com.prism.service.core.segment.SegmentRule;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class AggregationSqlBuilderTest {

    private static final ResolvedRange FEB =
            new ResolvedRange(Instant.parse("2026-02-01T00:00:00Z"), Instant.parse("2026-02-07T23:59:59.999Z"));

    private final AggregationSqlBuilder builder = new AggregationSqlBuilder();

    @Test
    void rowsAndTotalsShareTheFilter() {
        SegmentNode segment = SegmentGroup.and(
                SegmentRule.of(SegmentField.resolve("eventName"), SegmentOperator.EQ, "purchase"),
                SegmentRule.of(SegmentField.resolve("revenue"), SegmentOperator.GT, new BigDecimal("10")));

        AggregationSqlBuilder.Built built = builder.build(plan(segment, 10));

        assertThat(built.where())
                .startsWith(" WHERE tenant_id = :tenant_id")
                .contains("occurred_at >= :ts_from AND occurred_at <= :ts_to")
                .contains("(COALESCE(event_name, '') = :s0 AND ");
        assertThat(built.rowsSql()).contains(built.where());
        assertThat(built.totalsSql()).contains(built.where()).doesNotContain("GROUP BY").doesNotContain("LIMIT");
        assertEquals("acme", built.params().get("tenant_id"));
        assertEquals(utc("2026-02-01T00:00:00Z"), built.params().get("ts_from"));
        assertEquals(utc("2026-02-07T23:59:59.999Z"), built.params().get("ts_to"));
        assertEquals("purchase", built.params().get("s0"));
        assertEquals(new BigDecimal("10"), built.params().get("s1"));
    }

    @Test
    void numericFieldsAreGuardedBeforeTheCast() {
        AggregationSqlBuilder.Built built = builder.build(plan(
                SegmentRule.of(SegmentField.resolve("revenue"), SegmentOperator.GTE, new BigDecimal("5")), 10));

        String guarded = "CASE WHEN (properties->>'revenue') ~ '" + ScalarValues.NUMERIC_REGEX
                + "' THEN (properties->>'revenue')::numeric ELSE 0 END";
        assertThat(built.where()).contains(guarded + " >= :s0");
        assertThat(built.rowsSql()).contains("COALESCE(SUM(" + guarded + "), 0) AS m1");
    }

    @Test
    void orderingLimitAndTieBreak() {
        AggregationSqlBuilder.Built built = builder.build(plan(null, 25));

        assertThat(built.rowsSql())
                .contains("COALESCE(properties->>'channel', '(none)') AS d0")
                .contains("COUNT(*) AS m0")
                .contains(" GROUP BY 1")
                .contains(" ORDER BY g.m1 DESC, g.d0 COLLATE \"C\" ASC")
                .endsWith(" LIMIT :limit");
        assertEquals(25, built.params().get("limit"));
    }

    @Test
    void unlimitedPlanHasNoLimitClause() {
        AggregationPlan plan = new AggregationPlan(
                "acme",
                FEB,
                List.of(Dimension.DAY, Dimension.CHANNEL),
                List.of(Metric.USERS),
                null,
                List.of(RowSort.asc("day"), RowSort.asc("channel")),
                null,
                false);

        AggregationSqlBuilder.Built built = builder.build(plan);

        assertThat(built.rowsSql())
                .contains("TO_CHAR(occurred_at AT TIME ZONE 'UTC', 'YYYY-MM-DD') AS d0")
                .contains("COUNT(DISTINCT user_id) AS m0")
                .contains(" GROUP BY 1, 2")
                .contains(" ORDER BY g.d0 COLLATE \"C\" ASC, g.d1 COLLATE \"C\" ASC")
                .doesNotContain("LIMIT");
        assertThat(built.params()).doesNotContainKey("limit");
    }

    @Test
    void planWithoutDimensionsIsASingleAggregate() {
        AggregationPlan plan = new AggregationPlan(
                "acme", FEB, List.of(), List.of(Metric.EVENTS), null, List.of(RowSort.desc("events")), 10, true);

        assertThat(builder.build(plan).rowsSql()).doesNotContain("GROUP BY");
    }

    @Test
    void rawPropertiesAndContainsAreBound() {
        SegmentNode segment = SegmentGroup.or(
                SegmentRule.of(SegmentField.resolve("properties.utm_source"), SegmentOperator.CONTAINS, "50%_off"),
                new SegmentRule(SegmentField.resolve("channel"), SegmentOperator.IN, List.of("Email", "Direct")));

        AggregationSqlBuilder.Built built = builder.build(plan(segment, 10));

        assertThat(built.where())
                .contains("(COALESCE(properties->>:s0_key, '') ILIKE :s0 OR ")
                .contains("COALESCE(properties->>'channel', '') IN (:s1))")
                .doesNotContain("utm_source");
        assertEquals("utm_source", built.params().get("s0_key"));
        assertEquals("%50\\%\\_off%", built.params().get("s0"));
        assertEquals(List.of("Email", "Direct"), built.params().get("s1"));
    }

    @Test
    void dateFieldsCompareOnTheUtcDay() {
        AggregationSqlBuilder.Built built = builder.build(plan(
                SegmentRule.of(SegmentField.resolve("day"), SegmentOperator.LTE, LocalDate.parse("2026-02-03")),
                10));

        assertThat(built.where()).contains("(occurred_at AT TIME ZONE 'UTC')::date <= :s0");
    }

    @Test
    void helpers() {
        assertEquals("properties->>'o''brien'", AggregationSqlBuilder.propertyText("o'brien"));
        assertEquals("a\\\\b\\%c\\_d", AggregationSqlBuilder.escapeLike("a\\b%c_d"));
        assertEquals(
                "TO_CHAR(DATE_TRUNC('hour', occurred_at AT TIME ZONE 'UTC'), 'YYYY-MM-DD\"T\"HH24:00:00\"Z\"')",
                AggregationSqlBuilder.dimensionExpr(Dimension.HOUR));
        assertEquals("COALESCE(event_name, '(none)')", AggregationSqlBuilder.dimensionExpr(Dimension.EVENT_NAME));
    }

    @Test
    void customTableName() {
        assertThat(new AggregationSqlBuilder("analytics.events").build(plan(null, 10)).totalsSql())
                .contains("FROM analytics.events");
    }

    private static AggregationPlan plan(SegmentNode segment, Integer limit) {
        return new AggregationPlan(
                "acme",
                FEB,
                List.of(Dimension.CHANNEL),
                List.of(Metric.EVENTS, Metric.REVENUE),
                segment,
                List.of(RowSort.desc("revenue")),
                limit,
                true);
    }

    private static OffsetDateTime utc(String instant) {
        return OffsetDateTime.ofInstant(Instant.parse(instant), ZoneOffset.UTC);
    }
}
