package com.prism.service.storage.impl;

import com.prism.core.support.ScalarValues;
import com.prism.service.core.catalog.Dimension;
import com.prism.service.core.catalog.Metric;
import com.prism.service.core.catalog.SegmentField;
import com.prism.service.core.catalog.SegmentOperator;
import com.prism.service.core.engine.AggregationPlan;
import com.prism.service.core.query.RowSort;
import com.prism.service.core.segment.SegmentGroup;
import com.prism.service.core.segment.SegmentLogic;
import com.prism.service.core.segment.SegmentNode;
import com.prism.service.core.segment.SegmentRule;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers an {@link AggregationPlan} to two PostgreSQL statements over the events table:
 *
 *  1) the grouped rows, ordered and limited,
 *  2) the totals over the same filtered population.
 *
 * Both statements embed the same WHERE text and share one parameter map. Every request value is a bind
 * parameter; column expressions only interpolate property names from the closed catalog.
 */
public final class AggregationSqlBuilder {

    private static final String NUMERIC_GUARD = ScalarValues.NUMERIC_REGEX.replace("'", "''");

    private final String eventsTable;

    public AggregationSqlBuilder() {
        this("events");
    }

    public AggregationSqlBuilder(String eventsTable) {
        this.eventsTable = eventsTable;
    }

    public record Built(String rowsSql, String totalsSql, String where, Map<String, Object> params) {}

    public Built build(AggregationPlan plan) {
        Map<String, Object> p = new LinkedHashMap<>();
        String where = where(plan, p);

        List<Dimension> dims = plan.dimensions();
        List<Metric> metrics = plan.metrics();

        StringBuilder inner = new StringBuilder(1024).append("SELECT ");
        List<String> select = new ArrayList<>();
        for (int i = 0; i < dims.size(); i++) {
            select.add(dimensionExpr(dims.get(i)) + " AS d" + i);
        }
        for (int i = 0; i < metrics.size(); i++) {
            select.add(metricExpr(metrics.get(i)) + " AS m" + i);
        }
        inner.append(String.join(", ", select))
                .append("\n  FROM ")
                .append(eventsTable)
                .append("\n")
                .append(where);
        if (!dims.isEmpty()) {
            List<String> groupBy = new ArrayList<>();
            for (int i = 1; i <= dims.size(); i++) {
                groupBy.add(String.valueOf(i));
            }
            inner.append("\n GROUP BY ").append(String.join(", ", groupBy));
        }

        StringBuilder rows = new StringBuilder(1536)
                .append("SELECT * FROM (\n")
                .append(inner)
                .append("\n) g");
        List<String> orderBy = orderBy(plan);
        if (!orderBy.isEmpty()) {
            rows.append("\n ORDER BY ").append(String.join(", ", orderBy));
        }
        if (plan.limit() != null) {
            rows.append("\n LIMIT :limit");
            p.put("limit", plan.limit());
        }

        StringBuilder totals = new StringBuilder(512).append("SELECT ");
        List<String> totalSelect = new ArrayList<>();
        for (int i = 0; i < metrics.size(); i++) {
            totalSelect.add(metricExpr(metrics.get(i)) + " AS m" + i);
        }
        totals.append(String.join(", ", totalSelect))
                .append("\n  FROM ")
                .append(eventsTable)
                .append("\n")
                .append(where);

        return new Built(rows.toString(), totals.toString(), where, p);
    }

    private String where(AggregationPlan plan, Map<String, Object> p) {
        StringBuilder sql = new StringBuilder(512)
                .append(" WHERE tenant_id = :tenant_id\n")
                .append("   AND occurred_at >= :ts_from AND occurred_at <= :ts_to");
        p.put("tenant_id", plan.tenantId());
        p.put("ts_from", OffsetDateTime.ofInstant(plan.range().from(), ZoneOffset.UTC));
        p.put("ts_to", OffsetDateTime.ofInstant(plan.range().to(), ZoneOffset.UTC));
        if (plan.segment() != null) {
            sql.append("\n   AND ").append(segment(plan.segment(), p, new int[] {0}));
        }
        return sql.toString();
    }

    private List<String> orderBy(AggregationPlan plan) {
        List<String> out = new ArrayList<>();
        List<Integer> orderedDims = new ArrayList<>();
        for (RowSort sort : plan.ordering()) {
            int d = plan.dimensionIndex(sort.key());
            if (d >= 0) {
                out.add("g.d" + d + " COLLATE \"C\" " + sort.direction().sql());
                orderedDims.add(d);
            } else {
                out.add("g.m" + plan.metricIndex(sort.key()) + " " + sort.direction().sql());
            }
        }
        // ties: remaining dimensions ascending
        for (int d = 0; d < plan.dimensions().size(); d++) {
            if (!orderedDims.contains(d)) {
                out.add("g.d" + d + " COLLATE \"C\" ASC");
            }
        }
        return out;
    }

    static String dimensionExpr(Dimension dimension) {
        return switch (dimension.source()) {
            case PROPERTY -> "COALESCE(" + propertyText(dimension.property()) + ", '" + Dimension.NONE + "')";
            case EVENT_NAME -> "COALESCE(event_name, '" + Dimension.NONE + "')";
            case DAY -> "TO_CHAR(occurred_at AT TIME ZONE 'UTC', 'YYYY-MM-DD')";
            case HOUR -> "TO_CHAR(DATE_TRUNC('hour', occurred_at AT TIME ZONE 'UTC'), 'YYYY-MM-DD\"T\"HH24:00:00\"Z\"')";
        };
    }

    static String metricExpr(Metric metric) {
        return switch (metric.aggregation()) {
            case COUNT -> "COUNT(*)";
            case DISTINCT_USERS -> "COUNT(DISTINCT user_id)";
            case SUM -> "COALESCE(SUM(" + numeric(propertyText(metric.property())) + "), 0)";
        };
    }

    /** Cast guarded by the numeric pattern: anything else reads as 0. */
    static String numeric(String textExpr) {
        return "CASE WHEN (" + textExpr + ") ~ '" + NUMERIC_GUARD + "' THEN (" + textExpr
                + ")::numeric ELSE 0 END";
    }

    private String segment(SegmentNode node, Map<String, Object> p, int[] counter) {
        if (node instanceof SegmentRule rule) {
            return rule(rule, p, counter);
        }
        SegmentGroup group = (SegmentGroup) node;
        List<String> parts = new ArrayList<>(group.children().size());
        for (SegmentNode child : group.children()) {
            parts.add(segment(child, p, counter));
        }
        String joiner = group.logic() == SegmentLogic.AND ? " AND " : " OR ";
        return "(" + String.join(joiner, parts) + ")";
    }

    private String rule(SegmentRule rule, Map<String, Object> p, int[] counter) {
        String name = "s" + (counter[0]++);
        String lhs = fieldExpr(rule.field(), name, p);
        SegmentOperator op = rule.operator();
        switch (op) {
            case CONTAINS -> {
                p.put(name, "%" + escapeLike((String) rule.operand()) + "%");
                return lhs + " ILIKE :" + name;
            }
            case IN -> {
                p.put(name, new ArrayList<>(rule.operands()));
                return lhs + " IN (:" + name + ")";
            }
            default -> {
                p.put(name, rule.operand());
                return lhs + " " + comparison(op) + " :" + name;
            }
        }
    }

    private static String comparison(SegmentOperator op) {
        return switch (op) {
            case EQ -> "=";
            case NEQ -> "<>";
            case GT -> ">";
            case GTE -> ">=";
            case LT -> "<";
            case LTE -> "<=";
            default -> throw new IllegalArgumentException("Not a comparison: " + op);
        };
    }

    private static String fieldExpr(SegmentField field, String param, Map<String, Object> p) {
        return switch (field.type()) {
            case DATE -> "(occurred_at AT TIME ZONE 'UTC')::date";
            case NUMBER -> numeric(propertyText(field.property()));
            case TEXT -> switch (field.source()) {
                case EVENT_NAME -> "COALESCE(event_name, '')";
                case USER_ID -> "COALESCE(user_id, '')";
                case DAY -> "TO_CHAR(occurred_at AT TIME ZONE 'UTC', 'YYYY-MM-DD')";
                case PROPERTY -> {
                    if (field.raw()) {
                        p.put(param + "_key", field.property());
                        yield "COALESCE(properties->>:" + param + "_key, '')";
                    }
                    yield "COALESCE(" + propertyText(field.property()) + ", '')";
                }
            };
        };
    }

    static String propertyText(String property) {
        return "properties->>'" + property.replace("'", "''") + "'";
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
