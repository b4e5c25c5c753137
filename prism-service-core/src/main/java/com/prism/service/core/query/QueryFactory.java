package com.prism.service.core.query;

import com.prism.core.support.ScalarValues;
import com.prism.service.core.catalog.Dimension;
import com.prism.service.core.catalog.Metric;
import com.prism.service.core.catalog.SegmentField;
import com.prism.service.core.catalog.SegmentOperator;
import com.prism.service.core.config.QueryProperties;
import com.prism.service.core.query.QueryValidationException.Violation;
import com.prism.service.core.segment.SegmentGroup;
import com.prism.service.core.segment.SegmentLogic;
import com.prism.service.core.segment.SegmentNode;
import com.prism.service.core.segment.SegmentRule;
import jakarta.validation.Validator;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Turns wire requests into validated queries. The request's own constraints run first, then the catalog and
 * segment checks; every problem found is reported together in one {@link QueryValidationException}. A query
 * that comes out of here can be executed without further checks.
 */
@Component
public class QueryFactory {

    /** The query builder produces at most a group of groups. */
    static final int MAX_SEGMENT_DEPTH = 2;

    private static final Comparator<Violation> BY_FIELD =
            Comparator.comparing(Violation::field).thenComparing(Violation::message);

    private final QueryProperties properties;
    private final Validator validator;

    public QueryFactory(QueryProperties properties, Validator validator) {
        this.properties = properties;
        this.validator = validator;
    }

    public TableQuery table(TableQueryRequest request) {
        List<Violation> violations = constraints(request);
        String tenantId = tenant(request.tenantId());
        DateRange dateRange = dateRange(request.dateRange(), violations);
        List<Dimension> dimensions = dimensions("dimensionKeys", request.dimensionKeys(), violations);
        List<Metric> metrics = metrics("metricKeys", request.metricKeys(), violations);
        SegmentNode segment = segment(request.segment(), violations);
        int limit = request.limit() == null ? properties.getDefaultLimit() : request.limit();
        RowSort sort = sort(request.sort(), dimensions, metrics, violations);
        if (!violations.isEmpty()) {
            throw new QueryValidationException(violations);
        }
        return new TableQuery(tenantId, dateRange, dimensions, metrics, segment, sort, limit);
    }

    public TimeseriesQuery timeseries(TimeseriesQueryRequest request) {
        List<Violation> violations = constraints(request);
        String tenantId = tenant(request.tenantId());
        Metric metric = null;
        if (request.metricKey() != null && !request.metricKey().isBlank()) {
            metric = Metric.fromKey(LegacyKeyTranslator.metric(request.metricKey()));
            if (metric == null) {
                violations.add(new Violation("metricKey", "Unknown metric '" + request.metricKey() + "'"));
            }
        }
        Dimension dimension = null;
        if (request.dimensionKey() != null && !request.dimensionKey().isBlank()) {
            dimension = Dimension.fromKey(LegacyKeyTranslator.dimension(request.dimensionKey()));
            if (dimension == null) {
                violations.add(new Violation("dimensionKey", "Unknown dimension '" + request.dimensionKey() + "'"));
            }
        }
        Granularity granularity = Granularity.fromWire(request.granularity());
        if (granularity == null) {
            violations.add(new Violation("granularity", "granularity must be 'day' or 'hour'"));
        }
        DateRange dateRange = dateRange(request.dateRange(), violations);
        SegmentNode segment = segment(request.segment(), violations);
        if (!violations.isEmpty()) {
            throw new QueryValidationException(violations);
        }
        return new TimeseriesQuery(tenantId, metric, dimension, granularity, dateRange, segment);
    }

    /**
     * Freeform paging over the table engine: the window is cut at {@code offset + limit}, and the segment groups
     * are combined under one AND so they share the two-level depth rule with table queries.
     */
    public FreeformQuery freeform(FreeformQueryRequest request) {
        List<Violation> violations = constraints(request);
        String tenantId = tenant(request.tenantId());
        DateRange dateRange = request.dateRange() == null ? null : dateRange(request.dateRange(), violations);
        List<Dimension> dimensions = dimensions("rows", request.rows(), violations);
        List<Metric> metrics = metrics("columns", request.columns(), violations);
        SegmentNode segment = segments(request.segments(), violations);
        SortSpec first = request.sort() == null || request.sort().isEmpty() ? null : request.sort().get(0);
        RowSort sort = sort(first, dimensions, metrics, violations);
        if (!violations.isEmpty()) {
            throw new QueryValidationException(violations);
        }
        int pageSize = request.limit() == null ? FreeformQueryRequest.DEFAULT_LIMIT : request.limit();
        int offset = request.offset() == null ? 0 : request.offset();
        TableQuery window =
                new TableQuery(tenantId, dateRange, dimensions, metrics, segment, sort, offset + pageSize);
        return new FreeformQuery(window, offset, pageSize);
    }

    /** Declared request constraints, in a stable order; the list is mutable so later checks can add to it. */
    private List<Violation> constraints(Object request) {
        if (request == null) {
            throw new QueryValidationException(List.of(new Violation("body", "query request is required")));
        }
        List<Violation> violations = new ArrayList<>();
        validator.validate(request).stream()
                .map(v -> new Violation(v.getPropertyPath().toString(), v.getMessage()))
                .sorted(BY_FIELD)
                .forEach(violations::add);
        return violations;
    }

    private static String tenant(String tenantId) {
        return tenantId == null || tenantId.isBlank() ? null : tenantId.trim();
    }

    DateRange dateRange(DateRangeSpec spec, List<Violation> violations) {
        if (spec == null) {
            violations.add(new Violation("dateRange", "dateRange is required"));
            return null;
        }
        if (spec.preset() != null) {
            DatePreset preset = DatePreset.fromWire(spec.preset());
            if (preset == null) {
                violations.add(new Violation("dateRange.preset", "Unknown date preset '" + spec.preset() + "'"));
                return null;
            }
            return DateRange.of(preset);
        }
        Instant from = bound(spec.from(), DateBounds.Mode.START, "dateRange.from", violations);
        Instant to = bound(spec.to(), DateBounds.Mode.END, "dateRange.to", violations);
        if (from == null || to == null) {
            return null;
        }
        if (from.isAfter(to)) {
            violations.add(new Violation("dateRange", "dateRange.from must not be after dateRange.to"));
            return null;
        }
        return DateRange.between(from, to);
    }

    private Instant bound(String value, DateBounds.Mode mode, String field, List<Violation> violations) {
        if (value == null || value.isBlank()) {
            violations.add(new Violation(field, field + " is required"));
            return null;
        }
        Instant parsed = DateBounds.parse(value, mode);
        if (parsed == null) {
            violations.add(new Violation(field, "Invalid date format '" + value + "'"));
        }
        return parsed;
    }

    private List<Dimension> dimensions(String field, List<String> keys, List<Violation> violations) {
        List<Dimension> out = new ArrayList<>();
        if (keys == null) {
            return out;
        }
        Set<Dimension> seen = new LinkedHashSet<>();
        for (int i = 0; i < keys.size(); i++) {
            String raw = keys.get(i);
            Dimension dimension = Dimension.fromKey(LegacyKeyTranslator.dimension(raw));
            if (dimension == null) {
                violations.add(new Violation(field + "[" + i + "]", "Unknown dimension '" + raw + "'"));
            } else if (!seen.add(dimension)) {
                violations.add(new Violation(field + "[" + i + "]", "Duplicate dimension '" + raw + "'"));
            } else {
                out.add(dimension);
            }
        }
        return out;
    }

    private List<Metric> metrics(String field, List<String> keys, List<Violation> violations) {
        List<Metric> out = new ArrayList<>();
        if (keys == null) {
            return out;
        }
        Set<Metric> seen = new LinkedHashSet<>();
        for (int i = 0; i < keys.size(); i++) {
            String raw = keys.get(i);
            Metric metric = Metric.fromKey(LegacyKeyTranslator.metric(raw));
            if (metric == null) {
                violations.add(new Violation(field + "[" + i + "]", "Unknown metric '" + raw + "'"));
            } else if (!seen.add(metric)) {
                violations.add(new Violation(field + "[" + i + "]", "Duplicate metric '" + raw + "'"));
            } else {
                out.add(metric);
            }
        }
        return out;
    }

    private RowSort sort(SortSpec spec, List<Dimension> dimensions, List<Metric> metrics, List<Violation> violations) {
        if (spec == null || spec.key() == null) {
            if (metrics.isEmpty()) {
                return null;
            }
            SortDirection direction = spec == null ? SortDirection.DESC : direction(spec.direction(), violations);
            return new RowSort(metrics.get(0).key(), direction == null ? SortDirection.DESC : direction);
        }
        String key = LegacyKeyTranslator.sortKey(spec.key());
        boolean known = dimensions.stream().anyMatch(d -> d.key().equals(key))
                || metrics.stream().anyMatch(m -> m.key().equals(key));
        if (!known) {
            violations.add(new Violation("sort.key", "Invalid sort key: " + spec.key()));
            return null;
        }
        SortDirection direction = direction(spec.direction(), violations);
        return direction == null ? null : new RowSort(key, direction);
    }

    private SortDirection direction(String value, List<Violation> violations) {
        if (value == null) {
            return SortDirection.DESC;
        }
        SortDirection direction = SortDirection.fromWire(value);
        if (direction == null) {
            violations.add(new Violation("sort.direction", "sort.direction must be 'asc' or 'desc'"));
        }
        return direction;
    }

    private SegmentNode segments(List<SegmentSpec> specs, List<Violation> violations) {
        if (specs == null || specs.isEmpty()) {
            return null;
        }
        List<SegmentNode> groups = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            SegmentNode group = node(specs.get(i), "segments[" + i + "]", 2, violations);
            if (group != null) {
                groups.add(group);
            }
        }
        return groups.size() == specs.size() ? new SegmentGroup(SegmentLogic.AND, groups) : null;
    }

    SegmentNode segment(SegmentSpec spec, List<Violation> violations) {
        if (spec == null) {
            return null;
        }
        return node(spec, "segment", 1, violations);
    }

    private SegmentNode node(SegmentSpec spec, String path, int depth, List<Violation> violations) {
        if (spec == null) {
            violations.add(new Violation(path, "Segment node must not be null"));
            return null;
        }
        return spec.isRule() ? rule(spec, path, violations) : group(spec, path, depth, violations);
    }

    private SegmentNode group(SegmentSpec spec, String path, int depth, List<Violation> violations) {
        if (depth > MAX_SEGMENT_DEPTH) {
            violations.add(new Violation(path, "Segment groups nest at most " + MAX_SEGMENT_DEPTH + " levels deep"));
            return null;
        }
        SegmentLogic logic = SegmentLogic.fromWire(spec.op());
        if (logic == null) {
            violations.add(new Violation(path + ".op", "Segment group op must be AND or OR"));
        }
        if (spec.rules() == null || spec.rules().isEmpty()) {
            violations.add(new Violation(path + ".rules", "Segment group requires at least one rule"));
            return null;
        }
        List<SegmentNode> children = new ArrayList<>();
        for (int i = 0; i < spec.rules().size(); i++) {
            SegmentNode child = node(spec.rules().get(i), path + ".rules[" + i + "]", depth + 1, violations);
            if (child != null) {
                children.add(child);
            }
        }
        if (logic == null || children.size() != spec.rules().size()) {
            return null;
        }
        return new SegmentGroup(logic, children);
    }

    private SegmentNode rule(SegmentSpec spec, String path, List<Violation> violations) {
        String fieldKey = LegacyKeyTranslator.segmentField(spec.field());
        SegmentField field = SegmentField.resolve(fieldKey);
        if (field == null) {
            violations.add(new Violation(path + ".field", "Unsupported segment field: " + spec.field()));
            return null;
        }
        SegmentOperator operator = SegmentOperator.fromWire(spec.ruleOperator());
        if (operator == null) {
            violations.add(new Violation(path + ".operator", "Unknown operator '" + spec.ruleOperator() + "'"));
            return null;
        }
        if (!field.type().allowedOperators().contains(operator)) {
            violations.add(new Violation(path + ".operator", "Operator '" + operator.wireValue()
                    + "' is not valid for " + field.type().wireValue() + " field '" + field.key() + "'"));
            return null;
        }
        List<Object> rawValues = new ArrayList<>();
        if (operator == SegmentOperator.IN) {
            if (!(spec.value() instanceof Collection<?> values) || values.isEmpty()) {
                violations.add(new Violation(path + ".value", "Segment 'in' operator requires non-empty array value"));
                return null;
            }
            rawValues.addAll(values);
        } else {
            rawValues.add(spec.value());
        }
        List<Object> operands = new ArrayList<>();
        for (Object raw : rawValues) {
            Object operand = operand(field, raw);
            if (operand == null) {
                violations.add(new Violation(path + ".value", invalidValueMessage(field, raw)));
                return null;
            }
            operands.add(operand);
        }
        return new SegmentRule(field, operator, operands);
    }

    /** Operand converted to the field's type, or {@code null} when the value cannot be one. */
    private static Object operand(SegmentField field, Object raw) {
        if (!ScalarValues.isScalar(raw)) {
            return null;
        }
        return switch (field.type()) {
            case TEXT -> ScalarValues.asText(raw);
            case NUMBER -> numericOperand(raw);
            case DATE -> raw instanceof String s ? DateBounds.parseDay(s) : null;
        };
    }

    private static BigDecimal numericOperand(Object raw) {
        if (raw instanceof Boolean) {
            return null;
        }
        if (raw instanceof Number n && !(raw instanceof BigDecimal)) {
            double d = n.doubleValue();
            if (!Double.isFinite(d)) return null;
        }
        if (raw instanceof String s && !s.matches(ScalarValues.NUMERIC_REGEX)) {
            return null;
        }
        return ScalarValues.toNumber(raw);
    }

    private static String invalidValueMessage(SegmentField field, Object raw) {
        if (raw instanceof Map<?, ?> || raw instanceof Collection<?>) {
            return "Segment value for '" + field.key() + "' must be a scalar";
        }
        return switch (field.type()) {
            case NUMBER -> "Numeric segment value expected for field '" + field.key() + "'";
            case DATE -> "Date segment value (YYYY-MM-DD or ISO-8601) expected for field '" + field.key() + "'";
            case TEXT -> "Text segment value expected for field '" + field.key() + "'";
        };
    }
}
