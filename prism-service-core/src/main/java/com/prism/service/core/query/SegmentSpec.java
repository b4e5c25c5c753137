package com.prism.service.core.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Wire form of a segment node. A node with a {@code field} is a rule ({@code operator}, or {@code op} as older
 * clients send it, plus {@code value}); a node without one is a group ({@code op} AND/OR plus {@code rules}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SegmentSpec(String field, String operator, String op, Object value, List<SegmentSpec> rules) {

    public static SegmentSpec rule(String field, String operator, Object value) {
        return new SegmentSpec(field, operator, null, value, null);
    }

    public static SegmentSpec group(String op, SegmentSpec... rules) {
        return new SegmentSpec(null, null, op, null, List.of(rules));
    }

    public boolean isRule() {
        return field != null;
    }

    public String ruleOperator() {
        return operator != null ? operator : op;
    }
}
