package com.prism.service.core.catalog;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/** Value type of a segment field; decides which operators a rule on that field may use. */
public enum FieldType {
    TEXT,
    NUMBER,
    DATE;

    public Set<SegmentOperator> allowedOperators() {
        return switch (this) {
            case TEXT -> EnumSet.of(
                    SegmentOperator.EQ, SegmentOperator.NEQ, SegmentOperator.CONTAINS, SegmentOperator.IN);
            case NUMBER, DATE -> EnumSet.of(
                    SegmentOperator.EQ,
                    SegmentOperator.NEQ,
                    SegmentOperator.GT,
                    SegmentOperator.GTE,
                    SegmentOperator.LT,
                    SegmentOperator.LTE,
                    SegmentOperator.IN);
        };
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
