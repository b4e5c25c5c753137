package com.prism.service.core.segment;

import com.prism.core.model.Event;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Row-by-row evaluation of a segment tree. Pure and total for any tree that could be constructed; the SQL
 * compiler in the storage module emits the same comparisons.
 */
public final class SegmentEvaluator {

    private SegmentEvaluator() {}

    /** {@code null} segment matches everything. */
    public static boolean matches(Event event, SegmentNode node) {
        if (node == null) {
            return true;
        }
        if (node instanceof SegmentRule rule) {
            return matchesRule(event, rule);
        }
        SegmentGroup group = (SegmentGroup) node;
        if (group.logic() == SegmentLogic.AND) {
            for (SegmentNode child : group.children()) {
                if (!matches(event, child)) return false;
            }
            return true;
        }
        for (SegmentNode child : group.children()) {
            if (matches(event, child)) return true;
        }
        return false;
    }

    static boolean matchesRule(Event event, SegmentRule rule) {
        Object value = rule.field().read(event);
        return switch (rule.operator()) {
            case EQ -> compare(value, rule.operand()) == 0;
            case NEQ -> compare(value, rule.operand()) != 0;
            case GT -> compare(value, rule.operand()) > 0;
            case GTE -> compare(value, rule.operand()) >= 0;
            case LT -> compare(value, rule.operand()) < 0;
            case LTE -> compare(value, rule.operand()) <= 0;
            case CONTAINS -> ((String) value)
                    .toLowerCase(Locale.ROOT)
                    .contains(((String) rule.operand()).toLowerCase(Locale.ROOT));
            case IN -> {
                for (Object operand : rule.operands()) {
                    if (compare(value, operand) == 0) yield true;
                }
                yield false;
            }
        };
    }

    private static int compare(Object value, Object operand) {
        if (value instanceof BigDecimal number) {
            return number.compareTo((BigDecimal) operand);
        }
        if (value instanceof LocalDate date) {
            return date.compareTo((LocalDate) operand);
        }
        return ((String) value).compareTo((String) operand);
    }
}
