package com.prism.service.core.segment;

import com.prism.service.core.catalog.FieldType;
import com.prism.service.core.catalog.SegmentField;
import com.prism.service.core.catalog.SegmentOperator;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A typed comparison. Operands are already normalised to the field's type: {@link String} for text,
 * {@link BigDecimal} for numbers and {@link LocalDate} for dates. Only {@link SegmentOperator#IN} carries more
 * than one operand.
 */
public record SegmentRule(SegmentField field, SegmentOperator operator, List<Object> operands) implements SegmentNode {

    public SegmentRule {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException(
                    "Segment '" + operator.wireValue() + "' operator on '" + field.key() + "' requires a value");
        }
        if (operator != SegmentOperator.IN && operands.size() != 1) {
            throw new IllegalArgumentException(
                    "Segment '" + operator.wireValue() + "' operator takes exactly one value");
        }
        if (!field.type().allowedOperators().contains(operator)) {
            throw new IllegalArgumentException("Operator '" + operator.wireValue() + "' is not valid for "
                    + field.type().wireValue() + " field '" + field.key() + "'");
        }
        Class<?> expected = operandType(field.type());
        for (Object operand : operands) {
            if (!expected.isInstance(operand)) {
                throw new IllegalArgumentException("Segment value for '" + field.key() + "' must be "
                        + field.type().wireValue() + ", got " + operand);
            }
        }
        operands = List.copyOf(operands);
    }

    public static SegmentRule of(SegmentField field, SegmentOperator operator, Object operand) {
        return new SegmentRule(field, operator, List.of(operand));
    }

    public Object operand() {
        return operands.get(0);
    }

    static Class<?> operandType(FieldType type) {
        return switch (type) {
            case TEXT -> String.class;
            case NUMBER -> BigDecimal.class;
            case DATE -> LocalDate.class;
        };
    }
}
