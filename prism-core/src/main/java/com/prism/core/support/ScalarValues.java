package com.prism.core.support;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Coercion rules for property-bag scalars.
 *
 * <p>These rules are mirrored by the SQL emitted for the relational store, so both execution paths read a
 * malformed value the same way: non-numeric text becomes {@code 0}, absent values become {@code 0}, and
 * nothing here throws.
 */
public final class ScalarValues {

    /** Same expression the compiled SQL guards casts with. */
    public static final String NUMERIC_REGEX = "^-?[0-9]+(\\.[0-9]+)?$";

    private static final Pattern NUMERIC = Pattern.compile(NUMERIC_REGEX);

    private ScalarValues() {}

    public static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    /** Numeric reading of a scalar; {@code 0} for anything that is not a finite number or numeric text. */
    public static BigDecimal toNumber(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof BigDecimal bd) {
            return bd;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof BigInteger bi) {
            return new BigDecimal(bi);
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : BigDecimal.ZERO;
        }
        if (value instanceof String s && NUMERIC.matcher(s).matches()) {
            return new BigDecimal(s);
        }
        return BigDecimal.ZERO;
    }

    /**
     * Text rendering of a scalar as the relational store's JSON text extraction produces it: integral numbers
     * carry no fraction, booleans render as {@code true}/{@code false}. Returns {@code null} for null and
     * non-scalar values.
     */
    public static String asText(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof Number) {
            return normalize(toNumber(value)).toPlainString();
        }
        return null;
    }

    /** Drops trailing zeros so {@code 120.50} and {@code 120.5} compare and serialise identically. */
    public static BigDecimal normalize(BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
