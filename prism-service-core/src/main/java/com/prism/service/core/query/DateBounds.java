package com.prism.service.core.query;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parsing of range bounds. A date-only value ({@code YYYY-MM-DD}) is UTC midnight when it opens a range and
 * {@code 23:59:59.999} UTC when it closes one, which makes a single-day range inclusive of the whole day.
 */
public final class DateBounds {

    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T.*");

    public enum Mode {
        START,
        END
    }

    private DateBounds() {}

    public static boolean isDateOnly(String value) {
        return value != null && DATE_ONLY.matcher(value).matches();
    }

    /** True when {@code value} is a parseable date or date-time. */
    public static boolean isValid(String value) {
        return parse(value, Mode.START) != null;
    }

    /** Instant for {@code value}, or {@code null} when it is malformed. */
    public static Instant parse(String value, Mode mode) {
        if (value == null) return null;
        String trimmed = value.trim();
        try {
            if (DATE_ONLY.matcher(trimmed).matches()) {
                LocalDate day = LocalDate.parse(trimmed);
                return mode == Mode.START ? startOfDay(day) : endOfDay(day);
            }
            if (DATE_TIME.matcher(trimmed).matches()) {
                return parseDateTime(trimmed);
            }
        } catch (DateTimeParseException ex) {
            return null;
        }
        return null;
    }

    /** UTC calendar day of {@code value}, or {@code null} when it is malformed. */
    public static LocalDate parseDay(String value) {
        Instant instant = parse(value, Mode.START);
        return instant == null ? null : LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    public static Instant startOfDay(LocalDate day) {
        return day.atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    public static Instant endOfDay(LocalDate day) {
        return day.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC).minusMillis(1);
    }

    private static Instant parseDateTime(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ex) {
            // no offset: read as UTC
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        }
    }
}
