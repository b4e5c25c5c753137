package com.prism.service.core.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class DateBoundsTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-02-10T12:34:56Z"), ZoneOffset.UTC);

    @Test
    void singleDateOnlyRangeCoversTheWholeUtcDay() {
        ResolvedRange range = new ResolvedRange(
                DateBounds.parse("2026-02-01", DateBounds.Mode.START),
                DateBounds.parse("2026-02-01", DateBounds.Mode.END));

        assertTrue(range.contains(Instant.parse("2026-02-01T00:00:00Z")));
        assertTrue(range.contains(Instant.parse("2026-02-01T23:59:59.000Z")));
        assertTrue(range.contains(Instant.parse("2026-02-01T23:59:59.999Z")));
        assertFalse(range.contains(Instant.parse("2026-02-02T00:00:00.001Z")));
        assertFalse(range.contains(Instant.parse("2026-01-31T23:59:59.999Z")));
    }

    @Test
    void dateTimesKeepTheirInstant() {
        assertEquals(
                Instant.parse("2026-02-01T08:30:00Z"), DateBounds.parse("2026-02-01T10:30:00+02:00", DateBounds.Mode.END));
        assertEquals(
                Instant.parse("2026-02-01T10:30:00Z"), DateBounds.parse("2026-02-01T10:30:00", DateBounds.Mode.START));
    }

    @Test
    void malformedValuesParseToNull() {
        assertNull(DateBounds.parse("yesterday", DateBounds.Mode.START));
        assertNull(DateBounds.parse("2026-02-30", DateBounds.Mode.START));
        assertNull(DateBounds.parse("2026-02-01T25:00:00Z", DateBounds.Mode.START));
        assertNull(DateBounds.parse(null, DateBounds.Mode.END));
        assertFalse(DateBounds.isValid("02/01/2026"));
        assertEquals(LocalDate.parse("2026-02-02"), DateBounds.parseDay("2026-02-01T23:00:00-02:00"));
    }

    @Test
    void presetsResolveToWholeUtcDaysEndingToday() {
        ResolvedRange week = DateRange.of(DatePreset.LAST_7_DAYS).resolve(clock);
        ResolvedRange today = DateRange.of(DatePreset.TODAY).resolve(clock);

        assertEquals(Instant.parse("2026-02-04T00:00:00Z"), week.from());
        assertEquals(Instant.parse("2026-02-10T23:59:59.999Z"), week.to());
        assertEquals(Instant.parse("2026-02-10T00:00:00Z"), today.from());
        assertEquals(Instant.parse("2026-02-10T23:59:59.999Z"), today.to());
    }

    @Test
    void presetNamesAcceptLegacyPrefix() {
        assertEquals(DatePreset.LAST_30_DAYS, DatePreset.fromWire("date:last_30_days"));
        assertEquals(DatePreset.LAST_90_DAYS, DatePreset.fromWire("last_90_days"));
        assertNull(DatePreset.fromWire("last_year"));
    }
}
