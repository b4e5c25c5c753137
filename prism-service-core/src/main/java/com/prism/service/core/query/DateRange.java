package com.prism.service.core.query;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Validated date range. Presets stay symbolic until {@link #resolve(Clock)} so that a cached query keeps its
 * meaning; explicit bounds are already concrete instants.
 */
public record DateRange(DatePreset preset, Instant from, Instant to) {

    public static DateRange of(DatePreset preset) {
        return new DateRange(preset, null, null);
    }

    public static DateRange between(Instant from, Instant to) {
        return new DateRange(null, from, to);
    }

    public ResolvedRange resolve(Clock clock) {
        if (preset == null) {
            return new ResolvedRange(from, to);
        }
        LocalDate today = LocalDate.now(clock.withZone(java.time.ZoneOffset.UTC));
        LocalDate first = today.minusDays(preset.days() - 1L);
        return new ResolvedRange(DateBounds.startOfDay(first), DateBounds.endOfDay(today));
    }
}
