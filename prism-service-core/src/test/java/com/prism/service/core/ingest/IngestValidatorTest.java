package com.prism.service.core.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.prism.core.model.Event;
import com.prism.service.core.TestEvents;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IngestValidatorTest {

    private static final Instant TS = Instant.parse("2026-02-01T10:00:00Z");

    private final IngestValidator validator = new IngestValidator(TestEvents.VALIDATOR);

    @Test
    void convertsValidEventsForTheTenant() {
        Map<String, Object> props = new HashMap<>();
        props.put("channel", "Email");
        props.put("revenue", 12.5);
        props.put("gift", true);
        props.put("coupon", null);

        List<Event> events = validator.toEvents(
                "acme", List.of(new IngestEvent("e1", "purchase", Instant.parse("2026-02-01T08:00:00Z"), " ", "", props)));

        Event event = events.get(0);
        assertEquals("acme", event.tenantId());
        assertEquals(Instant.parse("2026-02-01T08:00:00Z"), event.timestamp());
        assertNull(event.userId());
        assertNull(event.sessionId());
        assertEquals("Email", event.property("channel"));
    }

    @Test
    void reportsEveryInvalidFieldWithItsPath() {
        IngestValidationException ex = assertThrows(
                IngestValidationException.class,
                () -> validator.toEvents("acme", List.of(
                        new IngestEvent("e1", "purchase", TS, null, null, Map.of()),
                        new IngestEvent("", " ", null, null, null, Map.of("items", List.of(1, 2), "ok", "fine")))));

        assertThat(ex.violations())
                .extracting(IngestValidationException.Violation::toString)
                .containsExactlyInAnyOrder(
                        "events[1].eventId: required",
                        "events[1].eventName: required",
                        "events[1].timestamp: ISO-8601 date-time expected",
                        "events[1].properties.items: must be a string, number, boolean or null");
    }

    @Test
    void enforcesEventNameLength() {
        String name = String.join("", Collections.nCopies(IngestEvent.MAX_EVENT_NAME_LENGTH + 1, "x"));

        IngestValidationException ex = assertThrows(
                IngestValidationException.class,
                () -> validator.toEvents("acme", List.of(new IngestEvent("e1", name, TS, null, null, null))));

        assertThat(ex.violations())
                .extracting(IngestValidationException.Violation::toString)
                .containsExactly("events[0].eventName: at most 120 characters");
    }

    @Test
    void enforcesBatchBounds() {
        List<IngestEvent> tooMany = new ArrayList<>();
        for (int i = 0; i <= IngestBatch.MAX_EVENTS; i++) {
            tooMany.add(new IngestEvent("e" + i, "purchase", TS, null, null, null));
        }

        IngestValidationException empty =
                assertThrows(IngestValidationException.class, () -> validator.toEvents("acme", List.of()));
        IngestValidationException missing =
                assertThrows(IngestValidationException.class, () -> validator.toEvents("acme", null));
        IngestValidationException oversized =
                assertThrows(IngestValidationException.class, () -> validator.toEvents("acme", tooMany));

        assertThat(empty.violations())
                .extracting(IngestValidationException.Violation::toString)
                .containsExactly("events: at least one event is required");
        assertThat(missing.violations()).extracting(IngestValidationException.Violation::field).containsExactly("events");
        assertThat(oversized.violations())
                .extracting(IngestValidationException.Violation::toString)
                .containsExactly("events: at most 500 events per batch");
    }

    @Test
    void nullEntriesAreRejected() {
        IngestValidationException ex = assertThrows(
                IngestValidationException.class,
                () -> validator.toEvents("acme", Arrays.asList(new IngestEvent("e1", "purchase", TS, null, null, null), null)));

        assertThat(ex.violations()).hasSize(1);
        assertThat(ex.violations().get(0).field()).startsWith("events[1]");
        assertThat(ex.violations().get(0).message()).isEqualTo("event must not be null");
    }

    @Test
    void requiresTenant() {
        assertThrows(IllegalArgumentException.class, () -> validator.toEvents(" ", List.of()));
    }
}
