package com.prism.service.core.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.Map;

/** Wire form of one event in an ingest batch. {@code timestamp} is an ISO-8601 instant with an offset. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IngestEvent(
        @NotBlank(message = "required") String eventId,
        @NotBlank(message = "required") @Size(max = IngestEvent.MAX_EVENT_NAME_LENGTH, message = "at most {max} characters")
                String eventName,
        @NotNull(message = "ISO-8601 date-time expected") Instant timestamp,
        String userId,
        String sessionId,
        @ScalarProperties Map<String, Object> properties) {

    public static final int MAX_EVENT_NAME_LENGTH = 120;
}
