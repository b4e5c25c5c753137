package com.prism.service.core.ingest;

import com.prism.core.model.Event;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Runs the ingest constraints declared on {@link IngestBatch} and {@link IngestEvent} and converts a valid batch
 * to domain events for one tenant. Storage implementations call this, so batches that did not come through the
 * REST layer are held to the same rules.
 */
@Component
public class IngestValidator {

    private static final Comparator<IngestValidationException.Violation> BY_FIELD = Comparator.comparing(
                    IngestValidationException.Violation::field)
            .thenComparing(IngestValidationException.Violation::message);

    private final Validator validator;

    public IngestValidator(Validator validator) {
        this.validator = validator;
    }

    public List<Event> toEvents(String tenantId, List<IngestEvent> events) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        Set<ConstraintViolation<IngestBatch>> violations = validator.validate(new IngestBatch(tenantId, events));
        if (!violations.isEmpty()) {
            throw new IngestValidationException(violations.stream()
                    .map(v -> new IngestValidationException.Violation(v.getPropertyPath().toString(), v.getMessage()))
                    .sorted(BY_FIELD)
                    .toList());
        }
        List<Event> out = new ArrayList<>(events.size());
        for (IngestEvent in : events) {
            out.add(Event.builder()
                    .tenantId(tenantId)
                    .eventId(in.eventId())
                    .eventName(in.eventName())
                    .timestamp(in.timestamp())
                    .userId(blankToNull(in.userId()))
                    .sessionId(blankToNull(in.sessionId()))
                    .properties(in.properties() == null ? Map.of() : in.properties())
                    .build());
        }
        return out;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
