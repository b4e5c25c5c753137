package com.prism.service.core.engine;

import com.prism.core.model.Event;
import java.time.Instant;
import java.util.List;

public interface CandidateEventSource extends EventSource {

    /** All events of {@code tenantId} whose timestamp lies in {@code [from, to]}, inclusive. */
    List<Event> fetchCandidates(String tenantId, Instant from, Instant to);
}
