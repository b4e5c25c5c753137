package com.prism.service.core.ingest;

import com.prism.core.model.Event;
import com.prism.service.core.engine.CandidateEventSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local event store used when no database is configured. Serves both ingestion and the in-process scan
 * strategy; each tenant's events are kept in arrival order.
 */
@Component
@ConditionalOnProperty(prefix = "prism", name = "storage", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryEventStore implements EventIngestService, CandidateEventSource {

    private final IngestValidator validator;
    private final Map<String, Map<String, Event>> tenants = new ConcurrentHashMap<>();

    public InMemoryEventStore(IngestValidator validator) {
        this.validator = validator;
        log.info("Using in-memory event store; data is lost on restart.");
    }

    @Override
    public String name() {
        return "memory-scan";
    }

    @Override
    public IngestResult ingestBatch(String tenantId, List<IngestEvent> batch) {
        List<Event> events = validator.toEvents(tenantId, batch);
        return IngestResult.of(store(tenantId, events), events.size());
    }

    /** Stores already validated events; returns how many were new. */
    public int store(String tenantId, List<Event> events) {
        Map<String, Event> byId = tenants.computeIfAbsent(tenantId, t -> new LinkedHashMap<>());
        int stored = 0;
        synchronized (byId) {
            for (Event event : events) {
                if (byId.putIfAbsent(event.eventId(), event) == null) {
                    stored++;
                }
            }
        }
        log.debug("Stored {} of {} events for tenant {}", stored, events.size(), tenantId);
        return stored;
    }

    @Override
    public List<Event> fetchCandidates(String tenantId, Instant from, Instant to) {
        Map<String, Event> byId = tenants.get(tenantId);
        if (byId == null) {
            return List.of();
        }
        List<Event> out = new ArrayList<>();
        synchronized (byId) {
            for (Event event : byId.values()) {
                Instant ts = event.timestamp();
                if (!ts.isBefore(from) && !ts.isAfter(to)) {
                    out.add(event);
                }
            }
        }
        out.sort(Comparator.comparing(Event::timestamp));
        return out;
    }

    public int count(String tenantId) {
        Map<String, Event> byId = tenants.get(tenantId);
        if (byId == null) {
            return 0;
        }
        synchronized (byId) {
            return byId.size();
        }
    }
}
