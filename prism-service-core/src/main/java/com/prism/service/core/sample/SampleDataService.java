package com.prism.service.core.sample;

import com.prism.service.core.config.SampleDataProperties;
import com.prism.service.core.ingest.EventIngestService;
import com.prism.service.core.ingest.IngestBatch;
import com.prism.service.core.ingest.IngestEvent;
import com.prism.service.core.ingest.IngestResult;
import com.prism.service.core.query.QueryService;
import java.time.Clock;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Loads the demo dataset for a tenant and drops the tenant's cached query results afterwards. */
@Service
@Slf4j
public class SampleDataService {

    private final EventIngestService ingest;
    private final QueryService queries;
    private final SampleDataProperties properties;
    private final SampleEventGenerator generator;

    public SampleDataService(
            EventIngestService ingest,
            QueryService queries,
            SampleDataProperties properties,
            Clock clock) {
        this.ingest = ingest;
        this.queries = queries;
        this.properties = properties;
        this.generator = new SampleEventGenerator(clock);
    }

    public IngestResult provision(String tenantId) {
        List<IngestEvent> events = generator.generate(properties.getDays(), properties.getEventsPerDay());
        int batchSize = Math.min(Math.max(1, properties.getBatchSize()), IngestBatch.MAX_EVENTS);
        int accepted = 0;
        for (int start = 0; start < events.size(); start += batchSize) {
            List<IngestEvent> batch = events.subList(start, Math.min(events.size(), start + batchSize));
            accepted += ingest.ingestBatch(tenantId, batch).accepted();
        }
        queries.invalidateTenant(tenantId);
        log.info("Provisioned sample data for tenant {}: {} new of {} events", tenantId, accepted, events.size());
        return IngestResult.of(accepted, events.size());
    }
}
