package com.prism.service.core.ingest;

import java.util.List;

public interface EventIngestService {

    /**
     * Validates and stores a batch for {@code tenantId}. Idempotent on {@code (tenantId, eventId)}: events already
     * stored are counted as rejected, not raised as errors.
     *
     * @throws IngestValidationException when the batch does not satisfy the ingest schema
     */
    IngestResult ingestBatch(String tenantId, List<IngestEvent> events);
}
