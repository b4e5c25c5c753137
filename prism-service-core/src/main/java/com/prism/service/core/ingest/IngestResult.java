package com.prism.service.core.ingest;

/** {@code rejected} counts events absorbed as duplicates of an already stored {@code (tenantId, eventId)}. */
public record IngestResult(int accepted, int rejected, int total) {

    public static IngestResult of(int stored, int total) {
        return new IngestResult(stored, total - stored, total);
    }
}
