package com.prism.service.core.apikey;

import java.time.Instant;

/** Stored form of an ingest key. Only the HMAC of the secret is kept. */
public record ApiKeyRecord(String id, String tenantId, String prefix, String secretHash, Instant revokedAt) {

    public boolean revoked() {
        return revokedAt != null;
    }
}
