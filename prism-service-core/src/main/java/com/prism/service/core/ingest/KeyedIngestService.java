package com.prism.service.core.ingest;

import com.prism.service.core.apikey.ApiKeyRecord;
import com.prism.service.core.apikey.ApiKeyService;
import com.prism.service.core.ratelimit.RateLimitDecision;
import com.prism.service.core.ratelimit.RateLimitExceededException;
import com.prism.service.core.ratelimit.RateLimitStore;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ingest entry point for external producers: the API key decides the tenant, the rate limit applies per key,
 * then the batch goes to whichever {@link EventIngestService} is configured. The query cache is not swept here;
 * cached results age out with their TTL.
 */
@Service
@Slf4j
public class KeyedIngestService {

    private final ApiKeyService apiKeys;
    private final RateLimitStore rateLimits;
    private final EventIngestService ingest;

    public KeyedIngestService(ApiKeyService apiKeys, RateLimitStore rateLimits, EventIngestService ingest) {
        this.apiKeys = apiKeys;
        this.rateLimits = rateLimits;
        this.ingest = ingest;
    }

    public IngestResult ingest(String rawKey, IngestBatch batch) {
        ApiKeyRecord key = apiKeys.authenticate(rawKey);
        RateLimitDecision decision = rateLimits.acquire(key.id());
        if (!decision.allowed()) {
            log.warn("Rate limit exceeded for ingest key {}", key.prefix());
            throw new RateLimitExceededException("Rate limit exceeded");
        }
        if (batch == null) {
            throw new IngestValidationException(
                    List.of(new IngestValidationException.Violation("body", "request body is required")));
        }
        if (batch.tenantId() != null && !batch.tenantId().equals(key.tenantId())) {
            throw new IllegalArgumentException("tenantId does not match the API key's tenant");
        }
        IngestResult result = ingest.ingestBatch(key.tenantId(), batch.events());
        log.info(
                "Ingested batch for tenant {}: accepted={} rejected={} total={}",
                key.tenantId(),
                result.accepted(),
                result.rejected(),
                result.total());
        return result;
    }
}
