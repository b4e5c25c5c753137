package com.prism.service.core.apikey;

import com.prism.service.core.config.IngestProperties;
import java.time.Clock;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Resolves a presented ingest key to its stored record, and issues new keys. */
@Service
@Slf4j
public class ApiKeyService {

    private final ApiKeyRepository repository;
    private final ApiKeyCodec codec;
    private final Clock clock;

    public ApiKeyService(ApiKeyRepository repository, IngestProperties properties, Clock clock) {
        this.repository = repository;
        this.codec = new ApiKeyCodec(properties.getApiKeySalt());
        this.clock = clock;
    }

    /**
     * @throws InvalidApiKeyException when the key is missing, malformed, unknown, revoked or does not verify
     */
    public ApiKeyRecord authenticate(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            throw new InvalidApiKeyException("Missing X-API-Key header");
        }
        ApiKeyCodec.ParsedKey parsed = ApiKeyCodec.parse(rawKey);
        if (parsed == null) {
            throw new InvalidApiKeyException("Invalid API key format");
        }
        ApiKeyRecord record = repository
                .findByPrefix(parsed.prefix())
                .filter(r -> !r.revoked())
                .filter(r -> codec.verify(rawKey, r.secretHash()))
                .orElseThrow(() -> new InvalidApiKeyException("API key invalid or revoked"));
        repository.markUsed(record.id(), clock.instant());
        return record;
    }

    /** Creates and stores a key for {@code tenantId}; the plaintext is only available in the return value. */
    public ApiKeyCodec.GeneratedKey issue(String tenantId) {
        ApiKeyCodec.GeneratedKey key = codec.generate();
        repository.save(new ApiKeyRecord(
                UUID.randomUUID().toString(), tenantId, key.prefix(), key.secretHash(), null));
        log.info("Issued ingest key {} for tenant {}", key.prefix(), tenantId);
        return key;
    }
}
