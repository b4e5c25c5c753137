package com.prism.service.core.apikey;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "prism", name = "storage", havingValue = "memory", matchIfMissing = true)
public class InMemoryApiKeyRepository implements ApiKeyRepository {

    private final Map<String, ApiKeyRecord> byPrefix = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastUsed = new ConcurrentHashMap<>();

    @Override
    public Optional<ApiKeyRecord> findByPrefix(String prefix) {
        return Optional.ofNullable(byPrefix.get(prefix));
    }

    @Override
    public void save(ApiKeyRecord record) {
        byPrefix.put(record.prefix(), record);
    }

    @Override
    public void markUsed(String id, Instant usedAt) {
        lastUsed.put(id, usedAt);
    }

    Optional<Instant> lastUsed(String id) {
        return Optional.ofNullable(lastUsed.get(id));
    }
}
