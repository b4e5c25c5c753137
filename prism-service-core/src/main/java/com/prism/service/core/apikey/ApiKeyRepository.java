package com.prism.service.core.apikey;

import java.time.Instant;
import java.util.Optional;

public interface ApiKeyRepository {

    Optional<ApiKeyRecord> findByPrefix(String prefix);

    void save(ApiKeyRecord record);

    void markUsed(String id, Instant usedAt);
}
