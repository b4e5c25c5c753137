package com.prism.reference;

import com.prism.service.core.apikey.ApiKeyCodec;
import com.prism.service.core.apikey.ApiKeyService;
import com.prism.service.core.config.IngestProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Issues one ingest key at startup so a local instance can receive events without key management. */
@Component
@ConditionalOnProperty(prefix = "prism.ingest", name = "bootstrap-tenant")
@RequiredArgsConstructor
@Slf4j
public class DevelopmentKeyIssuer implements ApplicationRunner {

    private final ApiKeyService apiKeys;
    private final IngestProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        String tenantId = properties.getBootstrapTenant();
        ApiKeyCodec.GeneratedKey key = apiKeys.issue(tenantId);
        log.warn("Development ingest key for tenant {}: {}", tenantId, key.plaintext());
    }
}
