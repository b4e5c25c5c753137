package com.prism.service.core.apikey;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.prism.service.core.config.IngestProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ApiKeyServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-10T12:00:00Z");

    private InMemoryApiKeyRepository repository;
    private ApiKeyService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryApiKeyRepository();
        service = new ApiKeyService(repository, new IngestProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void issuedKeyAuthenticatesAndIsMarkedUsed() {
        ApiKeyCodec.GeneratedKey key = service.issue("acme");

        ApiKeyRecord record = service.authenticate(key.plaintext());

        assertEquals("acme", record.tenantId());
        assertEquals(Optional.of(NOW), repository.lastUsed(record.id()));
    }

    @Test
    void missingAndMalformedKeys() {
        assertEquals("Missing X-API-Key header", reject(null));
        assertEquals("Missing X-API-Key header", reject(" "));
        assertEquals("Invalid API key format", reject("not-a-key"));
    }

    @Test
    void unknownPrefixOrWrongSecret() {
        ApiKeyCodec.GeneratedKey key = service.issue("acme");

        assertEquals("API key invalid or revoked", reject("prk_ffffffff_" + "0".repeat(48)));
        assertEquals("API key invalid or revoked", reject("prk_" + key.prefix() + "_" + "0".repeat(48)));
    }

    @Test
    void revokedKeyIsRejected() {
        ApiKeyCodec.GeneratedKey key = service.issue("acme");
        ApiKeyRecord stored = repository.findByPrefix(key.prefix()).orElseThrow();
        repository.save(new ApiKeyRecord(stored.id(), stored.tenantId(), stored.prefix(), stored.secretHash(), NOW));

        assertEquals("API key invalid or revoked", reject(key.plaintext()));
        assertTrue(repository.lastUsed(stored.id()).isEmpty());
    }

    private String reject(String rawKey) {
        return assertThrows(InvalidApiKeyException.class, () -> service.authenticate(rawKey)).getMessage();
    }
}
