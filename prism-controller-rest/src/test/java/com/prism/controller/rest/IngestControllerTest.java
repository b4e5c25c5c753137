package com.prism.controller.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

import com.prism.service.core.apikey.InvalidApiKeyException;
import com.prism.service.core.ingest.IngestBatch;
import com.prism.service.core.ingest.IngestEvent;
import com.prism.service.core.ingest.IngestResult;
import com.prism.service.core.ingest.KeyedIngestService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class IngestControllerTest {

    @Mock
    private KeyedIngestService ingest;

    private IngestController controller;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        controller = new IngestController(ingest);
    }

    @Test
    void delegatesWithTheHeaderKey() {
        IngestEvent event = new IngestEvent("e1", "purchase", Instant.parse("2026-02-01T10:00:00Z"), null, null, Map.of());
        IngestBatch batch = new IngestBatch("acme", List.of(event));
        when(ingest.ingest("prk_a_b", batch)).thenReturn(new IngestResult(1, 0, 1));

        assertEquals(new IngestResult(1, 0, 1), controller.ingestBatch("prk_a_b", batch));
    }

    @Test
    void authenticationErrorsPropagate() {
        when(ingest.ingest(null, null)).thenThrow(new InvalidApiKeyException("Missing X-API-Key header"));

        assertThrows(InvalidApiKeyException.class, () -> controller.ingestBatch(null, null));
    }
}
