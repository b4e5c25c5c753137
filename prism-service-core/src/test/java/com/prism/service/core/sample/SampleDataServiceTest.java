package com.prism.service.core.sample;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.prism.service.core.TestEvents;
import com.prism.service.core.config.SampleDataProperties;
import com.prism.service.core.ingest.InMemoryEventStore;
import com.prism.service.core.ingest.IngestResult;
import com.prism.service.core.ingest.IngestValidator;
import com.prism.service.core.query.QueryService;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class SampleDataServiceTest {

    @Mock
    private QueryService queries;

    private InMemoryEventStore store;
    private SampleDataService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        SampleDataProperties sample = new SampleDataProperties();
        sample.setDays(2);
        sample.setEventsPerDay(12);
        sample.setBatchSize(5);
        store = new InMemoryEventStore(new IngestValidator(TestEvents.VALIDATOR));
        service = new SampleDataService(
                store,
                queries,
                sample,
                Clock.fixed(Instant.parse("2026-02-10T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void provisioningIsIdempotentAndInvalidatesTheTenant() {
        IngestResult first = service.provision("acme");
        IngestResult second = service.provision("acme");

        assertEquals(new IngestResult(24, 0, 24), first);
        assertEquals(new IngestResult(0, 24, 24), second);
        assertEquals(24, store.count("acme"));
        verify(queries, times(2)).invalidateTenant("acme");
    }
}
