package com.prism.controller.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.prism.service.core.ingest.IngestResult;
import com.prism.service.core.sample.SampleDataService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class SampleDataControllerTest {

    @Mock
    private SampleDataService sampleData;

    private SampleDataController controller;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        controller = new SampleDataController(sampleData);
    }

    @Test
    void reportsInsertedAndSkipped() {
        when(sampleData.provision("acme")).thenReturn(new IngestResult(200, 52, 252));

        assertThat(controller.provision("acme"))
                .containsExactly(
                        entry("tenantId", "acme"),
                        entry("inserted", 200),
                        entry("skipped", 52),
                        entry("total", 252));
    }

    @Test
    void blankTenantIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> controller.provision(" "));
        verifyNoInteractions(sampleData);
    }
}
