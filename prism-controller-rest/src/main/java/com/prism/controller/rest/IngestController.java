package com.prism.controller.rest;

import com.prism.service.core.ingest.IngestBatch;
import com.prism.service.core.ingest.IngestResult;
import com.prism.service.core.ingest.KeyedIngestService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class IngestController {

    static final String API_KEY_HEADER = "X-API-Key";

    private final KeyedIngestService ingest;

    public IngestController(KeyedIngestService ingest) {
        this.ingest = ingest;
    }

    @PostMapping("/ingest/events")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public IngestResult ingestBatch(
            @RequestHeader(name = API_KEY_HEADER, required = false) String apiKey,
            @Valid @RequestBody(required = false) IngestBatch batch) {
        return ingest.ingest(apiKey, batch);
    }
}
