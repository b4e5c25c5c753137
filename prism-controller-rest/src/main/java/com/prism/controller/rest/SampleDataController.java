package com.prism.controller.rest;

import com.prism.service.core.ingest.IngestResult;
import com.prism.service.core.sample.SampleDataService;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenants")
@RequiredArgsConstructor
public class SampleDataController {

    private final SampleDataService sampleData;

    @PostMapping("/{tenantId}/sample-data")
    public Map<String, Object> provision(@PathVariable String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        IngestResult result = sampleData.provision(tenantId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tenantId", tenantId);
        body.put("inserted", result.accepted());
        body.put("skipped", result.rejected());
        body.put("total", result.total());
        return body;
    }
}
