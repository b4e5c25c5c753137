package com.prism.service.core.query;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TimeseriesQueryRequest(
        @NotBlank(message = "tenantId is required") @JsonAlias("orgId") String tenantId,
        @NotBlank(message = "metricKey is required") String metricKey,
        String dimensionKey,
        String granularity,
        DateRangeSpec dateRange,
        @JsonAlias("segmentDsl") SegmentSpec segment) {}
