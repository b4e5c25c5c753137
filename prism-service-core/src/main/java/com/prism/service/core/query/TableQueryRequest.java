package com.prism.service.core.query;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/** Table query as received from a caller, before catalog resolution and validation. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TableQueryRequest(
        @NotBlank(message = "tenantId is required") @JsonAlias("orgId") String tenantId,
        DateRangeSpec dateRange,
        @JsonAlias("rows") List<String> dimensionKeys,
        @NotEmpty(message = "At least one metric is required") @JsonAlias("metrics") List<String> metricKeys,
        @JsonAlias("segmentDsl") SegmentSpec segment,
        SortSpec sort,
        @Min(value = 1, message = "limit must be between 1 and " + TableQueryRequest.MAX_LIMIT)
                @Max(value = TableQueryRequest.MAX_LIMIT, message = "limit must be between 1 and {value}")
                Integer limit) {

    public static final int MAX_LIMIT = 1000;
}
