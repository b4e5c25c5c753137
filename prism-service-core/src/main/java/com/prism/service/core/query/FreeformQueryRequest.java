package com.prism.service.core.query;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Workspace table query: {@code rows} are dimension keys, {@code columns} metric keys. {@code segments} is a list
 * of AND/OR groups that must all match. Results are paged with {@code offset} and {@code limit}; only the first
 * {@code sort} entry is used.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FreeformQueryRequest(
        @NotBlank(message = "tenantId is required") @JsonAlias("orgId") String tenantId,
        List<String> rows,
        @NotEmpty(message = "At least one metric column is required") List<String> columns,
        List<SegmentSpec> segments,
        @NotNull(message = "dateRange is required") DateRangeSpec dateRange,
        @Min(value = 1, message = "limit must be between 1 and " + FreeformQueryRequest.MAX_LIMIT)
                @Max(value = FreeformQueryRequest.MAX_LIMIT, message = "limit must be between 1 and {value}")
                Integer limit,
        @Min(value = 0, message = "offset must not be negative")
                @Max(value = FreeformQueryRequest.MAX_OFFSET, message = "offset must be at most {value}")
                Integer offset,
        List<SortSpec> sort) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;
    public static final int MAX_OFFSET = 100_000;
}
