package com.prism.service.core.ingest;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

/** Request body of the ingest endpoint; {@code tenantId} is optional and must match the key's tenant. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IngestBatch(
        @JsonAlias("orgId") String tenantId,
        @NotEmpty(message = "at least one event is required")
                @Size(max = IngestBatch.MAX_EVENTS, message = "at most {max} events per batch")
                List<@NotNull(message = "event must not be null") @Valid IngestEvent> events) {

    public static final int MAX_EVENTS = 500;
}
