package com.prism.service.core.project;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/** A workspace snapshot as the client holds it, in the schema version the client wrote. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SaveVersionRequest(
        @JsonAlias("orgId") String tenantId,
        @NotNull(message = "schemaVersion is required") @Positive(message = "schemaVersion must be positive")
                Integer schemaVersion,
        @NotNull(message = "payload is required") JsonNode payload) {}
