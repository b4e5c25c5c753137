package com.prism.service.core.project;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Names are trimmed before the constraints apply. {@code tenantId} is optional and must match the path. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateProjectRequest(
        @JsonAlias("orgId") String tenantId,
        @NotBlank(message = "name is required") @Size(min = 2, max = 140, message = "name must be {min} to {max} characters")
                String name,
        @Size(max = 500, message = "description must be at most {max} characters") String description) {

    public CreateProjectRequest {
        name = name == null ? null : name.trim();
        description = description == null ? null : description.trim();
    }
}
