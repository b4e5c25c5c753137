package com.prism.service.core.project;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Size;

/** Absent fields stay as they are; an empty description clears it. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UpdateProjectRequest(
        @JsonAlias("orgId") String tenantId,
        @Size(min = 2, max = 140, message = "name must be {min} to {max} characters") String name,
        @Size(max = 500, message = "description must be at most {max} characters") String description) {

    public UpdateProjectRequest {
        name = name == null ? null : name.trim();
        description = description == null ? null : description.trim();
    }
}
