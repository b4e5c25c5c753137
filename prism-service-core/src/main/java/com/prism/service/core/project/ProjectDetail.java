package com.prism.service.core.project;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/** A project with its latest payload, already migrated to the current schema. */
public record ProjectDetail(
        String id,
        String tenantId,
        String name,
        String description,
        Instant updatedAt,
        ProjectSummary.Version latestVersion,
        JsonNode payload) {}
