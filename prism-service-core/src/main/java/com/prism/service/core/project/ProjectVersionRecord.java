package com.prism.service.core.project;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * One immutable snapshot of a project's workspace. {@code versionNo} counts from 1 per project and is assigned
 * by the repository; {@code checksum} is the SHA-256 of the stored payload's JSON text.
 */
public record ProjectVersionRecord(
        String id,
        String projectId,
        String tenantId,
        int versionNo,
        int schemaVersion,
        JsonNode payload,
        String checksum,
        Instant createdAt) {

    ProjectVersionRecord numbered(int versionNo) {
        return new ProjectVersionRecord(id, projectId, tenantId, versionNo, schemaVersion, payload, checksum, createdAt);
    }
}
