package com.prism.service.core.project;

import java.time.Instant;

/** A saved workspace owned by one tenant. Archived projects are hidden from every read. */
public record ProjectRecord(
        String id,
        String tenantId,
        String name,
        String description,
        Instant createdAt,
        Instant updatedAt,
        Instant archivedAt) {

    public boolean archived() {
        return archivedAt != null;
    }

    ProjectRecord edited(String name, String description, Instant updatedAt) {
        return new ProjectRecord(id, tenantId, name, description, createdAt, updatedAt, archivedAt);
    }
}
