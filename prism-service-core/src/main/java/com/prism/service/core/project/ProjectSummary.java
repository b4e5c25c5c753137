package com.prism.service.core.project;

import java.time.Instant;

public record ProjectSummary(
        String id, String name, String description, Instant createdAt, Instant updatedAt, Version latestVersion) {

    public record Version(String id, int versionNo, int schemaVersion, Instant createdAt) {

        static Version of(ProjectVersionRecord record) {
            return record == null
                    ? null
                    : new Version(record.id(), record.versionNo(), record.schemaVersion(), record.createdAt());
        }
    }

    static ProjectSummary of(ProjectRecord project, ProjectVersionRecord latest) {
        return new ProjectSummary(
                project.id(),
                project.name(),
                project.description(),
                project.createdAt(),
                project.updatedAt(),
                Version.of(latest));
    }
}
