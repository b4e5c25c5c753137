package com.prism.service.core.project;

import java.util.List;
import java.util.Optional;

/** Storage port for projects and their versions. Every lookup is scoped to a tenant. */
public interface ProjectRepository {

    /** Non-archived projects of {@code tenantId}, most recently updated first. */
    List<ProjectRecord> findActive(String tenantId);

    Optional<ProjectRecord> find(String tenantId, String projectId);

    /** Stores a new project together with its first version, which must carry {@code versionNo} 1. */
    void create(ProjectRecord project, ProjectVersionRecord firstVersion);

    /** @return {@code false} when no active project matched */
    boolean update(ProjectRecord project);

    /**
     * Appends {@code draft} as the project's next version and touches the project's {@code updatedAt}. The
     * draft's {@code versionNo} is ignored.
     *
     * @return the stored version, or empty when the project does not exist for the tenant
     */
    Optional<ProjectVersionRecord> appendVersion(ProjectVersionRecord draft);

    Optional<ProjectVersionRecord> latestVersion(String tenantId, String projectId);

    /** Newest first. */
    List<ProjectVersionRecord> versions(String tenantId, String projectId);
}
