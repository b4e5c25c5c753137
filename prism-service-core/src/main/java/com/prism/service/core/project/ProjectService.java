package com.prism.service.core.project;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Saved workspaces. Creating a project writes version 1 with the starter payload; every save appends the next
 * version number, so history is never rewritten. Payloads are migrated to the latest schema on the way in and
 * on the way out.
 */
@Service
@Slf4j
public class ProjectService {

    private final ProjectRepository repository;
    private final ProjectPayloads payloads;
    private final Validator validator;
    private final Clock clock;

    public ProjectService(ProjectRepository repository, ProjectPayloads payloads, Validator validator, Clock clock) {
        this.repository = repository;
        this.payloads = payloads;
        this.validator = validator;
        this.clock = clock;
    }

    public List<ProjectSummary> list(String tenantId) {
        String tenant = tenant(tenantId, null);
        return repository.findActive(tenant).stream()
                .map(p -> ProjectSummary.of(p, repository.latestVersion(tenant, p.id()).orElse(null)))
                .toList();
    }

    public ProjectSummary create(String tenantId, CreateProjectRequest request) {
        validate(request);
        String tenant = tenant(tenantId, request.tenantId());
        Instant now = clock.instant();
        ProjectRecord project = new ProjectRecord(
                UUID.randomUUID().toString(), tenant, request.name(), emptyToNull(request.description()), now, now, null);
        JsonNode payload = payloads.defaultPayload(project.name());
        ProjectVersionRecord first = new ProjectVersionRecord(
                UUID.randomUUID().toString(),
                project.id(),
                tenant,
                1,
                ProjectPayloads.LATEST_SCHEMA_VERSION,
                payload,
                payloads.checksum(payload),
                now);
        repository.create(project, first);
        log.info("Created project {} for tenant {}", project.id(), tenant);
        return ProjectSummary.of(project, first);
    }

    public ProjectDetail get(String tenantId, String projectId) {
        String tenant = tenant(tenantId, null);
        ProjectRecord project =
                repository.find(tenant, projectId).orElseThrow(() -> new ProjectNotFoundException(projectId));
        ProjectVersionRecord latest = repository.latestVersion(tenant, projectId).orElse(null);
        JsonNode payload = latest == null ? null : payloads.migrate(latest.payload(), latest.schemaVersion());
        return new ProjectDetail(
                project.id(),
                project.tenantId(),
                project.name(),
                project.description(),
                project.updatedAt(),
                ProjectSummary.Version.of(latest),
                payload);
    }

    public ProjectSummary update(String tenantId, String projectId, UpdateProjectRequest request) {
        validate(request);
        String tenant = tenant(tenantId, request.tenantId());
        ProjectRecord current =
                repository.find(tenant, projectId).orElseThrow(() -> new ProjectNotFoundException(projectId));
        ProjectRecord edited = current.edited(
                request.name() == null ? current.name() : request.name(),
                request.description() == null ? current.description() : emptyToNull(request.description()),
                clock.instant());
        if (!repository.update(edited)) {
            throw new ProjectNotFoundException(projectId);
        }
        return ProjectSummary.of(edited, repository.latestVersion(tenant, projectId).orElse(null));
    }

    public List<ProjectSummary.Version> versions(String tenantId, String projectId) {
        String tenant = tenant(tenantId, null);
        repository.find(tenant, projectId).orElseThrow(() -> new ProjectNotFoundException(projectId));
        return repository.versions(tenant, projectId).stream().map(ProjectSummary.Version::of).toList();
    }

    /** Stores the payload, migrated to the latest schema, as the project's next version. */
    public ProjectSummary.Version saveVersion(String tenantId, String projectId, SaveVersionRequest request) {
        validate(request);
        String tenant = tenant(tenantId, request.tenantId());
        JsonNode payload = payloads.migrate(request.payload(), request.schemaVersion());
        ProjectVersionRecord draft = new ProjectVersionRecord(
                UUID.randomUUID().toString(),
                projectId,
                tenant,
                0,
                ProjectPayloads.LATEST_SCHEMA_VERSION,
                payload,
                payloads.checksum(payload),
                clock.instant());
        ProjectVersionRecord saved =
                repository.appendVersion(draft).orElseThrow(() -> new ProjectNotFoundException(projectId));
        log.info("Saved version {} of project {} for tenant {}", saved.versionNo(), projectId, tenant);
        return ProjectSummary.Version.of(saved);
    }

    private <T> void validate(T request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
    }

    private static String tenant(String pathTenant, String bodyTenant) {
        if (pathTenant == null || pathTenant.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        String tenant = pathTenant.trim();
        if (bodyTenant != null && !bodyTenant.isBlank() && !bodyTenant.trim().equals(tenant)) {
            throw new IllegalArgumentException("tenantId in the body does not match the path");
        }
        return tenant;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
