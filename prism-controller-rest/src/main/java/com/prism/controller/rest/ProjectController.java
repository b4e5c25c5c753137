package com.prism.controller.rest;

import com.prism.service.core.project.CreateProjectRequest;
import com.prism.service.core.project.ProjectDetail;
import com.prism.service.core.project.ProjectService;
import com.prism.service.core.project.ProjectSummary;
import com.prism.service.core.project.SaveVersionRequest;
import com.prism.service.core.project.UpdateProjectRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Saved workspaces of a tenant and their version history. */
@RestController
@RequestMapping(path = "/api/tenants/{tenantId}/projects", produces = MediaType.APPLICATION_JSON_VALUE)
public class ProjectController {

    private final ProjectService projects;

    public ProjectController(ProjectService projects) {
        this.projects = projects;
    }

    @GetMapping
    public List<ProjectSummary> list(@PathVariable String tenantId) {
        return projects.list(tenantId);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public ProjectSummary create(@PathVariable String tenantId, @Valid @RequestBody CreateProjectRequest request) {
        return projects.create(tenantId, request);
    }

    @GetMapping("/{projectId}")
    public ProjectDetail get(@PathVariable String tenantId, @PathVariable String projectId) {
        return projects.get(tenantId, projectId);
    }

    @PutMapping(path = "/{projectId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ProjectSummary update(
            @PathVariable String tenantId,
            @PathVariable String projectId,
            @Valid @RequestBody UpdateProjectRequest request) {
        return projects.update(tenantId, projectId, request);
    }

    @GetMapping("/{projectId}/versions")
    public List<ProjectSummary.Version> versions(@PathVariable String tenantId, @PathVariable String projectId) {
        return projects.versions(tenantId, projectId);
    }

    @PostMapping(path = "/{projectId}/versions", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public ProjectSummary.Version saveVersion(
            @PathVariable String tenantId,
            @PathVariable String projectId,
            @Valid @RequestBody SaveVersionRequest request) {
        return projects.saveVersion(tenantId, projectId, request);
    }
}
