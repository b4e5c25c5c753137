package com.prism.service.core.project;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "prism", name = "storage", havingValue = "memory", matchIfMissing = true)
public class InMemoryProjectRepository implements ProjectRepository {

    private final Map<String, ProjectRecord> projects = new ConcurrentHashMap<>();
    private final Map<String, List<ProjectVersionRecord>> versions = new ConcurrentHashMap<>();

    @Override
    public List<ProjectRecord> findActive(String tenantId) {
        return projects.values().stream()
                .filter(p -> p.tenantId().equals(tenantId) && !p.archived())
                .sorted(Comparator.comparing(ProjectRecord::updatedAt).reversed())
                .toList();
    }

    @Override
    public Optional<ProjectRecord> find(String tenantId, String projectId) {
        return Optional.ofNullable(projects.get(projectId))
                .filter(p -> p.tenantId().equals(tenantId) && !p.archived());
    }

    @Override
    public synchronized void create(ProjectRecord project, ProjectVersionRecord firstVersion) {
        if (firstVersion.versionNo() != 1) {
            throw new IllegalArgumentException("First version must be number 1");
        }
        projects.put(project.id(), project);
        List<ProjectVersionRecord> history = new ArrayList<>();
        history.add(firstVersion);
        versions.put(project.id(), history);
    }

    @Override
    public synchronized boolean update(ProjectRecord project) {
        if (find(project.tenantId(), project.id()).isEmpty()) {
            return false;
        }
        projects.put(project.id(), project);
        return true;
    }

    @Override
    public synchronized Optional<ProjectVersionRecord> appendVersion(ProjectVersionRecord draft) {
        ProjectRecord project = projects.get(draft.projectId());
        if (project == null || project.archived() || !project.tenantId().equals(draft.tenantId())) {
            return Optional.empty();
        }
        List<ProjectVersionRecord> history = versions.computeIfAbsent(project.id(), id -> new ArrayList<>());
        ProjectVersionRecord stored = draft.numbered(history.size() + 1);
        history.add(stored);
        projects.put(project.id(), project.edited(project.name(), project.description(), draft.createdAt()));
        return Optional.of(stored);
    }

    @Override
    public synchronized Optional<ProjectVersionRecord> latestVersion(String tenantId, String projectId) {
        List<ProjectVersionRecord> history = owned(tenantId, projectId);
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    @Override
    public synchronized List<ProjectVersionRecord> versions(String tenantId, String projectId) {
        List<ProjectVersionRecord> newestFirst = new ArrayList<>(owned(tenantId, projectId));
        newestFirst.sort(Comparator.comparingInt(ProjectVersionRecord::versionNo).reversed());
        return newestFirst;
    }

    private List<ProjectVersionRecord> owned(String tenantId, String projectId) {
        ProjectRecord project = projects.get(projectId);
        if (project == null || !project.tenantId().equals(tenantId)) {
            return List.of();
        }
        return versions.getOrDefault(projectId, List.of());
    }
}
