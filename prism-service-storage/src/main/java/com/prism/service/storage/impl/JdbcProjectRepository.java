package com.prism.service.storage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.service.core.project.ProjectRecord;
import com.prism.service.core.project.ProjectRepository;
import com.prism.service.core.project.ProjectVersionRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Projects in {@code projects}, versions in {@code project_versions}. Creating a project and appending a version
 * are single statements, so the version number and the project's {@code updated_at} move together.
 */
public class JdbcProjectRepository implements ProjectRepository {

    private static final String PROJECT_COLUMNS =
            "id, tenant_id, name, description, created_at, updated_at, archived_at";
    private static final String VERSION_COLUMNS =
            "id, project_id, tenant_id, version_no, schema_version, payload::text as payload, checksum, created_at";

    private static final String CREATE =
            """
            with created as (
                insert into projects(id, tenant_id, name, description, created_at, updated_at)
                values (:id, :tenant_id, :name, :description, :created_at, :created_at)
                returning id, tenant_id
            )
            insert into project_versions(id, project_id, tenant_id, version_no, schema_version, payload, checksum, created_at)
            select :version_id, created.id, created.tenant_id, 1, :schema_version, cast(:payload as jsonb), :checksum, :created_at
              from created
            """;

    private static final String APPEND =
            """
            with project as (
                update projects set updated_at = :created_at
                 where id = :project_id and tenant_id = :tenant_id and archived_at is null
                returning id, tenant_id
            )
            insert into project_versions(id, project_id, tenant_id, version_no, schema_version, payload, checksum, created_at)
            select :id, project.id, project.tenant_id,
                   coalesce((select max(v.version_no) from project_versions v where v.project_id = project.id), 0) + 1,
                   :schema_version, cast(:payload as jsonb), :checksum, :created_at
              from project
            returning version_no
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper mapper;

    public JdbcProjectRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = jdbc;
        this.mapper = mapper;
    }

    @Override
    public List<ProjectRecord> findActive(String tenantId) {
        return jdbc.query(
                "select " + PROJECT_COLUMNS + " from projects"
                        + " where tenant_id = :tenant_id and archived_at is null order by updated_at desc",
                new MapSqlParameterSource("tenant_id", tenantId),
                JdbcProjectRepository::project);
    }

    @Override
    public Optional<ProjectRecord> find(String tenantId, String projectId) {
        return jdbc.query(
                        "select " + PROJECT_COLUMNS + " from projects"
                                + " where id = :id and tenant_id = :tenant_id and archived_at is null",
                        new MapSqlParameterSource().addValue("id", projectId).addValue("tenant_id", tenantId),
                        JdbcProjectRepository::project)
                .stream()
                .findFirst();
    }

    @Override
    public void create(ProjectRecord project, ProjectVersionRecord firstVersion) {
        if (firstVersion.versionNo() != 1) {
            throw new IllegalArgumentException("First version must be number 1");
        }
        jdbc.update(
                CREATE,
                new MapSqlParameterSource()
                        .addValue("id", project.id())
                        .addValue("tenant_id", project.tenantId())
                        .addValue("name", project.name())
                        .addValue("description", project.description())
                        .addValue("created_at", toOffset(project.createdAt()), Types.TIMESTAMP_WITH_TIMEZONE)
                        .addValue("version_id", firstVersion.id())
                        .addValue("schema_version", firstVersion.schemaVersion())
                        .addValue("payload", json(firstVersion.payload()))
                        .addValue("checksum", firstVersion.checksum()));
    }

    @Override
    public boolean update(ProjectRecord project) {
        int updated = jdbc.update(
                """
                update projects set name = :name, description = :description, updated_at = :updated_at
                 where id = :id and tenant_id = :tenant_id and archived_at is null
                """,
                new MapSqlParameterSource()
                        .addValue("id", project.id())
                        .addValue("tenant_id", project.tenantId())
                        .addValue("name", project.name())
                        .addValue("description", project.description())
                        .addValue("updated_at", toOffset(project.updatedAt()), Types.TIMESTAMP_WITH_TIMEZONE));
        return updated > 0;
    }

    @Override
    public Optional<ProjectVersionRecord> appendVersion(ProjectVersionRecord draft) {
        List<Integer> numbers = jdbc.query(
                APPEND,
                new MapSqlParameterSource()
                        .addValue("id", draft.id())
                        .addValue("project_id", draft.projectId())
                        .addValue("tenant_id", draft.tenantId())
                        .addValue("schema_version", draft.schemaVersion())
                        .addValue("payload", json(draft.payload()))
                        .addValue("checksum", draft.checksum())
                        .addValue("created_at", toOffset(draft.createdAt()), Types.TIMESTAMP_WITH_TIMEZONE),
                (rs, n) -> rs.getInt("version_no"));
        return numbers.stream()
                .findFirst()
                .map(versionNo -> new ProjectVersionRecord(
                        draft.id(),
                        draft.projectId(),
                        draft.tenantId(),
                        versionNo,
                        draft.schemaVersion(),
                        draft.payload(),
                        draft.checksum(),
                        draft.createdAt()));
    }

    @Override
    public Optional<ProjectVersionRecord> latestVersion(String tenantId, String projectId) {
        return jdbc.query(
                        "select " + VERSION_COLUMNS + " from project_versions"
                                + " where project_id = :project_id and tenant_id = :tenant_id"
                                + " order by version_no desc limit 1",
                        versionParams(tenantId, projectId),
                        versionMapper())
                .stream()
                .findFirst();
    }

    @Override
    public List<ProjectVersionRecord> versions(String tenantId, String projectId) {
        return jdbc.query(
                "select " + VERSION_COLUMNS + " from project_versions"
                        + " where project_id = :project_id and tenant_id = :tenant_id order by version_no desc",
                versionParams(tenantId, projectId),
                versionMapper());
    }

    private static MapSqlParameterSource versionParams(String tenantId, String projectId) {
        return new MapSqlParameterSource().addValue("project_id", projectId).addValue("tenant_id", tenantId);
    }

    private RowMapper<ProjectVersionRecord> versionMapper() {
        return (rs, n) -> new ProjectVersionRecord(
                rs.getString("id"),
                rs.getString("project_id"),
                rs.getString("tenant_id"),
                rs.getInt("version_no"),
                rs.getInt("schema_version"),
                parse(rs.getString("payload")),
                rs.getString("checksum"),
                instant(rs, "created_at"));
    }

    private static ProjectRecord project(ResultSet rs, int n) throws SQLException {
        return new ProjectRecord(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("name"),
                rs.getString("description"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"),
                instant(rs, "archived_at"));
    }

    private String json(JsonNode payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Project payload is not serialisable", e);
        }
    }

    private JsonNode parse(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Stored project payload is not valid JSON", e);
        }
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value == null ? null : value.toInstant();
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
