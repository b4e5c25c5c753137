package com.prism.service.storage.impl;

import com.prism.service.core.apikey.ApiKeyRecord;
import com.prism.service.core.apikey.ApiKeyRepository;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public class JdbcApiKeyRepository implements ApiKeyRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcApiKeyRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<ApiKeyRecord> findByPrefix(String prefix) {
        List<ApiKeyRecord> found = jdbc.query(
                "select id, tenant_id, prefix, secret_hash, revoked_at from api_keys where prefix = :prefix",
                new MapSqlParameterSource("prefix", prefix),
                (rs, n) -> {
                    Timestamp revokedAt = rs.getTimestamp("revoked_at");
                    return new ApiKeyRecord(
                            rs.getString("id"),
                            rs.getString("tenant_id"),
                            rs.getString("prefix"),
                            rs.getString("secret_hash"),
                            revokedAt == null ? null : revokedAt.toInstant());
                });
        return found.stream().findFirst();
    }

    @Override
    public void save(ApiKeyRecord record) {
        jdbc.update(
                """
                insert into api_keys(id, tenant_id, prefix, secret_hash, revoked_at)
                values (:id, :tenant_id, :prefix, :secret_hash, :revoked_at)
                on conflict (prefix) do update
                   set secret_hash = excluded.secret_hash, revoked_at = excluded.revoked_at
                """,
                new MapSqlParameterSource()
                        .addValue("id", record.id())
                        .addValue("tenant_id", record.tenantId())
                        .addValue("prefix", record.prefix())
                        .addValue("secret_hash", record.secretHash())
                        .addValue("revoked_at", toOffset(record.revokedAt()), Types.TIMESTAMP_WITH_TIMEZONE));
    }

    @Override
    public void markUsed(String id, Instant usedAt) {
        jdbc.update(
                "update api_keys set last_used_at = :used_at where id = :id",
                new MapSqlParameterSource()
                        .addValue("id", id)
                        .addValue("used_at", toOffset(usedAt), Types.TIMESTAMP_WITH_TIMEZONE));
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
