package com.prism.service.storage.impl;

import com.prism.core.model.Event;
import com.prism.service.core.ingest.EventIngestService;
import com.prism.service.core.ingest.IngestEvent;
import com.prism.service.core.ingest.IngestResult;
import com.prism.service.core.ingest.IngestValidator;
import java.sql.Types;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Batch insert into {@code events}; duplicates on {@code (tenant_id, event_id)} are skipped by the database. */
public class JdbcEventIngestService implements EventIngestService {

    private static final String SQL =
            """
            insert into events(
                      tenant_id, event_id, event_name, occurred_at, user_id, session_id, properties, ingested_at
            ) values (
                      :tenant_id, :event_id, :event_name, :occurred_at, :user_id, :session_id, cast(:properties as jsonb), :ingested_at
            )
            on conflict (tenant_id, event_id) do nothing
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final IngestValidator validator;
    private final Clock clock;

    public JdbcEventIngestService(NamedParameterJdbcTemplate jdbc, IngestValidator validator, Clock clock) {
        this.jdbc = jdbc;
        this.validator = validator;
        this.clock = clock;
    }

    @Override
    public IngestResult ingestBatch(String tenantId, List<IngestEvent> batch) {
        List<Event> events = validator.toEvents(tenantId, batch);
        OffsetDateTime now = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        int stored = 0;
        for (Event e : events) {
            MapSqlParameterSource p = new MapSqlParameterSource()
                    .addValue("tenant_id", e.tenantId())
                    .addValue("event_id", e.eventId())
                    .addValue("event_name", e.eventName())
                    .addValue(
                            "occurred_at",
                            OffsetDateTime.ofInstant(e.timestamp(), ZoneOffset.UTC),
                            Types.TIMESTAMP_WITH_TIMEZONE)
                    .addValue("user_id", e.userId())
                    .addValue("session_id", e.sessionId())
                    .addValue("properties", PropertiesJson.toJson(e.properties()))
                    .addValue("ingested_at", now, Types.TIMESTAMP_WITH_TIMEZONE);
            stored += jdbc.update(SQL, p);
        }
        return IngestResult.of(stored, events.size());
    }
}
