package com.prism.service.storage.impl;

import com.prism.core.model.Event;
import com.prism.service.core.engine.CandidateEventSource;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Reads raw events for in-process aggregation; used when {@code prism.query.strategy=scan}. */
public class JdbcCandidateEventSource implements CandidateEventSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcCandidateEventSource.class);

    private static final String SQL =
            """
            select tenant_id, event_id, event_name, occurred_at, user_id, session_id, properties::text as properties
              from events
             where tenant_id = :tenant_id
               and occurred_at >= :ts_from and occurred_at <= :ts_to
             order by occurred_at, id
            """;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcCandidateEventSource(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public String name() {
        return "jdbc-scan";
    }

    @Override
    public List<Event> fetchCandidates(String tenantId, Instant from, Instant to) {
        MapSqlParameterSource p = new MapSqlParameterSource()
                .addValue("tenant_id", tenantId)
                .addValue("ts_from", OffsetDateTime.ofInstant(from, ZoneOffset.UTC))
                .addValue("ts_to", OffsetDateTime.ofInstant(to, ZoneOffset.UTC));
        if (log.isDebugEnabled()) {
            log.debug("Candidate SQL:\n{}\nparams: {}", SQL, p.getValues());
        }
        return jdbc.query(SQL, p, (rs, n) -> {
            Timestamp occurredAt = rs.getTimestamp("occurred_at");
            return Event.builder()
                    .tenantId(rs.getString("tenant_id"))
                    .eventId(rs.getString("event_id"))
                    .eventName(rs.getString("event_name"))
                    .timestamp(occurredAt.toInstant())
                    .userId(rs.getString("user_id"))
                    .sessionId(rs.getString("session_id"))
                    .properties(PropertiesJson.fromJson(rs.getString("properties")))
                    .build();
        });
    }
}
