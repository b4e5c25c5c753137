package com.prism.service.storage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.service.core.apikey.ApiKeyRepository;
import com.prism.service.core.config.QueryProperties;
import com.prism.service.core.engine.EventSource;
import com.prism.service.core.ingest.EventIngestService;
import com.prism.service.core.ingest.IngestValidator;
import com.prism.service.core.project.ProjectRepository;
import com.prism.service.storage.impl.JdbcApiKeyRepository;
import com.prism.service.storage.impl.JdbcCandidateEventSource;
import com.prism.service.storage.impl.JdbcCompiledEventSource;
import com.prism.service.storage.impl.JdbcEventIngestService;
import com.prism.service.storage.impl.JdbcProjectRepository;
import java.time.Clock;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** PostgreSQL-backed storage, active with {@code prism.storage=jdbc}. */
@Configuration
@ConditionalOnClass(NamedParameterJdbcTemplate.class)
@ConditionalOnProperty(prefix = "prism", name = "storage", havingValue = "jdbc")
@Slf4j
public class JdbcConfig {

    @Bean
    @ConditionalOnMissingBean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public EventSource eventSource(NamedParameterJdbcTemplate jdbc, QueryProperties properties) {
        String strategy = properties.getStrategy();
        if ("scan".equalsIgnoreCase(strategy)) {
            log.info("Query strategy: in-process scan over JDBC candidates");
            return new JdbcCandidateEventSource(jdbc);
        }
        if (!"compiled".equalsIgnoreCase(strategy)) {
            throw new IllegalStateException(
                    "Unknown prism.query.strategy '" + strategy + "' (expected compiled or scan)");
        }
        log.info("Query strategy: compiled SQL");
        return new JdbcCompiledEventSource(jdbc);
    }

    @Bean
    public EventIngestService eventIngestService(
            NamedParameterJdbcTemplate jdbc, IngestValidator validator, Clock clock) {
        return new JdbcEventIngestService(jdbc, validator, clock);
    }

    @Bean
    public ApiKeyRepository apiKeyRepository(NamedParameterJdbcTemplate jdbc) {
        return new JdbcApiKeyRepository(jdbc);
    }

    @Bean
    public ProjectRepository projectRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper) {
        return new JdbcProjectRepository(jdbc, mapper);
    }
}
