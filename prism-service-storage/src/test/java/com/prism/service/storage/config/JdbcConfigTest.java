package com.prism.service.storage.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.service.core.config.QueryProperties;
import com.prism.service.storage.impl.JdbcCandidateEventSource;
import com.prism.service.storage.impl.JdbcCompiledEventSource;
import com.prism.service.storage.impl.JdbcProjectRepository;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

class JdbcConfigTest {

    private final JdbcConfig config = new JdbcConfig();
    private final NamedParameterJdbcTemplate jdbc = mock(NamedParameterJdbcTemplate.class);

    @Test
    void compiledIsTheDefaultStrategy() {
        assertThat(config.eventSource(jdbc, new QueryProperties())).isInstanceOf(JdbcCompiledEventSource.class);
    }

    @Test
    void scanStrategyUsesCandidateSource() {
        QueryProperties properties = new QueryProperties();
        properties.setStrategy("SCAN");

        assertThat(config.eventSource(jdbc, properties)).isInstanceOf(JdbcCandidateEventSource.class);
    }

    @Test
    void unknownStrategyFailsStartup() {
        QueryProperties properties = new QueryProperties();
        properties.setStrategy("magic");

        assertThrows(IllegalStateException.class, () -> config.eventSource(jdbc, properties));
    }

    @Test
    void projectsAreStoredInPostgres() {
        assertThat(config.projectRepository(jdbc, new ObjectMapper())).isInstanceOf(JdbcProjectRepository.class);
    }
}
