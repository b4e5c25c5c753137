package com.prism.reference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.service.core.apikey.ApiKeyCodec;
import com.prism.service.core.apikey.ApiKeyService;
import com.prism.service.core.engine.EventSource;
import com.prism.service.core.ingest.IngestBatch;
import com.prism.service.core.ingest.IngestEvent;
import com.prism.service.core.ingest.IngestResult;
import com.prism.service.core.ingest.KeyedIngestService;
import com.prism.service.core.project.CreateProjectRequest;
import com.prism.service.core.project.ProjectDetail;
import com.prism.service.core.project.ProjectService;
import com.prism.service.core.project.ProjectSummary;
import com.prism.service.core.query.DateRangeSpec;
import com.prism.service.core.query.FreeformQueryRequest;
import com.prism.service.core.query.FreeformQueryResult;
import com.prism.service.core.query.QueryService;
import com.prism.service.core.query.SortSpec;
import com.prism.service.core.query.TableQueryRequest;
import com.prism.service.core.query.TableQueryResult;
import com.prism.service.core.query.TimeseriesQueryRequest;
import com.prism.service.core.query.TimeseriesQueryResult;
import com.prism.service.core.sample.SampleDataService;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class PrismApplicationTest {

    private static final DateRangeSpec LAST_30 = DateRangeSpec.preset("last_30_days");

    @Autowired
    private EventSource eventSource;

    @Autowired
    private SampleDataService sampleData;

    @Autowired
    private QueryService queries;

    @Autowired
    private ApiKeyService apiKeys;

    @Autowired
    private KeyedIngestService ingest;

    @Autowired
    private ProjectService projects;

    @Autowired
    private ObjectMapper mapper;

    @Test
    void memoryStorageIsTheDefault() {
        assertEquals("memory-scan", eventSource.name());
    }

    @Test
    void sampleDataIsQueryableByChannel() {
        IngestResult provisioned = sampleData.provision("it-sample");

        TableQueryResult result = queries.table(new TableQueryRequest(
                "it-sample",
                LAST_30,
                List.of("channel"),
                List.of("events", "revenue"),
                null,
                new SortSpec("events", "desc"),
                3));

        assertEquals(252, provisioned.total());
        assertThat(result.columns()).containsExactly("channel", "events", "revenue");
        assertThat(result.rows()).hasSize(3);
        assertEquals(252L, result.totals().get("events"));
        assertThat(sampleData.provision("it-sample").accepted()).isZero();
    }

    @Test
    void starterProjectQueryRunsAgainstSampleData() throws Exception {
        sampleData.provision("it-projects");
        ProjectSummary created = projects.create("it-projects", new CreateProjectRequest(null, "Overview", null));

        ProjectDetail detail = projects.get("it-projects", created.id());
        FreeformQueryRequest saved =
                mapper.treeToValue(detail.payload().at("/panels/0/blocks/0/query"), FreeformQueryRequest.class);
        FreeformQueryResult result = queries.freeform(new FreeformQueryRequest(
                "it-projects",
                saved.rows(),
                saved.columns(),
                saved.segments(),
                saved.dateRange(),
                saved.limit(),
                saved.offset(),
                saved.sort()));

        assertEquals(1, detail.latestVersion().versionNo());
        assertThat(result.columns()).containsExactly("eventName", "events");
        assertEquals(252L, result.totals().get("events"));
    }

    @Test
    void freeformPagesThroughTheSampleChannels() {
        sampleData.provision("it-freeform");

        FreeformQueryResult lastPage = queries.freeform(new FreeformQueryRequest(
                "it-freeform", List.of("channel"), List.of("events"), List.of(), LAST_30, 2, 4, List.of()));
        FreeformQueryResult firstPage = queries.freeform(new FreeformQueryRequest(
                "it-freeform", List.of("channel"), List.of("events"), List.of(), LAST_30, 2, null, List.of()));

        assertThat(firstPage.rows()).hasSize(2);
        assertThat(lastPage.rows()).hasSize(1);
        assertEquals(252L, lastPage.totals().get("events"));
        assertThat(lastPage.queryMs()).isNotNegative();
    }

    @Test
    void keyedIngestFeedsQueries() {
        ApiKeyCodec.GeneratedKey key = apiKeys.issue("it-keyed");
        Instant today = LocalDate.now(ZoneOffset.UTC).atTime(0, 30).toInstant(ZoneOffset.UTC);
        List<IngestEvent> events = List.of(
                new IngestEvent("k1", "purchase", today, "u1", null, Map.of("channel", "Email", "revenue", "19.90")),
                new IngestEvent("k2", "purchase", today, "u2", null, Map.of("channel", "Email", "revenue", 5)));

        IngestResult result = ingest.ingest(key.plaintext(), new IngestBatch("it-keyed", events));

        assertEquals(new IngestResult(2, 0, 2), result);
        TimeseriesQueryResult series = queries.timeseries(
                new TimeseriesQueryRequest("it-keyed", "revenue", null, "day", DateRangeSpec.preset("today"), null));
        assertThat(series.series()).hasSize(1);
        assertEquals("24.9", series.series().get(0).value().toString());
        assertThrows(IllegalArgumentException.class, () -> ingest.ingest(key.plaintext(), new IngestBatch("x", events)));
    }
}
