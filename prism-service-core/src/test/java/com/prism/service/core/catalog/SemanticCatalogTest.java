package com.prism.service.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class SemanticCatalogTest {

    @Test
    void describeListsEveryVocabulary() {
        SemanticCatalog.Description description = SemanticCatalog.describe();

        assertThat(description.dimensions())
                .extracting(SemanticCatalog.Entry::key)
                .containsExactly("channel", "brand", "product", "campaign", "eventName", "day", "hour");
        assertThat(description.metrics())
                .containsExactly(
                        new SemanticCatalog.Entry("events", "Events", "number", "count", null),
                        new SemanticCatalog.Entry("users", "Users", "number", "distinct_users", null),
                        new SemanticCatalog.Entry("revenue", "Revenue", "number", "sum", null),
                        new SemanticCatalog.Entry("netDemand", "Net Demand", "number", "sum", null));
        assertThat(description.dimensions())
                .filteredOn(e -> e.key().equals("day"))
                .extracting(SemanticCatalog.Entry::type)
                .containsExactly("date");
    }

    @Test
    void segmentFieldsCarryTheirOperators() {
        List<SemanticCatalog.Entry> fields = SemanticCatalog.describe().segmentFields();

        assertThat(fields)
                .filteredOn(e -> e.key().equals("channel"))
                .singleElement()
                .satisfies(e -> assertThat(e.operators()).containsExactly("eq", "neq", "contains", "in"));
        assertThat(fields)
                .filteredOn(e -> e.key().equals("revenue"))
                .singleElement()
                .satisfies(e -> assertThat(e.operators()).contains("gte").doesNotContain("contains"));
    }

    @Test
    void lookups() {
        assertThat(SemanticCatalog.dimension("brand")).isEqualTo(Dimension.BRAND);
        assertThat(SemanticCatalog.metric("clicks")).isNull();
        assertThat(SemanticCatalog.fieldType("properties.utm_source")).isEqualTo(FieldType.TEXT);
        assertThat(SemanticCatalog.fieldType("day")).isEqualTo(FieldType.DATE);
        assertThat(SemanticCatalog.metricKeys()).containsExactly("events", "users", "revenue", "netDemand");
    }
}
