package com.prism.service.core.config;

import com.prism.service.core.ingest.IngestBatch;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "prism.sample-data")
public class SampleDataProperties {

    private int days = 21;
    private int eventsPerDay = 12;
    /** Events per ingest call; capped by the ingest batch limit. */
    private int batchSize = IngestBatch.MAX_EVENTS;

    public int getDays() {
        return days;
    }

    public void setDays(int days) {
        this.days = days;
    }

    public int getEventsPerDay() {
        return eventsPerDay;
    }

    public void setEventsPerDay(int eventsPerDay) {
        this.eventsPerDay = eventsPerDay;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }
}
