package com.prism.service.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "prism.ingest")
public class IngestProperties {

    private int rateLimitPerMinute = 300;
    /** HMAC salt for API key secrets. Override outside development. */
    private String apiKeySalt = "development-salt";
    /** When set, an ingest key for this tenant is issued at startup and logged. Development use only. */
    private String bootstrapTenant;

    public int getRateLimitPerMinute() {
        return rateLimitPerMinute;
    }

    public void setRateLimitPerMinute(int rateLimitPerMinute) {
        this.rateLimitPerMinute = rateLimitPerMinute;
    }

    public String getApiKeySalt() {
        return apiKeySalt;
    }

    public void setApiKeySalt(String apiKeySalt) {
        this.apiKeySalt = apiKeySalt;
    }

    public String getBootstrapTenant() {
        return bootstrapTenant;
    }

    public void setBootstrapTenant(String bootstrapTenant) {
        this.bootstrapTenant = bootstrapTenant;
    }
}
