package com.forenx.sentinel.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Replacement geo lookup source. Both fields empty switches geo enrichment off.
 */
public class EnrichmentSettingsUpdate {

    @JsonProperty("geo_database")
    private String geoDatabase;

    @JsonProperty("geo_endpoint")
    private String geoEndpoint;

    @JsonProperty("timeout")
    private Duration timeout;

    public String getGeoDatabase() {
        return geoDatabase;
    }

    public void setGeoDatabase(String geoDatabase) {
        this.geoDatabase = geoDatabase;
    }

    public String getGeoEndpoint() {
        return geoEndpoint;
    }

    public void setGeoEndpoint(String geoEndpoint) {
        this.geoEndpoint = geoEndpoint;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
