package com.forenx.sentinel.enrichment;

import com.forenx.sentinel.config.SentinelProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EnrichmentConfiguration {

    @Bean
    public UserAgentClassifier userAgentClassifier() {
        return new KeywordUserAgentClassifier();
    }

    @Bean
    public EnrichmentStage enrichmentStage(SentinelProperties properties, UserAgentClassifier userAgentClassifier,
                                           EnrichmentMetrics metrics) {
        SentinelProperties.Enrichment cfg = properties.getEnrichment();
        GeoLookup geoLookup = GeoLookupFactory.create(cfg.getGeoDatabase(), cfg.getGeoEndpoint(), cfg.getTimeout());
        return new EnrichmentStage(geoLookup, userAgentClassifier, metrics, cfg.getCacheSize(), cfg.getCacheTtl());
    }
}
