package com.forenx.sentinel.enrichment;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Counters for the enrichment stage: cache effectiveness and degraded lookups.
 */
@Component
public class EnrichmentMetrics {

    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter geoFailures;
    private final Counter userAgentFailures;

    public EnrichmentMetrics(MeterRegistry registry) {
        this.cacheHits = Counter.builder("forenx.enrichment.cache.hits")
            .description("Geo lookups answered from the cache")
            .tag("component", "enrichment")
            .register(registry);

        this.cacheMisses = Counter.builder("forenx.enrichment.cache.misses")
            .description("Geo lookups that went to the backend")
            .tag("component", "enrichment")
            .register(registry);

        this.geoFailures = Counter.builder("forenx.enrichment.failures")
            .description("Lookups that failed and degraded to Unknown")
            .tag("lookup", "geo")
            .register(registry);

        this.userAgentFailures = Counter.builder("forenx.enrichment.failures")
            .description("Lookups that failed and degraded to Unknown")
            .tag("lookup", "user_agent")
            .register(registry);
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordGeoFailure() {
        geoFailures.increment();
    }

    public void recordUserAgentFailure() {
        userAgentFailures.increment();
    }

    public double getGeoFailureCount() {
        return geoFailures.count();
    }

    public double getUserAgentFailureCount() {
        return userAgentFailures.count();
    }
}
