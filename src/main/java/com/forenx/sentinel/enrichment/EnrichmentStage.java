package com.forenx.sentinel.enrichment;

import com.forenx.sentinel.domain.Enrichment;
import com.forenx.sentinel.domain.GeoInfo;
import com.forenx.sentinel.domain.LogRecord;
import com.forenx.sentinel.domain.UserAgentClass;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Attaches geo and user-agent attributes to a record.
 *
 * Lookups never fail the pipeline: an {@link EnrichmentLookupException} (or any other runtime
 * failure of an injected lookup) is counted, logged at warn and replaced by Unknown. Successful
 * geo answers are cached per address; failures are not cached so the next record retries.
 * The geo lookup can be swapped at runtime when the configured database or endpoint changes.
 */
public class EnrichmentStage {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentStage.class);

    private final UserAgentClassifier userAgentClassifier;
    private final EnrichmentMetrics metrics;
    private final Cache<String, GeoInfo> geoCache;
    private volatile GeoLookup geoLookup;

    public EnrichmentStage(GeoLookup geoLookup, UserAgentClassifier userAgentClassifier,
                           EnrichmentMetrics metrics, long cacheSize, Duration cacheTtl) {
        this.geoLookup = geoLookup;
        this.userAgentClassifier = userAgentClassifier;
        this.metrics = metrics;
        this.geoCache = Caffeine.newBuilder()
            .maximumSize(cacheSize)
            .expireAfterWrite(cacheTtl)
            .build();
    }

    public LogRecord enrich(LogRecord record) {
        return record.withEnrichment(new Enrichment(resolveGeo(record.getClientIp()),
            classifyUserAgent(record.getUserAgent())));
    }

    public void replaceGeoLookup(GeoLookup lookup) {
        this.geoLookup = lookup;
        geoCache.invalidateAll();
        log.info("Geo lookup replaced by {}", lookup.getClass().getSimpleName());
    }

    private GeoInfo resolveGeo(String ip) {
        GeoInfo cached = geoCache.getIfPresent(ip);
        if (cached != null) {
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();
        try {
            GeoInfo info = geoLookup.lookup(ip);
            GeoInfo resolved = info != null ? info : GeoInfo.UNKNOWN;
            geoCache.put(ip, resolved);
            return resolved;
        } catch (RuntimeException e) {
            metrics.recordGeoFailure();
            log.warn("Geo lookup failed for {}, using Unknown: {}", ip, e.getMessage());
            return GeoInfo.UNKNOWN;
        }
    }

    private UserAgentClass classifyUserAgent(String userAgent) {
        try {
            UserAgentClass cls = userAgentClassifier.classify(userAgent);
            return cls != null ? cls : UserAgentClass.UNKNOWN;
        } catch (RuntimeException e) {
            metrics.recordUserAgentFailure();
            log.warn("User agent classification failed, using Unknown: {}", e.getMessage());
            return UserAgentClass.UNKNOWN;
        }
    }
}
