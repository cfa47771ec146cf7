package com.forenx.sentinel.api;

import com.forenx.sentinel.config.ClassifierConfigException;
import com.forenx.sentinel.config.DetectionSettings;
import com.forenx.sentinel.config.DetectionSettingsHolder;
import com.forenx.sentinel.config.DetectionSettingsUpdate;
import com.forenx.sentinel.config.EnrichmentSettingsUpdate;
import com.forenx.sentinel.config.SentinelProperties;
import com.forenx.sentinel.enrichment.EnrichmentStage;
import com.forenx.sentinel.enrichment.GeoLookupFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;

/**
 * Hot reconfiguration. Changes apply to records processed after the call returns;
 * ingestion keeps running throughout.
 */
@RestController
@RequestMapping("/api/config")
public class ConfigController {

    private final DetectionSettingsHolder settingsHolder;
    private final EnrichmentStage enrichmentStage;
    private final Duration defaultTimeout;

    public ConfigController(DetectionSettingsHolder settingsHolder, EnrichmentStage enrichmentStage,
                            SentinelProperties properties) {
        this.settingsHolder = settingsHolder;
        this.enrichmentStage = enrichmentStage;
        this.defaultTimeout = properties.getEnrichment().getTimeout();
    }

    @GetMapping("/detection")
    public DetectionSettings detection() {
        return settingsHolder.get();
    }

    @PutMapping("/detection")
    public DetectionSettings updateDetection(@RequestBody DetectionSettingsUpdate update) {
        settingsHolder.apply(update);
        return settingsHolder.get();
    }

    @PutMapping("/enrichment")
    public Map<String, String> updateEnrichment(@RequestBody EnrichmentSettingsUpdate update) {
        Duration timeout = update.getTimeout() == null ? defaultTimeout : update.getTimeout();
        if (timeout.isNegative() || timeout.isZero()) {
            throw new ClassifierConfigException("Enrichment timeout must be positive: " + timeout, "timeout");
        }
        try {
            enrichmentStage.replaceGeoLookup(
                GeoLookupFactory.create(update.getGeoDatabase(), update.getGeoEndpoint(), timeout));
        } catch (UncheckedIOException e) {
            throw new ClassifierConfigException(e.getMessage(), "geo_database", e);
        } catch (IllegalArgumentException e) {
            throw new ClassifierConfigException("Invalid geo lookup source: " + e.getMessage(), "geo_endpoint", e);
        }
        return Map.of("status", "applied");
    }
}
