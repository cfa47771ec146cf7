package com.forenx.sentinel.enrichment;

import com.forenx.sentinel.domain.GeoInfo;
import com.forenx.sentinel.domain.LogRecord;
import com.forenx.sentinel.domain.TestRecords;
import com.forenx.sentinel.domain.UserAgentClass;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static com.forenx.sentinel.domain.TestRecords.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EnrichmentStage Tests")
class EnrichmentStageTest {

    private static final GeoInfo GERMANY = new GeoInfo("DE", "Germany");

    @Mock
    private GeoLookup geoLookup;

    private EnrichmentMetrics metrics;
    private EnrichmentStage stage;

    @BeforeEach
    void setUp() {
        metrics = new EnrichmentMetrics(new SimpleMeterRegistry());
        stage = new EnrichmentStage(geoLookup, new KeywordUserAgentClassifier(), metrics, 1000, Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Should attach geo and user agent class")
    void shouldEnrichRecord() {
        when(geoLookup.lookup("198.51.100.7")).thenReturn(GERMANY);

        LogRecord enriched = stage.enrich(TestRecords.at(T0, "198.51.100.7", "/", 200, 0));

        assertThat(enriched.getEnrichment().getGeo()).isEqualTo(GERMANY);
        assertThat(enriched.getEnrichment().getUserAgentClass()).isEqualTo(UserAgentClass.BROWSER);
    }

    @Test
    @DisplayName("Should degrade to Unknown when the geo lookup fails")
    void shouldDegradeOnLookupFailure() {
        // Given
        when(geoLookup.lookup(anyString())).thenThrow(new EnrichmentLookupException("geo", "backend down"));

        // When
        LogRecord enriched = stage.enrich(TestRecords.at(T0, "198.51.100.7", "/", 200, 0));

        // Then
        assertThat(enriched.getEnrichment().getGeo()).isEqualTo(GeoInfo.UNKNOWN);
        assertThat(enriched.getEnrichment().getUserAgentClass()).isEqualTo(UserAgentClass.BROWSER);
        assertThat(metrics.getGeoFailureCount()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should answer repeated addresses from the cache")
    void shouldCacheSuccessfulLookups() {
        when(geoLookup.lookup("198.51.100.7")).thenReturn(GERMANY);

        stage.enrich(TestRecords.at(T0, "198.51.100.7", "/", 200, 0));
        stage.enrich(TestRecords.at(T0, "198.51.100.7", "/", 200, 1));

        verify(geoLookup, times(1)).lookup("198.51.100.7");
    }

    @Test
    @DisplayName("Should retry after a failed lookup instead of caching the failure")
    void shouldNotCacheFailures() {
        when(geoLookup.lookup("198.51.100.7"))
            .thenThrow(new EnrichmentLookupException("geo", "timeout"))
            .thenReturn(GERMANY);

        stage.enrich(TestRecords.at(T0, "198.51.100.7", "/", 200, 0));
        LogRecord second = stage.enrich(TestRecords.at(T0, "198.51.100.7", "/", 200, 1));

        assertThat(second.getEnrichment().getGeo()).isEqualTo(GERMANY);
    }

    @Test
    @DisplayName("Should drop cached answers when the lookup is replaced")
    void shouldInvalidateCacheOnReplace() {
        when(geoLookup.lookup("198.51.100.7")).thenReturn(GERMANY);
        stage.enrich(TestRecords.at(T0, "198.51.100.7", "/", 200, 0));

        stage.replaceGeoLookup(ip -> GeoInfo.UNKNOWN);
        LogRecord enriched = stage.enrich(TestRecords.at(T0, "198.51.100.7", "/", 200, 1));

        assertThat(enriched.getEnrichment().getGeo()).isEqualTo(GeoInfo.UNKNOWN);
    }
}
