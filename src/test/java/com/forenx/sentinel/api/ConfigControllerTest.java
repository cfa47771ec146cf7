package com.forenx.sentinel.api;

import com.forenx.sentinel.config.DetectionSettingsHolder;
import com.forenx.sentinel.config.SentinelProperties;
import com.forenx.sentinel.enrichment.CsvRangeGeoLookup;
import com.forenx.sentinel.enrichment.EnrichmentStage;
import com.forenx.sentinel.enrichment.GeoLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConfigController Tests")
class ConfigControllerTest {

    @Mock
    private EnrichmentStage enrichmentStage;

    private DetectionSettingsHolder settingsHolder;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        SentinelProperties properties = new SentinelProperties();
        settingsHolder = new DetectionSettingsHolder(properties);
        mockMvc = MockMvcBuilders
            .standaloneSetup(new ConfigController(settingsHolder, enrichmentStage, properties))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("Should apply a detection update and return the active settings")
    void shouldUpdateDetection() throws Exception {
        mockMvc.perform(put("/api/config/detection").contentType(MediaType.APPLICATION_JSON)
                .content("{\"auth_threshold\": 5, \"auth_window\": \"PT2M\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.auth_threshold").value(5))
            .andExpect(jsonPath("$.rate_threshold").value(300));

        assertThat(settingsHolder.get().getAuthThreshold()).isEqualTo(5);
        assertThat(settingsHolder.get().getAuthWindow()).isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    @DisplayName("Should reject an invalid detection update and keep the active settings")
    void shouldRejectInvalidDetection() throws Exception {
        mockMvc.perform(put("/api/config/detection").contentType(MediaType.APPLICATION_JSON)
                .content("{\"rate_threshold\": 0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("classifier_config_error"))
            .andExpect(jsonPath("$.details.definition").value("rate_threshold"));

        assertThat(settingsHolder.get().getRateThreshold()).isEqualTo(300);
    }

    @Test
    @DisplayName("Should report a malformed body as a configuration error")
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(put("/api/config/detection").contentType(MediaType.APPLICATION_JSON)
                .content("{\"auth_window\": \"five minutes\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("classifier_config_error"));
    }

    @Test
    @DisplayName("Should expose the active detection settings")
    void shouldReadDetection() throws Exception {
        mockMvc.perform(get("/api/config/detection"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.bytes_threshold").value(10_000_000));
    }

    @Test
    @DisplayName("Should swap the geo lookup for a new range database")
    void shouldReplaceGeoDatabase(@TempDir Path dir) throws Exception {
        Path database = dir.resolve("geo.csv");
        Files.writeString(database, "8.8.8.0,8.8.8.255,US,United States\n", StandardCharsets.UTF_8);

        mockMvc.perform(put("/api/config/enrichment").contentType(MediaType.APPLICATION_JSON)
                .content("{\"geo_database\": \"" + database.toString().replace("\\", "\\\\") + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("applied"));

        ArgumentCaptor<GeoLookup> captor = ArgumentCaptor.forClass(GeoLookup.class);
        verify(enrichmentStage).replaceGeoLookup(captor.capture());
        assertThat(captor.getValue()).isInstanceOf(CsvRangeGeoLookup.class);
    }

    @Test
    @DisplayName("Should keep the current lookup when the database cannot be read")
    void shouldRejectMissingDatabase(@TempDir Path dir) throws Exception {
        String missing = dir.resolve("missing.csv").toString().replace("\\", "\\\\");

        mockMvc.perform(put("/api/config/enrichment").contentType(MediaType.APPLICATION_JSON)
                .content("{\"geo_database\": \"" + missing + "\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("classifier_config_error"))
            .andExpect(jsonPath("$.details.definition").value("geo_database"));

        verify(enrichmentStage, never()).replaceGeoLookup(any());
    }
}
