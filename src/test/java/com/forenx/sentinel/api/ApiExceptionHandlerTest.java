package com.forenx.sentinel.api;

import com.forenx.sentinel.analytics.MetricsAggregator;
import com.forenx.sentinel.ingestion.CapacityExceededException;
import com.forenx.sentinel.ingestion.IngestionLedger;
import com.forenx.sentinel.ingestion.IngestionService;
import com.forenx.sentinel.ingestion.SourceLineReader;
import com.forenx.sentinel.query.QueryService;
import com.forenx.sentinel.storage.InMemoryAlertRepository;
import com.forenx.sentinel.storage.InMemoryRecordStore;
import com.forenx.sentinel.storage.StorageWriteException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("ApiExceptionHandler Tests")
class ApiExceptionHandlerTest {

    private static final String FROM = "2024-03-04T09:00:00Z";
    private static final String TO = "2024-03-04T10:00:00Z";

    @Mock
    private IngestionService ingestionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        QueryService queryService = new QueryService(
            new MetricsAggregator(10, 1_000, 0.01),
            new InMemoryAlertRepository(),
            new InMemoryRecordStore(),
            new SimpleMeterRegistry());
        mockMvc = MockMvcBuilders
            .standaloneSetup(new QueryController(queryService),
                new IngestionController(ingestionService, new IngestionLedger()),
                new EchoController())
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("Should report a missing range bound as an invalid query")
    void shouldMapMissingParameter() throws Exception {
        mockMvc.perform(get("/api/alerts").param("to", TO))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("invalid_query"))
            .andExpect(jsonPath("$.details.parameter").value("from"));
    }

    @Test
    @DisplayName("Should report an unknown granularity as an invalid query")
    void shouldMapValidationFailure() throws Exception {
        mockMvc.perform(get("/api/metrics").param("from", FROM).param("to", TO).param("granularity", "minute"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("invalid_query"))
            .andExpect(jsonPath("$.details.parameter").value("granularity"));
    }

    @Test
    @DisplayName("Should report a non-numeric limit as an invalid query")
    void shouldMapTypeMismatch() throws Exception {
        mockMvc.perform(get("/api/alerts").param("from", FROM).param("to", TO).param("limit", "many"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("invalid_query"))
            .andExpect(jsonPath("$.details.parameter").value("limit"));
    }

    @Test
    @DisplayName("Should serve a valid query")
    void shouldServeQuery() throws Exception {
        mockMvc.perform(get("/api/metrics").param("from", FROM).param("to", TO))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    @DisplayName("Should map a full pipeline to 429")
    void shouldMapCapacityExceeded() throws Exception {
        when(ingestionService.ingestBatch(eq("a.log"), any(SourceLineReader.class), anyLong()))
            .thenThrow(new CapacityExceededException("Ingestion pipeline is not accepting input"));

        mockMvc.perform(post("/api/ingest/batch").param("sourceFileId", "a.log")
                .contentType(MediaType.TEXT_PLAIN).content("line\n"))
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.kind").value("capacity_exceeded"));
    }

    @Test
    @DisplayName("Should map a storage failure to 503 with the offset to resume from")
    void shouldMapStorageFailure() throws Exception {
        when(ingestionService.ingestBatch(eq("a.log"), any(SourceLineReader.class), eq(0L)))
            .thenThrow(new StorageWriteException("disk full", "a.log", 42L, null));

        mockMvc.perform(post("/api/ingest/batch").param("sourceFileId", "a.log")
                .contentType(MediaType.TEXT_PLAIN).content("line\n"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.kind").value("storage_write_failure"))
            .andExpect(jsonPath("$.details.source_file_id").value("a.log"))
            .andExpect(jsonPath("$.details.first_unacknowledged_offset").value(42));
    }

    @Test
    @DisplayName("Should hide unexpected failures behind an internal error")
    void shouldMapUnexpectedFailure() throws Exception {
        when(ingestionService.ingestBatch(eq("a.log"), any(SourceLineReader.class), anyLong()))
            .thenThrow(new IllegalStateException("secret detail"));

        mockMvc.perform(post("/api/ingest/batch").param("sourceFileId", "a.log")
                .contentType(MediaType.TEXT_PLAIN).content("line\n"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.kind").value("internal"))
            .andExpect(jsonPath("$.message").value("Internal error"));
    }

    @Test
    @DisplayName("Should answer 404 when closing an unknown live source")
    void shouldReturnNotFoundForUnknownLiveSource() throws Exception {
        when(ingestionService.closeLive("tail")).thenReturn(null);

        mockMvc.perform(post("/api/ingest/live/close").param("sourceFileId", "tail"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should report a malformed body outside the config endpoints as an invalid request")
    void shouldMapUnreadableBodyOutsideConfig() throws Exception {
        mockMvc.perform(post("/api/echo").contentType(MediaType.APPLICATION_JSON).content("{\"limit\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("invalid_query"));
    }

    @RestController
    public static class EchoController {

        @PostMapping("/api/echo")
        public Map<String, Object> echo(@RequestBody Map<String, Object> body) {
            return body;
        }
    }
}
