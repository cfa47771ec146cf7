package com.forenx.sentinel.api;

import com.forenx.sentinel.ingestion.IngestionLedger;
import com.forenx.sentinel.ingestion.IngestionService;
import com.forenx.sentinel.ingestion.IngestionStatus;
import com.forenx.sentinel.ingestion.IngestionSummary;
import com.forenx.sentinel.ingestion.LiveIngestResult;
import com.forenx.sentinel.ingestion.LogFileReader;
import com.forenx.sentinel.ingestion.SourceLineReader;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;

/**
 * Ingestion endpoints. Batch bodies are streamed line by line (gzip bodies are detected and
 * inflated); live bodies are small and taken whole.
 */
@RestController
@RequestMapping("/api")
public class IngestionController {

    private final IngestionService ingestionService;
    private final IngestionLedger ledger;

    public IngestionController(IngestionService ingestionService, IngestionLedger ledger) {
        this.ingestionService = ingestionService;
        this.ledger = ledger;
    }

    @PostMapping(value = "/ingest/batch", consumes = {MediaType.TEXT_PLAIN_VALUE, MediaType.APPLICATION_OCTET_STREAM_VALUE})
    public IngestionSummary ingestBatch(@RequestParam String sourceFileId,
                                        @RequestParam(defaultValue = "0") long startOffset,
                                        HttpServletRequest request) throws IOException {
        try (SourceLineReader reader = LogFileReader.open(request.getInputStream())) {
            return ingestionService.ingestBatch(sourceFileId, reader, startOffset);
        }
    }

    @PostMapping(value = "/ingest/live", consumes = MediaType.TEXT_PLAIN_VALUE)
    public LiveIngestResult ingestLive(@RequestParam String sourceFileId,
                                       @RequestBody(required = false) String body) {
        List<String> lines = body == null || body.isEmpty() ? List.of() : body.lines().toList();
        return ingestionService.submitLive(sourceFileId, lines);
    }

    @PostMapping("/ingest/live/close")
    public ResponseEntity<IngestionSummary> closeLive(@RequestParam String sourceFileId) {
        IngestionSummary summary = ingestionService.closeLive(sourceFileId);
        return summary == null ? ResponseEntity.notFound().build() : ResponseEntity.ok(summary);
    }

    @GetMapping("/ingestion/batches")
    public List<IngestionSummary> batches() {
        return ledger.list();
    }

    @GetMapping("/ingestion/status")
    public IngestionStatus status() {
        return ingestionService.status();
    }
}
