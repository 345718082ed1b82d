package dev.pagegraph.controller;

import dev.pagegraph.dto.request.IngestRequest;
import dev.pagegraph.dto.response.IngestResponse;
import dev.pagegraph.service.IngestResult;
import dev.pagegraph.service.IngestionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Event receiver for the capture client. Answers as soon as the event is durable:
 * 202 for Queued and Throttled, 400 for Rejected. All processing is asynchronous.
 */
@RestController
public class IngestController {

    private final IngestionService ingestionService;

    public IngestController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @GetMapping("/")
    public Map<String, String> health() {
        return Map.of("status", "ok", "service", "url-ingestion");
    }

    @PostMapping("/ingest")
    public ResponseEntity<IngestResponse> ingest(@RequestBody IngestRequest request) {
        IngestResult result = ingestionService.ingest(request);
        IngestResponse body = new IngestResponse(result.accepted(), result.fingerprint(), result.status(),
                result.reason(), result.visitId());
        return ResponseEntity.status(result.accepted() ? HttpStatus.ACCEPTED : HttpStatus.BAD_REQUEST).body(body);
    }
}
