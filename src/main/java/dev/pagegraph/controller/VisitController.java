package dev.pagegraph.controller;

import dev.pagegraph.domain.valueobject.VisitSnapshot;
import dev.pagegraph.dto.response.CancelResponse;
import dev.pagegraph.dto.response.VisitEventResponse;
import dev.pagegraph.dto.response.VisitResponse;
import dev.pagegraph.exception.VisitNotFoundException;
import dev.pagegraph.service.VisitCancellationService;
import dev.pagegraph.service.VisitQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/visits")
public class VisitController {
    private final VisitQueryService queryService;
    private final VisitCancellationService cancellationService;

    public VisitController(VisitQueryService queryService, VisitCancellationService cancellationService) {
        this.queryService = queryService;
        this.cancellationService = cancellationService;
    }

    @GetMapping("/{id}")
    public ResponseEntity<VisitResponse> getVisit(@PathVariable UUID id) {
        return queryService.findById(id).map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public VisitResponse getLatestForUrl(@RequestParam String url) {
        return queryService.findLatestForUrl(url)
                .orElseThrow(() -> new VisitNotFoundException("No visit recorded for " + url));
    }

    @GetMapping("/{id}/events")
    public List<VisitEventResponse> getEvents(@PathVariable UUID id) {
        return queryService.replayEvents(id);
    }

    @PostMapping("/{id}/cancel")
    public CancelResponse cancel(@PathVariable UUID id) {
        VisitSnapshot visit = cancellationService.cancel(id);
        return CancelResponse.forVisit(id, visit.terminal(), visit.status());
    }

    @PostMapping("/cancel")
    public CancelResponse cancelHost(@RequestParam String host) {
        return CancelResponse.forHost(host, cancellationService.cancelHost(host));
    }
}
