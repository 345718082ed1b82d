package dev.pagegraph.controller;

import dev.pagegraph.dto.request.SimilarityQueryRequest;
import dev.pagegraph.knowledge.ConceptView;
import dev.pagegraph.knowledge.GraphView;
import dev.pagegraph.knowledge.QueryFacade;
import dev.pagegraph.knowledge.SimilarityHit;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.UUID;

/**
 * Read-only knowledge queries for the agent collaborator.
 */
@RestController
@RequestMapping("/query")
public class QueryController {
    private final QueryFacade queryFacade;

    public QueryController(QueryFacade queryFacade) {
        this.queryFacade = queryFacade;
    }

    @PostMapping("/similar")
    public List<SimilarityHit> similar(@Valid @RequestBody SimilarityQueryRequest request) {
        return queryFacade.similaritySearch(request.vectorArray(), request.kOrDefault(), request.modelVersion());
    }

    @GetMapping("/similar/{visitId}")
    public List<SimilarityHit> similarTo(@PathVariable UUID visitId,
                                         @RequestParam(defaultValue = "10") @Min(1) @Max(100) int k) {
        return queryFacade.similarTo(visitId, k);
    }

    @GetMapping("/graph/{nodeId}")
    public GraphView traverse(@PathVariable UUID nodeId,
                              @RequestParam(defaultValue = "1") @Min(0) int depth) {
        return queryFacade.traverse(nodeId, depth);
    }

    @GetMapping("/concepts/{label}")
    public ConceptView concept(@PathVariable String label) {
        return queryFacade.findConcept(label);
    }
}
