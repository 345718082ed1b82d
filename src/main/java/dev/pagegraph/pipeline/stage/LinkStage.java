package dev.pagegraph.pipeline.stage;

import dev.pagegraph.config.KnowledgeProperties;
import dev.pagegraph.domain.entity.ConceptNode;
import dev.pagegraph.domain.entity.Embedding;
import dev.pagegraph.domain.entity.Summary;
import dev.pagegraph.domain.enums.EdgeKind;
import dev.pagegraph.domain.enums.PipelineStage;
import dev.pagegraph.domain.valueobject.VisitSnapshot;
import dev.pagegraph.exception.LinkException;
import dev.pagegraph.knowledge.KnowledgeStore;
import dev.pagegraph.knowledge.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Connects the Visit into the concept graph.
 *
 * <ol>
 *   <li>get-or-create a ConceptNode per summary concept</li>
 *   <li>ABOUT(visit, concept) and RELATED_TO for every concept pair, weight 1 each</li>
 *   <li>SIMILAR_TO(visit, candidate), weighted by cosine similarity, for served pages
 *       sharing a concept whose similarity reaches the threshold</li>
 * </ol>
 *
 * <p>All reinforcements carry this Visit's id as evidence, so a re-run adds nothing.
 */
@Component
public class LinkStage implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(LinkStage.class);

    private final KnowledgeStore knowledgeStore;
    private final KnowledgeProperties properties;

    public LinkStage(KnowledgeStore knowledgeStore, KnowledgeProperties properties) {
        this.knowledgeStore = knowledgeStore;
        this.properties = properties;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.LINK;
    }

    @Override
    public void execute(VisitSnapshot visit) {
        try {
            link(visit);
        } catch (DataAccessException e) {
            throw new LinkException("Graph write for visit %s failed: %s".formatted(visit.id(), e.getMessage()), e);
        }
    }

    private void link(VisitSnapshot visit) {
        Summary summary = knowledgeStore.currentSummary(visit.id())
                .orElseThrow(() -> new LinkException("Visit %s has no summary to link".formatted(visit.id())));
        String evidence = evidenceKey(visit.id());

        Map<UUID, ConceptNode> concepts = new LinkedHashMap<>();
        for (String label : summary.getConcepts()) {
            if (concepts.size() == properties.maxConceptsPerVisit()) break;
            ConceptNode node = knowledgeStore.getOrCreateConceptNode(label);
            concepts.putIfAbsent(node.getId(), node);
        }

        int reinforced = 0;
        List<UUID> conceptIds = new ArrayList<>(concepts.keySet());
        for (UUID conceptId : conceptIds) {
            if (knowledgeStore.reinforceEdge(EdgeKind.ABOUT, visit.id(), conceptId, 1.0, evidence)) reinforced++;
        }
        for (int i = 0; i < conceptIds.size(); i++) {
            for (int j = i + 1; j < conceptIds.size(); j++) {
                if (knowledgeStore.reinforceEdge(EdgeKind.RELATED_TO, conceptIds.get(i), conceptIds.get(j), 1.0, evidence)) {
                    reinforced++;
                }
            }
        }

        int similar = linkSimilarPages(visit, conceptIds, evidence);
        log.info("Linked visit {} to {} concepts ({} edges reinforced, {} similar pages)",
                visit.id(), conceptIds.size(), reinforced, similar);
    }

    private int linkSimilarPages(VisitSnapshot visit, List<UUID> conceptIds, String evidence) {
        Optional<Embedding> own = knowledgeStore.currentEmbedding(visit.id());
        if (own.isEmpty()) return 0;
        float[] vector = own.get().getVector();
        int linked = 0;
        for (Embedding candidate : knowledgeStore.linkCandidates(visit, conceptIds, own.get().getModelVersion())) {
            if (candidate.getDimensions() != vector.length) continue;
            double similarity = VectorMath.cosine(vector, candidate.getVector());
            if (similarity >= properties.similarityThreshold()
                    && knowledgeStore.reinforceEdge(EdgeKind.SIMILAR_TO, visit.id(), candidate.getVisitId(), similarity, evidence)) {
                linked++;
            }
        }
        return linked;
    }

    static String evidenceKey(UUID visitId) {
        return "visit:" + visitId;
    }
}
