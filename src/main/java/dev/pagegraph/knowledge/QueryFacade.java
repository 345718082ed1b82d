package dev.pagegraph.knowledge;

import dev.pagegraph.config.KnowledgeProperties;
import dev.pagegraph.domain.entity.ConceptNode;
import dev.pagegraph.domain.entity.Embedding;
import dev.pagegraph.domain.entity.GraphEdge;
import dev.pagegraph.domain.entity.Visit;
import dev.pagegraph.domain.enums.EdgeKind;
import dev.pagegraph.exception.NodeNotFoundException;
import dev.pagegraph.exception.VisitNotFoundException;
import dev.pagegraph.repository.ConceptNodeRepository;
import dev.pagegraph.repository.EmbeddingRepository;
import dev.pagegraph.repository.GraphEdgeRepository;
import dev.pagegraph.repository.VisitRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only access for the agent collaborator: nearest-neighbor search over embeddings and
 * traversal of the concept graph. Only served Visits (latest completed revision of a page)
 * are ever returned.
 */
@Service
@Transactional(readOnly = true)
public class QueryFacade {

    private final EmbeddingRepository embeddingRepository;
    private final VisitRepository visitRepository;
    private final ConceptNodeRepository conceptRepository;
    private final GraphEdgeRepository edgeRepository;
    private final KnowledgeProperties properties;

    public QueryFacade(EmbeddingRepository embeddingRepository,
                       VisitRepository visitRepository,
                       ConceptNodeRepository conceptRepository,
                       GraphEdgeRepository edgeRepository,
                       KnowledgeProperties properties) {
        this.embeddingRepository = embeddingRepository;
        this.visitRepository = visitRepository;
        this.conceptRepository = conceptRepository;
        this.edgeRepository = edgeRepository;
        this.properties = properties;
    }

    /**
     * Top {@code k} served Visits by cosine similarity to {@code vector}, best first. Only
     * embeddings of {@code modelVersion} (the configured default when null) and of the
     * same dimension are compared.
     */
    public List<SimilarityHit> similaritySearch(float[] vector, int k, String modelVersion) {
        return search(vector, k, modelVersion, null);
    }

    /** Pages most similar to a stored page, excluding every revision of that page. */
    public List<SimilarityHit> similarTo(UUID visitId, int k) {
        Visit visit = visitRepository.findById(visitId).orElseThrow(() -> new VisitNotFoundException(visitId));
        Embedding embedding = embeddingRepository.findByVisitIdAndCurrentTrue(visitId)
                .orElseThrow(() -> new IllegalStateException("Visit %s has no embedding yet".formatted(visitId)));
        return search(embedding.getVector(), k, embedding.getModelVersion(), visit.getFingerprint());
    }

    private List<SimilarityHit> search(float[] vector, int k, String modelVersion, String excludedFingerprint) {
        if (vector == null || vector.length == 0) throw new IllegalArgumentException("Query vector is empty");
        if (k < 1) throw new IllegalArgumentException("k must be at least 1");
        String version = modelVersion == null || modelVersion.isBlank()
                ? properties.embeddingModelVersion()
                : modelVersion;

        List<Embedding> comparable = embeddingRepository.findServedByModelVersion(version).stream()
                .filter(e -> e.getDimensions() == vector.length)
                .toList();
        if (comparable.isEmpty()) return List.of();

        Map<UUID, Visit> visits = visitRepository.findAllById(comparable.stream().map(Embedding::getVisitId).toList())
                .stream()
                .collect(Collectors.toMap(Visit::getId, Function.identity()));

        return comparable.stream()
                .filter(e -> excludedFingerprint == null
                        || !excludedFingerprint.equals(visits.get(e.getVisitId()).getFingerprint()))
                .map(e -> new SimilarityHit(e.getVisitId(), visits.get(e.getVisitId()).getNormalizedUrl(),
                        VectorMath.cosine(vector, e.getVector())))
                .sorted(Comparator.comparingDouble(SimilarityHit::score).reversed())
                .limit(k)
                .toList();
    }

    /**
     * Breadth-first walk from {@code nodeId} over every edge kind in both directions, up to
     * {@code depth} hops (capped by configuration) and {@code traversal-max-nodes} nodes.
     * Visits that are not served are neither returned nor walked through.
     *
     * @throws NodeNotFoundException if the start is neither a ConceptNode nor a served Visit
     */
    public GraphView traverse(UUID nodeId, int depth) {
        if (depth < 0) throw new IllegalArgumentException("depth must not be negative");
        int maxDepth = Math.min(depth, properties.traversalMaxDepth());
        int maxNodes = properties.traversalMaxNodes();

        GraphView.Node root = resolve(Set.of(nodeId), 0).get(nodeId);
        if (root == null) {
            throw new NodeNotFoundException(nodeId);
        }

        Map<UUID, GraphView.Node> nodes = new LinkedHashMap<>();
        Map<UUID, GraphView.Edge> edges = new LinkedHashMap<>();
        nodes.put(nodeId, root);
        Deque<UUID> frontier = new ArrayDeque<>(List.of(nodeId));
        boolean truncated = false;

        for (int hop = 1; hop <= maxDepth && !frontier.isEmpty() && !truncated; hop++) {
            Map<UUID, List<GraphEdge>> pending = new LinkedHashMap<>();
            for (UUID current : frontier) {
                for (GraphEdge edge : edgeRepository.findTouching(current)) {
                    UUID other = edge.otherEnd(current);
                    pending.computeIfAbsent(other, id -> new ArrayList<>()).add(edge);
                }
            }
            Map<UUID, GraphView.Node> resolved = resolve(pending.keySet(), hop);
            Deque<UUID> next = new ArrayDeque<>();
            for (Map.Entry<UUID, List<GraphEdge>> entry : pending.entrySet()) {
                UUID other = entry.getKey();
                if (!nodes.containsKey(other)) {
                    GraphView.Node node = resolved.get(other);
                    if (node == null) continue;
                    if (nodes.size() >= maxNodes) {
                        truncated = true;
                        break;
                    }
                    nodes.put(other, node);
                    next.add(other);
                }
                for (GraphEdge edge : entry.getValue()) {
                    edges.putIfAbsent(edge.getId(), toView(edge));
                }
            }
            frontier = next;
        }

        return new GraphView(nodeId, maxDepth, List.copyOf(nodes.values()), List.copyOf(edges.values()), truncated);
    }

    /**
     * A concept by label (normalized before lookup) and the served pages about it.
     *
     * @throws NodeNotFoundException if no concept has this label
     */
    public ConceptView findConcept(String label) {
        String normalized = ConceptLabels.normalize(label);
        ConceptNode concept = conceptRepository.findByNormalizedLabel(normalized)
                .orElseThrow(() -> new NodeNotFoundException("No concept labelled '" + label + "'"));

        List<GraphEdge> about = edgeRepository.findByKindAndTargetId(EdgeKind.ABOUT, concept.getId());
        Map<UUID, Double> weights = new HashMap<>();
        about.forEach(e -> weights.merge(e.getSourceId(), e.getWeight(), Double::sum));

        List<ConceptView.Page> pages = weights.isEmpty() ? List.of() :
                visitRepository.findServedByIds(weights.keySet()).stream()
                        .map(v -> new ConceptView.Page(v.getId(), v.getNormalizedUrl(), weights.get(v.getId())))
                        .sorted(Comparator.comparingDouble(ConceptView.Page::weight).reversed())
                        .toList();
        return new ConceptView(concept.getId(), concept.getLabel(), concept.getNormalizedLabel(), pages);
    }

    /** Looks ids up as concepts first, then as served Visits; unknown or unserved ids are absent. */
    private Map<UUID, GraphView.Node> resolve(Set<UUID> ids, int hops) {
        Map<UUID, GraphView.Node> result = new HashMap<>();
        if (ids.isEmpty()) return result;
        for (ConceptNode c : conceptRepository.findAllById(ids)) {
            result.put(c.getId(), new GraphView.Node(c.getId(), GraphView.NodeType.CONCEPT, c.getLabel(), hops));
        }
        List<UUID> rest = ids.stream().filter(id -> !result.containsKey(id)).toList();
        if (!rest.isEmpty()) {
            for (Visit v : visitRepository.findServedByIds(rest)) {
                result.put(v.getId(), new GraphView.Node(v.getId(), GraphView.NodeType.VISIT, v.getNormalizedUrl(), hops));
            }
        }
        return result;
    }

    private static GraphView.Edge toView(GraphEdge e) {
        return new GraphView.Edge(e.getId(), e.getKind(), e.getSourceId(), e.getTargetId(),
                e.getWeight(), e.getEvidenceCount());
    }
}
