package dev.pagegraph.knowledge;

import dev.pagegraph.capability.FetchedContent;
import dev.pagegraph.capability.SummaryResult;
import dev.pagegraph.config.KnowledgeProperties;
import dev.pagegraph.domain.entity.ConceptNode;
import dev.pagegraph.domain.entity.Document;
import dev.pagegraph.domain.entity.EdgeEvidence;
import dev.pagegraph.domain.entity.Embedding;
import dev.pagegraph.domain.entity.GraphEdge;
import dev.pagegraph.domain.entity.Summary;
import dev.pagegraph.domain.entity.Visit;
import dev.pagegraph.domain.enums.EdgeKind;
import dev.pagegraph.domain.enums.EmbeddingSource;
import dev.pagegraph.domain.valueobject.Fingerprint;
import dev.pagegraph.domain.valueobject.VisitSnapshot;
import dev.pagegraph.repository.ConceptNodeRepository;
import dev.pagegraph.repository.DocumentRepository;
import dev.pagegraph.repository.EdgeEvidenceRepository;
import dev.pagegraph.repository.EmbeddingRepository;
import dev.pagegraph.repository.GraphEdgeRepository;
import dev.pagegraph.repository.SummaryRepository;
import dev.pagegraph.repository.VisitRepository;
import dev.pagegraph.support.KeyedLocks;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Documents, summaries, embeddings and the concept graph.
 *
 * <p>Per-revision artifacts are upserted by superseding the current row, so re-running a
 * stage never leaves two current artifacts. Graph writes are the only writes several
 * workers make to the same keys; each concept label and each edge is serialized by a
 * striped lock within this node, and by unique constraints plus the
 * {@code knowledge-write} Retry across nodes. Edge weight only ever grows, once per
 * distinct evidence key.
 */
@Service
public class KnowledgeStore {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeStore.class);

    private final DocumentRepository documentRepository;
    private final SummaryRepository summaryRepository;
    private final EmbeddingRepository embeddingRepository;
    private final ConceptNodeRepository conceptRepository;
    private final GraphEdgeRepository edgeRepository;
    private final EdgeEvidenceRepository evidenceRepository;
    private final VisitRepository visitRepository;
    private final TransactionTemplate transactionTemplate;
    private final KnowledgeProperties properties;
    private final Clock clock;
    private final Retry retry;
    private final KeyedLocks conceptLocks = new KeyedLocks(64);
    private final KeyedLocks edgeLocks = new KeyedLocks(256);

    public KnowledgeStore(DocumentRepository documentRepository,
                          SummaryRepository summaryRepository,
                          EmbeddingRepository embeddingRepository,
                          ConceptNodeRepository conceptRepository,
                          GraphEdgeRepository edgeRepository,
                          EdgeEvidenceRepository evidenceRepository,
                          VisitRepository visitRepository,
                          TransactionTemplate transactionTemplate,
                          KnowledgeProperties properties,
                          Clock clock,
                          RetryRegistry retryRegistry) {
        this.documentRepository = documentRepository;
        this.summaryRepository = summaryRepository;
        this.embeddingRepository = embeddingRepository;
        this.conceptRepository = conceptRepository;
        this.edgeRepository = edgeRepository;
        this.evidenceRepository = evidenceRepository;
        this.visitRepository = visitRepository;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
        this.retry = retryRegistry.retry("knowledge-write");
    }

    // ── Per-revision artifacts ─────────────────────────────────────

    @Transactional
    public Document upsertDocument(UUID visitId, FetchedContent content) {
        String text = content.text();
        boolean truncated = text.length() > properties.maxDocumentChars();
        if (truncated) {
            text = text.substring(0, properties.maxDocumentChars());
        }
        int superseded = documentRepository.supersedeCurrent(visitId);
        Document document = documentRepository.save(Document.create(visitId, text, content.extractionMethod(),
                Fingerprint.contentHash(text), truncated, clock.instant()));
        log.debug("Stored document {} for visit {} ({} chars, superseded {})",
                document.getId(), visitId, text.length(), superseded);
        return document;
    }

    @Transactional
    public Summary upsertSummary(UUID visitId, UUID documentId, SummaryResult result) {
        List<String> concepts = ConceptLabels.distinct(result.concepts());
        summaryRepository.supersedeCurrent(visitId);
        Summary summary = summaryRepository.save(
                Summary.create(visitId, documentId, result.summary(), concepts, clock.instant()));
        log.debug("Stored summary {} for visit {} with concepts {}", summary.getId(), visitId, concepts);
        return summary;
    }

    @Transactional
    public Embedding upsertEmbedding(UUID visitId, String modelVersion, float[] vector, EmbeddingSource source) {
        embeddingRepository.supersedeCurrent(visitId);
        Embedding embedding = embeddingRepository.save(
                Embedding.create(visitId, modelVersion, vector, source, clock.instant()));
        log.debug("Stored {}-dim {} embedding for visit {} from {}",
                vector.length, modelVersion, visitId, source);
        return embedding;
    }

    @Transactional(readOnly = true)
    public Optional<Document> currentDocument(UUID visitId) {
        return documentRepository.findByVisitIdAndCurrentTrue(visitId);
    }

    @Transactional(readOnly = true)
    public Optional<Summary> currentSummary(UUID visitId) {
        return summaryRepository.findByVisitIdAndCurrentTrue(visitId);
    }

    @Transactional(readOnly = true)
    public Optional<Embedding> currentEmbedding(UUID visitId) {
        return embeddingRepository.findByVisitIdAndCurrentTrue(visitId);
    }

    // ── Concept graph ──────────────────────────────────────────────

    /**
     * Returns the node for this label's normalized form, creating it on first sight.
     *
     * @throws IllegalArgumentException if the label normalizes to nothing
     */
    public ConceptNode getOrCreateConceptNode(String label) {
        String normalized = ConceptLabels.normalize(label);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Concept label is blank: '" + label + "'");
        }
        return conceptLocks.withLock(normalized, () -> retry.executeSupplier(() ->
                transactionTemplate.execute(tx -> conceptRepository.findByNormalizedLabel(normalized)
                        .orElseGet(() -> {
                            ConceptNode created = conceptRepository.saveAndFlush(
                                    ConceptNode.create(normalized, ConceptLabels.display(label), clock.instant()));
                            log.debug("Created concept node '{}' ({})", normalized, created.getId());
                            return created;
                        }))));
    }

    /**
     * Adds {@code weight} to the edge between {@code a} and {@code b}, once per evidence key.
     * Symmetric kinds are stored with endpoints in canonical order, so (a, b) and (b, a)
     * reinforce the same edge.
     *
     * @return true if the weight changed; false if this evidence was already recorded
     * @throws IllegalArgumentException for a self edge, a non-positive weight, or an endpoint
     *                                  that does not exist with the type the kind requires
     */
    public boolean reinforceEdge(EdgeKind kind, UUID a, UUID b, double weight, String evidenceKey) {
        if (a.equals(b)) throw new IllegalArgumentException("Self edges are not allowed: " + a);
        if (!(weight > 0)) throw new IllegalArgumentException("Edge weight must be positive: " + weight);
        if (evidenceKey == null || evidenceKey.isBlank()) throw new IllegalArgumentException("Evidence key required");

        UUID source = a;
        UUID target = b;
        if (kind.isSymmetric() && a.compareTo(b) > 0) {
            source = b;
            target = a;
        }
        UUID s = source;
        UUID t = target;
        String lockKey = kind + ":" + s + ":" + t;
        Boolean changed = edgeLocks.withLock(lockKey, () -> retry.executeSupplier(() ->
                transactionTemplate.execute(tx -> reinforceInTransaction(kind, s, t, weight, evidenceKey))));
        return Boolean.TRUE.equals(changed);
    }

    private boolean reinforceInTransaction(EdgeKind kind, UUID source, UUID target, double weight, String evidenceKey) {
        Instant now = clock.instant();
        GraphEdge edge = edgeRepository.findByKindAndSourceIdAndTargetId(kind, source, target).orElse(null);
        if (edge == null) {
            requireEndpoints(kind, source, target);
            edge = edgeRepository.saveAndFlush(GraphEdge.create(kind, source, target, now));
        } else if (evidenceRepository.existsByEdgeIdAndEvidenceKey(edge.getId(), evidenceKey)) {
            log.debug("Edge {} already holds evidence {}", edge.getId(), evidenceKey);
            return false;
        }
        evidenceRepository.save(EdgeEvidence.of(edge.getId(), evidenceKey, weight, now));
        edgeRepository.addWeight(edge.getId(), weight, now);
        return true;
    }

    private void requireEndpoints(EdgeKind kind, UUID source, UUID target) {
        boolean valid = switch (kind) {
            case ABOUT -> visitRepository.existsById(source) && conceptRepository.existsById(target);
            case RELATED_TO -> conceptRepository.existsById(source) && conceptRepository.existsById(target);
            case SIMILAR_TO -> visitRepository.existsById(source) && visitRepository.existsById(target);
        };
        if (!valid) {
            throw new IllegalArgumentException("%s edge endpoints do not exist: %s -> %s".formatted(kind, source, target));
        }
    }

    /**
     * Page-to-page link candidates: current embeddings, of the given model version, of
     * served Visits of other pages that are ABOUT at least one of {@code conceptIds};
     * newest first, at most {@code candidate-limit}.
     */
    @Transactional(readOnly = true)
    public List<Embedding> linkCandidates(VisitSnapshot visit, Collection<UUID> conceptIds, String modelVersion) {
        if (conceptIds.isEmpty()) return List.of();
        List<UUID> sharing = edgeRepository.findVisitsAboutAny(conceptIds, visit.id());
        if (sharing.isEmpty()) return List.of();
        List<UUID> served = visitRepository.findServedAmong(sharing, visit.fingerprint(),
                        PageRequest.of(0, properties.candidateLimit())).stream()
                .map(Visit::getId)
                .toList();
        if (served.isEmpty()) return List.of();
        return embeddingRepository.findByVisitIdInAndCurrentTrueAndModelVersion(served, modelVersion);
    }
}
