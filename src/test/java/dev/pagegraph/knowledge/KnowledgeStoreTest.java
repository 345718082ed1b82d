package dev.pagegraph.knowledge;

import dev.pagegraph.capability.FetchedContent;
import dev.pagegraph.capability.SummaryResult;
import dev.pagegraph.domain.entity.ConceptNode;
import dev.pagegraph.domain.entity.Document;
import dev.pagegraph.domain.entity.GraphEdge;
import dev.pagegraph.domain.entity.Summary;
import dev.pagegraph.domain.enums.EdgeKind;
import dev.pagegraph.domain.enums.EmbeddingSource;
import dev.pagegraph.repository.ConceptNodeRepository;
import dev.pagegraph.repository.DocumentRepository;
import dev.pagegraph.repository.EdgeEvidenceRepository;
import dev.pagegraph.repository.GraphEdgeRepository;
import dev.pagegraph.service.IngestionService;
import dev.pagegraph.support.DatabaseTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KnowledgeStoreTest extends DatabaseTestSupport {

    @Autowired
    private KnowledgeStore store;

    @Autowired
    private IngestionService ingestionService;

    @Autowired
    private DocumentRepository documentRepository;

    @Autowired
    private ConceptNodeRepository conceptRepository;

    @Autowired
    private GraphEdgeRepository edgeRepository;

    @Autowired
    private EdgeEvidenceRepository evidenceRepository;

    private UUID newVisit(String url) {
        return ingestionService.ingest(visit(url)).visitId();
    }

    private GraphEdge onlyEdge(EdgeKind kind) {
        List<GraphEdge> edges = edgeRepository.findAll().stream().filter(e -> e.getKind() == kind).toList();
        assertThat(edges).hasSize(1);
        return edges.get(0);
    }

    @Nested
    @DisplayName("per-revision artifacts")
    class Artifacts {

        @Test
        @DisplayName("re-storing a document supersedes the previous one")
        void documentUpsert() {
            UUID visitId = newVisit("https://example.com/a");

            store.upsertDocument(visitId, new FetchedContent("first text", "plain-text"));
            Document second = store.upsertDocument(visitId, new FetchedContent("second text", "plain-text"));

            assertThat(documentRepository.findByVisitIdOrderByFetchedAtAsc(visitId)).hasSize(2);
            assertThat(store.currentDocument(visitId)).get().extracting(Document::getId).isEqualTo(second.getId());
            assertThat(second.getContentHash()).hasSize(64);
        }

        @Test
        @DisplayName("oversized documents are truncated and flagged")
        void truncation() {
            UUID visitId = newVisit("https://example.com/long");

            Document document = store.upsertDocument(visitId, new FetchedContent("x".repeat(100_050), "plain-text"));

            assertThat(document.getText()).hasSize(100_000);
            assertThat(document.isTruncated()).isTrue();
        }

        @Test
        @DisplayName("summary concepts are de-duplicated by normalized label")
        void summaryConcepts() {
            UUID visitId = newVisit("https://example.com/a");
            Document document = store.upsertDocument(visitId, new FetchedContent("text", "plain-text"));

            store.upsertSummary(visitId, document.getId(),
                    new SummaryResult("A page.", List.of("Neural Networks", "neural networks", "", "Attention")));

            Summary summary = store.currentSummary(visitId).orElseThrow();
            assertThat(summary.getConcepts()).containsExactlyInAnyOrder("Neural Networks", "Attention");
        }

        @Test
        void embeddingUpsert() {
            UUID visitId = newVisit("https://example.com/a");

            store.upsertEmbedding(visitId, "hashing-v1", new float[]{1f, 0f}, EmbeddingSource.DOCUMENT);
            store.upsertEmbedding(visitId, "hashing-v1", new float[]{0.6f, 0.8f}, EmbeddingSource.SUMMARY);

            assertThat(store.currentEmbedding(visitId)).get().satisfies(e -> {
                assertThat(e.getVector()).containsExactly(0.6f, 0.8f);
                assertThat(e.getSource()).isEqualTo(EmbeddingSource.SUMMARY);
                assertThat(e.getDimensions()).isEqualTo(2);
            });
        }
    }

    @Nested
    @DisplayName("concept nodes")
    class Concepts {

        @Test
        @DisplayName("labels with the same normalized form share one node")
        void sharedNode() {
            ConceptNode a = store.getOrCreateConceptNode("Neural Networks");
            ConceptNode b = store.getOrCreateConceptNode("  neural   networks. ");

            assertThat(b.getId()).isEqualTo(a.getId());
            assertThat(a.getLabel()).isEqualTo("Neural Networks");
            assertThat(conceptRepository.count()).isEqualTo(1);
        }

        @Test
        void blankLabelRejected() {
            assertThatThrownBy(() -> store.getOrCreateConceptNode(" ... "))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("concurrent creation of one label yields one node")
        void concurrentCreation() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<UUID>> ids = new ArrayList<>();
            try {
                for (int i = 0; i < 8; i++) {
                    Callable<UUID> task = () -> {
                        start.await();
                        return store.getOrCreateConceptNode("Distributed Systems").getId();
                    };
                    ids.add(pool.submit(task));
                }
                start.countDown();
                UUID first = ids.get(0).get();
                for (Future<UUID> id : ids) {
                    assertThat(id.get()).isEqualTo(first);
                }
                assertThat(conceptRepository.count()).isEqualTo(1);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("edge reinforcement")
    class Edges {

        @Test
        @DisplayName("the same evidence reinforces an edge only once")
        void idempotentPerEvidence() {
            UUID a = store.getOrCreateConceptNode("Neural Networks").getId();
            UUID b = store.getOrCreateConceptNode("Backpropagation").getId();

            assertThat(store.reinforceEdge(EdgeKind.RELATED_TO, a, b, 1.0, "visit:1")).isTrue();
            assertThat(store.reinforceEdge(EdgeKind.RELATED_TO, a, b, 1.0, "visit:1")).isFalse();

            GraphEdge edge = onlyEdge(EdgeKind.RELATED_TO);
            assertThat(edge.getWeight()).isEqualTo(1.0);
            assertThat(edge.getEvidenceCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("symmetric edges are stored once whatever the argument order")
        void symmetricCanonicalOrder() {
            UUID a = store.getOrCreateConceptNode("Neural Networks").getId();
            UUID b = store.getOrCreateConceptNode("Backpropagation").getId();

            store.reinforceEdge(EdgeKind.RELATED_TO, a, b, 1.0, "visit:1");
            store.reinforceEdge(EdgeKind.RELATED_TO, b, a, 1.0, "visit:2");

            GraphEdge edge = onlyEdge(EdgeKind.RELATED_TO);
            assertThat(edge.getWeight()).isEqualTo(2.0);
            assertThat(edge.getSourceId().compareTo(edge.getTargetId())).isNegative();
            assertThat(evidenceRepository.countByEdgeId(edge.getId())).isEqualTo(2);
        }

        @Test
        @DisplayName("ABOUT runs from a visit to a concept and keeps its direction")
        void aboutIsDirected() {
            UUID visitId = newVisit("https://example.com/a");
            UUID concept = store.getOrCreateConceptNode("Attention").getId();

            store.reinforceEdge(EdgeKind.ABOUT, visitId, concept, 1.0, "visit:" + visitId);

            GraphEdge edge = onlyEdge(EdgeKind.ABOUT);
            assertThat(edge.getSourceId()).isEqualTo(visitId);
            assertThat(edge.getTargetId()).isEqualTo(concept);
            assertThatThrownBy(() -> store.reinforceEdge(EdgeKind.ABOUT, concept, visitId, 1.0, "visit:x"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void rejectsInvalidEdges() {
            UUID a = store.getOrCreateConceptNode("Attention").getId();

            assertThatThrownBy(() -> store.reinforceEdge(EdgeKind.RELATED_TO, a, a, 1.0, "e"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> store.reinforceEdge(EdgeKind.RELATED_TO, a, UUID.randomUUID(), 0.0, "e"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> store.reinforceEdge(EdgeKind.RELATED_TO, a, UUID.randomUUID(), 1.0, "e"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(edgeRepository.count()).isZero();
        }

        @Test
        @DisplayName("concurrent reinforcements with distinct evidence all add up")
        void concurrentReinforcement() throws Exception {
            UUID a = store.getOrCreateConceptNode("Neural Networks").getId();
            UUID b = store.getOrCreateConceptNode("Deep Learning").getId();
            int writers = 8;
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            try {
                for (int i = 0; i < writers; i++) {
                    String evidence = "visit:" + i;
                    boolean flip = i % 2 == 0;
                    Callable<Boolean> task = () -> {
                        start.await();
                        return flip
                                ? store.reinforceEdge(EdgeKind.RELATED_TO, a, b, 1.0, evidence)
                                : store.reinforceEdge(EdgeKind.RELATED_TO, b, a, 1.0, evidence);
                    };
                    results.add(pool.submit(task));
                }
                start.countDown();
                for (Future<Boolean> result : results) {
                    assertThat(result.get()).isTrue();
                }
            } finally {
                pool.shutdownNow();
            }

            GraphEdge edge = onlyEdge(EdgeKind.RELATED_TO);
            assertThat(edge.getWeight()).isEqualTo(8.0);
            assertThat(edge.getEvidenceCount()).isEqualTo(8);
        }
    }
}
