package dev.pagegraph.knowledge;

import dev.pagegraph.capability.ContentAdapter;
import dev.pagegraph.capability.EmbeddingAdapter;
import dev.pagegraph.capability.FetchedContent;
import dev.pagegraph.capability.SummarizationAdapter;
import dev.pagegraph.capability.SummaryResult;
import dev.pagegraph.exception.NodeNotFoundException;
import dev.pagegraph.exception.VisitNotFoundException;
import dev.pagegraph.repository.ConceptNodeRepository;
import dev.pagegraph.service.IngestionService;
import dev.pagegraph.support.DatabaseTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.OngoingStubbing;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

class QueryFacadeTest extends DatabaseTestSupport {

    private static final float[] X = {1f, 0f, 0f};
    private static final float[] MOSTLY_X = {0.8f, 0.6f, 0f};
    private static final float[] Y = {0f, 1f, 0f};

    @MockitoBean
    private ContentAdapter contentAdapter;

    @MockitoBean
    private SummarizationAdapter summarizer;

    @MockitoBean
    private EmbeddingAdapter embedder;

    @Autowired
    private QueryFacade queryFacade;

    @Autowired
    private IngestionService ingestionService;

    @Autowired
    private ConceptNodeRepository conceptRepository;

    @BeforeEach
    void capabilities() {
        when(contentAdapter.fetch(anyString())).thenReturn(new FetchedContent("page text", "plain-text"));
        when(summarizer.summarize(anyString()))
                .thenReturn(new SummaryResult("About networks.", List.of("Neural Networks", "Deep Learning")));
    }

    /** Ingests and fully processes one page per vector, in order; returns the visit ids. */
    private List<UUID> servedPages(float[]... vectors) throws InterruptedException {
        OngoingStubbing<float[]> stub = when(embedder.embed(anyString(), anyString())).thenReturn(vectors[0]);
        for (int i = 1; i < vectors.length; i++) {
            stub = stub.thenReturn(vectors[i]);
        }
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < vectors.length; i++) {
            ids.add(ingestionService.ingest(visit("https://site" + i + ".example.com/page")).visitId());
        }
        runQueuedJobs();
        return ids;
    }

    @Nested
    @DisplayName("similarity search")
    class Similarity {

        @Test
        @DisplayName("ranks served pages by cosine similarity and honors k")
        void ranksByCosine() throws InterruptedException {
            List<UUID> ids = servedPages(Y, X, MOSTLY_X);

            List<SimilarityHit> hits = queryFacade.similaritySearch(new float[]{1f, 0f, 0f}, 2, null);

            assertThat(hits).extracting(SimilarityHit::visitId).containsExactly(ids.get(1), ids.get(2));
            assertThat(hits.get(0).score()).isCloseTo(1.0, within(1e-6));
            assertThat(hits.get(1).score()).isCloseTo(0.8, within(1e-6));
            assertThat(hits.get(0).url()).isEqualTo("https://site1.example.com/page");
        }

        @Test
        @DisplayName("never returns pages that are still in the pipeline")
        void onlyServedPages() throws InterruptedException {
            servedPages(X);
            ingestionService.ingest(visit("https://pending.example.com/"));

            assertThat(queryFacade.similaritySearch(X, 10, "hashing-v1")).hasSize(1);
        }

        @Test
        @DisplayName("returns only the latest completed revision of a page")
        void supersededRevisionHidden() throws InterruptedException {
            UUID first = servedPages(X).get(0);
            clock.advance(Duration.ofDays(8));
            when(embedder.embed(anyString(), anyString())).thenReturn(X);
            UUID second = ingestionService.ingest(visit("https://site0.example.com/page")).visitId();
            runQueuedJobs();

            assertThat(second).isNotEqualTo(first);
            assertThat(queryFacade.similaritySearch(X, 10, null))
                    .extracting(SimilarityHit::visitId)
                    .containsExactly(second);
        }

        @Test
        @DisplayName("does not compare across model versions or dimensions")
        void incomparableVectors() throws InterruptedException {
            servedPages(X);

            assertThat(queryFacade.similaritySearch(X, 5, "other-model")).isEmpty();
            assertThat(queryFacade.similaritySearch(new float[]{1f, 0f}, 5, null)).isEmpty();
        }

        @Test
        void rejectsBadArguments() {
            assertThatThrownBy(() -> queryFacade.similaritySearch(new float[0], 5, null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> queryFacade.similaritySearch(X, 0, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("similarTo excludes the page itself")
        void similarToExcludesSelf() throws InterruptedException {
            List<UUID> ids = servedPages(X, MOSTLY_X);

            assertThat(queryFacade.similarTo(ids.get(0), 5))
                    .extracting(SimilarityHit::visitId)
                    .containsExactly(ids.get(1));
        }

        @Test
        void similarToUnknownVisit() {
            assertThatThrownBy(() -> queryFacade.similarTo(UUID.randomUUID(), 5))
                    .isInstanceOf(VisitNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("graph traversal")
    class Traversal {

        @Test
        @DisplayName("one hop from a concept reaches its pages and related concepts")
        void oneHopFromConcept() throws InterruptedException {
            List<UUID> ids = servedPages(X, Y);
            UUID nn = conceptRepository.findByNormalizedLabel("neural networks").orElseThrow().getId();
            UUID dl = conceptRepository.findByNormalizedLabel("deep learning").orElseThrow().getId();

            GraphView view = queryFacade.traverse(nn, 1);

            assertThat(view.rootId()).isEqualTo(nn);
            assertThat(view.truncated()).isFalse();
            assertThat(view.nodes()).extracting(GraphView.Node::id)
                    .containsExactlyInAnyOrder(nn, dl, ids.get(0), ids.get(1));
            assertThat(view.nodes()).filteredOn(n -> n.id().equals(dl))
                    .singleElement()
                    .satisfies(n -> {
                        assertThat(n.type()).isEqualTo(GraphView.NodeType.CONCEPT);
                        assertThat(n.hops()).isEqualTo(1);
                    });
            assertThat(view.edges()).hasSize(3);
        }

        @Test
        @DisplayName("pages sharing a concept are two hops apart")
        void twoHopsBetweenPages() throws InterruptedException {
            List<UUID> ids = servedPages(X, Y);

            GraphView oneHop = queryFacade.traverse(ids.get(0), 1);
            GraphView twoHops = queryFacade.traverse(ids.get(0), 2);

            assertThat(oneHop.nodes()).extracting(GraphView.Node::id).doesNotContain(ids.get(1));
            assertThat(twoHops.nodes()).filteredOn(n -> n.id().equals(ids.get(1)))
                    .singleElement()
                    .satisfies(n -> {
                        assertThat(n.type()).isEqualTo(GraphView.NodeType.VISIT);
                        assertThat(n.hops()).isEqualTo(2);
                    });
        }

        @Test
        void depthZeroIsJustTheRoot() throws InterruptedException {
            UUID page = servedPages(X).get(0);

            GraphView view = queryFacade.traverse(page, 0);

            assertThat(view.nodes()).singleElement().extracting(GraphView.Node::id).isEqualTo(page);
            assertThat(view.edges()).isEmpty();
        }

        @Test
        @DisplayName("unknown and unserved start nodes are not found")
        void unknownStart() {
            UUID pending = ingestionService.ingest(visit("https://pending.example.com/")).visitId();

            assertThatThrownBy(() -> queryFacade.traverse(UUID.randomUUID(), 2))
                    .isInstanceOf(NodeNotFoundException.class);
            assertThatThrownBy(() -> queryFacade.traverse(pending, 2))
                    .isInstanceOf(NodeNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("concept lookup")
    class ConceptLookup {

        @Test
        @DisplayName("finds a concept by any spelling of its label with the pages about it")
        void findsByNormalizedLabel() throws InterruptedException {
            List<UUID> ids = servedPages(X, Y);

            ConceptView concept = queryFacade.findConcept("  NEURAL   networks ");

            assertThat(concept.label()).isEqualTo("Neural Networks");
            assertThat(concept.normalizedLabel()).isEqualTo("neural networks");
            assertThat(concept.pages()).extracting(ConceptView.Page::visitId)
                    .containsExactlyInAnyOrderElementsOf(ids);
            assertThat(concept.pages()).extracting(ConceptView.Page::weight).containsOnly(1.0);
        }

        @Test
        void unknownConcept() {
            assertThatThrownBy(() -> queryFacade.findConcept("quantum gravity"))
                    .isInstanceOf(NodeNotFoundException.class);
        }
    }
}
