package dev.pagegraph.pipeline.stage;

import dev.pagegraph.capability.EmbeddingAdapter;
import dev.pagegraph.config.KnowledgeProperties;
import dev.pagegraph.config.PipelineProperties;
import dev.pagegraph.domain.entity.Document;
import dev.pagegraph.domain.entity.Summary;
import dev.pagegraph.domain.enums.EmbeddingSource;
import dev.pagegraph.domain.enums.VisitStatus;
import dev.pagegraph.domain.valueobject.VisitSnapshot;
import dev.pagegraph.exception.EmbedException;
import dev.pagegraph.knowledge.KnowledgeStore;
import dev.pagegraph.pipeline.CapabilityInvoker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmbedStageTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");
    private static final float[] VECTOR = {0.1f, 0.2f};

    private final EmbeddingAdapter embedder = mock(EmbeddingAdapter.class);
    private final KnowledgeStore knowledgeStore = mock(KnowledgeStore.class);
    private final KnowledgeProperties knowledgeProperties =
            new KnowledgeProperties(0, 0, 0, 0, "test-model", 0, 0);
    private final VisitSnapshot visit = new VisitSnapshot(UUID.randomUUID(), "fp", "https://example.com/",
            "example.com", 1, VisitStatus.EMBEDDING, null, 1, 0, false, false);

    private ExecutorService executor;
    private EmbedStage stage;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        CapabilityInvoker invoker = new CapabilityInvoker(executor, new PipelineProperties(
                1, 1, null, null, null, null, 0, null, 0, null, null, null, 0, null, false, false));
        stage = new EmbedStage(embedder, invoker, knowledgeStore, knowledgeProperties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("embeds the summary together with its concepts")
    void embedsSummary() {
        Summary summary = Summary.create(visit.id(), UUID.randomUUID(), "Attention explained.",
                List.of("Attention", "Transformers"), NOW);
        when(knowledgeStore.currentSummary(visit.id())).thenReturn(Optional.of(summary));
        when(embedder.embed("Attention explained.\n\nTopics: Attention, Transformers", "test-model"))
                .thenReturn(VECTOR);

        stage.execute(visit);

        verify(knowledgeStore).upsertEmbedding(visit.id(), "test-model", VECTOR, EmbeddingSource.SUMMARY);
    }

    @Test
    @DisplayName("falls back to the document text when there is no summary")
    void fallsBackToDocument() {
        Document document = Document.create(visit.id(), "raw page text", "plain-text", "hash", false, NOW);
        when(knowledgeStore.currentSummary(visit.id())).thenReturn(Optional.empty());
        when(knowledgeStore.currentDocument(visit.id())).thenReturn(Optional.of(document));
        when(embedder.embed("raw page text", "test-model")).thenReturn(VECTOR);

        stage.execute(visit);

        verify(knowledgeStore).upsertEmbedding(visit.id(), "test-model", VECTOR, EmbeddingSource.DOCUMENT);
    }

    @Test
    void nothingToEmbed() {
        when(knowledgeStore.currentSummary(visit.id())).thenReturn(Optional.empty());
        when(knowledgeStore.currentDocument(visit.id())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> stage.execute(visit)).isInstanceOf(EmbedException.class);
        verify(embedder, never()).embed(anyString(), anyString());
        verify(knowledgeStore, never()).upsertEmbedding(any(), any(), any(), any());
    }
}
