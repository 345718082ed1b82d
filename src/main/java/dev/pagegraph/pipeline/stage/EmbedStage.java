package dev.pagegraph.pipeline.stage;

import dev.pagegraph.capability.EmbeddingAdapter;
import dev.pagegraph.config.KnowledgeProperties;
import dev.pagegraph.domain.entity.Document;
import dev.pagegraph.domain.entity.Summary;
import dev.pagegraph.domain.enums.EmbeddingSource;
import dev.pagegraph.domain.enums.PipelineStage;
import dev.pagegraph.domain.valueobject.VisitSnapshot;
import dev.pagegraph.exception.EmbedException;
import dev.pagegraph.knowledge.KnowledgeStore;
import dev.pagegraph.pipeline.CapabilityInvoker;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Embeds the summary and its concepts, or the document text when there is no summary,
 * and stores the vector under the configured model version.
 */
@Component
public class EmbedStage implements StageHandler {

    private final EmbeddingAdapter embedder;
    private final CapabilityInvoker invoker;
    private final KnowledgeStore knowledgeStore;
    private final KnowledgeProperties properties;

    public EmbedStage(EmbeddingAdapter embedder, CapabilityInvoker invoker,
                      KnowledgeStore knowledgeStore, KnowledgeProperties properties) {
        this.embedder = embedder;
        this.invoker = invoker;
        this.knowledgeStore = knowledgeStore;
        this.properties = properties;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.EMBED;
    }

    @Override
    public void execute(VisitSnapshot visit) {
        Optional<Summary> summary = knowledgeStore.currentSummary(visit.id());
        String text;
        EmbeddingSource source;
        if (summary.isPresent()) {
            text = summaryText(summary.get());
            source = EmbeddingSource.SUMMARY;
        } else {
            Document document = knowledgeStore.currentDocument(visit.id())
                    .orElseThrow(() -> new EmbedException("Visit %s has nothing to embed".formatted(visit.id())));
            text = document.getText();
            source = EmbeddingSource.DOCUMENT;
        }
        String modelVersion = properties.embeddingModelVersion();
        float[] vector = invoker.invoke(PipelineStage.EMBED, () -> embedder.embed(text, modelVersion));
        knowledgeStore.upsertEmbedding(visit.id(), modelVersion, vector, source);
    }

    static String summaryText(Summary summary) {
        if (summary.getConcepts().isEmpty()) return summary.getText();
        return summary.getText() + "\n\nTopics: " + String.join(", ", summary.getConcepts());
    }
}
