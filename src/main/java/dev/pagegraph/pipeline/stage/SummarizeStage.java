package dev.pagegraph.pipeline.stage;

import dev.pagegraph.capability.SummarizationAdapter;
import dev.pagegraph.capability.SummaryResult;
import dev.pagegraph.domain.entity.Document;
import dev.pagegraph.domain.enums.PipelineStage;
import dev.pagegraph.domain.valueobject.VisitSnapshot;
import dev.pagegraph.exception.SummarizeException;
import dev.pagegraph.knowledge.KnowledgeStore;
import dev.pagegraph.pipeline.CapabilityInvoker;
import org.springframework.stereotype.Component;

/** Summarizes the current Document. A failure here keeps the Document; the retry starts here. */
@Component
public class SummarizeStage implements StageHandler {

    private final SummarizationAdapter summarizer;
    private final CapabilityInvoker invoker;
    private final KnowledgeStore knowledgeStore;

    public SummarizeStage(SummarizationAdapter summarizer, CapabilityInvoker invoker, KnowledgeStore knowledgeStore) {
        this.summarizer = summarizer;
        this.invoker = invoker;
        this.knowledgeStore = knowledgeStore;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.SUMMARIZE;
    }

    @Override
    public void execute(VisitSnapshot visit) {
        Document document = knowledgeStore.currentDocument(visit.id())
                .orElseThrow(() -> new SummarizeException("Visit %s has no document to summarize".formatted(visit.id())));
        SummaryResult result = invoker.invoke(PipelineStage.SUMMARIZE, () -> summarizer.summarize(document.getText()));
        knowledgeStore.upsertSummary(visit.id(), document.getId(), result);
    }
}
