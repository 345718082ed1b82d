package dev.pagegraph.pipeline.stage;

import dev.pagegraph.capability.ContentAdapter;
import dev.pagegraph.capability.FetchedContent;
import dev.pagegraph.domain.enums.PipelineStage;
import dev.pagegraph.domain.valueobject.VisitSnapshot;
import dev.pagegraph.knowledge.KnowledgeStore;
import dev.pagegraph.pipeline.CapabilityInvoker;
import org.springframework.stereotype.Component;

/** Fetches the page and stores it as the revision's current Document. */
@Component
public class FetchStage implements StageHandler {

    private final ContentAdapter contentAdapter;
    private final CapabilityInvoker invoker;
    private final KnowledgeStore knowledgeStore;

    public FetchStage(ContentAdapter contentAdapter, CapabilityInvoker invoker, KnowledgeStore knowledgeStore) {
        this.contentAdapter = contentAdapter;
        this.invoker = invoker;
        this.knowledgeStore = knowledgeStore;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.FETCH;
    }

    @Override
    public void execute(VisitSnapshot visit) {
        FetchedContent content = invoker.invoke(PipelineStage.FETCH, () -> contentAdapter.fetch(visit.url()));
        knowledgeStore.upsertDocument(visit.id(), content);
    }
}
