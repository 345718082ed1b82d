package dev.pagegraph.pipeline.stage;

import dev.pagegraph.domain.enums.PipelineStage;
import dev.pagegraph.domain.valueobject.VisitSnapshot;

/**
 * One step of the visit pipeline.
 *
 * <p>Contract: {@link #execute} is idempotent for a Visit revision (running it again
 * supersedes or deduplicates, never duplicates) and reports failure by throwing a
 * {@link dev.pagegraph.exception.StageException}. It reads the previous stage's output from
 * the knowledge store, never from memory, so it can run on a different node after a restart.
 */
public interface StageHandler {

    PipelineStage stage();

    void execute(VisitSnapshot visit);
}
