package dev.pagegraph.exception;

import dev.pagegraph.domain.enums.PipelineStage;

/**
 * A failure scoped to one stage of one Visit revision. The pipeline records it on the
 * Visit and schedules a retry of the same stage; it never escapes the worker.
 */
public class StageException extends RuntimeException {

    private final PipelineStage stage;

    public StageException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
