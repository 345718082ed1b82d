package dev.pagegraph.exception;

import dev.pagegraph.domain.enums.PipelineStage;

/** Embedding generation failed for one Visit. */
public class EmbedException extends StageException {
    public EmbedException(String message) {
        super(PipelineStage.EMBED, message);
    }

    public EmbedException(String message, Throwable cause) {
        super(PipelineStage.EMBED, message, cause);
    }
}
