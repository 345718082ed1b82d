package dev.pagegraph.exception;

import dev.pagegraph.domain.enums.PipelineStage;

/** Content retrieval failed for one Visit. */
public class FetchException extends StageException {
    public FetchException(String message) {
        super(PipelineStage.FETCH, message);
    }

    public FetchException(String message, Throwable cause) {
        super(PipelineStage.FETCH, message, cause);
    }
}
