package dev.pagegraph.exception;

import dev.pagegraph.domain.enums.PipelineStage;

/** Summarization failed for one Visit. */
public class SummarizeException extends StageException {
    public SummarizeException(String message) {
        super(PipelineStage.SUMMARIZE, message);
    }

    public SummarizeException(String message, Throwable cause) {
        super(PipelineStage.SUMMARIZE, message, cause);
    }
}
