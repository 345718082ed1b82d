package dev.pagegraph.exception;

import dev.pagegraph.domain.enums.PipelineStage;

/** Graph linking failed for one Visit. */
public class LinkException extends StageException {
    public LinkException(String message) {
        super(PipelineStage.LINK, message);
    }

    public LinkException(String message, Throwable cause) {
        super(PipelineStage.LINK, message, cause);
    }
}
