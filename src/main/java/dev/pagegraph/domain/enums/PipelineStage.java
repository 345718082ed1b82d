package dev.pagegraph.domain.enums;

/**
 * The four per-visit processing stages, in order. Each stage owns the status a
 * Visit carries while that stage runs.
 */
public enum PipelineStage {
    FETCH(VisitStatus.FETCHING),
    SUMMARIZE(VisitStatus.SUMMARIZING),
    EMBED(VisitStatus.EMBEDDING),
    LINK(VisitStatus.LINKING);

    private final VisitStatus status;

    PipelineStage(VisitStatus status) {
        this.status = status;
    }

    public VisitStatus status() {
        return status;
    }

    /** Status a Visit moves to once this stage succeeds. */
    public VisitStatus successor() {
        return switch (this) {
            case FETCH -> VisitStatus.SUMMARIZING;
            case SUMMARIZE -> VisitStatus.EMBEDDING;
            case EMBED -> VisitStatus.LINKING;
            case LINK -> VisitStatus.DONE;
        };
    }

    public static PipelineStage forStatus(VisitStatus status) {
        for (PipelineStage stage : values()) {
            if (stage.status == status) return stage;
        }
        throw new IllegalArgumentException("No stage runs in status " + status);
    }
}
