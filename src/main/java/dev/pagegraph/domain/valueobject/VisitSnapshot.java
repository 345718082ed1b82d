package dev.pagegraph.domain.valueobject;

import dev.pagegraph.domain.entity.Visit;
import dev.pagegraph.domain.enums.PipelineStage;
import dev.pagegraph.domain.enums.VisitStatus;

import java.util.UUID;

/**
 * Immutable copy of a Visit's state, safe to hand to worker and capability threads
 * (the managed entity never leaves its transaction).
 */
public record VisitSnapshot(UUID id, String fingerprint, String url, String host, int revision,
                            VisitStatus status, PipelineStage failedStage, int attemptCount,
                            int stageAttempts, boolean cancelRequested, boolean terminal) {

    public static VisitSnapshot from(Visit v) {
        return new VisitSnapshot(v.getId(), v.getFingerprint(), v.getNormalizedUrl(), v.getHost(),
                v.getRevision(), v.getStatus(), v.getFailedStage(), v.getAttemptCount(),
                v.getStageAttempts(), v.isCancelRequested(), v.isTerminal());
    }
}
