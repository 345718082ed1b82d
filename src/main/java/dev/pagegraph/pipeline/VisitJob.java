package dev.pagegraph.pipeline;

import java.time.Instant;
import java.util.UUID;

/**
 * Queue message: just the Visit id. The Visit row is the source of truth, so a job
 * that arrives late or twice re-reads state instead of trusting the message.
 */
public record VisitJob(UUID visitId, String fingerprint, Instant enqueuedAt) {
    public VisitJob {
        if (visitId == null) throw new IllegalArgumentException("visitId required");
    }
}
