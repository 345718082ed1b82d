package dev.pagegraph.service;

import dev.pagegraph.domain.enums.IngestStatus;

import java.util.UUID;

/**
 * Gateway acknowledgement. Queued and Throttled are both accepted: the event is durable
 * either way, Throttled only says the processing job waits for the backlog drain.
 */
public record IngestResult(IngestStatus status, String fingerprint, UUID visitId, String reason) {

    public static IngestResult queued(String fingerprint, UUID visitId) {
        return new IngestResult(IngestStatus.QUEUED, fingerprint, visitId, null);
    }

    public static IngestResult throttled(String fingerprint, UUID visitId) {
        return new IngestResult(IngestStatus.THROTTLED, fingerprint, visitId, "processing queue is full; event stored");
    }

    public static IngestResult rejected(String reason) {
        return new IngestResult(IngestStatus.REJECTED, null, null, reason);
    }

    public boolean accepted() {
        return status != IngestStatus.REJECTED;
    }
}
