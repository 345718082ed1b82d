package dev.pagegraph.service;

import dev.pagegraph.domain.valueobject.VisitSnapshot;

/**
 * Result of one Event Store append: which Visit the event landed on and whether that
 * needs a processing job.
 */
public record AppendOutcome(long eventId, VisitSnapshot visit, Disposition disposition) {

    public enum Disposition {
        /** First Visit ever for this Fingerprint. */
        NEW_VISIT,
        /** A later revision of an already known page. */
        NEW_REVISION,
        /** Merged into an existing Visit as another occurrence. */
        COALESCED
    }

    public boolean spawnsJob() {
        return disposition != Disposition.COALESCED;
    }
}
