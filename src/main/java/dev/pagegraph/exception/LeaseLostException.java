package dev.pagegraph.exception;

import java.util.UUID;

/**
 * The worker no longer holds the lease on a Visit (it expired and another worker claimed
 * it, or the Visit was cancelled). The current job must stop without writing.
 */
public class LeaseLostException extends RuntimeException {
    public LeaseLostException(UUID visitId, String owner) {
        super("Lease on visit %s no longer held by %s".formatted(visitId, owner));
    }
}
