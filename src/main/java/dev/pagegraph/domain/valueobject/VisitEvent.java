package dev.pagegraph.domain.valueobject;

import dev.pagegraph.domain.enums.VisitSource;

import java.time.Instant;

/**
 * One observed navigation, already validated and normalized. clientTabRef is an opaque
 * correlation id from the client, never an identity.
 */
public record VisitEvent(NormalizedUrl url, Instant observedAt, VisitSource source, String clientTabRef) {
    public VisitEvent {
        if (url == null) throw new IllegalArgumentException("url required");
        if (observedAt == null) throw new IllegalArgumentException("observedAt required");
        if (source == null) throw new IllegalArgumentException("source required");
    }
}
