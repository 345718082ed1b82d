package dev.pagegraph.dto.response;

import dev.pagegraph.domain.enums.VisitSource;

import java.time.Instant;
import java.util.UUID;

public record VisitEventResponse(long id, String url, VisitSource source, String tabRef,
                                 Instant observedAt, Instant receivedAt, UUID visitId) {}
