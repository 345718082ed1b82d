package dev.pagegraph.dto.response;

import dev.pagegraph.domain.enums.PipelineStage;
import dev.pagegraph.domain.enums.VisitStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record VisitResponse(
        UUID id, String url, String host, String fingerprint, int revision,
        VisitStatus status, PipelineStage failedStage, String failureReason,
        boolean cancelled, boolean cancelRequested, boolean superseded,
        int attemptCount, Instant retryAt, long occurrenceCount,
        Instant createdAt, Instant completedAt, Artifacts artifacts
) {
    /** Current artifacts of this revision; null members are not produced yet. */
    public record Artifacts(DocumentInfo document, SummaryInfo summary, EmbeddingInfo embedding) {}

    public record DocumentInfo(UUID id, String extractionMethod, int length, boolean truncated,
                               String contentHash, Instant fetchedAt) {}

    public record SummaryInfo(UUID id, String text, List<String> concepts) {}

    public record EmbeddingInfo(UUID id, String modelVersion, int dimensions, String source) {}
}
