package dev.pagegraph.service;

import dev.pagegraph.domain.entity.Document;
import dev.pagegraph.domain.entity.Embedding;
import dev.pagegraph.domain.entity.Summary;
import dev.pagegraph.domain.entity.Visit;
import dev.pagegraph.domain.entity.VisitEventRecord;
import dev.pagegraph.domain.valueobject.Fingerprint;
import dev.pagegraph.dto.response.VisitEventResponse;
import dev.pagegraph.dto.response.VisitResponse;
import dev.pagegraph.exception.VisitNotFoundException;
import dev.pagegraph.repository.DocumentRepository;
import dev.pagegraph.repository.EmbeddingRepository;
import dev.pagegraph.repository.SummaryRepository;
import dev.pagegraph.repository.VisitEventRepository;
import dev.pagegraph.repository.VisitRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Read-side service for Visit inspection, with read-only transactions. */
@Service
@Transactional(readOnly = true)
public class VisitQueryService {

    private final VisitRepository visitRepository;
    private final VisitEventRepository eventRepository;
    private final DocumentRepository documentRepository;
    private final SummaryRepository summaryRepository;
    private final EmbeddingRepository embeddingRepository;
    private final UrlNormalizer urlNormalizer;

    public VisitQueryService(VisitRepository visitRepository,
                             VisitEventRepository eventRepository,
                             DocumentRepository documentRepository,
                             SummaryRepository summaryRepository,
                             EmbeddingRepository embeddingRepository,
                             UrlNormalizer urlNormalizer) {
        this.visitRepository = visitRepository;
        this.eventRepository = eventRepository;
        this.documentRepository = documentRepository;
        this.summaryRepository = summaryRepository;
        this.embeddingRepository = embeddingRepository;
        this.urlNormalizer = urlNormalizer;
    }

    public Optional<VisitResponse> findById(UUID id) {
        return visitRepository.findById(id).map(this::toResponse);
    }

    /** Latest revision for a URL, normalized the same way the gateway does. */
    public Optional<VisitResponse> findLatestForUrl(String url) {
        Fingerprint fingerprint = Fingerprint.of(urlNormalizer.normalize(url));
        return visitRepository.findTopByFingerprintOrderByRevisionDesc(fingerprint.value()).map(this::toResponse);
    }

    /** Every event ever recorded for the page of this Visit, all revisions, in arrival order. */
    public List<VisitEventResponse> replayEvents(UUID visitId) {
        Visit visit = visitRepository.findById(visitId).orElseThrow(() -> new VisitNotFoundException(visitId));
        return eventRepository.findByFingerprintOrderByIdAsc(visit.getFingerprint()).stream()
                .map(VisitQueryService::toEventResponse)
                .toList();
    }

    private VisitResponse toResponse(Visit v) {
        VisitResponse.DocumentInfo document = documentRepository.findByVisitIdAndCurrentTrue(v.getId())
                .map(VisitQueryService::toDocumentInfo).orElse(null);
        VisitResponse.SummaryInfo summary = summaryRepository.findByVisitIdAndCurrentTrue(v.getId())
                .map(VisitQueryService::toSummaryInfo).orElse(null);
        VisitResponse.EmbeddingInfo embedding = embeddingRepository.findByVisitIdAndCurrentTrue(v.getId())
                .map(VisitQueryService::toEmbeddingInfo).orElse(null);
        return new VisitResponse(v.getId(), v.getNormalizedUrl(), v.getHost(), v.getFingerprint(), v.getRevision(),
                v.getStatus(), v.getFailedStage(), v.getFailureReason(),
                v.isCancelled(), v.isCancelRequested(), v.isSuperseded(),
                v.getAttemptCount(), v.getRetryAt(), eventRepository.countByVisitId(v.getId()),
                v.getCreatedAt(), v.getCompletedAt(),
                new VisitResponse.Artifacts(document, summary, embedding));
    }

    private static VisitResponse.DocumentInfo toDocumentInfo(Document d) {
        return new VisitResponse.DocumentInfo(d.getId(), d.getExtractionMethod(), d.getText().length(),
                d.isTruncated(), d.getContentHash(), d.getFetchedAt());
    }

    private static VisitResponse.SummaryInfo toSummaryInfo(Summary s) {
        return new VisitResponse.SummaryInfo(s.getId(), s.getText(), List.copyOf(s.getConcepts()));
    }

    private static VisitResponse.EmbeddingInfo toEmbeddingInfo(Embedding e) {
        return new VisitResponse.EmbeddingInfo(e.getId(), e.getModelVersion(), e.getDimensions(), e.getSource().name());
    }

    private static VisitEventResponse toEventResponse(VisitEventRecord r) {
        return new VisitEventResponse(r.getId(), r.getUrl(), r.getSource(), r.getClientTabRef(),
                r.getObservedAt(), r.getReceivedAt(), r.getVisitId());
    }
}
