package dev.pagegraph.service;

import dev.pagegraph.config.IngestProperties;
import dev.pagegraph.domain.enums.VisitSource;
import dev.pagegraph.domain.valueobject.Fingerprint;
import dev.pagegraph.domain.valueobject.NormalizedUrl;
import dev.pagegraph.domain.valueobject.VisitEvent;
import dev.pagegraph.dto.request.IngestRequest;
import dev.pagegraph.exception.InvalidEventException;
import dev.pagegraph.pipeline.DispatchQueue;
import dev.pagegraph.pipeline.VisitJob;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Ingestion gateway: validate, normalize, fingerprint, write-ahead append, then enqueue.
 *
 * <p>The append happens before the enqueue and does not depend on it. A full queue turns
 * the answer into Throttled; the Visit is already stored as runnable and the backlog
 * drain picks it up. An invalid event is Rejected with nothing written.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);
    private static final int MAX_TAB_REF_LENGTH = 256;

    private final UrlNormalizer urlNormalizer;
    private final VisitEventStore eventStore;
    private final DispatchQueue queue;
    private final IngestProperties properties;
    private final Clock clock;
    private final Counter acceptedCounter;
    private final Counter coalescedCounter;
    private final Counter throttledCounter;
    private final Counter rejectedCounter;

    public IngestionService(UrlNormalizer urlNormalizer,
                            VisitEventStore eventStore,
                            DispatchQueue queue,
                            IngestProperties properties,
                            Clock clock,
                            MeterRegistry meterRegistry) {
        this.urlNormalizer = urlNormalizer;
        this.eventStore = eventStore;
        this.queue = queue;
        this.properties = properties;
        this.clock = clock;
        this.acceptedCounter = counter(meterRegistry, "accepted");
        this.coalescedCounter = counter(meterRegistry, "coalesced");
        this.throttledCounter = counter(meterRegistry, "throttled");
        this.rejectedCounter = counter(meterRegistry, "rejected");
    }

    public IngestResult ingest(IngestRequest request) {
        VisitEvent event;
        try {
            event = toEvent(request);
        } catch (InvalidEventException e) {
            rejectedCounter.increment();
            log.debug("Rejected event for '{}': {}", request.url(), e.getMessage());
            return IngestResult.rejected(e.getMessage());
        }

        Fingerprint fingerprint = Fingerprint.of(event.url());
        AppendOutcome outcome = eventStore.append(event, fingerprint);
        acceptedCounter.increment();

        if (!outcome.spawnsJob()) {
            coalescedCounter.increment();
            return IngestResult.queued(fingerprint.value(), outcome.visit().id());
        }

        VisitJob job = new VisitJob(outcome.visit().id(), fingerprint.value(), clock.instant());
        DispatchQueue.OfferResult offered = queue.offer(job, properties.offerTimeout());
        if (!offered.accepted()) {
            throttledCounter.increment();
            log.warn("Queue full, visit {} for {} left for backlog drain", outcome.visit().id(), event.url());
            return IngestResult.throttled(fingerprint.value(), outcome.visit().id());
        }
        log.info("Queued visit {} revision {} for {}", outcome.visit().id(), outcome.visit().revision(), event.url());
        return IngestResult.queued(fingerprint.value(), outcome.visit().id());
    }

    private VisitEvent toEvent(IngestRequest request) {
        NormalizedUrl url = urlNormalizer.normalize(request.url());
        VisitSource source = request.source() == null || request.source().isBlank()
                ? properties.defaultSource()
                : VisitSource.parse(request.source())
                        .orElseThrow(() -> new InvalidEventException("unknown source '%s'".formatted(request.source())));
        String tabRef = request.tabRef();
        if (tabRef != null && tabRef.length() > MAX_TAB_REF_LENGTH) {
            throw new InvalidEventException("tabRef exceeds %d characters".formatted(MAX_TAB_REF_LENGTH));
        }
        Instant observedAt = request.observedAt() != null ? request.observedAt() : clock.instant();
        return new VisitEvent(url, observedAt, source, tabRef);
    }

    private static Counter counter(MeterRegistry registry, String outcome) {
        return Counter.builder("pagegraph.ingest.events")
                .description("Inbound visit events by outcome")
                .tag("outcome", outcome)
                .register(registry);
    }
}
