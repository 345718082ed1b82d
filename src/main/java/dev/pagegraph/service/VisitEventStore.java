package dev.pagegraph.service;

import dev.pagegraph.config.IngestProperties;
import dev.pagegraph.domain.entity.Visit;
import dev.pagegraph.domain.entity.VisitEventRecord;
import dev.pagegraph.domain.enums.VisitStatus;
import dev.pagegraph.domain.valueobject.Fingerprint;
import dev.pagegraph.domain.valueobject.VisitEvent;
import dev.pagegraph.domain.valueobject.VisitSnapshot;
import dev.pagegraph.repository.VisitEventRepository;
import dev.pagegraph.repository.VisitRepository;
import dev.pagegraph.support.KeyedLocks;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only event log keyed by Fingerprint, and the single place that decides whether
 * an event is a duplicate.
 *
 * <p>Decision, per Fingerprint, against its latest Visit revision:
 * <pre>
 *   none                        → revision 1, spawn a job
 *   non-terminal                → merge as an occurrence (rapid repeats, SPA route churn)
 *   DONE, within cool-down      → merge
 *   DONE, older than reprocess  → new revision, spawn a job
 *   DONE, otherwise             → merge (revisit recorded, not reprocessed)
 *   FAILED and terminal         → new revision immediately (retry-by-revision)
 * </pre>
 *
 * <p>Appends for one Fingerprint are serialized by a striped lock and run in one short
 * transaction. A concurrent writer in another process loses on the unique
 * active_fingerprint / (fingerprint, revision) constraints and is retried by the
 * {@code visit-ledger} Retry, which re-reads and decides again.
 */
@Service
public class VisitEventStore {

    private static final Logger log = LoggerFactory.getLogger(VisitEventStore.class);

    private final VisitRepository visitRepository;
    private final VisitEventRepository eventRepository;
    private final TransactionTemplate transactionTemplate;
    private final IngestProperties properties;
    private final Clock clock;
    private final Retry retry;
    private final KeyedLocks locks = new KeyedLocks(64);

    public VisitEventStore(VisitRepository visitRepository,
                           VisitEventRepository eventRepository,
                           TransactionTemplate transactionTemplate,
                           IngestProperties properties,
                           Clock clock,
                           RetryRegistry retryRegistry) {
        this.visitRepository = visitRepository;
        this.eventRepository = eventRepository;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
        this.retry = retryRegistry.retry("visit-ledger");
    }

    /**
     * Appends one accepted event. Exactly one event row is written per call.
     */
    public AppendOutcome append(VisitEvent event, Fingerprint fingerprint) {
        return locks.withLock(fingerprint.value(), () ->
                retry.executeSupplier(() -> transactionTemplate.execute(tx -> appendInTransaction(event, fingerprint))));
    }

    /** Full event history of one page across all revisions, in arrival order. */
    public List<VisitEventRecord> replay(String fingerprint) {
        return eventRepository.findByFingerprintOrderByIdAsc(fingerprint);
    }

    /** Occurrences of one Visit revision, ordered by observation time. */
    public List<VisitEventRecord> occurrences(UUID visitId) {
        return eventRepository.findByVisitIdOrderByObservedAtAscIdAsc(visitId);
    }

    private AppendOutcome appendInTransaction(VisitEvent event, Fingerprint fingerprint) {
        Instant now = clock.instant();
        Optional<Visit> latest = visitRepository.findTopByFingerprintOrderByRevisionDesc(fingerprint.value());
        AppendOutcome.Disposition disposition = decide(latest.orElse(null), event, now);

        Visit target = switch (disposition) {
            case NEW_VISIT -> visitRepository.saveAndFlush(
                    Visit.create(fingerprint.value(), event.url().value(), event.url().host(), 1, now));
            case NEW_REVISION -> visitRepository.saveAndFlush(
                    Visit.create(fingerprint.value(), event.url().value(), event.url().host(),
                            latest.get().getRevision() + 1, now));
            case COALESCED -> latest.get();
        };

        VisitEventRecord record = eventRepository.save(VisitEventRecord.of(
                fingerprint.value(), event.url().value(), event.source(), event.clientTabRef(),
                event.observedAt(), now, target.getId()));

        if (disposition == AppendOutcome.Disposition.COALESCED) {
            log.debug("Coalesced event for {} into visit {} (revision {}, status {})",
                    event.url(), target.getId(), target.getRevision(), target.getStatus());
        } else {
            log.info("Visit {} revision {} created for {}", target.getId(), target.getRevision(), event.url());
        }
        return new AppendOutcome(record.getId(), VisitSnapshot.from(target), disposition);
    }

    private AppendOutcome.Disposition decide(Visit latest, VisitEvent event, Instant now) {
        if (latest == null) {
            return AppendOutcome.Disposition.NEW_VISIT;
        }
        if (!latest.isTerminal()) {
            return AppendOutcome.Disposition.COALESCED;
        }
        if (latest.getStatus() == VisitStatus.FAILED) {
            return AppendOutcome.Disposition.NEW_REVISION;
        }
        Instant lastSeen = eventRepository.findLatestObservedAt(latest.getId());
        if (lastSeen != null && Duration.between(lastSeen, event.observedAt()).abs().compareTo(properties.coolDown()) <= 0) {
            return AppendOutcome.Disposition.COALESCED;
        }
        Instant completedAt = latest.getCompletedAt() != null ? latest.getCompletedAt() : latest.getUpdatedAt();
        if (!completedAt.plus(properties.reprocessInterval()).isAfter(now)) {
            return AppendOutcome.Disposition.NEW_REVISION;
        }
        return AppendOutcome.Disposition.COALESCED;
    }
}
