package dev.pagegraph.pipeline;

import dev.pagegraph.config.PipelineProperties;
import dev.pagegraph.domain.entity.Visit;
import dev.pagegraph.domain.enums.PipelineStage;
import dev.pagegraph.domain.enums.VisitStatus;
import dev.pagegraph.domain.valueobject.VisitSnapshot;
import dev.pagegraph.exception.LeaseLostException;
import dev.pagegraph.exception.VisitNotFoundException;
import dev.pagegraph.repository.VisitRepository;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Every Visit status transition, each in its own short transaction.
 *
 * <p>Workers never hold a managed Visit. They call in here with the visit id and their
 * lease owner name, and get a {@link VisitSnapshot} back. Transitions are compare-and-set
 * through {@code @Version}; a lost race surfaces as an optimistic locking failure and is
 * retried by the {@code visit-ledger} Retry against fresh state.
 */
@Component
public class VisitLedger {

    private static final Logger log = LoggerFactory.getLogger(VisitLedger.class);

    private final VisitRepository visitRepository;
    private final TransactionTemplate transactionTemplate;
    private final RetryBackoff backoff;
    private final PipelineProperties properties;
    private final Clock clock;
    private final Retry retry;
    private final MeterRegistry meterRegistry;
    private final Counter exhaustedCounter;
    private final Counter cancelledCounter;

    public VisitLedger(VisitRepository visitRepository,
                       TransactionTemplate transactionTemplate,
                       RetryBackoff backoff,
                       PipelineProperties properties,
                       Clock clock,
                       RetryRegistry retryRegistry,
                       MeterRegistry meterRegistry) {
        this.visitRepository = visitRepository;
        this.transactionTemplate = transactionTemplate;
        this.backoff = backoff;
        this.properties = properties;
        this.clock = clock;
        this.retry = retryRegistry.retry("visit-ledger");
        this.meterRegistry = meterRegistry;
        this.exhaustedCounter = Counter.builder("pagegraph.visits.exhausted")
                .description("Visits that used every attempt of a stage")
                .register(meterRegistry);
        this.cancelledCounter = Counter.builder("pagegraph.visits.cancelled")
                .description("Visits stopped by cancellation")
                .register(meterRegistry);
    }

    /**
     * Takes the lease on a runnable Visit and starts one attempt. Empty when the Visit is
     * terminal, leased by someone else, or still waiting out its backoff. A pending
     * cancellation is honored here, before any stage runs.
     */
    public Optional<VisitSnapshot> claim(UUID visitId, String owner) {
        return inTransaction(now -> {
            Visit visit = visitRepository.findById(visitId).orElse(null);
            if (visit == null || visit.isTerminal()) {
                return Optional.empty();
            }
            if (visit.isCancelRequested() && visit.isLeaseFree(now)) {
                visit.cancel(now);
                visitRepository.saveAndFlush(visit);
                cancelledCounter.increment();
                log.info("Visit {} cancelled before resuming at {}", visitId, visit.getFailedStage());
                return Optional.empty();
            }
            if (!visit.isRunnable(now) && !visit.isLeasedBy(owner, now)) {
                log.debug("Visit {} not claimable by {} (status {}, lease {})",
                        visitId, owner, visit.getStatus(), visit.getLeaseOwner());
                return Optional.empty();
            }
            visit.claim(owner, now, properties.leaseDuration());
            visit.beginAttempt(now);
            visitRepository.saveAndFlush(visit);
            log.debug("Visit {} claimed by {} for attempt {} at {}",
                    visitId, owner, visit.getAttemptCount(), visit.getStatus());
            return Optional.of(VisitSnapshot.from(visit));
        });
    }

    /**
     * Records success of {@code completed} and renews the lease. Reaching DONE marks the
     * page's older completed revisions superseded.
     */
    public VisitSnapshot advance(UUID visitId, String owner, PipelineStage completed) {
        return inTransaction(now -> {
            Visit visit = requireLeased(visitId, owner, now);
            visit.advance(completed, now);
            if (visit.getStatus() == VisitStatus.DONE) {
                supersedeOlderRevisions(visit, now);
            } else {
                visit.claim(owner, now, properties.leaseDuration());
            }
            visitRepository.saveAndFlush(visit);
            return VisitSnapshot.from(visit);
        });
    }

    /**
     * Marks the stage failed and either schedules the next try with exponential backoff
     * or, when the stage is out of attempts, ends the revision. Releases the lease.
     */
    public VisitSnapshot recordFailure(UUID visitId, String owner, PipelineStage stage, String reason) {
        VisitSnapshot result = inTransaction(now -> {
            Visit visit = requireLeased(visitId, owner, now);
            int failures = visit.recordStageFailure(stage, reason, now);
            Optional<Duration> delay = backoff.delayAfter(failures);
            if (delay.isPresent()) {
                visit.scheduleRetry(now.plus(delay.get()), now);
                log.warn("Visit {} failed at {} ({}/{}), retry in {}: {}",
                        visitId, stage, failures, backoff.maxAttempts(), delay.get(), reason);
            } else {
                visit.exhaust(now);
                log.error("Visit {} exhausted {} attempts at {}: {}", visitId, failures, stage, reason);
            }
            visit.releaseLease(owner, now);
            visitRepository.saveAndFlush(visit);
            return VisitSnapshot.from(visit);
        });
        Counter.builder("pagegraph.stage.failures")
                .tag("stage", stage.name().toLowerCase())
                .register(meterRegistry)
                .increment();
        if (result.terminal()) {
            exhaustedCounter.increment();
        }
        return result;
    }

    public boolean isCancelRequested(UUID visitId) {
        return visitRepository.findById(visitId).map(Visit::isCancelRequested).orElse(false);
    }

    /** Ends the revision as Failed(Cancelled) at a stage boundary. */
    public VisitSnapshot cancelAtBoundary(UUID visitId, String owner) {
        VisitSnapshot result = inTransaction(now -> {
            Visit visit = requireLeased(visitId, owner, now);
            visit.cancel(now);
            visit.releaseLease(owner, now);
            visitRepository.saveAndFlush(visit);
            return VisitSnapshot.from(visit);
        });
        cancelledCounter.increment();
        log.info("Visit {} cancelled at stage boundary (stopped before {})", visitId, result.failedStage());
        return result;
    }

    /**
     * Cancels a Visit on behalf of a user. An idle Visit is cancelled on the spot; one a
     * worker is driving is flagged and stops at its next stage boundary.
     *
     * @throws VisitNotFoundException if no such Visit exists
     * @throws IllegalStateException if the Visit already finished
     */
    public VisitSnapshot requestCancel(UUID visitId) {
        VisitSnapshot result = inTransaction(now -> {
            Visit visit = visitRepository.findById(visitId).orElseThrow(() -> new VisitNotFoundException(visitId));
            if (visit.isTerminal()) {
                throw new IllegalStateException("Visit %s already finished as %s".formatted(visitId, visit.getStatus()));
            }
            if (visit.isLeaseFree(now)) {
                visit.cancel(now);
            } else {
                visit.requestCancel(now);
            }
            visitRepository.saveAndFlush(visit);
            return VisitSnapshot.from(visit);
        });
        if (result.terminal()) {
            cancelledCounter.increment();
        }
        log.info("Cancellation of visit {} {}", visitId, result.terminal() ? "applied" : "requested");
        return result;
    }

    /** Cancels every in-flight Visit of a host; returns how many were affected. */
    public int cancelHost(String host) {
        List<UUID> ids = visitRepository.findByHostAndActiveFingerprintIsNotNull(host).stream()
                .map(Visit::getId)
                .toList();
        int affected = 0;
        for (UUID id : ids) {
            try {
                requestCancel(id);
                affected++;
            } catch (IllegalStateException e) {
                log.debug("Visit {} finished before it could be cancelled", id);
            }
        }
        log.info("Cancelled {} in-flight visits of host {}", affected, host);
        return affected;
    }

    public void release(UUID visitId, String owner) {
        inTransaction(now -> {
            visitRepository.findById(visitId).ifPresent(visit -> {
                if (owner.equals(visit.getLeaseOwner())) {
                    visit.releaseLease(owner, now);
                    visitRepository.saveAndFlush(visit);
                }
            });
            return null;
        });
    }

    /** Non-terminal, unleased and due Visits, oldest first. */
    public List<VisitSnapshot> findRunnable(int limit) {
        Instant now = clock.instant();
        return visitRepository.findRunnable(now, PageRequest.of(0, limit)).stream()
                .map(VisitSnapshot::from)
                .toList();
    }

    /** Frees leases this node held before a restart, so its unfinished work is runnable again. */
    public int releaseNodeLeases(String nodeId) {
        Integer released = transactionTemplate.execute(tx ->
                visitRepository.releaseLeasesByOwnerPrefix(WorkerOrchestrator.ownerPrefix(nodeId) + "%"));
        return released == null ? 0 : released;
    }

    private Visit requireLeased(UUID visitId, String owner, Instant now) {
        Visit visit = visitRepository.findById(visitId).orElseThrow(() -> new VisitNotFoundException(visitId));
        if (!visit.isLeasedBy(owner, now)) {
            throw new LeaseLostException(visitId, owner);
        }
        return visit;
    }

    private void supersedeOlderRevisions(Visit done, Instant now) {
        for (Visit older : visitRepository.findByFingerprintOrderByRevisionDesc(done.getFingerprint())) {
            if (older.getRevision() < done.getRevision() && !older.isSuperseded()
                    && older.getStatus() == VisitStatus.DONE) {
                older.markSuperseded(now);
                log.debug("Visit {} revision {} superseded by revision {}",
                        older.getId(), older.getRevision(), done.getRevision());
            }
        }
    }

    private <T> T inTransaction(Function<Instant, T> work) {
        return retry.executeSupplier(() -> transactionTemplate.execute(tx -> work.apply(clock.instant())));
    }
}
