package dev.pagegraph.pipeline;

import dev.pagegraph.domain.enums.PipelineStage;
import dev.pagegraph.domain.valueobject.VisitSnapshot;
import dev.pagegraph.exception.LeaseLostException;
import dev.pagegraph.exception.StageException;
import dev.pagegraph.pipeline.stage.StageHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one Visit from its persisted status to DONE, or to the first failing stage.
 *
 * <pre>
 *  1. Claim the lease and start an attempt (resumes at the failed stage, if any)
 *  2. For each remaining stage:
 *       a. stop as Failed(Cancelled) if cancellation was requested
 *       b. run the stage (external calls bounded by the stage timeout)
 *       c. persist the advance before touching the next stage
 *  3. On a stage failure: record it, schedule the backoff retry, stop
 *  4. Release the lease
 * </pre>
 *
 * <p>There is no in-memory progress: everything the next stage needs is in the database,
 * so a crash between any two steps resumes correctly from the persisted status.
 */
@Component
public class VisitPipeline {

    private static final Logger log = LoggerFactory.getLogger(VisitPipeline.class);

    private final Map<PipelineStage, StageHandler> handlers = new EnumMap<>(PipelineStage.class);
    private final VisitLedger ledger;
    private final MeterRegistry meterRegistry;

    public VisitPipeline(List<StageHandler> stageHandlers, VisitLedger ledger, MeterRegistry meterRegistry) {
        stageHandlers.forEach(handler -> handlers.put(handler.stage(), handler));
        for (PipelineStage stage : PipelineStage.values()) {
            if (!handlers.containsKey(stage)) {
                throw new IllegalStateException("No handler registered for stage " + stage);
            }
        }
        this.ledger = ledger;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Processes one job as lease owner {@code owner}. Stage failures are recorded on the
     * Visit and do not propagate; a lost lease or a database failure does.
     */
    public void process(VisitJob job, String owner) {
        Optional<VisitSnapshot> claimed = ledger.claim(job.visitId(), owner);
        if (claimed.isEmpty()) {
            log.debug("Dropping job for visit {}: not claimable", job.visitId());
            return;
        }
        VisitSnapshot visit = claimed.get();
        log.info("Processing visit {} revision {} ({}), attempt {} from {}",
                visit.id(), visit.revision(), visit.url(), visit.attemptCount(), visit.status());
        try {
            while (visit.status().isStageInProgress()) {
                if (ledger.isCancelRequested(visit.id())) {
                    ledger.cancelAtBoundary(visit.id(), owner);
                    return;
                }
                PipelineStage stage = PipelineStage.forStatus(visit.status());
                if (!runStage(stage, visit, owner)) {
                    return;
                }
                visit = ledger.advance(visit.id(), owner, stage);
                log.info("Visit {} finished {}, now {}", visit.id(), stage, visit.status());
            }
        } finally {
            releaseQuietly(visit, owner);
        }
    }

    /** @return true if the stage succeeded; false once its failure is recorded */
    private boolean runStage(PipelineStage stage, VisitSnapshot visit, String owner) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            handlers.get(stage).execute(visit);
            return true;
        } catch (LeaseLostException e) {
            outcome = "abandoned";
            throw e;
        } catch (StageException e) {
            outcome = "failure";
            ledger.recordFailure(visit.id(), owner, stage, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            outcome = "failure";
            log.warn("Unexpected error in {} for visit {}", stage, visit.id(), e);
            ledger.recordFailure(visit.id(), owner, stage, e.getClass().getSimpleName() + ": " + e.getMessage());
            return false;
        } finally {
            sample.stop(Timer.builder("pagegraph.stage.duration")
                    .description("Time spent in one pipeline stage")
                    .tag("stage", stage.name().toLowerCase())
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    private void releaseQuietly(VisitSnapshot visit, String owner) {
        try {
            ledger.release(visit.id(), owner);
        } catch (RuntimeException e) {
            // the lease simply expires and recovery picks the visit up again
            log.warn("Could not release lease on visit {}: {}", visit.id(), e.getMessage());
        }
    }
}
