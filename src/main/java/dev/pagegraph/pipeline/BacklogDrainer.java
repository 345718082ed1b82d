package dev.pagegraph.pipeline;

import dev.pagegraph.config.PipelineProperties;
import dev.pagegraph.domain.valueobject.VisitSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Re-enqueues durable work the queue does not hold: events acknowledged as Throttled,
 * Visits whose backoff has elapsed, and Visits left mid-pipeline by a restart.
 *
 * <p>Runs once when the application is ready (after dropping this node's stale leases) and
 * then on a fixed delay. Never offers more than the queue can take right now.
 */
@Component
public class BacklogDrainer {

    private static final Logger log = LoggerFactory.getLogger(BacklogDrainer.class);

    private final VisitLedger ledger;
    private final DispatchQueue queue;
    private final PipelineProperties properties;
    private final Clock clock;

    public BacklogDrainer(VisitLedger ledger, DispatchQueue queue, PipelineProperties properties, Clock clock) {
        this.ledger = ledger;
        this.queue = queue;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        if (!properties.recoveryEnabled()) {
            log.info("Backlog recovery disabled");
            return;
        }
        int released = ledger.releaseNodeLeases(properties.nodeId());
        int enqueued = drain();
        log.info("Recovery on node {}: released {} stale leases, enqueued {} visits",
                properties.nodeId(), released, enqueued);
    }

    @Scheduled(fixedDelayString = "${pagegraph.pipeline.drain-interval:PT5S}",
            initialDelayString = "${pagegraph.pipeline.drain-interval:PT5S}")
    public void scheduledDrain() {
        if (properties.recoveryEnabled()) {
            drain();
        }
    }

    /** @return how many jobs were newly enqueued */
    public int drain() {
        int room = Math.min(queue.remainingCapacity(), properties.drainBatchSize());
        if (room <= 0) {
            return 0;
        }
        List<VisitSnapshot> runnable = ledger.findRunnable(room);
        int enqueued = 0;
        for (VisitSnapshot visit : runnable) {
            DispatchQueue.OfferResult result = queue.offer(new VisitJob(visit.id(), visit.fingerprint(), clock.instant()));
            if (result == DispatchQueue.OfferResult.ENQUEUED) {
                enqueued++;
            } else if (result == DispatchQueue.OfferResult.FULL) {
                break;
            }
        }
        if (enqueued > 0) {
            log.debug("Backlog drain enqueued {} of {} runnable visits", enqueued, runnable.size());
        }
        return enqueued;
    }
}
