package dev.pagegraph.pipeline;

import dev.pagegraph.config.PipelineProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Bounded multi-producer/multi-consumer queue of Visit jobs.
 *
 * <p>Capacity is the backpressure: producers either reject immediately or wait up to a
 * timeout, never grow memory. There is no ordering promise across Visits, and no
 * mutual exclusion here either; a worker must still win the Visit's lease before doing
 * anything. The waiting-set only keeps the same Visit from occupying two slots.
 */
@Component
public class DispatchQueue {

    private static final Logger log = LoggerFactory.getLogger(DispatchQueue.class);

    public enum OfferResult {
        ENQUEUED, ALREADY_QUEUED, FULL;

        public boolean accepted() {
            return this != FULL;
        }
    }

    private final BlockingQueue<VisitJob> queue;
    private final Set<UUID> waiting = ConcurrentHashMap.newKeySet();
    private final int capacity;

    public DispatchQueue(PipelineProperties properties, MeterRegistry meterRegistry) {
        this.capacity = properties.queueCapacity();
        this.queue = new ArrayBlockingQueue<>(capacity);
        Gauge.builder("pagegraph.queue.depth", queue, BlockingQueue::size)
                .description("Visit jobs waiting for a worker")
                .register(meterRegistry);
        Gauge.builder("pagegraph.queue.remaining", queue, BlockingQueue::remainingCapacity)
                .description("Free slots in the dispatch queue")
                .register(meterRegistry);
    }

    /** Non-blocking offer. */
    public OfferResult offer(VisitJob job) {
        return offer(job, Duration.ZERO);
    }

    /** Offers, waiting up to {@code timeout} for space. */
    public OfferResult offer(VisitJob job, Duration timeout) {
        if (!waiting.add(job.visitId())) {
            return OfferResult.ALREADY_QUEUED;
        }
        boolean added;
        try {
            added = timeout.isZero() || timeout.isNegative()
                    ? queue.offer(job)
                    : queue.offer(job, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            added = false;
        }
        if (!added) {
            waiting.remove(job.visitId());
            log.debug("Dispatch queue full ({}), job for visit {} not enqueued", capacity, job.visitId());
            return OfferResult.FULL;
        }
        return OfferResult.ENQUEUED;
    }

    /** Takes the next job, waiting up to {@code timeout}. */
    public Optional<VisitJob> poll(Duration timeout) throws InterruptedException {
        VisitJob job = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (job != null) {
            waiting.remove(job.visitId());
        }
        return Optional.ofNullable(job);
    }

    public int size() {
        return queue.size();
    }

    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    public int capacity() {
        return capacity;
    }
}
