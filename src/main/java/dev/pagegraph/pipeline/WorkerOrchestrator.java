package dev.pagegraph.pipeline;

import dev.pagegraph.config.PipelineProperties;
import dev.pagegraph.exception.LeaseLostException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of workers draining the {@link DispatchQueue}.
 *
 * <p>Each worker is one long-running loop on {@code visitWorkerExecutor} with its own lease
 * owner name ({@code <nodeId>#<index>}). A job's failure, whatever it is, ends with that job:
 * it is logged and counted, and the loop takes the next one. Stopping the lifecycle lets
 * each loop finish its current job and exit.
 */
@Component
public class WorkerOrchestrator implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerOrchestrator.class);

    private final DispatchQueue queue;
    private final VisitPipeline pipeline;
    private final ThreadPoolTaskExecutor executor;
    private final PipelineProperties properties;
    private final AtomicInteger busy = new AtomicInteger();
    private final Counter jobErrors;
    private volatile boolean running;

    public WorkerOrchestrator(DispatchQueue queue,
                              VisitPipeline pipeline,
                              @Qualifier("visitWorkerExecutor") ThreadPoolTaskExecutor executor,
                              PipelineProperties properties,
                              MeterRegistry meterRegistry) {
        this.queue = queue;
        this.pipeline = pipeline;
        this.executor = executor;
        this.properties = properties;
        this.jobErrors = Counter.builder("pagegraph.worker.errors")
                .description("Jobs that ended with an unexpected exception")
                .register(meterRegistry);
        Gauge.builder("pagegraph.workers.busy", busy, AtomicInteger::get)
                .description("Workers currently processing a visit")
                .register(meterRegistry);
    }

    static String ownerPrefix(String nodeId) {
        return nodeId + "#";
    }

    @Override
    public void start() {
        running = true;
        for (int i = 0; i < properties.workers(); i++) {
            String owner = ownerPrefix(properties.nodeId()) + i;
            executor.execute(() -> workLoop(owner));
        }
        log.info("Started {} visit workers on node {}", properties.workers(), properties.nodeId());
    }

    @Override
    public void stop() {
        running = false;
        log.info("Stopping visit workers on node {}", properties.nodeId());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.workersEnabled();
    }

    private void workLoop(String owner) {
        while (running) {
            Optional<VisitJob> job;
            try {
                job = queue.poll(properties.workerPollTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            job.ifPresent(j -> runContained(j, owner));
        }
        log.debug("Worker {} exited", owner);
    }

    /** Runs one job with MDC set, never letting its failure reach the loop. */
    void runContained(VisitJob job, String owner) {
        busy.incrementAndGet();
        MDC.put("visitId", job.visitId().toString());
        if (job.fingerprint() != null) MDC.put("fingerprint", job.fingerprint());
        try {
            pipeline.process(job, owner);
        } catch (LeaseLostException e) {
            log.warn("Abandoned visit {}: {}", job.visitId(), e.getMessage());
        } catch (Exception e) {
            jobErrors.increment();
            log.error("Worker {} failed on visit {}: {}", owner, job.visitId(), e.getMessage(), e);
        } finally {
            MDC.remove("visitId");
            MDC.remove("fingerprint");
            busy.decrementAndGet();
        }
    }
}
