package dev.pagegraph.pipeline;

import dev.pagegraph.config.PipelineProperties;
import dev.pagegraph.exception.LeaseLostException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class WorkerOrchestratorTest {

    private final VisitPipeline pipeline = mock(VisitPipeline.class);
    private final PipelineProperties properties = PipelineTestProperties.withQueueCapacity(4);
    private SimpleMeterRegistry meterRegistry;
    private DispatchQueue queue;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queue = new DispatchQueue(properties, meterRegistry);
    }

    private static VisitJob job() {
        return new VisitJob(UUID.randomUUID(), "fp-" + UUID.randomUUID(), Instant.EPOCH);
    }

    private double errors() {
        return meterRegistry.get("pagegraph.worker.errors").counter().count();
    }

    @Nested
    @DisplayName("job containment")
    class Containment {

        private final ThreadPoolTaskExecutor executor = mock(ThreadPoolTaskExecutor.class);
        private WorkerOrchestrator orchestrator;

        @BeforeEach
        void create() {
            orchestrator = new WorkerOrchestrator(queue, pipeline, executor, properties, meterRegistry);
        }

        @Test
        @DisplayName("an unexpected exception is counted and does not escape")
        void unexpectedFailureContained() {
            VisitJob job = job();
            doThrow(new IllegalStateException("database down")).when(pipeline).process(job, "node-t#0");

            orchestrator.runContained(job, "node-t#0");

            assertThat(errors()).isEqualTo(1.0);
            assertThat(meterRegistry.get("pagegraph.workers.busy").gauge().value()).isZero();
        }

        @Test
        @DisplayName("a lost lease abandons the job without counting an error")
        void lostLeaseNotAnError() {
            VisitJob job = job();
            doThrow(new LeaseLostException(job.visitId(), "node-t#0")).when(pipeline).process(job, "node-t#0");

            orchestrator.runContained(job, "node-t#0");

            assertThat(errors()).isZero();
        }

        @Test
        @DisplayName("the visit id is in the MDC while the job runs and gone afterwards")
        void mdcScopedToJob() {
            VisitJob job = job();
            AtomicReference<String> seen = new AtomicReference<>();
            doAnswer(invocation -> {
                seen.set(MDC.get("visitId"));
                return null;
            }).when(pipeline).process(any(), anyString());

            orchestrator.runContained(job, "node-t#1");

            assertThat(seen.get()).isEqualTo(job.visitId().toString());
            assertThat(MDC.get("visitId")).isNull();
            assertThat(MDC.get("fingerprint")).isNull();
        }

        @Test
        @DisplayName("start launches one loop per configured worker")
        void startLaunchesWorkers() {
            orchestrator.start();

            verify(executor, times(properties.workers())).execute(any(Runnable.class));
            assertThat(orchestrator.isRunning()).isTrue();
            assertThat(orchestrator.isAutoStartup()).isFalse();

            orchestrator.stop();
            assertThat(orchestrator.isRunning()).isFalse();
        }
    }

    @Nested
    @DisplayName("live workers")
    class LiveWorkers {

        private ThreadPoolTaskExecutor executor;
        private WorkerOrchestrator orchestrator;

        @BeforeEach
        void start() {
            executor = new ThreadPoolTaskExecutor();
            executor.setCorePoolSize(properties.workers());
            executor.setMaxPoolSize(properties.workers());
            executor.setThreadNamePrefix("visit-worker-test-");
            executor.initialize();
            orchestrator = new WorkerOrchestrator(queue, pipeline, executor, properties, meterRegistry);
            orchestrator.start();
        }

        @AfterEach
        void stop() {
            orchestrator.stop();
            executor.shutdown();
        }

        @Test
        @DisplayName("workers keep taking jobs after one of them fails")
        void loopSurvivesFailure() {
            VisitJob failing = job();
            VisitJob next = job();
            doThrow(new RuntimeException("boom")).when(pipeline).process(eq(failing), anyString());

            queue.offer(failing);
            queue.offer(next);

            verify(pipeline, timeout(2000)).process(eq(failing), startsWith("node-t#"));
            verify(pipeline, timeout(2000)).process(eq(next), startsWith("node-t#"));
        }
    }
}
