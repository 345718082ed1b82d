package dev.pagegraph.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Thread pools for the pipeline.
 *
 * <p>Two pools with different jobs:
 * <ul>
 *   <li><b>visitWorkerExecutor</b>: exactly {@code pagegraph.pipeline.workers} platform threads,
 *       one long-running drain loop each. Its size is the cap on concurrent outbound
 *       fetch/LLM work.</li>
 *   <li><b>capabilityExecutorService</b>: where each adapter call actually runs, so the
 *       worker can enforce a per-stage timeout and move on. A timed-out call is interrupted
 *       but may hold its thread briefly, so the pool allows twice the worker count and
 *       rejects beyond that.</li>
 * </ul>
 *
 * <p>Both wrap tasks with MDC propagation so visitId/fingerprint survive the hop onto
 * the capability thread.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "visitWorkerExecutor")
    public ThreadPoolTaskExecutor visitWorkerExecutor(PipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setCorePoolSize(properties.workers());
        executor.setMaxPoolSize(properties.workers());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("visit-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "capabilityExecutorService", destroyMethod = "shutdownNow")
    public ExecutorService capabilityExecutorService(PipelineProperties properties) {
        ExecutorService base = new ThreadPoolExecutor(properties.workers(), properties.workers() * 2,
                60, TimeUnit.SECONDS, new SynchronousQueue<>(), new CustomizableThreadFactory("capability-"));
        return new DelegatingExecutorService(base, new MdcPropagatingTaskDecorator());
    }

    /**
     * Propagates MDC context (visitId, fingerprint) from the calling thread to the task thread.
     */
    static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }

    /**
     * Wraps an ExecutorService to apply MDC propagation to all submitted tasks.
     */
    static class DelegatingExecutorService extends AbstractExecutorService {
        private final ExecutorService delegate;
        private final MdcPropagatingTaskDecorator decorator;

        DelegatingExecutorService(ExecutorService delegate, MdcPropagatingTaskDecorator decorator) {
            this.delegate = delegate;
            this.decorator = decorator;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(decorator.decorate(command));
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit)
                throws InterruptedException { return delegate.awaitTermination(timeout, unit); }
    }
}
