package dev.pagegraph.pipeline;

import dev.pagegraph.config.PipelineProperties;
import dev.pagegraph.domain.enums.PipelineStage;
import dev.pagegraph.exception.EmbedException;
import dev.pagegraph.exception.FetchException;
import dev.pagegraph.exception.LinkException;
import dev.pagegraph.exception.StageException;
import dev.pagegraph.exception.SummarizeException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one external capability call on the capability pool and waits at most the stage's
 * timeout. A timeout counts as a failure of the stage. The capability thread is interrupted
 * and the worker moves on, so the call must give up its thread when interrupted.
 */
@Component
public class CapabilityInvoker {

    private final ExecutorService executor;
    private final PipelineProperties properties;

    public CapabilityInvoker(@Qualifier("capabilityExecutorService") ExecutorService executor,
                             PipelineProperties properties) {
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * @throws StageException of the stage's own type for any failure, including a timeout
     */
    public <T> T invoke(PipelineStage stage, Supplier<T> call) {
        Duration timeout = properties.timeoutFor(stage);
        Future<T> future;
        try {
            future = executor.submit(call::get);
        } catch (RejectedExecutionException e) {
            throw failure(stage, "%s rejected: capability pool is saturated".formatted(stage), e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw failure(stage, "%s timed out after %s".formatted(stage, timeout), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StageException stageException) {
                throw stageException;
            }
            throw failure(stage, "%s failed: %s".formatted(stage, cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw failure(stage, stage + " interrupted", e);
        }
    }

    static StageException failure(PipelineStage stage, String message, Throwable cause) {
        return switch (stage) {
            case FETCH -> new FetchException(message, cause);
            case SUMMARIZE -> new SummarizeException(message, cause);
            case EMBED -> new EmbedException(message, cause);
            case LINK -> new LinkException(message, cause);
        };
    }
}
