package dev.pagegraph.pipeline;

import dev.pagegraph.config.PipelineProperties;
import io.github.resilience4j.core.IntervalFunction;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Persisted per-visit retry schedule: exponential from initialBackoff, capped at maxBackoff,
 * at most maxAttempts tries of one stage per revision.
 */
@Component
public class RetryBackoff {

    private final IntervalFunction intervals;
    private final int maxAttempts;

    public RetryBackoff(PipelineProperties properties) {
        this.intervals = IntervalFunction.ofExponentialBackoff(
                properties.initialBackoff(), properties.backoffMultiplier(), properties.maxBackoff());
        this.maxAttempts = properties.maxAttempts();
    }

    /**
     * Delay before the next try after {@code failures} consecutive failures of a stage,
     * or empty once the stage has used all its attempts.
     */
    public Optional<Duration> delayAfter(int failures) {
        if (failures < 1) throw new IllegalArgumentException("failures starts at 1");
        if (failures >= maxAttempts) return Optional.empty();
        return Optional.of(Duration.ofMillis(intervals.apply(failures)));
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
