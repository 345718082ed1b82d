package dev.pagegraph.config;

import dev.pagegraph.domain.enums.PipelineStage;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Worker pool, queue and retry policy.
 *
 * <p>workers is the cap on concurrent outbound fetch/LLM calls. maxAttempts bounds the
 * attempts of one stage within one Visit revision; the backoff between them grows from
 * initialBackoff by backoffMultiplier up to maxBackoff.
 */
@ConfigurationProperties(prefix = "pagegraph.pipeline")
public record PipelineProperties(int workers,
                                 int queueCapacity,
                                 Duration fetchTimeout,
                                 Duration summarizeTimeout,
                                 Duration embedTimeout,
                                 Duration linkTimeout,
                                 int maxAttempts,
                                 Duration initialBackoff,
                                 double backoffMultiplier,
                                 Duration maxBackoff,
                                 Duration leaseDuration,
                                 String nodeId,
                                 int drainBatchSize,
                                 Duration workerPollTimeout,
                                 Boolean workersEnabled,
                                 Boolean recoveryEnabled) {
    public PipelineProperties {
        if (workers <= 0) workers = 4;
        if (queueCapacity <= 0) queueCapacity = 256;
        if (fetchTimeout == null) fetchTimeout = Duration.ofSeconds(30);
        if (summarizeTimeout == null) summarizeTimeout = Duration.ofSeconds(120);
        if (embedTimeout == null) embedTimeout = Duration.ofSeconds(60);
        if (linkTimeout == null) linkTimeout = Duration.ofSeconds(30);
        if (maxAttempts <= 0) maxAttempts = 5;
        if (initialBackoff == null) initialBackoff = Duration.ofSeconds(5);
        if (backoffMultiplier < 1.0) backoffMultiplier = 2.0;
        if (maxBackoff == null) maxBackoff = Duration.ofMinutes(10);
        if (leaseDuration == null) leaseDuration = Duration.ofMinutes(10);
        if (nodeId == null || nodeId.isBlank()) nodeId = "node-1";
        if (drainBatchSize <= 0) drainBatchSize = 100;
        if (workerPollTimeout == null) workerPollTimeout = Duration.ofMillis(500);
        if (workersEnabled == null) workersEnabled = true;
        if (recoveryEnabled == null) recoveryEnabled = true;
    }

    public Duration timeoutFor(PipelineStage stage) {
        return switch (stage) {
            case FETCH -> fetchTimeout;
            case SUMMARIZE -> summarizeTimeout;
            case EMBED -> embedTimeout;
            case LINK -> linkTimeout;
        };
    }
}
