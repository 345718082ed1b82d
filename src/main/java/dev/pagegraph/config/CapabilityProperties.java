package dev.pagegraph.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Capability back-end selection. summarizer: spring-ai | heuristic; embedder: spring-ai | hashing.
 */
@ConfigurationProperties(prefix = "pagegraph.capabilities")
public record CapabilityProperties(String summarizer,
                                   String embedder,
                                   int hashingDimensions,
                                   Duration fetchConnectTimeout,
                                   Duration fetchResponseTimeout,
                                   String userAgent,
                                   int maxFetchBytes,
                                   int maxSummaryInputChars,
                                   int maxOutputTokens) {
    public CapabilityProperties {
        if (summarizer == null || summarizer.isBlank()) summarizer = "heuristic";
        if (embedder == null || embedder.isBlank()) embedder = "hashing";
        if (hashingDimensions <= 0) hashingDimensions = 256;
        if (fetchConnectTimeout == null) fetchConnectTimeout = Duration.ofSeconds(10);
        if (fetchResponseTimeout == null) fetchResponseTimeout = Duration.ofSeconds(20);
        if (userAgent == null || userAgent.isBlank()) userAgent = "pagegraph/0.1 (+knowledge-pipeline)";
        if (maxFetchBytes <= 0) maxFetchBytes = 2 * 1024 * 1024;
        if (maxSummaryInputChars <= 0) maxSummaryInputChars = 16_000;
        if (maxOutputTokens <= 0) maxOutputTokens = 1024;
    }
}
