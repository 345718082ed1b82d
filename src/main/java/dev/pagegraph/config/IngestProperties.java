package dev.pagegraph.config;

import dev.pagegraph.domain.enums.VisitSource;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Gateway and dedup policy. coolDown collapses rapid repeats into one Visit;
 * reprocessInterval decides when a finished page is worth processing again.
 */
@ConfigurationProperties(prefix = "pagegraph.ingest")
public record IngestProperties(Duration coolDown,
                               Duration reprocessInterval,
                               int maxUrlLength,
                               List<String> strippedQueryParams,
                               Boolean keepHashBangFragments,
                               VisitSource defaultSource,
                               Duration offerTimeout) {
    public IngestProperties {
        if (coolDown == null) coolDown = Duration.ofMinutes(10);
        if (reprocessInterval == null) reprocessInterval = Duration.ofDays(7);
        if (maxUrlLength <= 0) maxUrlLength = 2048;
        if (strippedQueryParams == null) strippedQueryParams = List.of("utm_*", "fbclid", "gclid");
        if (keepHashBangFragments == null) keepHashBangFragments = true;
        if (defaultSource == null) defaultSource = VisitSource.FULL_LOAD;
        if (offerTimeout == null) offerTimeout = Duration.ZERO;
    }
}
