package dev.pagegraph.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Body of {@code POST /ingest}. Also accepts the field names older capture clients send
 * ({@code tab_id}, {@code timestamp}). Validation happens in the gateway so that a bad
 * event is answered with a Rejected acknowledgement rather than a bare 400.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IngestRequest(
        String url,
        @JsonAlias({"tab_id", "tabId", "clientTabRef"}) String tabRef,
        @JsonAlias({"timestamp"}) Instant observedAt,
        String source
) {}
