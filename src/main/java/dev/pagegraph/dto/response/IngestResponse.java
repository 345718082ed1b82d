package dev.pagegraph.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pagegraph.domain.enums.IngestStatus;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestResponse(boolean accepted, String fingerprint, IngestStatus status,
                             String reason, UUID visitId) {}
