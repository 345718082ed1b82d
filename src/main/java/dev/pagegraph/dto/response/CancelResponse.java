package dev.pagegraph.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pagegraph.domain.enums.VisitStatus;

import java.util.UUID;

/**
 * {@code applied} is true when the Visit is already Failed(Cancelled); false when a worker
 * holds it and will stop at the next stage boundary.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CancelResponse(UUID visitId, String host, Integer affected, Boolean applied, VisitStatus status) {

    public static CancelResponse forVisit(UUID visitId, boolean applied, VisitStatus status) {
        return new CancelResponse(visitId, null, null, applied, status);
    }

    public static CancelResponse forHost(String host, int affected) {
        return new CancelResponse(null, host, affected, null, null);
    }
}
