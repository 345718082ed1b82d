package dev.pagegraph.service;

import dev.pagegraph.domain.valueobject.VisitSnapshot;
import dev.pagegraph.pipeline.VisitLedger;
import org.springframework.stereotype.Service;

import java.net.IDN;
import java.util.Locale;
import java.util.UUID;

/**
 * User-initiated cancellation, for one Visit or for every in-flight Visit of a domain
 * (monitoring disabled for that domain). Takes effect at the next stage boundary.
 */
@Service
public class VisitCancellationService {

    private final VisitLedger ledger;

    public VisitCancellationService(VisitLedger ledger) {
        this.ledger = ledger;
    }

    public VisitSnapshot cancel(UUID visitId) {
        return ledger.requestCancel(visitId);
    }

    /** @return number of Visits cancelled or flagged for cancellation */
    public int cancelHost(String host) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host is required");
        }
        String normalized = IDN.toASCII(host.strip().toLowerCase(Locale.ROOT), IDN.ALLOW_UNASSIGNED);
        return ledger.cancelHost(normalized);
    }
}
