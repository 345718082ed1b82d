package dev.pagegraph.domain.entity;

import dev.pagegraph.domain.enums.VisitSource;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only log entry for one accepted event. Never updated after insert; the
 * events linked to a Visit are that Visit's occurrences.
 */
@Entity
@Table(name = "visit_events", indexes = {
        @Index(name = "idx_event_fingerprint", columnList = "fingerprint"),
        @Index(name = "idx_event_visit", columnList = "visit_id, observed_at")
})
public class VisitEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64, updatable = false)
    private String fingerprint;

    @Column(nullable = false, length = 2048, updatable = false)
    private String url;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private VisitSource source;

    @Column(name = "client_tab_ref", length = 256, updatable = false)
    private String clientTabRef;

    @Column(name = "observed_at", nullable = false, updatable = false)
    private Instant observedAt;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(name = "visit_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID visitId;

    protected VisitEventRecord() {
    }

    public static VisitEventRecord of(String fingerprint, String url, VisitSource source, String clientTabRef,
                                      Instant observedAt, Instant receivedAt, UUID visitId) {
        VisitEventRecord e = new VisitEventRecord();
        e.fingerprint = fingerprint;
        e.url = url;
        e.source = source;
        e.clientTabRef = clientTabRef;
        e.observedAt = observedAt;
        e.receivedAt = receivedAt;
        e.visitId = visitId;
        return e;
    }

    public Long getId() {
        return id;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getUrl() {
        return url;
    }

    public VisitSource getSource() {
        return source;
    }

    public String getClientTabRef() {
        return clientTabRef;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public UUID getVisitId() {
        return visitId;
    }
}
