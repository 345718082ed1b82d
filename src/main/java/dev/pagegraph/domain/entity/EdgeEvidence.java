package dev.pagegraph.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One piece of evidence behind an edge weight. (edge, evidenceKey) is unique, which is
 * what makes re-running Link for the same Visit a no-op.
 */
@Entity
@Table(name = "edge_evidence",
        uniqueConstraints = @UniqueConstraint(name = "uq_edge_evidence", columnNames = {"edge_id", "evidence_key"}))
public class EdgeEvidence {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "edge_id", nullable = false, columnDefinition = "uuid")
    private UUID edgeId;

    @Column(name = "evidence_key", nullable = false, length = 128)
    private String evidenceKey;

    @Column(nullable = false)
    private double weight;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    protected EdgeEvidence() {
    }

    public static EdgeEvidence of(UUID edgeId, String evidenceKey, double weight, Instant now) {
        EdgeEvidence e = new EdgeEvidence();
        e.edgeId = edgeId;
        e.evidenceKey = evidenceKey;
        e.weight = weight;
        e.recordedAt = now;
        return e;
    }

    public Long getId() {
        return id;
    }

    public UUID getEdgeId() {
        return edgeId;
    }

    public String getEvidenceKey() {
        return evidenceKey;
    }

    public double getWeight() {
        return weight;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }
}
