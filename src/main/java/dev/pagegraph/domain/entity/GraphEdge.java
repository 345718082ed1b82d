package dev.pagegraph.domain.entity;

import dev.pagegraph.domain.enums.EdgeKind;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Weighted, typed relation. Weight only grows: every increment is backed by one
 * {@link EdgeEvidence} row, and increments are applied with an atomic update query.
 */
@Entity
@Table(name = "graph_edges",
        uniqueConstraints = @UniqueConstraint(name = "uq_edge_endpoints",
                columnNames = {"kind", "source_id", "target_id"}),
        indexes = {
                @Index(name = "idx_edge_source", columnList = "source_id"),
                @Index(name = "idx_edge_target", columnList = "target_id")
        })
public class GraphEdge {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EdgeKind kind;

    @Column(name = "source_id", nullable = false, columnDefinition = "uuid")
    private UUID sourceId;

    @Column(name = "target_id", nullable = false, columnDefinition = "uuid")
    private UUID targetId;

    @Column(nullable = false)
    private double weight;

    @Column(name = "evidence_count", nullable = false)
    private int evidenceCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected GraphEdge() {
    }

    /** A new edge starts at weight zero; weight arrives only through evidence. */
    public static GraphEdge create(EdgeKind kind, UUID sourceId, UUID targetId, Instant now) {
        GraphEdge e = new GraphEdge();
        e.id = UUID.randomUUID();
        e.kind = kind;
        e.sourceId = sourceId;
        e.targetId = targetId;
        e.weight = 0.0;
        e.evidenceCount = 0;
        e.createdAt = now;
        e.updatedAt = now;
        return e;
    }

    public UUID otherEnd(UUID nodeId) {
        return sourceId.equals(nodeId) ? targetId : sourceId;
    }

    public UUID getId() {
        return id;
    }

    public EdgeKind getKind() {
        return kind;
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public UUID getTargetId() {
        return targetId;
    }

    public double getWeight() {
        return weight;
    }

    public int getEvidenceCount() {
        return evidenceCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
