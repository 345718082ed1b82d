package dev.pagegraph.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Canonical topic node. normalizedLabel is unique; label keeps the first-seen spelling.
 */
@Entity
@Table(name = "concept_nodes")
public class ConceptNode {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "normalized_label", nullable = false, unique = true)
    private String normalizedLabel;

    @Column(nullable = false)
    private String label;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ConceptNode() {
    }

    public static ConceptNode create(String normalizedLabel, String label, Instant now) {
        ConceptNode n = new ConceptNode();
        n.id = UUID.randomUUID();
        n.normalizedLabel = normalizedLabel;
        n.label = label;
        n.createdAt = now;
        return n;
    }

    public UUID getId() {
        return id;
    }

    public String getNormalizedLabel() {
        return normalizedLabel;
    }

    public String getLabel() {
        return label;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
