package dev.pagegraph.domain.entity;

import dev.pagegraph.domain.enums.EmbeddingSource;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Fixed-length vector for a Visit revision, tagged with the model version that produced
 * it. Vectors of different model versions are never compared.
 */
@Entity
@Table(name = "embeddings", indexes = {
        @Index(name = "idx_embedding_visit", columnList = "visit_id, current_version"),
        @Index(name = "idx_embedding_model", columnList = "model_version")
})
public class Embedding {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "visit_id", nullable = false, columnDefinition = "uuid")
    private UUID visitId;

    @Column(name = "model_version", nullable = false, length = 128)
    private String modelVersion;

    @Column(nullable = false)
    private int dimensions;

    @Convert(converter = VectorConverter.class)
    @Column(name = "vector", nullable = false, columnDefinition = "bytea")
    private float[] vector;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 20)
    private EmbeddingSource source;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "current_version", nullable = false)
    private boolean current;

    protected Embedding() {
    }

    public static Embedding create(UUID visitId, String modelVersion, float[] vector,
                                   EmbeddingSource source, Instant now) {
        if (vector == null || vector.length == 0) throw new IllegalArgumentException("vector required");
        Embedding e = new Embedding();
        e.id = UUID.randomUUID();
        e.visitId = visitId;
        e.modelVersion = modelVersion;
        e.dimensions = vector.length;
        e.vector = vector.clone();
        e.source = source;
        e.createdAt = now;
        e.current = true;
        return e;
    }

    public UUID getId() {
        return id;
    }

    public UUID getVisitId() {
        return visitId;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public int getDimensions() {
        return dimensions;
    }

    public float[] getVector() {
        return vector.clone();
    }

    public EmbeddingSource getSource() {
        return source;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isCurrent() {
        return current;
    }
}
