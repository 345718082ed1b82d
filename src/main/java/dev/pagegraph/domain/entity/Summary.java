package dev.pagegraph.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Condensation of a Document. Concept labels keep the order the summarizer produced.
 */
@Entity
@Table(name = "summaries", indexes = {
        @Index(name = "idx_summary_visit", columnList = "visit_id, current_version")
})
public class Summary {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "visit_id", nullable = false, columnDefinition = "uuid")
    private UUID visitId;

    @Column(name = "document_id", nullable = false, columnDefinition = "uuid")
    private UUID documentId;

    @Column(name = "summary_text", nullable = false, columnDefinition = "text")
    private String text;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "summary_concepts", joinColumns = @JoinColumn(name = "summary_id"))
    @OrderColumn(name = "position")
    @Column(name = "label", nullable = false)
    private List<String> concepts = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "current_version", nullable = false)
    private boolean current;

    protected Summary() {
    }

    public static Summary create(UUID visitId, UUID documentId, String text, List<String> concepts, Instant now) {
        Summary s = new Summary();
        s.id = UUID.randomUUID();
        s.visitId = visitId;
        s.documentId = documentId;
        s.text = text;
        s.concepts = new ArrayList<>(concepts);
        s.createdAt = now;
        s.current = true;
        return s;
    }

    public UUID getId() {
        return id;
    }

    public UUID getVisitId() {
        return visitId;
    }

    public UUID getDocumentId() {
        return documentId;
    }

    public String getText() {
        return text;
    }

    public List<String> getConcepts() {
        return List.copyOf(concepts);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isCurrent() {
        return current;
    }
}
