package dev.pagegraph.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Fetched and extracted page content for one Visit revision. A re-fetch of the same
 * revision supersedes (current = false) rather than deletes.
 */
@Entity
@Table(name = "documents", indexes = {
        @Index(name = "idx_document_visit", columnList = "visit_id, current_version")
})
public class Document {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "visit_id", nullable = false, columnDefinition = "uuid")
    private UUID visitId;

    @Column(name = "raw_text", nullable = false, columnDefinition = "text")
    private String text;

    @Column(name = "extraction_method", nullable = false, length = 64)
    private String extractionMethod;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(nullable = false)
    private boolean truncated;

    @Column(name = "fetched_at", nullable = false)
    private Instant fetchedAt;

    @Column(name = "current_version", nullable = false)
    private boolean current;

    protected Document() {
    }

    public static Document create(UUID visitId, String text, String extractionMethod,
                                  String contentHash, boolean truncated, Instant fetchedAt) {
        Document d = new Document();
        d.id = UUID.randomUUID();
        d.visitId = visitId;
        d.text = text;
        d.extractionMethod = extractionMethod;
        d.contentHash = contentHash;
        d.truncated = truncated;
        d.fetchedAt = fetchedAt;
        d.current = true;
        return d;
    }

    public UUID getId() {
        return id;
    }

    public UUID getVisitId() {
        return visitId;
    }

    public String getText() {
        return text;
    }

    public String getExtractionMethod() {
        return extractionMethod;
    }

    public String getContentHash() {
        return contentHash;
    }

    public boolean isTruncated() {
        return truncated;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    public boolean isCurrent() {
        return current;
    }
}
