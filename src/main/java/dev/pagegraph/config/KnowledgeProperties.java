package dev.pagegraph.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Knowledge store limits and linking policy.
 */
@ConfigurationProperties(prefix = "pagegraph.knowledge")
public record KnowledgeProperties(int maxDocumentChars,
                                  int maxConceptsPerVisit,
                                  double similarityThreshold,
                                  int candidateLimit,
                                  String embeddingModelVersion,
                                  int traversalMaxNodes,
                                  int traversalMaxDepth) {
    public KnowledgeProperties {
        if (maxDocumentChars <= 0) maxDocumentChars = 100_000;
        if (maxConceptsPerVisit <= 0) maxConceptsPerVisit = 12;
        if (similarityThreshold <= 0) similarityThreshold = 0.75;
        if (candidateLimit <= 0) candidateLimit = 50;
        if (embeddingModelVersion == null || embeddingModelVersion.isBlank()) embeddingModelVersion = "hashing-v1";
        if (traversalMaxNodes <= 0) traversalMaxNodes = 500;
        if (traversalMaxDepth <= 0) traversalMaxDepth = 4;
    }
}
