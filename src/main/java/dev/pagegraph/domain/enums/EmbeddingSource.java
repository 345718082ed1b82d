package dev.pagegraph.domain.enums;

/** Which text an embedding was computed from. */
public enum EmbeddingSource {
    SUMMARY, DOCUMENT
}
