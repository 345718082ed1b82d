package dev.pagegraph.domain.enums;

/**
 * Typed graph relations. Symmetric kinds are stored with their endpoints in canonical order.
 */
public enum EdgeKind {
    /** Visit → ConceptNode. */
    ABOUT(false),
    /** ConceptNode ↔ ConceptNode, reinforced by co-occurrence. */
    RELATED_TO(true),
    /** Visit ↔ Visit, weighted by embedding similarity. */
    SIMILAR_TO(true);

    private final boolean symmetric;

    EdgeKind(boolean symmetric) {
        this.symmetric = symmetric;
    }

    public boolean isSymmetric() {
        return symmetric;
    }
}
