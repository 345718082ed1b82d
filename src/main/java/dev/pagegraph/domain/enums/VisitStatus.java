package dev.pagegraph.domain.enums;

/**
 * Lifecycle: PENDING → FETCHING → SUMMARIZING → EMBEDDING → LINKING → DONE | FAILED
 *
 * <p>FAILED is terminal only once no retry is scheduled; see {@code Visit#isTerminal()}.
 */
public enum VisitStatus {
    PENDING, FETCHING, SUMMARIZING, EMBEDDING, LINKING, DONE, FAILED;

    public boolean isStageInProgress() {
        return this == FETCHING || this == SUMMARIZING || this == EMBEDDING || this == LINKING;
    }
}
