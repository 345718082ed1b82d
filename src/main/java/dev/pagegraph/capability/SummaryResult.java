package dev.pagegraph.capability;

import java.util.List;

/**
 * Summary text and concept labels in the order the summarizer ranked them.
 */
public record SummaryResult(String summary, List<String> concepts) {
    public SummaryResult {
        if (summary == null) throw new IllegalArgumentException("summary is required");
        concepts = concepts == null ? List.of() : List.copyOf(concepts);
    }
}
