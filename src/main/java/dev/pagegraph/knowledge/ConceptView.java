package dev.pagegraph.knowledge;

import java.util.List;
import java.util.UUID;

/** A ConceptNode and the served pages about it, strongest first. */
public record ConceptView(UUID id, String label, String normalizedLabel, List<Page> pages) {

    public record Page(UUID visitId, String url, double weight) {}
}
