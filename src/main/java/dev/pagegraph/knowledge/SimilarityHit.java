package dev.pagegraph.knowledge;

import java.util.UUID;

/** One nearest-neighbor result: a served Visit and its cosine similarity to the query. */
public record SimilarityHit(UUID visitId, String url, double score) {}
