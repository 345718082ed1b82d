package dev.pagegraph.capability;

import dev.pagegraph.exception.EmbedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Embeds through the configured Spring AI {@link EmbeddingModel}. The model version string
 * is whatever the deployment names it in configuration; this adapter only carries it.
 */
public class SpringAiEmbeddingAdapter implements EmbeddingAdapter {

    private final EmbeddingModel embeddingModel;

    public SpringAiEmbeddingAdapter(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    @CircuitBreaker(name = "embedder")
    public float[] embed(String text, String modelVersion) {
        float[] vector;
        try {
            vector = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            throw new EmbedException("Embedding model %s failed: %s".formatted(modelVersion, e.getMessage()), e);
        }
        if (vector == null || vector.length == 0) {
            throw new EmbedException("Embedding model %s returned an empty vector".formatted(modelVersion));
        }
        return vector;
    }
}
