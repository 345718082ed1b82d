package dev.pagegraph.capability;

import dev.pagegraph.exception.EmbedException;
import dev.pagegraph.knowledge.VectorMath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HashingEmbeddingAdapterTest {

    private final HashingEmbeddingAdapter adapter = new HashingEmbeddingAdapter(256);

    @Test
    @DisplayName("produces a unit vector of the configured dimension")
    void unitVector() {
        float[] v = adapter.embed("Neural networks learn representations", "hashing-v1");

        assertThat(v).hasSize(256);
        assertThat(VectorMath.cosine(v, v)).isCloseTo(1.0, within(1e-6));
        double norm = 0;
        for (float x : v) norm += x * x;
        assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-5));
    }

    @Test
    void deterministic() {
        assertThat(adapter.embed("Kafka consumer groups", "v"))
                .containsExactly(adapter.embed("kafka CONSUMER groups", "v"));
    }

    @Test
    @DisplayName("texts sharing vocabulary are closer than unrelated texts")
    void sharedVocabularyIsCloser() {
        float[] a = adapter.embed("neural networks learn representations from training data", "v");
        float[] b = adapter.embed("neural networks learn features from training data", "v");
        float[] c = adapter.embed("slow fermented sourdough bread with a crisp crust", "v");

        assertThat(VectorMath.cosine(a, b)).isGreaterThan(VectorMath.cosine(a, c));
        assertThat(VectorMath.cosine(a, b)).isGreaterThan(0.5);
    }

    @Test
    void rejectsTextWithoutTokens() {
        assertThatThrownBy(() -> adapter.embed("  ", "v")).isInstanceOf(EmbedException.class);
        assertThatThrownBy(() -> adapter.embed("!!! ---", "v")).isInstanceOf(EmbedException.class);
    }

    @Test
    void rejectsTinyDimensions() {
        assertThatThrownBy(() -> new HashingEmbeddingAdapter(4)).isInstanceOf(IllegalArgumentException.class);
    }
}
