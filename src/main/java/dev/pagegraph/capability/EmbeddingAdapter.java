package dev.pagegraph.capability;

/**
 * Produces a fixed-length vector for a text. The model version is recorded with the
 * vector; vectors of different versions are never compared.
 * Failures are reported as {@link dev.pagegraph.exception.EmbedException}.
 */
public interface EmbeddingAdapter {

    float[] embed(String text, String modelVersion);
}
