package dev.pagegraph.knowledge;

/**
 * Cosine similarity over float vectors.
 */
public final class VectorMath {

    private VectorMath() {}

    /**
     * @return cosine of the angle between {@code a} and {@code b}; 0 when either has zero length
     * @throws IllegalArgumentException if the dimensions differ
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("dimension mismatch: %d vs %d".formatted(a.length, b.length));
        }
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) return 0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
