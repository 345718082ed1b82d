package dev.pagegraph.capability;

import dev.pagegraph.exception.EmbedException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Feature-hashing embedder: lowercased tokens and adjacent-token pairs hashed into a fixed
 * number of buckets, then L2-normalized. Texts sharing vocabulary land close together,
 * which is enough for offline use and tests.
 */
public class HashingEmbeddingAdapter implements EmbeddingAdapter {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}0-9]+");

    private final int dimensions;

    public HashingEmbeddingAdapter(int dimensions) {
        if (dimensions < 8) throw new IllegalArgumentException("dimensions must be at least 8");
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(String text, String modelVersion) {
        if (text == null || text.isBlank()) {
            throw new EmbedException("Nothing to embed");
        }
        float[] v = new float[dimensions];
        Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        String previous = null;
        while (m.find()) {
            String token = m.group();
            add(v, token, 1.0f);
            if (previous != null) add(v, previous + ' ' + token, 0.5f);
            previous = token;
        }
        double norm = 0.0;
        for (float x : v) norm += x * x;
        if (norm == 0.0) {
            throw new EmbedException("No tokens to embed");
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < v.length; i++) v[i] /= (float) norm;
        return v;
    }

    private void add(float[] v, String feature, float weight) {
        int h = feature.hashCode();
        int idx = Math.floorMod(h, dimensions);
        // sign bit from a second mix keeps collisions from only ever adding up
        float sign = ((h >>> 16) & 1) == 0 ? 1f : -1f;
        v[idx] += sign * weight;
    }
}
