package dev.pagegraph.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record SimilarityQueryRequest(
        @NotEmpty List<Float> vector,
        @Min(1) @Max(100) Integer k,
        String modelVersion
) {
    public float[] vectorArray() {
        float[] v = new float[vector.size()];
        for (int i = 0; i < v.length; i++) v[i] = vector.get(i);
        return v;
    }

    public int kOrDefault() {
        return k == null ? 10 : k;
    }
}
