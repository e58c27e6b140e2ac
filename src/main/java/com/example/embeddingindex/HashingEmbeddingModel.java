package com.example.embeddingindex;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Locale;

/**
 * Deterministic stand-in for a real model: texts are feature-hashed by token,
 * images by content. Texts sharing words land close together, which is enough
 * for local runs and tests.
 */
@Service
@ConditionalOnProperty(prefix = "embedding", name = "cli.enabled", havingValue = "false", matchIfMissing = true)
public class HashingEmbeddingModel implements EmbeddingModel {

    private final int dimension;

    public HashingEmbeddingModel(@Value("${embedding.hashing.dimension:64}") int dimension) {
        if (dimension < 1) throw new IllegalArgumentException("embedding.hashing.dimension must be >= 1");
        this.dimension = dimension;
    }

    @Override
    public float[] embedText(String text) {
        float[] v = new float[dimension];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.isEmpty()) continue;
            int h = token.hashCode();
            int slot = Math.floorMod(h, dimension);
            v[slot] += (h & 0x40000000) == 0 ? 1f : -1f;
        }
        return nonZero(v, text.hashCode());
    }

    @Override
    public float[] embedImage(byte[] image, String contentType) {
        return nonZero(new float[dimension], Arrays.hashCode(image));
    }

    // pseudo values in [-1,1] seeded by h when nothing else filled the vector
    private float[] nonZero(float[] v, int h) {
        for (float f : v) {
            if (f != 0f) return v;
        }
        for (int i = 0; i < dimension; i++) {
            h = 31 * h + i;
            v[i] = ((h % 1000) - 500) / 500.0f;
        }
        for (float f : v) {
            if (f != 0f) return v;
        }
        v[0] = 1f;
        return v;
    }
}
