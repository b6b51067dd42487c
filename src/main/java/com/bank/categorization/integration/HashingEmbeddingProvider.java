package com.bank.categorization.integration;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Local embedding by feature hashing: each lower-cased token and each adjacent
 * token pair is hashed into a fixed number of buckets, then the vector is
 * L2-normalized. Texts sharing vocabulary land close together under cosine
 * similarity, which is all the rationale lookup needs without a model.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private final int dimensions;

    public HashingEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed blank text");
        }
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+");
        float[] vector = new float[dimensions];
        String previous = null;
        for (String token : tokens) {
            if (token.isEmpty()) continue;
            add(vector, token, 1.0f);
            if (previous != null) {
                add(vector, previous + " " + token, 0.5f);
            }
            previous = token;
        }

        double norm = 0;
        for (float v : vector) norm += v * v;
        if (norm == 0) {
            throw new EmbeddingException("No embeddable tokens in text");
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
        return vector;
    }

    public int dimensions() {
        return dimensions;
    }

    private void add(float[] vector, String feature, float weight) {
        CRC32 crc = new CRC32();
        crc.update(feature.getBytes(StandardCharsets.UTF_8));
        long hash = crc.getValue();
        int bucket = (int) (hash % dimensions);
        // high bit picks the sign so collisions tend to cancel
        float sign = ((hash >>> 31) & 1) == 0 ? 1f : -1f;
        vector[bucket] += sign * weight;
    }
}
