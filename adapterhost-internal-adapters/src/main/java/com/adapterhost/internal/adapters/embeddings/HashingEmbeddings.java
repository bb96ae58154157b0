package com.adapterhost.internal.adapters.embeddings;

import com.adapterhost.adapters.embeddings.Embeddings;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic bag-of-words embeddings: every lower-cased token is hashed (FNV-1a) into one of
 * {@code dimensions} buckets with a hash-derived sign, and the result is L2-normalized. Texts sharing
 * words get similar vectors, which is enough for local development and tests.
 */
public final class HashingEmbeddings implements Embeddings {

    public static final int DEFAULT_DIMENSIONS = 64;

    private static final int FNV_OFFSET = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private final int dimensions;

    public HashingEmbeddings() {
        this(DEFAULT_DIMENSIONS);
    }

    public HashingEmbeddings(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimensions];
        if (text == null) return vector;
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.isEmpty()) continue;
            int hash = fnv1a(token);
            int bucket = Math.floorMod(hash, dimensions);
            vector[bucket] += (hash & 0x80000000) == 0 ? 1f : -1f;
        }
        double norm = 0;
        for (float v : vector) norm += v * v;
        if (norm > 0) {
            float scale = (float) (1 / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) vector[i] *= scale;
        }
        return vector;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (String text : texts) {
            out.add(embed(text));
        }
        return out;
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    private static int fnv1a(String token) {
        int hash = FNV_OFFSET;
        for (byte b : token.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xff;
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
