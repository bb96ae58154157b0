package com.adapterhost.internal.adapters.embeddings;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HashingEmbeddingsTest {

    private final HashingEmbeddings embeddings = new HashingEmbeddings(32);

    @Test
    void embed_isDeterministicAndNormalized() {
        float[] a = embeddings.embed("The quick brown fox");
        float[] b = new HashingEmbeddings(32).embed("the QUICK brown fox!");

        assertArrayEquals(a, b);
        assertEquals(32, a.length);
        assertEquals(1.0, norm(a), 1e-5);
    }

    @Test
    void embed_sharedWordsScoreHigherThanUnrelatedText() {
        float[] query = embeddings.embed("vector search engine");
        double related = dot(query, embeddings.embed("a search engine for vectors and vector data"));
        double unrelated = dot(query, embeddings.embed("chocolate cake recipe"));
        assertTrue(related > unrelated);
    }

    @Test
    void embed_emptyTextIsZeroVector() {
        assertEquals(0.0, norm(embeddings.embed("  ")), 0.0);
    }

    @Test
    void embedBatch_keepsOrder() {
        List<float[]> batch = embeddings.embedBatch(List.of("one", "two"));
        assertArrayEquals(embeddings.embed("one"), batch.get(0));
        assertArrayEquals(embeddings.embed("two"), batch.get(1));
    }

    @Test
    void constructor_rejectsNonPositiveDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new HashingEmbeddings(0));
    }

    private static double norm(float[] v) {
        return Math.sqrt(dot(v, v));
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) sum += a[i] * b[i];
        return sum;
    }
}
