package com.adapterhost.adapters.embeddings;

import java.util.List;

/**
 * Text embedding model.
 */
public interface Embeddings {

    float[] embed(String text);

    /** One vector per input, in input order. */
    List<float[]> embedBatch(List<String> texts);

    /** Length of every vector this model returns. */
    int getDimensions();
}
