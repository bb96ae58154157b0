package com.adapterhost.proxy;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.embeddings.Embeddings;
import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.transport.AdapterTransport;
import com.adapterhost.ipc.transport.CallOptions;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;

public final class EmbeddingsProxy extends RemoteAdapter implements Embeddings {

    private static final TypeReference<List<float[]>> VECTORS = new TypeReference<>() { };

    public EmbeddingsProxy(AdapterTransport transport, WireCodec codec) {
        this(AdapterTokens.EMBEDDINGS, transport, codec, null);
    }

    public EmbeddingsProxy(String token, AdapterTransport transport, WireCodec codec, CallOptions callOptions) {
        super(token, transport, codec, callOptions);
    }

    @Override
    public float[] embed(String text) {
        return call(float[].class, "embed", text);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        return call(VECTORS, "embedBatch", texts);
    }

    @Override
    public int getDimensions() {
        Integer dimensions = call(Integer.class, "getDimensions");
        return dimensions != null ? dimensions : 0;
    }
}
