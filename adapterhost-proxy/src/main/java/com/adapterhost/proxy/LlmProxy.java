package com.adapterhost.proxy;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.llm.Llm;
import com.adapterhost.adapters.llm.LlmOptions;
import com.adapterhost.adapters.llm.LlmResponse;
import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.transport.AdapterTransport;
import com.adapterhost.ipc.transport.CallOptions;

public final class LlmProxy extends RemoteAdapter implements Llm {

    public LlmProxy(AdapterTransport transport, WireCodec codec) {
        this(AdapterTokens.LLM, transport, codec, null);
    }

    public LlmProxy(String token, AdapterTransport transport, WireCodec codec, CallOptions callOptions) {
        super(token, transport, codec, callOptions);
    }

    @Override
    public LlmResponse complete(String prompt, LlmOptions options) {
        return call(LlmResponse.class, "complete", prompt, options);
    }
}
