package com.adapterhost.internal.adapters.llm;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.loader.AdapterDependencies;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.AdapterSettings;

/** Settings: {@code model} (reported when a call names none; default {@code echo}). */
public final class EchoLlmModule implements AdapterModule {

    public static final String ID = "echo-llm";

    private static final AdapterManifest MANIFEST = AdapterManifest.builder(ID, AdapterTokens.LLM)
            .name("Echo LLM")
            .version("1.0.0")
            .description("Deterministic completion model that echoes the prompt")
            .build();

    @Override
    public AdapterManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Object create(AdapterSettings settings, AdapterDependencies dependencies) {
        return new EchoLlm(settings.getString("model", "echo"));
    }
}
