package com.adapterhost.adapters.llm;

/**
 * Text completion model. Calls are one-shot: the whole completion comes back in one response.
 */
public interface Llm {

    /**
     * @param options model, sampling and length settings, or null for the adapter's defaults
     */
    LlmResponse complete(String prompt, LlmOptions options);

    default LlmResponse complete(String prompt) {
        return complete(prompt, null);
    }
}
