package com.adapterhost.adapters.llm;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/** Per-call completion settings; null fields fall back to the adapter's defaults. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmOptions(String model, Double temperature, Integer maxTokens, List<String> stop, String systemPrompt) {

    public LlmOptions {
        stop = stop != null ? List.copyOf(stop) : null;
    }

    public static LlmOptions defaults() {
        return new LlmOptions(null, null, null, null, null);
    }

    public LlmOptions withModel(String model) {
        return new LlmOptions(model, temperature, maxTokens, stop, systemPrompt);
    }

    public LlmOptions withTemperature(double temperature) {
        return new LlmOptions(model, temperature, maxTokens, stop, systemPrompt);
    }

    public LlmOptions withMaxTokens(int maxTokens) {
        return new LlmOptions(model, temperature, maxTokens, stop, systemPrompt);
    }

    public LlmOptions withStop(List<String> stop) {
        return new LlmOptions(model, temperature, maxTokens, stop, systemPrompt);
    }

    public LlmOptions withSystemPrompt(String systemPrompt) {
        return new LlmOptions(model, temperature, maxTokens, stop, systemPrompt);
    }
}
