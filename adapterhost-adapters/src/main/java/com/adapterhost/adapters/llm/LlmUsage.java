package com.adapterhost.adapters.llm;

public record LlmUsage(int promptTokens, int completionTokens) {

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
