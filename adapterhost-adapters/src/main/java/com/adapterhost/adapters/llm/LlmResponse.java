package com.adapterhost.adapters.llm;

public record LlmResponse(String content, LlmUsage usage, String model) {
}
