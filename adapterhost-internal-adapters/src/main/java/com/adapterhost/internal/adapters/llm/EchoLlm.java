package com.adapterhost.internal.adapters.llm;

import com.adapterhost.adapters.llm.Llm;
import com.adapterhost.adapters.llm.LlmOptions;
import com.adapterhost.adapters.llm.LlmResponse;
import com.adapterhost.adapters.llm.LlmUsage;

import java.util.Arrays;
import java.util.Objects;

/**
 * Model stand-in that answers {@code "ECHO: " + prompt}. The reply honours {@code stop} (cut before
 * the first stop sequence) and {@code maxTokens} (whitespace-separated tokens kept); token counts
 * are whitespace-separated words.
 */
public final class EchoLlm implements Llm {

    static final String PREFIX = "ECHO: ";

    private final String defaultModel;

    public EchoLlm(String defaultModel) {
        this.defaultModel = Objects.requireNonNull(defaultModel, "defaultModel");
    }

    @Override
    public LlmResponse complete(String prompt, LlmOptions options) {
        Objects.requireNonNull(prompt, "prompt");
        LlmOptions opts = options != null ? options : LlmOptions.defaults();
        String content = PREFIX + prompt.trim();
        if (opts.stop() != null) {
            for (String stop : opts.stop()) {
                int at = stop.isEmpty() ? -1 : content.indexOf(stop);
                if (at >= 0) content = content.substring(0, at);
            }
        }
        if (opts.maxTokens() != null) {
            content = firstTokens(content, opts.maxTokens());
        }
        int promptTokens = countTokens(prompt) + countTokens(opts.systemPrompt());
        String model = opts.model() != null ? opts.model() : defaultModel;
        return new LlmResponse(content, new LlmUsage(promptTokens, countTokens(content)), model);
    }

    static int countTokens(String text) {
        if (text == null || text.isBlank()) return 0;
        return text.trim().split("\\s+").length;
    }

    private static String firstTokens(String text, int max) {
        if (max <= 0) return "";
        String[] tokens = text.trim().split("\\s+");
        if (tokens.length <= max) return text;
        return String.join(" ", Arrays.copyOf(tokens, max));
    }
}
