package com.aijudge.provider;

import java.util.Map;

/**
 * Fully-resolved payload for one completion call.
 */
public record CompletionRequest(
        String prompt,
        String systemPrompt,
        double temperature,
        int maxTokens,
        Map<String, Object> options
) {
    public static final String OPTION_FORMAT = "format";
    public static final String FORMAT_JSON = "json";

    public CompletionRequest {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt is required");
        }
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        if (temperature < 0.0d) {
            throw new IllegalArgumentException("temperature must not be negative");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be greater than zero");
        }
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public CompletionRequest(String prompt, String systemPrompt, double temperature, int maxTokens) {
        this(prompt, systemPrompt, temperature, maxTokens, Map.of());
    }

    public boolean wantsJson() {
        return FORMAT_JSON.equals(options.get(OPTION_FORMAT));
    }
}
