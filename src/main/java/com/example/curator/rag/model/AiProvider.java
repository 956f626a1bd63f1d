package com.example.curator.rag.model;

import java.util.Locale;
import java.util.Optional;

/**
 * External model providers that can back completion and embedding calls.
 * The value is what the settings store holds and what match_documents filters on.
 */
public enum AiProvider {
    GEMINI("gemini"),
    OPENAI("openai");

    private final String value;

    AiProvider(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<AiProvider> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AiProvider provider : values()) {
            if (provider.value.equals(normalized)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
