package com.example.curator.rag.provider;

import com.example.curator.rag.model.AiProvider;

/**
 * Deterministic text completion backed by one provider.
 */
public interface TextCompleter {

    AiProvider provider();

    /**
     * Sends the instruction and the user message and returns the raw model text.
     * Provider failures are thrown as-is.
     */
    String complete(String systemInstruction, String userMessage);
}
