package com.example.curator.rag.provider;

import com.example.curator.rag.model.AiProvider;

/**
 * The embedding model returned a vector whose length does not match what the vector backend
 * was populated with for that provider.
 */
public class EmbeddingDimensionMismatchException extends RuntimeException {

    private final AiProvider provider;
    private final int expected;
    private final int actual;

    public EmbeddingDimensionMismatchException(AiProvider provider, int expected, int actual) {
        super("Embedding from %s has dimension %d, expected %d".formatted(provider.value(), actual, expected));
        this.provider = provider;
        this.expected = expected;
        this.actual = actual;
    }

    public AiProvider getProvider() {
        return provider;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
