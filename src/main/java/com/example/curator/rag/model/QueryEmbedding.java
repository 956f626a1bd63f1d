package com.example.curator.rag.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Query vector together with the provider whose model produced it.
 */
public record QueryEmbedding(AiProvider provider, float[] vector) {

    public QueryEmbedding {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(vector, "vector");
        vector = vector.clone();
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryEmbedding other)) return false;
        return provider == other.provider && Arrays.equals(vector, other.vector);
    }

    @Override
    public int hashCode() {
        return 31 * provider.hashCode() + Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return "QueryEmbedding[provider=" + provider + ", dimension=" + vector.length + "]";
    }
}
