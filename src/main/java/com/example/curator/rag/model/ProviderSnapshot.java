package com.example.curator.rag.model;

import java.util.Objects;

/**
 * Active provider resolved once per query and passed to every stage, so a settings change
 * never splits one query across two providers.
 */
public record ProviderSnapshot(AiProvider provider) {

    public ProviderSnapshot {
        Objects.requireNonNull(provider, "provider");
    }

    public static ProviderSnapshot of(AiProvider provider) {
        return new ProviderSnapshot(provider);
    }
}
