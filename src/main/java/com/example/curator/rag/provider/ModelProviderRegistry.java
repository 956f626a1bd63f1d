package com.example.curator.rag.provider;

import com.example.curator.rag.model.AiProvider;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * The one place a provider name is turned into concrete completion and embedding clients.
 */
public class ModelProviderRegistry {

    private final Map<AiProvider, TextCompleter> completers;
    private final Map<AiProvider, Embedder> embedders;

    public ModelProviderRegistry(Map<AiProvider, TextCompleter> completers, Map<AiProvider, Embedder> embedders) {
        this.completers = copy(completers);
        this.embedders = copy(embedders);
    }

    public TextCompleter completerFor(AiProvider provider) {
        TextCompleter completer = completers.get(provider);
        if (completer == null) {
            throw new IllegalStateException("No text completer configured for provider " + provider.value());
        }
        return completer;
    }

    public Embedder embedderFor(AiProvider provider) {
        Embedder embedder = embedders.get(provider);
        if (embedder == null) {
            throw new IllegalStateException("No embedder configured for provider " + provider.value());
        }
        return embedder;
    }

    public Set<AiProvider> configuredProviders() {
        return Collections.unmodifiableSet(completers.keySet());
    }

    private static <T> Map<AiProvider, T> copy(Map<AiProvider, T> source) {
        Map<AiProvider, T> target = new EnumMap<>(AiProvider.class);
        if (source != null) {
            target.putAll(source);
        }
        return Collections.unmodifiableMap(target);
    }
}
