package com.example.curator.rag.config;

import com.example.curator.rag.model.AiProvider;
import com.example.curator.rag.provider.Embedder;
import com.example.curator.rag.provider.GeminiTextCompleter;
import com.example.curator.rag.provider.LangChain4jEmbedder;
import com.example.curator.rag.provider.ModelProviderRegistry;
import com.example.curator.rag.provider.OpenAiTextCompleter;
import com.example.curator.rag.provider.TextCompleter;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.util.EnumMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Builds one completion model and one embedding model per provider that has an API key.
 * A provider without a key is left out of the registry; selecting it fails the query.
 */
@Slf4j
@Configuration
public class LangChain4jConfig {

    // classification must be deterministic
    private static final double CLASSIFIER_TEMPERATURE = 0.0;

    @Bean
    public ModelProviderRegistry modelProviderRegistry(AiProviderProperties props) {
        Map<AiProvider, TextCompleter> completers = new EnumMap<>(AiProvider.class);
        Map<AiProvider, Embedder> embedders = new EnumMap<>(AiProvider.class);

        AiProviderProperties.ProviderSettings openai = props.getOpenai();
        if (openai.isConfigured()) {
            completers.put(AiProvider.OPENAI, new OpenAiTextCompleter(openAiChatModel(openai)));
            embedders.put(AiProvider.OPENAI, new LangChain4jEmbedder(
                    AiProvider.OPENAI, openAiEmbeddingModel(openai), openai.getEmbeddingDimension()));
        }

        AiProviderProperties.ProviderSettings gemini = props.getGemini();
        if (gemini.isConfigured()) {
            completers.put(AiProvider.GEMINI, new GeminiTextCompleter(geminiChatModel(gemini)));
            embedders.put(AiProvider.GEMINI, new LangChain4jEmbedder(
                    AiProvider.GEMINI, geminiEmbeddingModel(gemini), gemini.getEmbeddingDimension()));
        }

        if (completers.isEmpty()) {
            log.warn("No AI provider has an api-key configured; every query will fail until one is set");
        } else {
            log.info("Configured AI providers: {}", completers.keySet());
        }
        return new ModelProviderRegistry(completers, embedders);
    }

    private static OpenAiChatModel openAiChatModel(AiProviderProperties.ProviderSettings s) {
        var builder = OpenAiChatModel.builder()
                .apiKey(s.getApiKey())
                .modelName(s.getChatModel())
                .temperature(CLASSIFIER_TEMPERATURE)
                .timeout(s.getTimeout())
                .maxRetries(s.getMaxRetries());
        if (StringUtils.hasText(s.getBaseUrl())) {
            builder.baseUrl(s.getBaseUrl());
        }
        return builder.build();
    }

    private static OpenAiEmbeddingModel openAiEmbeddingModel(AiProviderProperties.ProviderSettings s) {
        var builder = OpenAiEmbeddingModel.builder()
                .apiKey(s.getApiKey())
                .modelName(s.getEmbeddingModel())
                .timeout(s.getTimeout())
                .maxRetries(s.getMaxRetries());
        if (StringUtils.hasText(s.getBaseUrl())) {
            builder.baseUrl(s.getBaseUrl());
        }
        return builder.build();
    }

    private static GoogleAiGeminiChatModel geminiChatModel(AiProviderProperties.ProviderSettings s) {
        return GoogleAiGeminiChatModel.builder()
                .apiKey(s.getApiKey())
                .modelName(s.getChatModel())
                .temperature(CLASSIFIER_TEMPERATURE)
                .timeout(s.getTimeout())
                .maxRetries(s.getMaxRetries())
                .build();
    }

    private static GoogleAiEmbeddingModel geminiEmbeddingModel(AiProviderProperties.ProviderSettings s) {
        return GoogleAiEmbeddingModel.builder()
                .apiKey(s.getApiKey())
                .modelName(s.getEmbeddingModel())
                .timeout(s.getTimeout())
                .maxRetries(s.getMaxRetries())
                .build();
    }
}
